package com.linkpatrol.core.service.export;

import com.linkpatrol.core.model.LinkIssue;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/** 문제 링크 표를 CSV(UTF-8, RFC 4180 인용)로 저장 */
public final class CsvReportExporter implements ReportExporter {

    static final List<String> HEADER = List.of(
            "Source Page", "Link URL", "Anchor Text", "Issue Type", "Status Code", "Redirect To", "Error");

    @Override
    public Path export(Path baseDir, List<LinkIssue> issues, Instant generatedAt) throws IOException {
        Path out = ReportNaming.csvPath(baseDir, generatedAt);
        Files.createDirectories(out.getParent());
        try (Writer w = Files.newBufferedWriter(out, StandardCharsets.UTF_8)) {
            write(w, issues);
        }
        return out;
    }

    /** 파일 없이 Writer로 직접 쓰기 (CLI stdout 등) */
    public void write(Writer w, List<LinkIssue> issues) throws IOException {
        w.write(row(HEADER));
        w.write("\r\n");
        for (LinkIssue i : issues) {
            w.write(row(cells(i)));
            w.write("\r\n");
        }
    }

    static List<String> cells(LinkIssue i) {
        return List.of(
                i.getSourcePage(),
                i.getLinkUrl(),
                i.getAnchorText(),
                i.getIssueType().name().toUpperCase(Locale.ROOT),
                i.getStatusCode() == 0 ? "N/A" : String.valueOf(i.getStatusCode()),
                i.getRedirectTarget().orElse(""),
                i.getErrorMessage().orElse(""));
    }

    private static String row(List<String> cells) {
        StringBuilder sb = new StringBuilder();
        for (int k = 0; k < cells.size(); k++) {
            if (k > 0) sb.append(',');
            sb.append(escape(cells.get(k)));
        }
        return sb.toString();
    }

    static String escape(String s) {
        if (s == null) return "";
        boolean need = s.contains(",") || s.contains("\"") || s.contains("\n") || s.contains("\r");
        String body = s.replace("\"", "\"\"");
        return need ? "\"" + body + "\"" : body;
    }
}
