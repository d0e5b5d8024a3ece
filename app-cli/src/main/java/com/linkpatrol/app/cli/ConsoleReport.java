package com.linkpatrol.app.cli;

import com.linkpatrol.core.model.CheckStats;
import com.linkpatrol.core.model.IssueType;
import com.linkpatrol.core.model.LinkIssue;
import com.linkpatrol.core.service.export.IssueReport;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** 검사 결과를 터미널에 표로 출력 */
public final class ConsoleReport {

    private static final int URL_COL = 60;
    private static final int ANCHOR_COL = 30;

    private final PrintStream out;

    public ConsoleReport(PrintStream out) {
        this.out = out;
    }

    public void summary(IssueReport report, CheckStats.Snapshot stats) {
        out.println();
        out.println("=== Summary ===");
        out.printf(Locale.ROOT, "Pages checked     : %d (extraction failed: %d, errors: %d)%n",
                stats.pagesCompleted, stats.extractionFailures, stats.pagesFailed);
        out.printf(Locale.ROOT, "Links checked     : %d%n", stats.linksChecked);
        out.printf(Locale.ROOT, "Total issues      : %d%n", report.total());
        for (Map.Entry<IssueType, Long> e : report.countsByType().entrySet()) {
            out.printf(Locale.ROOT, "  %-16s: %d%n", capitalize(e.getKey().label()), e.getValue());
        }
        out.printf(Locale.ROOT, "Pages with issues : %d%n", report.pagesWithIssues().size());
        out.printf(Locale.ROOT, "Elapsed           : %.1fs%n", stats.elapsedMs / 1000.0);
    }

    /** @param filter null이면 전체 */
    public void table(IssueReport report, IssueType filter) {
        List<LinkIssue> rows = report.filter(filter);
        out.println();
        out.printf(Locale.ROOT, "=== Issues (%s: %d) ===%n",
                filter == null ? "all" : filter.label(), rows.size());
        if (rows.isEmpty()) {
            out.println("(none)");
            return;
        }
        out.printf(Locale.ROOT, "%-8s %-6s %-" + URL_COL + "s %-" + ANCHOR_COL + "s %s%n",
                "TYPE", "STATUS", "LINK", "ANCHOR", "DETAIL");
        for (LinkIssue i : rows) {
            out.printf(Locale.ROOT, "%-8s %-6s %-" + URL_COL + "s %-" + ANCHOR_COL + "s %s%n",
                    i.getIssueType().name(),
                    i.getStatusCode() == 0 ? "N/A" : String.valueOf(i.getStatusCode()),
                    clip(i.getLinkUrl(), URL_COL),
                    clip(i.getAnchorText(), ANCHOR_COL),
                    detail(i));
        }
    }

    /** 페이지별 묶음 (페이지 URL 순) */
    public void breakdown(IssueReport report) {
        if (report.isClean()) return;
        out.println();
        out.println("=== By page ===");
        report.byPage().forEach((page, issues) -> {
            out.printf(Locale.ROOT, "%s (%d)%n", page, issues.size());
            for (LinkIssue i : issues) {
                out.printf(Locale.ROOT, "  - [%s] %s%s%n", i.getIssueType().label(), i.getLinkUrl(),
                        detail(i).isEmpty() ? "" : " -> " + detail(i));
            }
        });
    }

    static String detail(LinkIssue i) {
        return i.getRedirectTarget().or(i::getErrorMessage).orElse("");
    }

    static String clip(String s, int max) {
        if (s == null) return "";
        if (s.codePointCount(0, s.length()) <= max) return s;
        return s.substring(0, s.offsetByCodePoints(0, max - 3)) + "...";
    }

    private static String capitalize(String s) {
        return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
