package com.linkpatrol.core.service.export;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.linkpatrol.core.model.IssueType;
import com.linkpatrol.core.model.LinkIssue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/** 요약 + 문제 링크 목록을 JSON(v1)으로 저장 */
public final class JsonReportExporter implements ReportExporter {

    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS); // ISO-8601

    @Override
    public Path export(Path baseDir, List<LinkIssue> issues, Instant generatedAt) throws IOException {
        Path out = ReportNaming.jsonPath(baseDir, generatedAt);
        Files.createDirectories(out.getParent());
        om.writerWithDefaultPrettyPrinter().writeValue(out.toFile(), toReport(issues, generatedAt));
        return out;
    }

    public JsonReport read(Path file) throws IOException {
        JsonReport r = om.readValue(file.toFile(), JsonReport.class);
        if (!"1".equals(r.v)) {
            throw new IllegalArgumentException("Unsupported report version: " + r.v);
        }
        return r;
    }

    static JsonReport toReport(List<LinkIssue> issues, Instant generatedAt) {
        IssueReport summary = IssueReport.of(issues);
        JsonReport r = new JsonReport();
        r.generatedAt = (generatedAt == null ? Instant.now() : generatedAt);
        r.summary.total = summary.total();
        r.summary.broken = summary.count(IssueType.BROKEN);
        r.summary.redirect = summary.count(IssueType.REDIRECT);
        r.summary.error = summary.count(IssueType.ERROR);
        r.summary.pagesWithIssues = summary.pagesWithIssues().size();
        for (LinkIssue i : issues) {
            JsonReport.Issue j = new JsonReport.Issue();
            j.sourcePage = i.getSourcePage();
            j.linkUrl = i.getLinkUrl();
            j.anchorText = i.getAnchorText();
            j.issueType = i.getIssueType().label();
            j.statusCode = i.getStatusCode();
            j.redirectTo = i.getRedirectTarget().orElse(null);
            j.error = i.getErrorMessage().orElse(null);
            r.issues.add(j);
        }
        return r;
    }
}
