package com.linkpatrol.app.cli;

import com.linkpatrol.core.model.CheckStats;
import com.linkpatrol.core.model.IssueType;
import com.linkpatrol.core.model.LinkIssue;
import com.linkpatrol.core.service.export.IssueReport;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConsoleReportTest {

    private final IssueReport report = IssueReport.of(List.of(
            LinkIssue.builder().sourcePage("https://b.test/").linkUrl("/gone").anchorText("Gone")
                    .statusCode(410).issueType(IssueType.BROKEN).build(),
            LinkIssue.builder().sourcePage("https://a.test/").linkUrl("/old").anchorText("Old")
                    .statusCode(301).redirectTarget("/new").issueType(IssueType.REDIRECT).build()));

    private static String render(java.util.function.Consumer<ConsoleReport> body) {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        body.accept(new ConsoleReport(new PrintStream(buf, true, StandardCharsets.UTF_8)));
        return buf.toString(StandardCharsets.UTF_8);
    }

    @Test
    void summary_lists_every_type() {
        CheckStats.Snapshot stats = new CheckStats.Snapshot(2, 2, 0, 0, 7, 2, 2, 1500);
        String s = render(c -> c.summary(report, stats));

        assertThat(s).contains("Total issues      : 2");
        assertThat(s).contains("Broken").contains("Redirect").contains("Error");
        assertThat(s).contains("Pages with issues : 2");
        assertThat(s).contains("Links checked     : 7");
    }

    @Test
    void table_honors_filter() {
        String s = render(c -> c.table(report, IssueType.REDIRECT));
        assertThat(s).contains("redirect: 1").contains("/old").contains("/new").doesNotContain("/gone");
    }

    @Test
    void breakdown_is_sorted_by_page() {
        String s = render(c -> c.breakdown(report));
        assertThat(s.indexOf("https://a.test/")).isLessThan(s.indexOf("https://b.test/"));
    }

    @Test
    void clip_marks_cut_text() {
        assertThat(ConsoleReport.clip("abcdefghij", 6)).isEqualTo("abc...");
        assertThat(ConsoleReport.clip("abc", 6)).isEqualTo("abc");
    }
}
