package com.linkpatrol.core.service;

import com.linkpatrol.core.api.IStatusResolver;
import com.linkpatrol.core.extract.LinkExtractor;
import com.linkpatrol.core.model.ExtractionResult;
import com.linkpatrol.core.model.IssueType;
import com.linkpatrol.core.model.LinkCheckConfig;
import com.linkpatrol.core.model.LinkIssue;
import com.linkpatrol.core.model.LinkReference;
import com.linkpatrol.core.model.PageOutcome;
import com.linkpatrol.core.model.StatusOutcome;
import com.linkpatrol.core.util.Sleeper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PageCheckerTest {

    private static final String PAGE = "https://example.com/";

    /** 호출 기록용 Sleeper */
    static class RecordingSleeper implements Sleeper {
        final List<Duration> sleeps = new ArrayList<>();
        @Override public void sleep(Duration d) { sleeps.add(d); }
    }

    private static IStatusResolver byUrl(Map<String, StatusOutcome> table) {
        return url -> table.getOrDefault(url, StatusOutcome.of(200));
    }

    private final LinkCheckConfig cfg = LinkCheckConfig.defaults();

    @Test
    void only_problem_links_become_issues_and_keep_original_href() {
        LinkExtractor ex = page -> ExtractionResult.of(List.of(
                new LinkReference("https://example.com/missing", "/missing", "Missing"),
                new LinkReference("https://example.com/fine", "/fine", "Fine")));
        IStatusResolver r = byUrl(Map.of("https://example.com/missing", StatusOutcome.of(404)));

        PageOutcome out = new PageChecker(cfg, ex, r, new RecordingSleeper()).checkPage(PAGE);

        assertThat(out.getStatus()).isEqualTo(PageOutcome.Status.CHECKED);
        assertThat(out.getLinksChecked()).isEqualTo(2);
        assertThat(out.getIssues()).hasSize(1);
        LinkIssue i = out.getIssues().get(0);
        assertThat(i.getSourcePage()).isEqualTo(PAGE);
        assertThat(i.getLinkUrl()).isEqualTo("/missing");
        assertThat(i.getAnchorText()).isEqualTo("Missing");
        assertThat(i.getStatusCode()).isEqualTo(404);
        assertThat(i.getIssueType()).isEqualTo(IssueType.BROKEN);
    }

    @Test
    void issues_follow_link_discovery_order_and_carry_redirect_and_error_details() {
        LinkExtractor ex = page -> ExtractionResult.of(List.of(
                new LinkReference("https://a.test/", "https://a.test/", "A"),
                new LinkReference("https://b.test/", "https://b.test/", "B"),
                new LinkReference("https://c.test/", "https://c.test/", "C")));
        IStatusResolver r = byUrl(Map.of(
                "https://a.test/", StatusOutcome.failure(StatusOutcome.TIMEOUT),
                "https://c.test/", StatusOutcome.of(308, "https://c2.test/")));

        List<LinkIssue> issues = new PageChecker(cfg, ex, r, new RecordingSleeper()).checkPage(PAGE).getIssues();

        assertThat(issues).extracting(LinkIssue::getIssueType).containsExactly(IssueType.ERROR, IssueType.REDIRECT);
        assertThat(issues.get(0).getStatusCode()).isZero();
        assertThat(issues.get(0).getErrorMessage()).contains("Timeout");
        assertThat(issues.get(1).getRedirectTarget()).contains("https://c2.test/");
    }

    @Test
    void extraction_failure_yields_no_issues_and_no_link_checks() {
        List<String> asked = new ArrayList<>();
        LinkExtractor ex = page -> ExtractionResult.failed("HTTP 500");
        IStatusResolver r = url -> { asked.add(url); return StatusOutcome.of(200); };

        PageOutcome out = new PageChecker(cfg, ex, r, new RecordingSleeper()).checkPage(PAGE);

        assertThat(out.getStatus()).isEqualTo(PageOutcome.Status.EXTRACTION_FAILED);
        assertThat(out.getIssues()).isEmpty();
        assertThat(out.getFailureReason()).contains("HTTP 500");
        assertThat(asked).isEmpty();
    }

    @Test
    void page_without_links_is_checked_with_zero_links() {
        RecordingSleeper sleeper = new RecordingSleeper();
        PageOutcome out = new PageChecker(cfg, page -> ExtractionResult.of(List.of()),
                url -> StatusOutcome.of(200), sleeper).checkPage(PAGE);

        assertThat(out.getStatus()).isEqualTo(PageOutcome.Status.CHECKED);
        assertThat(out.getLinksChecked()).isZero();
        assertThat(sleeper.sleeps).isEmpty();
    }

    @Test
    void politeness_delay_follows_every_link_check() {
        RecordingSleeper sleeper = new RecordingSleeper();
        LinkExtractor ex = page -> ExtractionResult.of(List.of(
                new LinkReference("https://a.test/1", "/1", "1"),
                new LinkReference("https://a.test/2", "/2", "2"),
                new LinkReference("https://a.test/3", "/3", "3")));
        LinkCheckConfig c = LinkCheckConfig.defaults().setPolitenessDelay(Duration.ofMillis(250));

        new PageChecker(c, ex, url -> StatusOutcome.of(200), sleeper).checkPage(PAGE);

        assertThat(sleeper.sleeps).containsExactly(
                Duration.ofMillis(250), Duration.ofMillis(250), Duration.ofMillis(250));
    }

    @Test
    void long_anchor_text_is_truncated_by_code_points() {
        String emoji = "\uD83D\uDE00"; // 서로게이트 쌍
        String longText = "a".repeat(99) + emoji + emoji + "tail";
        LinkExtractor ex = page -> ExtractionResult.of(List.of(
                new LinkReference("https://a.test/x", "/x", longText)));

        LinkIssue i = new PageChecker(cfg, ex, url -> StatusOutcome.of(500), new RecordingSleeper())
                .checkPage(PAGE).getIssues().get(0);

        assertThat(i.getAnchorText().codePointCount(0, i.getAnchorText().length()))
                .isEqualTo(LinkIssue.MAX_ANCHOR_CODE_POINTS);
        assertThat(i.getAnchorText()).endsWith(emoji);
    }

    @Test
    void interrupted_sleep_surfaces_as_cancellation() {
        Sleeper interrupting = d -> { throw new InterruptedException(); };
        LinkExtractor ex = page -> ExtractionResult.of(List.of(new LinkReference("https://a.test/", "/", "x")));
        PageChecker pc = new PageChecker(cfg, ex, url -> StatusOutcome.of(200), interrupting);
        try {
            assertThatThrownBy(() -> pc.checkPage(PAGE)).isInstanceOf(CancellationException.class);
        } finally {
            Thread.interrupted();
        }
    }
}
