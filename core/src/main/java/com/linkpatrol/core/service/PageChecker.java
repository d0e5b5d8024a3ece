package com.linkpatrol.core.service;

import com.linkpatrol.core.api.IPageChecker;
import com.linkpatrol.core.api.IStatusResolver;
import com.linkpatrol.core.classify.IssueClassifier;
import com.linkpatrol.core.extract.JsoupLinkExtractor;
import com.linkpatrol.core.extract.LinkExtractor;
import com.linkpatrol.core.http.HttpStatusResolver;
import com.linkpatrol.core.model.Classification;
import com.linkpatrol.core.model.ExtractionResult;
import com.linkpatrol.core.model.LinkCheckConfig;
import com.linkpatrol.core.model.LinkIssue;
import com.linkpatrol.core.model.LinkReference;
import com.linkpatrol.core.model.PageOutcome;
import com.linkpatrol.core.model.StatusOutcome;
import com.linkpatrol.core.util.DefaultSleeper;
import com.linkpatrol.core.util.Sleeper;
import com.linkpatrol.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * 페이지 1개 검사: 추출 → 링크별 상태 확인 → 분류 → 문제 링크만 수집.
 * 링크는 발견 순서대로 하나씩 확인하고, 확인할 때마다 politenessDelay만큼 쉰다(페이지 단위 제한).
 */
public final class PageChecker implements IPageChecker {

    private static final Logger LOG = LoggerFactory.getLogger(PageChecker.class);
    private static final StructuredLog SLOG = StructuredLog.get(PageChecker.class);

    private final LinkExtractor extractor;
    private final IStatusResolver resolver;
    private final Sleeper sleeper;
    private final Duration politenessDelay;

    /** 기본 구현(JSoup 추출 + HttpClient 상태 확인) */
    public PageChecker(LinkCheckConfig config) {
        this(config, new JsoupLinkExtractor(config), new HttpStatusResolver(config), new DefaultSleeper());
    }

    /** DI/테스트용 */
    public PageChecker(LinkCheckConfig config, LinkExtractor extractor, IStatusResolver resolver, Sleeper sleeper) {
        Objects.requireNonNull(config, "config").validate();
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.politenessDelay = config.getPolitenessDelay();
    }

    @Override
    public PageOutcome checkPage(String pageUrl) {
        ExtractionResult extraction = extractor.extract(pageUrl);
        if (extraction.isFailed()) {
            String reason = extraction.getFailureReason().orElse("");
            LOG.warn("Link extraction failed for {}: {}", pageUrl, reason);
            SLOG.warn("extract-failed", "page", pageUrl, "reason", reason);
            return PageOutcome.extractionFailed(pageUrl, reason);
        }

        List<LinkReference> links = extraction.getLinks();
        if (links.isEmpty()) {
            return PageOutcome.checked(pageUrl, List.of(), 0);
        }

        List<LinkIssue> issues = new ArrayList<>();
        int checked = 0;
        for (LinkReference link : links) {
            checkInterrupted();

            StatusOutcome outcome = resolver.checkStatus(link.resolvedUrl());
            checked++;

            Classification c = IssueClassifier.classify(outcome);
            if (c.problem()) {
                issues.add(LinkIssue.builder()
                        .sourcePage(pageUrl)
                        .from(link, outcome)
                        .issueType(c.type())
                        .build());
                LOG.debug("Issue on {}: {} -> {}", pageUrl, link.originalHref(), outcome);
            }

            pause();
        }
        return PageOutcome.checked(pageUrl, issues, checked);
    }

    private void pause() {
        try {
            sleeper.sleep(politenessDelay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted during politeness delay");
        }
    }

    private static void checkInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Interrupted while checking links");
        }
    }
}
