package com.linkpatrol.core.service;

import com.linkpatrol.core.api.IPageChecker;
import com.linkpatrol.core.model.CheckRun;
import com.linkpatrol.core.model.CheckStats;
import com.linkpatrol.core.model.LinkCheckConfig;
import com.linkpatrol.core.model.LinkIssue;
import com.linkpatrol.core.model.PageOutcome;
import com.linkpatrol.core.util.ProgressListener;
import com.linkpatrol.core.util.StructuredLog;
import com.linkpatrol.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 링크 검사 오케스트레이터:
 *  - 페이지마다 PageChecker 실행, 고정 스레드풀(min(concurrency, 페이지 수))로 동시성 상한 유지
 *  - 완료 순서대로 결과를 모은다(입력 순서 아님). 집계와 진행률 콜백은 호출 스레드 한 곳에서만 수행
 *  - 페이지 하나의 실패는 로그만 남기고 나머지는 계속 진행
 */
public final class LinkCheckService {

    private static final Logger LOG = LoggerFactory.getLogger(LinkCheckService.class);
    private static final StructuredLog SLOG = StructuredLog.get(LinkCheckService.class);

    private static final long POLL_MS = 100;

    private final LinkCheckConfig config;
    private final IPageChecker pageChecker;

    /** 기본 구현 */
    public LinkCheckService(LinkCheckConfig config) {
        this(config, new PageChecker(config));
    }

    /** DI/테스트용 */
    public LinkCheckService(LinkCheckConfig config, IPageChecker pageChecker) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.pageChecker = Objects.requireNonNull(pageChecker, "pageChecker");
    }

    /* =========================
       실행 API
       ========================= */

    public List<LinkIssue> checkPages(List<String> urls) {
        return run(urls, ProgressListener.NONE, null).issues();
    }

    public List<LinkIssue> checkPages(List<String> urls, ProgressListener listener) {
        return run(urls, listener, null).issues();
    }

    /**
     * @param urls       검사할 페이지(중복 허용, 상한 없음)
     * @param listener   페이지 완료마다 한 번 호출(null 허용)
     * @param cancelFlag true가 되면 남은 작업을 버리고 CancellationException (null 허용)
     * @throws IllegalArgumentException 목록이 비었거나 http(s) URL이 아닌 항목이 있을 때
     */
    public CheckRun run(List<String> urls, ProgressListener listener, AtomicBoolean cancelFlag) {
        final List<String> pages = validateInput(urls);
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final AtomicBoolean cancel = cancelFlag;

        final int total = pages.size();
        final int cc = Math.min(config.getConcurrency(), total);
        final StructuredLog slog = SLOG.withRun(UUID.randomUUID().toString().substring(0, 8));
        final long t0 = System.nanoTime();

        LOG.info("Link check start: pages={}, cc={}, timeoutMs={}", total, cc, config.getTimeoutMs());
        slog.info("check-start", "pages", total, "cc", cc, "timeoutMs", config.getTimeoutMs());

        final CheckStats stats = new CheckStats();
        final AtomicInteger inFlight = new AtomicInteger(0);

        ExecutorService exec = new ThreadPoolExecutor(
                cc, cc,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new NamedThreadFactory("page-worker"));
        CompletionService<PageOutcome> ecs = new ExecutorCompletionService<>(exec);
        Map<Future<PageOutcome>, String> futureToUrl = new HashMap<>();

        final List<LinkIssue> issues = new ArrayList<>();
        final List<PageOutcome> outcomes = new ArrayList<>(total);

        try {
            // ---- 1) 작업 제출 ----
            for (String url : pages) {
                checkCancel(cancel);
                futureToUrl.put(ecs.submit(() -> checkOne(url, inFlight, stats, slog)), url);
            }

            // ---- 2) 완료 순서대로 수집 ----
            for (int done = 1; done <= total; done++) {
                Future<PageOutcome> f = nextCompleted(ecs, cancel);
                PageOutcome outcome;
                try {
                    outcome = f.get();
                } catch (ExecutionException e) {
                    Throwable cause = (e.getCause() != null ? e.getCause() : e);
                    String url = futureToUrl.get(f);
                    LOG.warn("Page task failed: {} ({})", url, cause.toString());
                    slog.error("page-failed", cause, "page", url);
                    outcome = PageOutcome.failed(url, cause);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new CancellationException("Interrupted while collecting results");
                }

                outcomes.add(outcome);
                issues.addAll(outcome.getIssues());
                stats.recordPage(outcome);
                notifyProgress(pl, done, total, outcome.getPageUrl());
            }
        } finally {
            // ---- 3) 종료 ----
            exec.shutdownNow();
            try {
                exec.awaitTermination(30, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
        CheckStats.Snapshot snap = stats.snapshot(total, elapsedMs);

        LOG.info("Link check done. pages={}, links={}, issues={}, failedPages={}, maxObservedCC={}, elapsedMs={}",
                snap.pagesCompleted, snap.linksChecked, issues.size(),
                snap.pagesFailed + snap.extractionFailures, snap.maxObservedConcurrency, elapsedMs);
        slog.info("check-done",
                "pages", snap.pagesCompleted,
                "links", snap.linksChecked,
                "issues", issues.size(),
                "pagesFailed", snap.pagesFailed,
                "extractionFailures", snap.extractionFailures,
                "maxObservedCC", snap.maxObservedConcurrency,
                "elapsedMs", elapsedMs);

        return new CheckRun(issues, outcomes, snap);
    }

    /* =========================
       내부
       ========================= */

    /** 워커 스레드에서 실행. 예기치 못한 예외는 결과 값으로 바꾼다. */
    private PageOutcome checkOne(String url, AtomicInteger inFlight, CheckStats stats, StructuredLog slog) {
        int cur = inFlight.incrementAndGet();
        stats.observeConcurrency(cur);
        try {
            PageOutcome outcome = pageChecker.checkPage(url);
            if (outcome == null) {
                throw new IllegalStateException("page checker returned no outcome");
            }
            LOG.info("Checked {} -> links={}, issues={}", url, outcome.getLinksChecked(), outcome.getIssues().size());
            slog.info("page-checked",
                    "page", url,
                    "status", outcome.getStatus().name(),
                    "links", outcome.getLinksChecked(),
                    "issues", outcome.getIssues().size());
            return outcome;
        } catch (CancellationException ce) {
            throw ce;
        } catch (RuntimeException e) {
            LOG.warn("Error processing {}: {}", url, e.toString());
            slog.error("page-failed", e, "page", url);
            return PageOutcome.failed(url, e);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private static Future<PageOutcome> nextCompleted(CompletionService<PageOutcome> ecs, AtomicBoolean cancel) {
        try {
            Future<PageOutcome> f;
            while ((f = ecs.poll(POLL_MS, TimeUnit.MILLISECONDS)) == null) {
                checkCancel(cancel);
            }
            return f;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while collecting results");
        }
    }

    private static void notifyProgress(ProgressListener pl, int done, int total, String url) {
        try {
            pl.onProgress(done, total, url);
        } catch (RuntimeException e) {
            LOG.warn("Progress listener failed at {}/{}: {}", done, total, e.toString());
        }
    }

    /** 빈 목록/빈 항목/http(s) 아닌 항목은 실행 전에 거부 */
    static List<String> validateInput(List<String> urls) {
        if (urls == null || urls.isEmpty()) {
            throw new IllegalArgumentException("At least one page URL is required");
        }
        List<String> out = new ArrayList<>(urls.size());
        List<String> invalid = new ArrayList<>();
        for (String u : urls) {
            String s = (u == null ? "" : u.trim());
            if (!UrlUtils.isHttpUrl(s)) {
                invalid.add(s.isEmpty() ? "<blank>" : s);
            } else {
                out.add(s);
            }
        }
        if (!invalid.isEmpty()) {
            throw new IllegalArgumentException("Invalid page URL(s): " + String.join(", ", invalid));
        }
        return out;
    }

    private static void checkCancel(AtomicBoolean flag) {
        if (Thread.currentThread().isInterrupted() || (flag != null && flag.get())) {
            throw new CancellationException();
        }
    }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
