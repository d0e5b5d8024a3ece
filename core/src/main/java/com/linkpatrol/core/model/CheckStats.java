package com.linkpatrol.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 실행 1회분 텔레메트리 누적기 (스레드 세이프). */
public final class CheckStats {
    private final AtomicInteger pagesCompleted = new AtomicInteger(0);
    private final AtomicInteger pagesFailed = new AtomicInteger(0);          // 예기치 못한 작업 실패
    private final AtomicInteger extractionFailures = new AtomicInteger(0);   // 페이지 fetch/파싱 실패
    private final AtomicLong linksChecked = new AtomicLong(0);
    private final AtomicLong issuesFound = new AtomicLong(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    public void recordPage(PageOutcome outcome) {
        pagesCompleted.incrementAndGet();
        switch (outcome.getStatus()) {
            case FAILED -> pagesFailed.incrementAndGet();
            case EXTRACTION_FAILED -> extractionFailures.incrementAndGet();
            case CHECKED -> {
                linksChecked.addAndGet(outcome.getLinksChecked());
                issuesFound.addAndGet(outcome.getIssues().size());
            }
        }
    }

    /** 현재 동시 실행 수를 관측하여 최대값 갱신 */
    public void observeConcurrency(int current) {
        maxObservedConcurrency.accumulateAndGet(current, Math::max);
    }

    public Snapshot snapshot(int pagesTotal, long elapsedMs) {
        return new Snapshot(pagesTotal, pagesCompleted.get(), pagesFailed.get(), extractionFailures.get(),
                linksChecked.get(), issuesFound.get(), maxObservedConcurrency.get(), elapsedMs);
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final int pagesTotal;
        public final int pagesCompleted;
        public final int pagesFailed;
        public final int extractionFailures;
        public final long linksChecked;
        public final long issuesFound;
        public final int maxObservedConcurrency;
        public final long elapsedMs;

        public Snapshot(int pagesTotal, int pagesCompleted, int pagesFailed, int extractionFailures,
                        long linksChecked, long issuesFound, int maxObservedConcurrency, long elapsedMs) {
            this.pagesTotal = pagesTotal;
            this.pagesCompleted = pagesCompleted;
            this.pagesFailed = pagesFailed;
            this.extractionFailures = extractionFailures;
            this.linksChecked = linksChecked;
            this.issuesFound = issuesFound;
            this.maxObservedConcurrency = maxObservedConcurrency;
            this.elapsedMs = elapsedMs;
        }
    }
}
