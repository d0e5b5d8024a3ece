package com.linkpatrol.core.service;

import com.linkpatrol.core.api.IPageChecker;
import com.linkpatrol.core.model.CheckRun;
import com.linkpatrol.core.model.LinkCheckConfig;
import com.linkpatrol.core.model.PageOutcome;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConcurrencyCapTest {

    @Test
    void observed_concurrency_never_exceeds_five_pages() {
        // 1) 설정: 최대 동시성
        LinkCheckConfig cfg = LinkCheckConfig.defaults().setConcurrency(LinkCheckConfig.MAX_CONCURRENCY);

        // 2) 스텁 페이지 검사기: 150ms 슬립 + 자체 동시 실행 수 측정
        AtomicInteger active = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        IPageChecker checker = url -> {
            int now = active.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try { Thread.sleep(150); } catch (InterruptedException ignored) { Thread.currentThread().interrupt(); }
            finally { active.decrementAndGet(); }
            return PageOutcome.checked(url, List.of(), 1);
        };

        // 3) 12개 페이지
        List<String> pages = new ArrayList<>();
        for (int i = 0; i < 12; i++) pages.add("http://example.com/p" + i);

        // 4) 실행
        CheckRun run = new LinkCheckService(cfg, checker).run(pages, null, null);

        // 5) 검증
        assertTrue(peak.get() <= 5, "peak=" + peak.get());
        assertTrue(run.stats().maxObservedConcurrency <= 5,
                "observed=" + run.stats().maxObservedConcurrency);
        assertEquals(12, run.stats().pagesCompleted);
        assertEquals(12, run.stats().linksChecked);
    }

    @Test
    void lower_configured_concurrency_is_respected() {
        LinkCheckConfig cfg = LinkCheckConfig.defaults().setConcurrency(2);
        AtomicInteger active = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        IPageChecker checker = url -> {
            peak.accumulateAndGet(active.incrementAndGet(), Math::max);
            try { Thread.sleep(80); } catch (InterruptedException ignored) { Thread.currentThread().interrupt(); }
            finally { active.decrementAndGet(); }
            return PageOutcome.checked(url, List.of(), 0);
        };

        List<String> pages = new ArrayList<>();
        for (int i = 0; i < 6; i++) pages.add("https://example.com/" + i);
        new LinkCheckService(cfg, checker).checkPages(pages);

        assertTrue(peak.get() <= 2, "peak=" + peak.get());
    }
}
