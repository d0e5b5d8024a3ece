package com.linkpatrol.app.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Ctrl+C(종료 훅) → 취소 플래그.
 * 훅은 close()가 불릴 때까지 최대 {@link #GRACE_MS}ms 기다린다. 그 사이 검사 루프가 취소를 보고
 * "Cancelled." 출력까지 마칠 수 있다.
 */
final class CancelOnShutdown implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(CancelOnShutdown.class);

    static final long GRACE_MS = 5_000;

    private final AtomicBoolean cancel = new AtomicBoolean(false);
    private final CountDownLatch finished = new CountDownLatch(1);
    private final Thread hook;

    private CancelOnShutdown(boolean register) {
        if (register) {
            hook = new Thread(this::onShutdown, "cancel-hook");
            Runtime.getRuntime().addShutdownHook(hook);
        } else {
            hook = null;
        }
    }

    /** JVM 종료 훅 등록 */
    static CancelOnShutdown install() {
        return new CancelOnShutdown(true);
    }

    /** 훅 없이 (테스트용) */
    static CancelOnShutdown detached() {
        return new CancelOnShutdown(false);
    }

    AtomicBoolean flag() {
        return cancel;
    }

    void onShutdown() {
        cancel.set(true);
        try {
            if (!finished.await(GRACE_MS, TimeUnit.MILLISECONDS)) {
                LOG.warn("Run did not finish within {} ms after cancel", GRACE_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        finished.countDown();
        if (hook == null) return;
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM 종료 중: 훅이 이미 실행 중이다
            LOG.debug("Shutdown in progress, hook left in place");
        }
    }
}
