package com.linkpatrol.core.util;

/** 페이지 단위 진행률 콜백. 오케스트레이터가 한 스레드에서 직렬로 호출한다. */
@FunctionalInterface
public interface ProgressListener {
    /**
     * @param completed   완료된 페이지 수(1부터)
     * @param total       전체 페이지 수
     * @param lastPageUrl 방금 완료된 페이지
     */
    void onProgress(int completed, int total, String lastPageUrl);

    ProgressListener NONE = (c, t, u) -> {};
}
