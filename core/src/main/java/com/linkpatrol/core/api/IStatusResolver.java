package com.linkpatrol.core.api;

import com.linkpatrol.core.model.StatusOutcome;

/** 상태 확인 최소 계약: 절대 URL 하나를 받아 정규화된 결과를 돌려준다. 예외를 던지지 않는다. */
@FunctionalInterface
public interface IStatusResolver extends AutoCloseable {
    StatusOutcome checkStatus(String url);
    @Override default void close() {}
}
