package com.linkpatrol.core.extract;

import com.linkpatrol.core.model.ExtractionResult;

/** 페이지에서 링크를 추출하는 전략 인터페이스. */
@FunctionalInterface
public interface LinkExtractor {
    /**
     * pageUrl을 가져와 링크를 마크업 순서대로 추출한다.
     * fetch 실패(비 2xx, 네트워크 오류)는 {@link ExtractionResult#failed(String)}로 돌려준다.
     */
    ExtractionResult extract(String pageUrl);
}
