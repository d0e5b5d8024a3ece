package com.linkpatrol.core.api;

import com.linkpatrol.core.model.PageOutcome;

/** 페이지 검사 최소 계약: 페이지 URL 하나를 받아 그 페이지의 결과를 돌려준다. */
@FunctionalInterface
public interface IPageChecker {
    PageOutcome checkPage(String pageUrl);
}
