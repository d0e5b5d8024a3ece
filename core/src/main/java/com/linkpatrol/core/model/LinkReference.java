package com.linkpatrol.core.model;

import java.util.Objects;

/**
 * 페이지에서 발견한 링크 1건.
 *
 * @param resolvedUrl  페이지 URL 기준으로 해석한 절대 URL (상태 확인 대상)
 * @param originalHref 마크업에 적힌 그대로의 href (trim만 적용)
 * @param anchorText   앵커 텍스트. 비어 있으면 {@link #NO_ANCHOR_TEXT}
 */
public record LinkReference(String resolvedUrl, String originalHref, String anchorText) {

    public static final String NO_ANCHOR_TEXT = "[No anchor text]";

    public LinkReference {
        Objects.requireNonNull(resolvedUrl, "resolvedUrl");
        Objects.requireNonNull(originalHref, "originalHref");
        anchorText = (anchorText == null || anchorText.isBlank()) ? NO_ANCHOR_TEXT : anchorText.trim();
    }
}
