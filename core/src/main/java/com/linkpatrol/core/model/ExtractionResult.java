package com.linkpatrol.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 링크 추출 결과. 페이지 fetch/파싱 실패는 예외 대신 failureReason으로 표현한다.
 * 실패 시 links는 항상 비어 있다.
 */
public final class ExtractionResult {
    private final List<LinkReference> links;
    private final String failureReason; // nullable

    private ExtractionResult(List<LinkReference> links, String failureReason) {
        this.links = links;
        this.failureReason = failureReason;
    }

    public static ExtractionResult of(List<LinkReference> links) {
        return new ExtractionResult(List.copyOf(Objects.requireNonNull(links, "links")), null);
    }

    public static ExtractionResult failed(String reason) {
        return new ExtractionResult(List.of(), reason == null || reason.isBlank() ? "Extraction failed" : reason);
    }

    public List<LinkReference> getLinks() { return links; }
    public Optional<String> getFailureReason() { return Optional.ofNullable(failureReason); }
    public boolean isFailed() { return failureReason != null; }
}
