package com.linkpatrol.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 페이지 1개의 검사 결과.
 * - CHECKED: 추출 성공, 링크 검사 완료 (issues는 비어 있을 수 있음)
 * - EXTRACTION_FAILED: 페이지 fetch/파싱 실패, issues 없음
 * - FAILED: 예기치 못한 작업 실패, issues 없음
 */
public final class PageOutcome {

    public enum Status { CHECKED, EXTRACTION_FAILED, FAILED }

    private final String pageUrl;
    private final Status status;
    private final List<LinkIssue> issues;
    private final int linksChecked;
    private final String failureReason; // nullable

    private PageOutcome(String pageUrl, Status status, List<LinkIssue> issues, int linksChecked, String failureReason) {
        this.pageUrl = Objects.requireNonNull(pageUrl, "pageUrl");
        this.status = status;
        this.issues = List.copyOf(issues);
        this.linksChecked = linksChecked;
        this.failureReason = failureReason;
    }

    public static PageOutcome checked(String pageUrl, List<LinkIssue> issues, int linksChecked) {
        return new PageOutcome(pageUrl, Status.CHECKED, issues, linksChecked, null);
    }

    public static PageOutcome extractionFailed(String pageUrl, String reason) {
        return new PageOutcome(pageUrl, Status.EXTRACTION_FAILED, List.of(), 0, reason);
    }

    public static PageOutcome failed(String pageUrl, Throwable cause) {
        String reason = (cause == null) ? "Unknown failure" : String.valueOf(cause);
        return new PageOutcome(pageUrl, Status.FAILED, List.of(), 0, reason);
    }

    public String getPageUrl() { return pageUrl; }
    public Status getStatus() { return status; }
    public List<LinkIssue> getIssues() { return issues; }
    public int getLinksChecked() { return linksChecked; }
    public Optional<String> getFailureReason() { return Optional.ofNullable(failureReason); }
}
