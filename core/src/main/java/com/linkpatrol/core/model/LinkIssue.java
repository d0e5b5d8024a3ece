package com.linkpatrol.core.model;

import java.util.Objects;
import java.util.Optional;

/** 문제 링크 1건 (생성 후 불변) */
public final class LinkIssue {

    /** 앵커 텍스트 최대 길이(코드 포인트 기준) */
    public static final int MAX_ANCHOR_CODE_POINTS = 100;

    private final String sourcePage;
    private final String linkUrl;        // 원본 href (해석 전)
    private final String anchorText;
    private final int statusCode;        // 0 = 네트워크 수준 실패
    private final IssueType issueType;
    private final String redirectTarget; // nullable
    private final String errorMessage;   // nullable

    private LinkIssue(Builder b) {
        this.sourcePage = b.sourcePage;
        this.linkUrl = b.linkUrl;
        this.anchorText = truncate(b.anchorText == null ? LinkReference.NO_ANCHOR_TEXT : b.anchorText,
                MAX_ANCHOR_CODE_POINTS);
        this.statusCode = b.statusCode;
        this.issueType = b.issueType;
        this.redirectTarget = b.redirectTarget;
        this.errorMessage = b.errorMessage;
    }

    public String getSourcePage() { return sourcePage; }
    public String getLinkUrl() { return linkUrl; }
    public String getAnchorText() { return anchorText; }
    public int getStatusCode() { return statusCode; }
    public IssueType getIssueType() { return issueType; }
    public Optional<String> getRedirectTarget() { return Optional.ofNullable(redirectTarget); }
    public Optional<String> getErrorMessage() { return Optional.ofNullable(errorMessage); }

    /** 서로게이트 쌍을 쪼개지 않도록 코드 포인트 단위로 자른다. */
    static String truncate(String s, int maxCodePoints) {
        if (s.codePointCount(0, s.length()) <= maxCodePoints) return s;
        return s.substring(0, s.offsetByCodePoints(0, maxCodePoints));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LinkIssue other)) return false;
        return statusCode == other.statusCode
                && sourcePage.equals(other.sourcePage)
                && linkUrl.equals(other.linkUrl)
                && anchorText.equals(other.anchorText)
                && issueType == other.issueType
                && Objects.equals(redirectTarget, other.redirectTarget)
                && Objects.equals(errorMessage, other.errorMessage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourcePage, linkUrl, anchorText, statusCode, issueType, redirectTarget, errorMessage);
    }

    @Override
    public String toString() {
        return "LinkIssue{" + issueType.label() + " " + statusCode + " " + linkUrl + " @ " + sourcePage + "}";
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String sourcePage;
        private String linkUrl;
        private String anchorText;
        private int statusCode;
        private IssueType issueType;
        private String redirectTarget;
        private String errorMessage;

        public Builder sourcePage(String sourcePage) { this.sourcePage = sourcePage; return this; }
        public Builder linkUrl(String linkUrl) { this.linkUrl = linkUrl; return this; }
        public Builder anchorText(String anchorText) { this.anchorText = anchorText; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder issueType(IssueType issueType) { this.issueType = issueType; return this; }
        public Builder redirectTarget(String redirectTarget) { this.redirectTarget = redirectTarget; return this; }
        public Builder errorMessage(String errorMessage) { this.errorMessage = errorMessage; return this; }

        /** 링크 + 상태 결과를 한 번에 채운다. */
        public Builder from(LinkReference link, StatusOutcome outcome) {
            this.linkUrl = link.originalHref();
            this.anchorText = link.anchorText();
            this.statusCode = outcome.getStatusCode();
            this.redirectTarget = outcome.getRedirectTarget().orElse(null);
            this.errorMessage = outcome.getFailureReason().orElse(null);
            return this;
        }

        public LinkIssue build() {
            Objects.requireNonNull(sourcePage, "sourcePage");
            Objects.requireNonNull(linkUrl, "linkUrl");
            Objects.requireNonNull(issueType, "issueType");
            return new LinkIssue(this);
        }
    }
}
