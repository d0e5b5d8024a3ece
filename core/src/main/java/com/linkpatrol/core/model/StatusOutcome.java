package com.linkpatrol.core.model;

import java.util.Optional;
import java.util.Set;

/**
 * 단일 URL 상태 확인 결과.
 * statusCode &gt; 0 이면 서버 응답, 0 이면 네트워크 수준 실패(failureReason 필수).
 */
public final class StatusOutcome {

    public static final String TIMEOUT = "Timeout";
    public static final String CONNECTION_ERROR = "Connection Error";
    public static final String TOO_MANY_REDIRECTS = "Too Many Redirects";

    /** Location 헤더를 채우는 리다이렉트 상태 코드 */
    public static final Set<Integer> REDIRECT_CODES = Set.of(301, 302, 303, 307, 308);

    private final int statusCode;
    private final String redirectTarget;   // nullable
    private final String failureReason;    // nullable

    private StatusOutcome(int statusCode, String redirectTarget, String failureReason) {
        this.statusCode = statusCode;
        this.redirectTarget = redirectTarget;
        this.failureReason = failureReason;
    }

    /** 서버 응답. redirectTarget은 리다이렉트 코드일 때만 보존한다. */
    public static StatusOutcome of(int statusCode, String location) {
        if (statusCode <= 0) throw new IllegalArgumentException("statusCode must be > 0: " + statusCode);
        String target = isRedirect(statusCode) && location != null && !location.isBlank() ? location : null;
        return new StatusOutcome(statusCode, target, null);
    }

    public static StatusOutcome of(int statusCode) {
        return of(statusCode, null);
    }

    /** 네트워크 수준 실패 (status 0) */
    public static StatusOutcome failure(String reason) {
        String r = (reason == null || reason.isBlank()) ? "Unknown error" : reason;
        return new StatusOutcome(0, null, r);
    }

    public static boolean isRedirect(int statusCode) {
        return REDIRECT_CODES.contains(statusCode);
    }

    public int getStatusCode() { return statusCode; }
    public Optional<String> getRedirectTarget() { return Optional.ofNullable(redirectTarget); }
    public Optional<String> getFailureReason() { return Optional.ofNullable(failureReason); }
    public boolean isFailure() { return failureReason != null; }

    @Override
    public String toString() {
        if (failureReason != null) return "StatusOutcome{0, " + failureReason + "}";
        return "StatusOutcome{" + statusCode + (redirectTarget != null ? " -> " + redirectTarget : "") + "}";
    }
}
