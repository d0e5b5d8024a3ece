package com.linkpatrol.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 링크 검사 설정 (linkcheck.yml 매핑 대상). 순수 설정 보관용.
 * 타임아웃 범위 제한([5,30]초)은 표시 계층(CLI) 책임이며 코어는 양수면 모두 허용한다.
 */
public final class LinkCheckConfig {

    /** 동시에 검사하는 페이지 수 상한 */
    public static final int MAX_CONCURRENCY = 5;

    /** 실제 브라우저와 같은 식별자를 보낸다. */
    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) "
                    + "Chrome/91.0.4472.124 Safari/537.36";

    private Duration timeout = Duration.ofSeconds(10);         // 요청 1회당 타임아웃
    private int concurrency = MAX_CONCURRENCY;                 // 동시 페이지 수
    private Duration politenessDelay = Duration.ofMillis(100); // 링크 검사 사이 대기(페이지 단위)
    private String userAgent = DEFAULT_USER_AGENT;
    private int maxUrls = 100;                                 // 입력 목록 상한(입력 파서/CLI에서만 적용)
    private Path outputDir = Path.of("out");
    private List<String> urls = List.of();                     // 설정 파일에 적힌 페이지 목록(옵션)

    // ---------- getters ----------
    public Duration getTimeout() { return timeout; }
    public int getConcurrency() { return concurrency; }
    public Duration getPolitenessDelay() { return politenessDelay; }
    public String getUserAgent() { return userAgent; }
    public int getMaxUrls() { return maxUrls; }
    public Path getOutputDir() { return outputDir; }
    public List<String> getUrls() { return urls; }

    // ---------- fluent setters ----------
    public LinkCheckConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public LinkCheckConfig setConcurrency(int concurrency) { this.concurrency = concurrency; return this; }
    public LinkCheckConfig setPolitenessDelay(Duration d) { this.politenessDelay = d; return this; }
    public LinkCheckConfig setUserAgent(String userAgent) { this.userAgent = userAgent; return this; }
    public LinkCheckConfig setMaxUrls(int maxUrls) { this.maxUrls = maxUrls; return this; }
    public LinkCheckConfig setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }
    public LinkCheckConfig setUrls(List<String> urls) {
        this.urls = (urls == null ? List.of() : List.copyOf(urls));
        return this;
    }

    public LinkCheckConfig setTimeoutSeconds(long seconds) {
        this.timeout = Duration.ofSeconds(seconds);
        return this;
    }

    public LinkCheckConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(ms);
        return this;
    }

    // ---------- validate ----------
    public void validate() {
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        if (concurrency < 1 || concurrency > MAX_CONCURRENCY)
            throw new IllegalArgumentException("concurrency must be between 1 and " + MAX_CONCURRENCY);
        if (politenessDelay == null || politenessDelay.isNegative())
            throw new IllegalArgumentException("politenessDelay must be >= 0");
        if (userAgent == null || userAgent.isBlank())
            throw new IllegalArgumentException("userAgent must not be blank");
        if (maxUrls < 1) throw new IllegalArgumentException("maxUrls must be >= 1");
        Objects.requireNonNull(outputDir, "outputDir");
    }

    // ---------- helpers ----------
    public static LinkCheckConfig defaults() { return new LinkCheckConfig(); }

    public long getTimeoutMs() { return timeout.toMillis(); }

    /** jsoup 등 int ms 필요 시 편의 메서드 */
    public int getTimeoutMsInt() {
        long ms = getTimeoutMs();
        return (ms > Integer.MAX_VALUE) ? Integer.MAX_VALUE : (int) ms;
    }
}
