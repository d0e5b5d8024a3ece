package com.linkpatrol.core.http;

import com.linkpatrol.core.api.IStatusResolver;
import com.linkpatrol.core.model.LinkCheckConfig;
import com.linkpatrol.core.model.StatusOutcome;
import com.linkpatrol.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * 링크 상태 확인기.
 * - 1차: HEAD (본문 없음), 리다이렉트는 따라가지 않음 → 3xx 원본 코드 관측
 * - 405면 같은 URL에 GET 한 번 더 (역시 리다이렉트 미추적, 본문은 읽지 않고 닫음)
 * - 시도마다 timeout 독립 적용
 * - 예외는 모두 status 0 + failureReason 으로 변환
 */
public class HttpStatusResolver implements IStatusResolver {

    private static final Logger LOG = LoggerFactory.getLogger(HttpStatusResolver.class);

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<?> send(HttpRequest req) throws Exception;
    }

    static final int METHOD_NOT_ALLOWED = 405;

    private final Duration timeout;
    private final String userAgent;
    private final HttpClient client;   // 프로덕션 경로
    private final HttpSender sender;

    public HttpStatusResolver(LinkCheckConfig config) {
        Objects.requireNonNull(config, "config");
        this.timeout = config.getTimeout();
        this.userAgent = config.getUserAgent();
        this.client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(config.getTimeout())
                .build();
        this.sender = this::sendOverClient;
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpStatusResolver(LinkCheckConfig config, HttpSender testSender) {
        Objects.requireNonNull(config, "config");
        this.timeout = config.getTimeout();
        this.userAgent = config.getUserAgent();
        this.client = null; // 테스트에선 사용 안 함
        this.sender = Objects.requireNonNull(testSender, "testSender");
    }

    @Override
    public StatusOutcome checkStatus(String url) {
        try {
            URI uri = UrlUtils.toUri(url);

            HttpResponse<?> resp = sender.send(request(uri, "HEAD"));
            if (resp.statusCode() == METHOD_NOT_ALLOWED) {
                LOG.debug("HEAD not allowed, falling back to GET: {}", url);
                resp = sender.send(request(uri, "GET"));
            }

            int code = resp.statusCode();
            String location = resp.headers().firstValue("Location").orElse(null);
            return StatusOutcome.of(code, location);

        } catch (HttpTimeoutException e) {
            // connect timeout(HttpConnectTimeoutException) 포함
            return StatusOutcome.failure(StatusOutcome.TIMEOUT);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return StatusOutcome.failure("Interrupted");
        } catch (IOException e) {
            if (isTooManyRedirects(e)) return StatusOutcome.failure(StatusOutcome.TOO_MANY_REDIRECTS);
            LOG.debug("Connection failure for {}: {}", url, e.toString());
            return StatusOutcome.failure(StatusOutcome.CONNECTION_ERROR);
        } catch (Exception e) {
            // 잘못된 URL/지원하지 않는 scheme 등
            String msg = e.getMessage();
            return StatusOutcome.failure(msg == null || msg.isBlank() ? e.toString() : msg);
        }
    }

    private HttpRequest request(URI uri, String method) {
        return HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("User-Agent", userAgent)
                .method(method, HttpRequest.BodyPublishers.noBody())
                .build();
    }

    private HttpResponse<?> sendOverClient(HttpRequest req) throws IOException, InterruptedException {
        if ("HEAD".equals(req.method())) {
            return client.send(req, HttpResponse.BodyHandlers.discarding());
        }
        // GET은 상태/헤더만 필요 → 스트림으로 받아 바로 닫는다
        HttpResponse<InputStream> resp = client.send(req, HttpResponse.BodyHandlers.ofInputStream());
        try (InputStream ignored = resp.body()) {
            return resp;
        }
    }

    private static boolean isTooManyRedirects(IOException e) {
        String m = e.getMessage();
        return m != null && m.toLowerCase(Locale.ROOT).contains("too many redirects");
    }
}
