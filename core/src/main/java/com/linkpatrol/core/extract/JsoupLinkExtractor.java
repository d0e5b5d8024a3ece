package com.linkpatrol.core.extract;

import com.linkpatrol.core.model.ExtractionResult;
import com.linkpatrol.core.model.LinkCheckConfig;
import com.linkpatrol.core.model.LinkReference;
import com.linkpatrol.core.util.UrlUtils;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/** JSoup 기반 링크 추출기: 페이지 GET → a[href] → 페이지 URL 기준 절대 URL */
public class JsoupLinkExtractor implements LinkExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(JsoupLinkExtractor.class);

    /** 이 접두사로 시작하는 href는 링크로 취급하지 않는다(대소문자 무시). */
    static final List<String> EXCLUDED_PREFIXES = List.of("#", "javascript:", "mailto:", "tel:");

    private static final int MAX_BODY_BYTES = 10 * 1024 * 1024;

    private final int timeoutMs;
    private final String userAgent;

    public JsoupLinkExtractor(LinkCheckConfig config) {
        this(config.getTimeoutMsInt(), config.getUserAgent());
    }

    public JsoupLinkExtractor(int timeoutMs, String userAgent) {
        this.timeoutMs = Math.max(1, timeoutMs);
        this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
    }

    @Override
    public ExtractionResult extract(String pageUrl) {
        if (pageUrl == null || pageUrl.isBlank()) return ExtractionResult.failed("Empty page URL");
        try {
            Document doc = Jsoup.connect(pageUrl)
                    .userAgent(userAgent)
                    .timeout(timeoutMs)
                    .followRedirects(true)
                    .ignoreContentType(true)
                    .maxBodySize(MAX_BODY_BYTES)
                    .get();
            List<LinkReference> links = parse(doc, pageUrl);
            LOG.debug("Extracted {} link(s) from {}", links.size(), pageUrl);
            return ExtractionResult.of(links);
        } catch (HttpStatusException e) {
            return ExtractionResult.failed("HTTP " + e.getStatusCode());
        } catch (SocketTimeoutException e) {
            return ExtractionResult.failed("Timeout");
        } catch (IOException e) {
            return ExtractionResult.failed(e.toString());
        } catch (UncheckedIOException e) {
            return ExtractionResult.failed(String.valueOf(e.getCause()));
        } catch (IllegalArgumentException e) {
            // jsoup: 잘못된 URL
            return ExtractionResult.failed("Invalid URL: " + e.getMessage());
        }
    }

    /** 이미 파싱된 문서에서 추출. 같은 마크업이면 항상 같은 순서/내용. */
    public static List<LinkReference> parse(Document doc, String pageUrl) {
        List<LinkReference> out = new ArrayList<>();
        for (Element a : doc.select("a[href]")) {
            String href = a.attr("href").trim();
            if (isExcluded(href)) continue;

            Optional<String> resolved = UrlUtils.resolve(pageUrl, href);
            if (resolved.isEmpty()) {
                LOG.debug("Unresolvable href skipped: {} (page={})", href, pageUrl);
                continue;
            }
            out.add(new LinkReference(resolved.get(), href, a.text()));
        }
        return out;
    }

    /** 마크업 문자열에서 추출 (네트워크 없이) */
    public static List<LinkReference> parse(String html, String pageUrl) {
        return parse(Jsoup.parse(html == null ? "" : html, pageUrl), pageUrl);
    }

    static boolean isExcluded(String href) {
        if (href == null || href.isBlank()) return true;
        String h = href.trim().toLowerCase(Locale.ROOT);
        for (String p : EXCLUDED_PREFIXES) {
            if (h.startsWith(p)) return true;
        }
        return false;
    }
}
