package com.linkpatrol.core.util;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

import org.jsoup.internal.StringUtil;

/** href 해석 + 요청용 URI 변환 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    private static final Pattern SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.\\-]*:");

    /**
     * href를 페이지 URL 기준으로 절대 URL로 해석 (jsoup의 abs:href와 같은 규칙, RFC 3986).
     * - 상대 경로 → 절대, 절대 URL은 그대로, "//host/x"는 페이지 scheme 상속
     * - "?q=1"처럼 쿼리만 있는 참조는 페이지 경로를 유지한다
     * - 루트 위로 올라가는 "../"는 버린다 (https://a.com/../x → https://a.com/x)
     * - 해석기가 모르는 scheme(data:, sms: 등)의 절대 참조는 원문 그대로 돌려준다
     * 해석 불가면 empty.
     */
    public static Optional<String> resolve(String pageUrl, String href) {
        if (href == null || pageUrl == null) return Optional.empty();
        String rel = href.trim();
        String abs = StringUtil.resolve(pageUrl, rel);
        if (abs.isEmpty()) {
            if (hasScheme(rel) && !rel.regionMatches(true, 0, "http", 0, 4)) return Optional.of(rel);
            return Optional.empty();
        }
        return Optional.of(clampAboveRoot(abs));
    }

    private static String clampAboveRoot(String abs) {
        try {
            URL u = new URL(abs);
            String path = u.getPath();
            if (path == null || !path.startsWith("/../")) return abs;
            String file = path.replaceFirst("^(/\\.\\.)+(?=/)", "")
                    + (u.getQuery() != null ? "?" + u.getQuery() : "")
                    + (u.getRef() != null ? "#" + u.getRef() : "");
            return new URL(u.getProtocol(), u.getHost(), u.getPort(), file).toExternalForm();
        } catch (MalformedURLException e) {
            return abs;
        }
    }

    public static boolean hasScheme(String s) {
        return s != null && SCHEME.matcher(s).find();
    }

    /**
     * 요청용 URI로 변환. 공백 등 URI에 허용되지 않는 문자는 퍼센트 인코딩해서 재시도한다.
     * @throws IllegalArgumentException 변환 불가
     */
    public static URI toUri(String url) {
        if (url == null || url.isBlank()) throw new IllegalArgumentException("URL is blank");
        String s = url.trim();
        try {
            return new URI(s);
        } catch (URISyntaxException first) {
            try {
                URL u = new URL(s);
                return new URI(u.getProtocol(), u.getUserInfo(), u.getHost(), u.getPort(),
                        u.getPath(), u.getQuery(), u.getRef());
            } catch (MalformedURLException | URISyntaxException e) {
                throw new IllegalArgumentException("Invalid URL: " + s, first);
            }
        }
    }

    /** host가 있는 절대 http(s) URL인지 */
    public static boolean isHttpUrl(String url) {
        if (url == null || url.isBlank()) return false;
        try {
            URI u = toUri(url);
            String scheme = u.getScheme();
            if (scheme == null) return false;
            String sc = scheme.toLowerCase(Locale.ROOT);
            return (sc.equals("http") || sc.equals("https")) && u.getHost() != null && !u.getHost().isBlank();
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
