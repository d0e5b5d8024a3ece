package com.linkpatrol.core.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 입력 텍스트(한 줄에 URL 하나) → 페이지 목록.
 * trim 후 빈 줄은 버리고, maxUrls를 넘으면 앞에서부터 maxUrls개만 남긴다.
 * 중복 제거는 하지 않는다.
 */
public final class UrlListParser {
    private UrlListParser() {}

    /** @param requested 잘리기 전 입력 개수 */
    public record Parsed(List<String> urls, int requested) {
        public Parsed {
            urls = List.copyOf(urls);
        }
        public boolean truncated() { return requested > urls.size(); }
    }

    public static Parsed parse(String text, int maxUrls) {
        if (text == null) return new Parsed(List.of(), 0);
        return parseLines(List.of(text.split("\\R")), maxUrls);
    }

    public static Parsed parseLines(Collection<String> lines, int maxUrls) {
        if (maxUrls < 1) throw new IllegalArgumentException("maxUrls must be >= 1");
        List<String> all = new ArrayList<>();
        if (lines != null) {
            for (String line : lines) {
                if (line == null) continue;
                String s = line.trim();
                if (!s.isEmpty()) all.add(s);
            }
        }
        List<String> kept = all.size() > maxUrls ? all.subList(0, maxUrls) : all;
        return new Parsed(kept, all.size());
    }
}
