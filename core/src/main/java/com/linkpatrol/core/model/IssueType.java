package com.linkpatrol.core.model;

import java.util.Locale;
import java.util.Optional;

/** 문제 링크 분류 */
public enum IssueType {
    /** 404, 그 밖의 4xx/5xx */
    BROKEN,
    /** 301/302/303/307/308 */
    REDIRECT,
    /** 타임아웃/연결 실패 등 전송 계층 실패, status 0 */
    ERROR;

    /** 보고서/로그용 소문자 표기 ("broken" | "redirect" | "error") */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** 대소문자 무시 파싱. "all"/빈 값/미지정이면 empty. */
    public static Optional<IssueType> parse(String s) {
        if (s == null) return Optional.empty();
        String v = s.trim();
        if (v.isEmpty() || v.equalsIgnoreCase("all")) return Optional.empty();
        for (IssueType t : values()) {
            if (t.name().equalsIgnoreCase(v)) return Optional.of(t);
        }
        throw new IllegalArgumentException("Unknown issue type: " + s);
    }
}
