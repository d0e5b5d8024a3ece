package com.linkpatrol.core.service.export;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** JSON 보고서 파일 포맷 (v=1) */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class JsonReport {
    public String v = "1";           // 스키마 버전
    public Instant generatedAt;
    public Summary summary = new Summary();
    public List<Issue> issues = new ArrayList<>();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Summary {
        public int total;
        public long broken;
        public long redirect;
        public long error;
        public int pagesWithIssues;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class Issue {
        public String sourcePage;
        public String linkUrl;
        public String anchorText;
        public String issueType;   // "broken" | "redirect" | "error"
        public int statusCode;     // 0 = 네트워크 수준 실패
        public String redirectTo;  // null 허용
        public String error;       // null 허용
    }
}
