package com.linkpatrol.core.model;

import java.util.List;

/**
 * 실행 1회의 전체 결과.
 *
 * @param issues 페이지 완료 순서대로 이어 붙인 문제 링크 (페이지 내부는 발견 순서)
 * @param pages  페이지별 결과, 완료 순서
 * @param stats  실행 텔레메트리
 */
public record CheckRun(List<LinkIssue> issues, List<PageOutcome> pages, CheckStats.Snapshot stats) {
    public CheckRun {
        issues = List.copyOf(issues);
        pages = List.copyOf(pages);
    }
}
