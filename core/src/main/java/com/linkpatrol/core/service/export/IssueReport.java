package com.linkpatrol.core.service.export;

import com.linkpatrol.core.model.IssueType;
import com.linkpatrol.core.model.LinkIssue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/** 문제 링크 목록 요약/필터/페이지별 묶음. 입력 목록은 바꾸지 않는다. */
public final class IssueReport {

    private final List<LinkIssue> issues;

    private IssueReport(List<LinkIssue> issues) {
        this.issues = List.copyOf(issues);
    }

    public static IssueReport of(List<LinkIssue> issues) {
        return new IssueReport(Objects.requireNonNull(issues, "issues"));
    }

    public List<LinkIssue> issues() { return issues; }
    public int total() { return issues.size(); }
    public boolean isClean() { return issues.isEmpty(); }

    public long count(IssueType type) {
        return issues.stream().filter(i -> i.getIssueType() == type).count();
    }

    /** 모든 유형을 포함(0건도 표시) */
    public Map<IssueType, Long> countsByType() {
        Map<IssueType, Long> m = new EnumMap<>(IssueType.class);
        for (IssueType t : IssueType.values()) m.put(t, 0L);
        for (LinkIssue i : issues) m.merge(i.getIssueType(), 1L, Long::sum);
        return Collections.unmodifiableMap(m);
    }

    /** 문제가 하나 이상 있는 페이지(처음 나온 순서) */
    public Set<String> pagesWithIssues() {
        Set<String> s = new LinkedHashSet<>();
        for (LinkIssue i : issues) s.add(i.getSourcePage());
        return Collections.unmodifiableSet(s);
    }

    /** type이 null이면 전체 */
    public List<LinkIssue> filter(IssueType type) {
        if (type == null) return issues;
        return issues.stream().filter(i -> i.getIssueType() == type).collect(Collectors.toUnmodifiableList());
    }

    /** 페이지 URL 사전순, 페이지 내부는 원래 순서 */
    public SortedMap<String, List<LinkIssue>> byPage() {
        SortedMap<String, List<LinkIssue>> m = new TreeMap<>();
        for (LinkIssue i : issues) m.computeIfAbsent(i.getSourcePage(), k -> new ArrayList<>()).add(i);
        m.replaceAll((k, v) -> List.copyOf(v));
        return Collections.unmodifiableSortedMap(m);
    }
}
