package com.linkpatrol.core.model;

import java.util.Optional;

/** 분류 결과: 문제 여부 + 문제일 때의 유형 */
public record Classification(boolean problem, IssueType type) {

    public static final Classification OK = new Classification(false, null);

    public Classification {
        if (problem && type == null) throw new IllegalArgumentException("problem requires a type");
        if (!problem && type != null) throw new IllegalArgumentException("non-problem must not carry a type");
    }

    public static Classification problem(IssueType type) {
        return new Classification(true, type);
    }

    public Optional<IssueType> issueType() {
        return Optional.ofNullable(type);
    }
}
