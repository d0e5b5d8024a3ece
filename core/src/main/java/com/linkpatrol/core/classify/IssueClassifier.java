package com.linkpatrol.core.classify;

import com.linkpatrol.core.model.Classification;
import com.linkpatrol.core.model.IssueType;
import com.linkpatrol.core.model.StatusOutcome;

/**
 * 상태 결과 → 문제 여부/유형. 순수 함수.
 * 규칙(우선순위 순):
 * 1. failureReason 있음 → ERROR
 * 2. 404 → BROKEN
 * 3. 301/302/303/307/308 → REDIRECT
 * 4. &gt;= 400 → BROKEN
 * 5. 0 → ERROR
 * 6. 그 외(2xx, 목록 밖 3xx 등) → 문제 아님
 */
public final class IssueClassifier {
    private IssueClassifier() {}

    public static Classification classify(int statusCode, String failureReason) {
        if (failureReason != null && !failureReason.isEmpty()) return Classification.problem(IssueType.ERROR);
        if (statusCode == 404) return Classification.problem(IssueType.BROKEN);
        if (StatusOutcome.isRedirect(statusCode)) return Classification.problem(IssueType.REDIRECT);
        if (statusCode >= 400) return Classification.problem(IssueType.BROKEN);
        if (statusCode == 0) return Classification.problem(IssueType.ERROR);
        return Classification.OK;
    }

    public static Classification classify(StatusOutcome outcome) {
        return classify(outcome.getStatusCode(), outcome.getFailureReason().orElse(null));
    }
}
