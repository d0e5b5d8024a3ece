package com.linkpatrol.core.service.export;

import com.linkpatrol.core.model.IssueType;
import com.linkpatrol.core.model.LinkIssue;

import java.util.List;

/** 내보내기 테스트 공용 샘플 */
final class ExportFixtures {
    private ExportFixtures() {}

    static List<LinkIssue> sample() {
        return List.of(
                LinkIssue.builder().sourcePage("https://b.test/").linkUrl("/missing")
                        .anchorText("Missing, \"quoted\"").statusCode(404).issueType(IssueType.BROKEN).build(),
                LinkIssue.builder().sourcePage("https://a.test/").linkUrl("/old")
                        .anchorText("Old").statusCode(301).redirectTarget("https://a.test/new")
                        .issueType(IssueType.REDIRECT).build(),
                LinkIssue.builder().sourcePage("https://b.test/").linkUrl("https://down.test/")
                        .anchorText("Down").statusCode(0).errorMessage("Connection Error")
                        .issueType(IssueType.ERROR).build());
    }
}
