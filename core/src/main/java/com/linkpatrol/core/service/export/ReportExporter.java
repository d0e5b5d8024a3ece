package com.linkpatrol.core.service.export;

import com.linkpatrol.core.model.LinkIssue;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/** 문제 링크 목록을 파일로 내보내는 책임 (CSV/JSON) */
public interface ReportExporter {
    /**
     * @param baseDir     출력 루트 (null이면 "out")
     * @param issues      문제 링크 목록 (순서 유지)
     * @param generatedAt 보고서 시각 (파일명에도 사용)
     * @return 생성된 파일의 경로
     */
    Path export(Path baseDir, List<LinkIssue> issues, Instant generatedAt) throws IOException;
}
