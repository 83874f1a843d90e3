package com.ryuqq.milestone.core.spi;

/**
 * 파일 하나의 변경.
 *
 * @param branch 작업 브랜치 (null이면 저장소 기본 브랜치)
 * @param path 저장소 내 파일 경로
 * @param content 새 파일 전체 내용
 * @param message 커밋 메시지 (Pull Request 제목으로도 사용)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ChangeSet(String branch, String path, String content, String message) {

    public ChangeSet {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path cannot be null or blank");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }
}
