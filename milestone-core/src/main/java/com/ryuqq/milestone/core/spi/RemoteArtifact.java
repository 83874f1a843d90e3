package com.ryuqq.milestone.core.spi;

/**
 * 원격에 생성된 산출물(Issue, Pull Request, 커밋, Discussion, 댓글) 참조.
 *
 * @param id 원격 식별자 (node id, commit sha)
 * @param number 사람이 보는 번호 (없으면 0)
 * @param url 웹 URL (nullable)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RemoteArtifact(String id, long number, String url) {

    public RemoteArtifact {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (number < 0) {
            throw new IllegalArgumentException("number must be non-negative (current: " + number + ")");
        }
    }
}
