package com.ryuqq.milestone.core.outcome;

import java.time.Instant;

/**
 * 재시도 가능한 실패.
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>요청 예산 소진 (403 + remaining=0, 429)</li>
 *   <li>네트워크 타임아웃</li>
 *   <li>502/503/504</li>
 * </ul>
 *
 * @param kind THROTTLED 또는 TRANSIENT
 * @param message 실패 사유
 * @param retryAt 서버가 알려준 재시도 가능 시각 (모르면 null)
 * @param <T> 응답 값 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Retryable<T>(FailureKind kind, String message, Instant retryAt) implements AttemptOutcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public Retryable {
        if (kind == null || !kind.isRetryable()) {
            throw new IllegalArgumentException("kind must be THROTTLED or TRANSIENT (current: " + kind + ")");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }
}
