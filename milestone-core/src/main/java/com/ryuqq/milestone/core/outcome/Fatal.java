package com.ryuqq.milestone.core.outcome;

/**
 * 재시도 불가 실패.
 *
 * <p>해당 워크플로우를 중단시키지만 다른 워크플로우에는 영향을 주지 않습니다.</p>
 *
 * @param kind 실패 분류 (THROTTLED, TRANSIENT 제외)
 * @param code 기계 판독용 코드 (예: "HTTP-422", "DEADLINE")
 * @param message 사람이 읽을 수 있는 메시지
 * @param <T> 응답 값 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Fatal<T>(FailureKind kind, String code, String message) implements AttemptOutcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public Fatal {
        if (kind == null || kind.isRetryable()) {
            throw new IllegalArgumentException("kind must be a fatal classification (current: " + kind + ")");
        }
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    /**
     * 코드를 분류 이름으로 채운 Fatal 생성.
     *
     * @param kind 실패 분류
     * @param message 메시지
     * @param <T> 응답 값 타입
     * @return Fatal
     */
    public static <T> Fatal<T> of(FailureKind kind, String message) {
        return new Fatal<>(kind, kind.name(), message);
    }
}
