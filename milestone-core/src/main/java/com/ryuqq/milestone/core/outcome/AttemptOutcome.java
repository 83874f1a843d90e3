package com.ryuqq.milestone.core.outcome;

/**
 * 원격 호출 시도 결과.
 *
 * <p>AttemptOutcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Success}: 성공, 응답 값 포함</li>
 *   <li>{@link Retryable}: 재시도 가능한 실패 (THROTTLED, TRANSIENT)</li>
 *   <li>{@link Fatal}: 재시도 불가 실패</li>
 * </ul>
 *
 * <p>원격 오류는 예외가 아닌 값으로 전달됩니다. RetryPolicy는 Retryable을 흡수하므로
 * 워크플로우는 Success 또는 Fatal만 받습니다.</p>
 *
 * @param <T> 응답 값 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface AttemptOutcome<T> permits Success, Retryable, Fatal {

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default boolean isRetryable() {
        return this instanceof Retryable;
    }

    default boolean isFatal() {
        return this instanceof Fatal;
    }

    /**
     * 성공 값 조회.
     *
     * @return 응답 값
     * @throws IllegalStateException 성공이 아닌 경우
     */
    default T payload() {
        if (this instanceof Success<T> success) {
            return success.value();
        }
        throw new IllegalStateException("Outcome is not a success: " + this);
    }

    /**
     * 실패 분류 조회.
     *
     * @return 실패 분류 (성공이면 null)
     */
    default FailureKind failureKind() {
        if (this instanceof Retryable<T> retryable) {
            return retryable.kind();
        }
        if (this instanceof Fatal<T> fatal) {
            return fatal.kind();
        }
        return null;
    }
}
