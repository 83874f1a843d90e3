package com.ryuqq.milestone.core.workflow;

import com.ryuqq.milestone.core.outcome.AttemptOutcome;
import com.ryuqq.milestone.core.outcome.Fatal;
import com.ryuqq.milestone.core.outcome.FailureKind;

import java.util.Map;

/**
 * 단계 실행 결과.
 *
 * <ul>
 *   <li>{@link Advanced}: 성공, 효과를 커밋</li>
 *   <li>{@link Blocked}: 외부 전제 조건 대기, 오류 없이 중단</li>
 *   <li>{@link Failed}: 워크플로우 중단, 커밋된 진행은 유지</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface StepOutcome {

    record Advanced(StepEffect effect) implements StepOutcome {

        public Advanced {
            if (effect == null) {
                throw new IllegalArgumentException("effect cannot be null");
            }
        }
    }

    record Blocked(String reason) implements StepOutcome {

        public Blocked {
            if (reason == null || reason.isBlank()) {
                throw new IllegalArgumentException("reason cannot be null or blank");
            }
        }
    }

    record Failed(FailureKind kind, String code, String message) implements StepOutcome {

        public Failed {
            if (kind == null || kind.isRetryable()) {
                throw new IllegalArgumentException("kind must be a fatal classification (current: " + kind + ")");
            }
            if (code == null || code.isBlank()) {
                code = kind.name();
            }
            if (message == null || message.isBlank()) {
                message = kind.name();
            }
        }
    }

    /**
     * counter를 1 올리는 성공.
     *
     * @return Advanced
     */
    static StepOutcome advanced() {
        return new Advanced(StepEffect.increment());
    }

    /**
     * counter를 올리고 워크플로우를 완료하는 성공.
     *
     * @param delta counter 증가량
     * @return Advanced
     */
    static StepOutcome completed(long delta) {
        return new Advanced(new StepEffect(delta, true, Map.of()));
    }

    /**
     * counter를 바꾸지 않고 속성만 남기는 성공 (설정 단계).
     *
     * @param attributes 속성
     * @return Advanced
     */
    static StepOutcome recorded(Map<String, String> attributes) {
        return new Advanced(StepEffect.attributes(attributes));
    }

    static StepOutcome blocked(String reason) {
        return new Blocked(reason);
    }

    static StepOutcome failed(FailureKind kind, String message) {
        return new Failed(kind, kind.name(), message);
    }

    /**
     * 실패한 호출 결과를 단계 실패로 변환.
     *
     * @param outcome Fatal 호출 결과
     * @return Failed
     * @throws IllegalArgumentException 성공 결과가 전달된 경우
     */
    static StepOutcome failed(AttemptOutcome<?> outcome) {
        if (outcome instanceof Fatal<?> fatal) {
            return new Failed(fatal.kind(), fatal.code(), fatal.message());
        }
        if (outcome.isRetryable()) {
            // RetryPolicy가 흡수해야 하는 분류가 남은 경우
            return new Failed(FailureKind.RETRIES_EXHAUSTED, FailureKind.RETRIES_EXHAUSTED.name(), String.valueOf(outcome));
        }
        throw new IllegalArgumentException("outcome is not a failure: " + outcome);
    }
}
