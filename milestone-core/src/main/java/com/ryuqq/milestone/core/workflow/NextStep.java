package com.ryuqq.milestone.core.workflow;

import com.ryuqq.milestone.core.model.StepId;

import java.time.Duration;

/**
 * {@link Workflow#nextStep}의 결과.
 *
 * <ul>
 *   <li>{@link Step}: 실행할 단계</li>
 *   <li>{@link Done}: 목표 도달, 더 할 일 없음</li>
 *   <li>{@link Blocked}: 외부 전제 조건 대기 (오류 아님)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface NextStep {

    /**
     * 실행할 단계.
     *
     * @param id 결정적 단계 식별자
     * @param description 로그용 설명
     * @param action 단계 동작
     * @param pauseAfter 성공 후 다음 단계까지의 간격 (없으면 ZERO)
     */
    record Step(StepId id, String description, StepAction action, Duration pauseAfter) implements NextStep {

        public Step {
            if (id == null) {
                throw new IllegalArgumentException("id cannot be null");
            }
            if (action == null) {
                throw new IllegalArgumentException("action cannot be null");
            }
            if (description == null || description.isBlank()) {
                description = id.getValue();
            }
            if (pauseAfter == null) {
                pauseAfter = Duration.ZERO;
            }
            if (pauseAfter.isNegative()) {
                throw new IllegalArgumentException("pauseAfter must be non-negative (current: " + pauseAfter + ")");
            }
        }

        public Step(StepId id, String description, StepAction action) {
            this(id, description, action, Duration.ZERO);
        }
    }

    /**
     * 목표 도달.
     *
     * @param summary 완료 요약
     */
    record Done(String summary) implements NextStep {
    }

    /**
     * 외부 전제 조건 대기.
     *
     * @param reason 운영자에게 보여줄 사유
     */
    record Blocked(String reason) implements NextStep {

        public Blocked {
            if (reason == null || reason.isBlank()) {
                throw new IllegalArgumentException("reason cannot be null or blank");
            }
        }
    }
}
