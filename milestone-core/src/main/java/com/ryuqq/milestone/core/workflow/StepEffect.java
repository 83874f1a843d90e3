package com.ryuqq.milestone.core.workflow;

import java.util.Map;

/**
 * 성공한 단계가 진행 기록에 남기는 효과.
 *
 * @param delta counter 증가량 (0 이상)
 * @param completes 워크플로우 완료 여부
 * @param attributes 병합할 속성
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StepEffect(long delta, boolean completes, Map<String, String> attributes) {

    public StepEffect {
        if (delta < 0) {
            throw new IllegalArgumentException("delta must be non-negative (current: " + delta + ")");
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static StepEffect increment() {
        return new StepEffect(1, false, Map.of());
    }

    public static StepEffect attributes(Map<String, String> attributes) {
        return new StepEffect(0, false, attributes);
    }
}
