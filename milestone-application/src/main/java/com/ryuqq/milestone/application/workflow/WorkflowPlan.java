package com.ryuqq.milestone.application.workflow;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 실행 대상과 워크플로우별 설정의 묶음.
 *
 * <p>설정이 없는 워크플로우는 {@link WorkflowKind#defaults()}를 사용합니다.</p>
 *
 * @param environment 실행 대상
 * @param settings 워크플로우별 설정
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WorkflowPlan(WorkflowEnvironment environment, Map<WorkflowKind, WorkflowSettings> settings) {

    public WorkflowPlan {
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        EnumMap<WorkflowKind, WorkflowSettings> copy = new EnumMap<>(WorkflowKind.class);
        if (settings != null) {
            copy.putAll(settings);
        }
        settings = Collections.unmodifiableMap(copy);
    }

    /**
     * 기본 설정만 사용하는 계획.
     *
     * @param environment 실행 대상
     * @return WorkflowPlan
     */
    public static WorkflowPlan defaults(WorkflowEnvironment environment) {
        return new WorkflowPlan(environment, Map.of());
    }

    public WorkflowSettings settingsFor(WorkflowKind kind) {
        return settings.getOrDefault(kind, kind.defaults());
    }

    /**
     * 한 워크플로우의 설정만 바꾼 새 계획.
     *
     * @param kind 워크플로우
     * @param workflowSettings 새 설정
     * @return 새 WorkflowPlan
     */
    public WorkflowPlan with(WorkflowKind kind, WorkflowSettings workflowSettings) {
        EnumMap<WorkflowKind, WorkflowSettings> copy = new EnumMap<>(WorkflowKind.class);
        copy.putAll(settings);
        copy.put(kind, workflowSettings);
        return new WorkflowPlan(environment, copy);
    }
}
