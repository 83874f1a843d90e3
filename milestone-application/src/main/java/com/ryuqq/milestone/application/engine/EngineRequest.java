package com.ryuqq.milestone.application.engine;

import com.ryuqq.milestone.application.workflow.WorkflowKind;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 엔진 실행 요청.
 *
 * @param workflows 실행할 워크플로우 (비어 있으면 활성화된 전부)
 * @param dryRun true면 원격 변경 없이 가상 결과로 실행
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record EngineRequest(Set<WorkflowKind> workflows, boolean dryRun) {

    public EngineRequest {
        EnumSet<WorkflowKind> copy = EnumSet.noneOf(WorkflowKind.class);
        if (workflows != null) {
            copy.addAll(workflows);
        }
        workflows = Collections.unmodifiableSet(copy);
    }

    public static EngineRequest all() {
        return new EngineRequest(Set.of(), false);
    }

    public EngineRequest withDryRun(boolean dryRun) {
        return new EngineRequest(workflows, dryRun);
    }

    /**
     * 실행 대상 여부.
     *
     * @param kind 워크플로우
     * @return 선택되었거나 선택이 비어 있으면 true
     */
    public boolean selects(WorkflowKind kind) {
        return workflows.isEmpty() || workflows.contains(kind);
    }
}
