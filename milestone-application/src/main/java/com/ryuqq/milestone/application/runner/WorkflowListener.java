package com.ryuqq.milestone.application.runner;

import com.ryuqq.milestone.core.model.ProgressRecord;
import com.ryuqq.milestone.core.model.StepId;
import com.ryuqq.milestone.core.model.WorkflowName;
import com.ryuqq.milestone.core.statemachine.WorkflowStatus;

/**
 * 워크플로우 상태 전이 관찰자.
 *
 * <p>모든 메서드는 워크플로우 태스크 스레드에서 호출되므로 구현은 스레드 안전해야 합니다.
 * 기본 구현은 아무것도 하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface WorkflowListener {

    /**
     * 아무것도 하지 않는 리스너.
     */
    WorkflowListener NONE = new WorkflowListener() {
    };

    default void statusChanged(WorkflowName workflow, WorkflowStatus from, WorkflowStatus to) {
    }

    default void stepStarted(WorkflowName workflow, StepId stepId, String description) {
    }

    default void stepCommitted(WorkflowName workflow, StepId stepId, ProgressRecord record) {
    }

    default void thresholdCrossed(WorkflowName workflow, long threshold) {
    }

    default void workflowFinished(WorkflowReport report) {
    }
}
