package com.ryuqq.milestone.adapter.runner;

import com.ryuqq.milestone.application.runner.WorkflowListener;
import com.ryuqq.milestone.application.runner.WorkflowReport;
import com.ryuqq.milestone.core.model.ProgressRecord;
import com.ryuqq.milestone.core.model.StepId;
import com.ryuqq.milestone.core.model.WorkflowName;
import com.ryuqq.milestone.core.statemachine.WorkflowStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 진행 이벤트를 DEBUG 로그로 남기는 WorkflowListener.
 *
 * <p>다른 리스너로 위임할 수 있어 CLI 출력과 함께 쓸 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class LoggingWorkflowListener implements WorkflowListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingWorkflowListener.class);

    private final WorkflowListener delegate;

    public LoggingWorkflowListener() {
        this(WorkflowListener.NONE);
    }

    public LoggingWorkflowListener(WorkflowListener delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    @Override
    public void statusChanged(WorkflowName workflow, WorkflowStatus from, WorkflowStatus to) {
        log.debug("{}: {} → {}", workflow, from, to);
        delegate.statusChanged(workflow, from, to);
    }

    @Override
    public void stepStarted(WorkflowName workflow, StepId stepId, String description) {
        log.debug("{}: start {} ({})", workflow, stepId, description);
        delegate.stepStarted(workflow, stepId, description);
    }

    @Override
    public void stepCommitted(WorkflowName workflow, StepId stepId, ProgressRecord record) {
        log.debug("{}: committed {} (counter {})", workflow, stepId, record.counter());
        delegate.stepCommitted(workflow, stepId, record);
    }

    @Override
    public void thresholdCrossed(WorkflowName workflow, long threshold) {
        log.debug("{}: threshold {}", workflow, threshold);
        delegate.thresholdCrossed(workflow, threshold);
    }

    @Override
    public void workflowFinished(WorkflowReport report) {
        log.debug("{}: finished {}", report.getWorkflow(), report);
        delegate.workflowFinished(report);
    }
}
