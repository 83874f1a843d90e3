package com.ryuqq.milestone.application.runner;

import com.ryuqq.milestone.core.model.ProgressRecord;
import com.ryuqq.milestone.core.model.StepId;
import com.ryuqq.milestone.core.model.WorkflowName;
import com.ryuqq.milestone.core.outcome.FailureKind;
import com.ryuqq.milestone.core.statemachine.WorkflowStatus;

/**
 * 워크플로우 한 번 실행의 종료 보고.
 *
 * <p>운영자에게 워크플로우 이름, 실패 단계 식별자, 실패 분류를 알려주고,
 * 다시 실행하면 진행되는지(STOPPED_RESUMABLE) 아닌지(STOPPED_UNACHIEVABLE)를 구분합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 상태 변경 불가</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkflowReport {

    private final WorkflowName workflow;
    private final WorkflowStatus status;
    private final FailureKind failureKind;
    private final StepId stepId;
    private final String message;
    private final ProgressRecord record;
    private final int stepsExecuted;
    private final RunStatistics statistics;

    private WorkflowReport(WorkflowName workflow, WorkflowStatus status, FailureKind failureKind,
                           StepId stepId, String message, ProgressRecord record, int stepsExecuted) {
        this(workflow, status, failureKind, stepId, message, record, stepsExecuted, RunStatistics.EMPTY);
    }

    private WorkflowReport(WorkflowName workflow, WorkflowStatus status, FailureKind failureKind,
                           StepId stepId, String message, ProgressRecord record, int stepsExecuted,
                           RunStatistics statistics) {
        if (workflow == null) {
            throw new IllegalArgumentException("workflow cannot be null");
        }
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("status must be terminal (current: " + status + ")");
        }
        this.workflow = workflow;
        this.status = status;
        this.failureKind = failureKind;
        this.stepId = stepId;
        this.message = message;
        this.record = record;
        this.stepsExecuted = stepsExecuted;
        this.statistics = statistics == null ? RunStatistics.EMPTY : statistics;
    }

    public static WorkflowReport completed(WorkflowName workflow, ProgressRecord record, int stepsExecuted) {
        return new WorkflowReport(workflow, WorkflowStatus.COMPLETED, null, null,
            "completed at " + record.counter(), record, stepsExecuted);
    }

    public static WorkflowReport blocked(WorkflowName workflow, ProgressRecord record, StepId stepId,
                                         String reason, int stepsExecuted) {
        return new WorkflowReport(workflow, WorkflowStatus.BLOCKED, null, stepId, reason, record, stepsExecuted);
    }

    /**
     * 실패 보고 생성.
     *
     * <p>분류가 재개 가능하면 STOPPED_RESUMABLE, 아니면 STOPPED_UNACHIEVABLE입니다.</p>
     *
     * @param workflow 워크플로우 이름
     * @param record 마지막으로 커밋된 기록
     * @param stepId 실패한 단계
     * @param kind 실패 분류
     * @param message 실패 메시지
     * @param stepsExecuted 이번 실행에서 커밋한 단계 수
     * @return WorkflowReport
     */
    public static WorkflowReport stopped(WorkflowName workflow, ProgressRecord record, StepId stepId,
                                         FailureKind kind, String message, int stepsExecuted) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null for a stopped report");
        }
        WorkflowStatus status = kind.isResumable() ? WorkflowStatus.STOPPED_RESUMABLE : WorkflowStatus.STOPPED_UNACHIEVABLE;
        return new WorkflowReport(workflow, status, kind, stepId, message, record, stepsExecuted);
    }

    /**
     * 예상하지 못한 예외로 중단된 워크플로우 보고.
     *
     * <p>분류 없이 STOPPED_RESUMABLE로 보고합니다. 커밋된 진행은 그대로이므로 다시 실행할 수 있습니다.</p>
     *
     * @param workflow 워크플로우 이름
     * @param recordOrNull 마지막으로 커밋된 기록
     * @param message 예외 메시지
     * @return WorkflowReport
     */
    public static WorkflowReport unexpected(WorkflowName workflow, ProgressRecord recordOrNull, String message) {
        return new WorkflowReport(workflow, WorkflowStatus.STOPPED_RESUMABLE, null, null, message, recordOrNull, 0);
    }

    public static WorkflowReport cancelled(WorkflowName workflow, ProgressRecord record, StepId stepId, int stepsExecuted) {
        return new WorkflowReport(workflow, WorkflowStatus.CANCELLED, null, stepId, "cancelled", record, stepsExecuted);
    }

    public static WorkflowReport disabled(WorkflowName workflow, ProgressRecord recordOrNull) {
        return new WorkflowReport(workflow, WorkflowStatus.DISABLED, null, null, "disabled", recordOrNull, 0);
    }

    /**
     * 같은 보고에 이번 실행의 호출 통계를 붙인 사본.
     *
     * @param statistics 호출 통계
     * @return 새 WorkflowReport
     */
    public WorkflowReport withStatistics(RunStatistics statistics) {
        return new WorkflowReport(workflow, status, failureKind, stepId, message, record, stepsExecuted, statistics);
    }

    public WorkflowName getWorkflow() {
        return workflow;
    }

    public WorkflowStatus getStatus() {
        return status;
    }

    /**
     * 실패 분류.
     *
     * @return 실패 분류 (실패가 아니면 null)
     */
    public FailureKind getFailureKind() {
        return failureKind;
    }

    /**
     * 중단된 단계.
     *
     * @return 단계 식별자 (완료/비활성이면 null)
     */
    public StepId getStepId() {
        return stepId;
    }

    public String getMessage() {
        return message;
    }

    /**
     * 마지막으로 커밋된 기록.
     *
     * @return 기록 (한 번도 커밋하지 않았으면 null)
     */
    public ProgressRecord getRecord() {
        return record;
    }

    public int getStepsExecuted() {
        return stepsExecuted;
    }

    public RunStatistics getStatistics() {
        return statistics;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("WorkflowReport{")
            .append(workflow).append(' ').append(status);
        if (failureKind != null) {
            builder.append(' ').append(failureKind);
        }
        if (stepId != null) {
            builder.append(" at ").append(stepId);
        }
        if (record != null) {
            builder.append(", counter=").append(record.counter());
        }
        return builder.append(", message=").append(message).append('}').toString();
    }
}
