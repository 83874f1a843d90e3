package com.ryuqq.milestone.application.workflow;

import com.ryuqq.milestone.core.model.CredentialRole;
import com.ryuqq.milestone.core.outcome.AttemptOutcome;
import com.ryuqq.milestone.core.spi.ChangeSet;
import com.ryuqq.milestone.core.spi.RemoteArtifact;
import com.ryuqq.milestone.core.workflow.StepAction;
import com.ryuqq.milestone.core.workflow.StepOutcome;

/**
 * 작은 변경을 하나씩 병합해 counter를 올리는 워크플로우.
 *
 * <p>단계마다 전용 브랜치에 counter 파일을 갱신하고 병합합니다.
 * 병합 호출의 멱등 키는 단계 ID에서 파생되므로 재개 시 같은 단계가 반복되어도 한 번만 반영됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class BatchCounterWorkflow extends AbstractThresholdWorkflow {

    static final String COUNTER_PATH = "counter.txt";

    public BatchCounterWorkflow(WorkflowEnvironment environment, WorkflowSettings settings) {
        super(WorkflowKind.BATCH_COUNTER.workflowName(), environment, settings);
    }

    @Override
    protected StepAction action(long index) {
        return context -> {
            ChangeSet changeSet = new ChangeSet(
                name.getValue() + "-" + index,
                COUNTER_PATH,
                index + "\n",
                "Update counter to " + index
            );
            AttemptOutcome<RemoteArtifact> merged = context.call(CredentialRole.PRIMARY,
                client -> client.mergeChangeSet(environment.repository(), changeSet,
                    context.stepId().subKey("merge")));
            if (!merged.isSuccess()) {
                return StepOutcome.failed(merged);
            }
            return StepOutcome.advanced();
        };
    }
}
