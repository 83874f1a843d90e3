package com.ryuqq.milestone.application.workflow;

import com.ryuqq.milestone.core.model.CredentialRole;
import com.ryuqq.milestone.core.outcome.AttemptOutcome;
import com.ryuqq.milestone.core.outcome.FailureKind;
import com.ryuqq.milestone.core.spi.ChangeSet;
import com.ryuqq.milestone.core.spi.RemoteArtifact;
import com.ryuqq.milestone.core.workflow.StepAction;
import com.ryuqq.milestone.core.workflow.StepOutcome;

/**
 * 리뷰를 요청한 풀 리퀘스트를 리뷰 없이 병합하는 일회성 워크플로우.
 *
 * <p>리뷰어는 주 자격 증명과 다른 사용자여야 합니다.
 * 풀 리퀘스트 번호는 "pull" 체크포인트에 남겨 재개 시 중복 생성하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ReviewBypassWorkflow extends AbstractThresholdWorkflow {

    static final String PULL = "pull";

    public ReviewBypassWorkflow(WorkflowEnvironment environment, WorkflowSettings settings) {
        super(WorkflowKind.REVIEW_BYPASS.workflowName(), environment, settings);
    }

    @Override
    protected String describe(long index) {
        return "merge a pull request without review";
    }

    @Override
    protected StepAction action(long index) {
        return context -> {
            String reviewer = settings.reviewer();
            if (reviewer == null) {
                return StepOutcome.failed(FailureKind.PRECONDITION, "a reviewer is required for " + name);
            }
            if (reviewer.equalsIgnoreCase(environment.primary().login())) {
                return StepOutcome.failed(FailureKind.PRECONDITION,
                    "reviewer must differ from the primary identity (" + reviewer + ")");
            }

            String pull = context.checkpoints().get(PULL);
            if (pull == null) {
                ChangeSet changeSet = new ChangeSet(
                    name.getValue() + "-merge",
                    "yolo.md",
                    "Merged without review\n",
                    "Merge without review"
                );
                AttemptOutcome<RemoteArtifact> opened = context.call(CredentialRole.PRIMARY,
                    client -> client.createBypassPullRequest(environment.repository(), changeSet, reviewer,
                        context.stepId().subKey("open")));
                if (!opened.isSuccess()) {
                    return StepOutcome.failed(opened);
                }
                pull = String.valueOf(opened.payload().number());
                context.checkpoint(PULL, pull);
            }

            long number = Long.parseLong(pull);
            AttemptOutcome<RemoteArtifact> merged = context.call(CredentialRole.PRIMARY,
                client -> client.mergePullRequest(environment.repository(), number, context.stepId().subKey("merge")));
            if (!merged.isSuccess()) {
                return StepOutcome.failed(merged);
            }
            return StepOutcome.completed(1);
        };
    }
}
