package com.ryuqq.milestone.application.workflow;

import com.ryuqq.milestone.core.model.Credential;
import com.ryuqq.milestone.core.model.CredentialRole;
import com.ryuqq.milestone.core.model.ProgressRecord;
import com.ryuqq.milestone.core.model.StepId;
import com.ryuqq.milestone.core.model.WorkflowName;
import com.ryuqq.milestone.core.outcome.AttemptOutcome;
import com.ryuqq.milestone.core.outcome.FailureKind;
import com.ryuqq.milestone.core.spi.CollaboratorStatus;
import com.ryuqq.milestone.core.workflow.NextStep;
import com.ryuqq.milestone.core.workflow.StepContext;
import com.ryuqq.milestone.core.workflow.StepOutcome;

import java.util.Map;
import java.util.Optional;

/**
 * 보조 자격 증명을 저장소 협업자로 등록하는 준비 단계.
 *
 * <p>초대가 대기 중이면 autoAccept 설정에 따라 보조 자격 증명으로 수락하거나,
 * Blocked로 사용자 조치를 요청합니다. 완료 여부는 진행 기록 속성에 남겨 재실행 시 건너뜁니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class CollaboratorSetup {

    static final String READY_ATTRIBUTE = "collaborator.ready";
    static final String LABEL = "collaborator";

    private final WorkflowName workflow;
    private final WorkflowEnvironment environment;
    private final boolean autoAccept;

    CollaboratorSetup(WorkflowName workflow, WorkflowEnvironment environment, boolean autoAccept) {
        this.workflow = workflow;
        this.environment = environment;
        this.autoAccept = autoAccept;
    }

    Optional<NextStep> stepFor(ProgressRecord progress) {
        if (progress.attribute(READY_ATTRIBUTE).isPresent()) {
            return Optional.empty();
        }
        return Optional.of(new NextStep.Step(
            StepId.setup(workflow, LABEL),
            "add secondary identity as collaborator",
            this::execute
        ));
    }

    private StepOutcome execute(StepContext context) throws InterruptedException {
        Optional<Credential> secondary = environment.credential(CredentialRole.SECONDARY);
        if (secondary.isEmpty() || !context.hasCredential(CredentialRole.SECONDARY)) {
            return StepOutcome.failed(FailureKind.PRECONDITION, "secondary credential is required for " + workflow);
        }
        String login = secondary.get().login();

        AttemptOutcome<CollaboratorStatus> added = context.call(CredentialRole.PRIMARY,
            client -> client.addCollaborator(environment.repository(), login, context.stepId().subKey("invite")));
        if (!added.isSuccess()) {
            return StepOutcome.failed(added);
        }
        if (added.payload() == CollaboratorStatus.ACTIVE) {
            return ready();
        }
        if (!autoAccept) {
            return StepOutcome.blocked("invitation pending for " + login + " on " + environment.repository()
                + "; accept it and run again");
        }

        AttemptOutcome<Boolean> accepted = context.call(CredentialRole.SECONDARY,
            client -> client.acceptInvitation(environment.repository(), context.stepId().subKey("accept")));
        if (!accepted.isSuccess()) {
            return StepOutcome.failed(accepted);
        }
        return ready();
    }

    private static StepOutcome ready() {
        return StepOutcome.recorded(Map.of(READY_ATTRIBUTE, "true"));
    }
}
