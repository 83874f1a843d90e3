package com.ryuqq.milestone.application.workflow;

import com.ryuqq.milestone.core.model.CoAuthor;
import com.ryuqq.milestone.core.model.Credential;
import com.ryuqq.milestone.core.model.CredentialRole;
import com.ryuqq.milestone.core.model.ProgressRecord;
import com.ryuqq.milestone.core.outcome.AttemptOutcome;
import com.ryuqq.milestone.core.outcome.FailureKind;
import com.ryuqq.milestone.core.spi.ChangeSet;
import com.ryuqq.milestone.core.spi.RemoteArtifact;
import com.ryuqq.milestone.core.workflow.NextStep;
import com.ryuqq.milestone.core.workflow.StepAction;
import com.ryuqq.milestone.core.workflow.StepOutcome;

import java.util.Optional;

/**
 * 공동 작성자를 표기한 커밋을 쌓는 워크플로우.
 *
 * <p><strong>작성자 결정:</strong></p>
 * <ul>
 *   <li>alternateAuthors=true: counter가 짝수면 PRIMARY, 홀수면 SECONDARY가 작성</li>
 *   <li>alternateAuthors=false: 항상 PRIMARY가 작성</li>
 *   <li>공동 작성자는 항상 작성자가 아닌 쪽 자격 증명</li>
 * </ul>
 *
 * <p>교대 모드에서는 첫 반복 전에 {@link CollaboratorSetup}으로 보조 자격 증명의 쓰기 권한을 확보합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AlternatingCoAuthorWorkflow extends AbstractThresholdWorkflow {

    private final CollaboratorSetup collaboratorSetup;

    public AlternatingCoAuthorWorkflow(WorkflowEnvironment environment, WorkflowSettings settings) {
        super(WorkflowKind.ALTERNATING.workflowName(), environment, settings);
        this.collaboratorSetup = new CollaboratorSetup(name, environment, settings.autoAcceptInvitation());
    }

    @Override
    protected Optional<NextStep> setup(ProgressRecord progress) {
        if (!settings.alternateAuthors()) {
            return Optional.empty();
        }
        return collaboratorSetup.stepFor(progress);
    }

    @Override
    protected StepAction action(long index) {
        return context -> {
            CredentialRole author = authorFor(index - 1);
            Optional<Credential> coAuthorCredential = environment.credential(author.other());
            if (coAuthorCredential.isEmpty() || !context.hasCredential(author)) {
                return StepOutcome.failed(FailureKind.PRECONDITION,
                    "secondary credential is required for " + name);
            }
            CoAuthor coAuthor = coAuthorCredential.get().asCoAuthor();
            ChangeSet changeSet = new ChangeSet(
                null,
                "pair/commit-" + index + ".md",
                "Pair commit " + index + "\n",
                "Pair commit " + index
            );
            AttemptOutcome<RemoteArtifact> committed = context.call(author,
                client -> client.createCoAuthoredCommit(environment.repository(), changeSet, coAuthor,
                    context.stepId().subKey("commit")));
            if (!committed.isSuccess()) {
                return StepOutcome.failed(committed);
            }
            return StepOutcome.advanced();
        };
    }

    /**
     * counter 값에 대한 작성자 역할.
     *
     * @param counter 단계 실행 전 counter
     * @return 작성자 역할
     */
    CredentialRole authorFor(long counter) {
        if (!settings.alternateAuthors()) {
            return CredentialRole.PRIMARY;
        }
        return counter % 2 == 0 ? CredentialRole.PRIMARY : CredentialRole.SECONDARY;
    }
}
