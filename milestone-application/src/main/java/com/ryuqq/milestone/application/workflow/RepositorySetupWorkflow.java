package com.ryuqq.milestone.application.workflow;

import com.ryuqq.milestone.core.model.CredentialRole;
import com.ryuqq.milestone.core.model.WorkflowName;
import com.ryuqq.milestone.core.outcome.AttemptOutcome;
import com.ryuqq.milestone.core.spi.RemoteRepository;
import com.ryuqq.milestone.core.workflow.StepAction;
import com.ryuqq.milestone.core.workflow.StepOutcome;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * 대상 저장소가 없으면 만드는 일회성 준비 워크플로우.
 *
 * <p>다른 워크플로우보다 먼저 실행됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RepositorySetupWorkflow extends AbstractThresholdWorkflow {

    public static final WorkflowName NAME = WorkflowName.of("repository");

    private static final WorkflowSettings SETTINGS = new WorkflowSettings(true, List.of(1L), 1,
        Duration.ZERO, Duration.ZERO, null, false, false, null);

    public RepositorySetupWorkflow(WorkflowEnvironment environment) {
        super(NAME, environment, SETTINGS);
    }

    @Override
    protected String describe(long index) {
        return "ensure repository " + environment.repository() + " exists";
    }

    @Override
    protected StepAction action(long index) {
        return context -> {
            AttemptOutcome<Optional<RemoteRepository>> found = context.call(CredentialRole.PRIMARY,
                client -> client.findRepository(environment.repository()));
            if (!found.isSuccess()) {
                return StepOutcome.failed(found);
            }
            if (found.payload().isEmpty()) {
                AttemptOutcome<RemoteRepository> created = context.call(CredentialRole.PRIMARY,
                    client -> client.createRepository(environment.repository(),
                        "Milestone workspace", context.stepId().subKey("create")));
                if (!created.isSuccess()) {
                    return StepOutcome.failed(created);
                }
            }
            return StepOutcome.completed(1);
        };
    }
}
