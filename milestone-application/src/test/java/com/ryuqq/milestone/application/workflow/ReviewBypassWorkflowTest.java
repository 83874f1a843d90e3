package com.ryuqq.milestone.application.workflow;

import com.ryuqq.milestone.core.model.Credential;
import com.ryuqq.milestone.core.model.CredentialRole;
import com.ryuqq.milestone.core.model.ProgressRecord;
import com.ryuqq.milestone.core.model.RepositoryId;
import com.ryuqq.milestone.core.outcome.FailureKind;
import com.ryuqq.milestone.core.spi.RemoteArtifact;
import com.ryuqq.milestone.core.spi.RemoteClient;
import com.ryuqq.milestone.core.spi.RemoteResponse;
import com.ryuqq.milestone.core.spi.RemoteRepository;
import com.ryuqq.milestone.core.workflow.NextStep;
import com.ryuqq.milestone.core.workflow.StepOutcome;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * ReviewBypassWorkflow / RepositorySetupWorkflow 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ReviewBypassWorkflowTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final RepositoryId REPO = RepositoryId.parse("octo/milestones");
    private static final WorkflowEnvironment ENVIRONMENT = new WorkflowEnvironment(REPO,
        Credential.of(CredentialRole.PRIMARY, "octo", "t1"), null);

    @Mock
    private RemoteClient client;

    private ReviewBypassWorkflow workflow(String reviewer) {
        return new ReviewBypassWorkflow(ENVIRONMENT, WorkflowKind.REVIEW_BYPASS.defaults().withReviewer(reviewer));
    }

    @Test
    void execute_ReviewerIsPrimary_FailsWithPrecondition() throws Exception {
        // given
        ReviewBypassWorkflow workflow = workflow("OCTO");
        ProgressRecord record = ProgressRecord.initial(workflow.name(), T0);
        NextStep.Step step = (NextStep.Step) workflow.nextStep(record);

        // when
        StepOutcome outcome = step.action().execute(new StubStepContext(step.id(), record, client, null, T0));

        // then
        assertThat(((StepOutcome.Failed) outcome).kind()).isEqualTo(FailureKind.PRECONDITION);
        verifyNoInteractions(client);
    }

    @Test
    void execute_NoReviewer_FailsWithPrecondition() throws Exception {
        ReviewBypassWorkflow workflow = workflow(null);
        ProgressRecord record = ProgressRecord.initial(workflow.name(), T0);
        NextStep.Step step = (NextStep.Step) workflow.nextStep(record);

        StepOutcome outcome = step.action().execute(new StubStepContext(step.id(), record, client, null, T0));

        assertThat(((StepOutcome.Failed) outcome).kind()).isEqualTo(FailureKind.PRECONDITION);
    }

    @Test
    void execute_OpensThenMerges_AndCompletes() throws Exception {
        // given
        ReviewBypassWorkflow workflow = workflow("hubot");
        ProgressRecord record = ProgressRecord.initial(workflow.name(), T0);
        NextStep.Step step = (NextStep.Step) workflow.nextStep(record);
        when(client.createBypassPullRequest(eq(REPO), any(), eq("hubot"), eq("yolo/step-1/open")))
            .thenReturn(RemoteResponse.of(new RemoteArtifact("PR_9", 9, null)));
        when(client.mergePullRequest(REPO, 9, "yolo/step-1/merge"))
            .thenReturn(RemoteResponse.of(new RemoteArtifact("PR_9", 9, null)));
        StubStepContext context = new StubStepContext(step.id(), record, client, null, T0);

        // when
        StepOutcome outcome = step.action().execute(context);

        // then
        assertThat(outcome).isEqualTo(StepOutcome.completed(1));
        assertThat(context.checkpoints()).containsEntry("pull", "9");
    }

    @Test
    void execute_ResumedWithPullCheckpoint_OnlyMerges() throws Exception {
        // given
        ReviewBypassWorkflow workflow = workflow("hubot");
        ProgressRecord base = ProgressRecord.initial(workflow.name(), T0);
        NextStep.Step step = (NextStep.Step) workflow.nextStep(base);
        ProgressRecord record = base.withCheckpoint(step.id(), "pull", "9", T0);
        when(client.mergePullRequest(eq(REPO), eq(9L), anyString()))
            .thenReturn(RemoteResponse.of(new RemoteArtifact("PR_9", 9, null)));

        // when
        StepOutcome outcome = step.action().execute(new StubStepContext(step.id(), record, client, null, T0));

        // then
        assertThat(outcome).isEqualTo(StepOutcome.completed(1));
        verify(client, never()).createBypassPullRequest(any(), any(), anyString(), anyString());
    }

    // ============================================================
    // RepositorySetupWorkflow
    // ============================================================

    @Test
    void repositorySetup_MissingRepository_CreatesIt() throws Exception {
        // given
        RepositorySetupWorkflow setup = new RepositorySetupWorkflow(ENVIRONMENT);
        ProgressRecord record = ProgressRecord.initial(setup.name(), T0);
        NextStep.Step step = (NextStep.Step) setup.nextStep(record);
        when(client.findRepository(REPO)).thenReturn(RemoteResponse.of(Optional.empty()));
        when(client.createRepository(eq(REPO), anyString(), eq("repository/step-1/create")))
            .thenReturn(RemoteResponse.of(new RemoteRepository(REPO, "main")));

        // when
        StepOutcome outcome = step.action().execute(new StubStepContext(step.id(), record, client, null, T0));

        // then
        assertThat(outcome).isEqualTo(StepOutcome.completed(1));
    }

    @Test
    void repositorySetup_ExistingRepository_DoesNotCreate() throws Exception {
        RepositorySetupWorkflow setup = new RepositorySetupWorkflow(ENVIRONMENT);
        ProgressRecord record = ProgressRecord.initial(setup.name(), T0);
        NextStep.Step step = (NextStep.Step) setup.nextStep(record);
        when(client.findRepository(REPO)).thenReturn(RemoteResponse.of(Optional.of(new RemoteRepository(REPO, "main"))));

        StepOutcome outcome = step.action().execute(new StubStepContext(step.id(), record, client, null, T0));

        assertThat(outcome).isEqualTo(StepOutcome.completed(1));
        verify(client, never()).createRepository(any(), anyString(), anyString());
    }
}
