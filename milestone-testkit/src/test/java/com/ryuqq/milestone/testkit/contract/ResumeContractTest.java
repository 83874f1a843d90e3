package com.ryuqq.milestone.testkit.contract;

import com.ryuqq.milestone.application.runner.WorkflowReport;
import com.ryuqq.milestone.application.workflow.WorkflowKind;
import com.ryuqq.milestone.application.workflow.WorkflowSettings;
import com.ryuqq.milestone.core.model.StepId;
import com.ryuqq.milestone.core.model.WorkflowName;
import com.ryuqq.milestone.core.statemachine.WorkflowStatus;
import com.ryuqq.milestone.core.workflow.Workflow;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract Test: resuming after a crash repeats no remote effect.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Crash after a merge took effect but before the step was committed</li>
 *   <li>The rerun repeats the uncommitted step with the same idempotency key</li>
 *   <li>Each counter value maps to exactly one remote artefact</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ResumeContractTest extends AbstractContractTest {

    private static final WorkflowName BATCH = WorkflowKind.BATCH_COUNTER.workflowName();

    private WorkflowSettings batchSettings() {
        return WorkflowKind.BATCH_COUNTER.defaults()
            .withThresholds(List.of(2L, 16L))
            .withPacing(Duration.ZERO, Duration.ZERO);
    }

    @Test
    void testResume_CrashMidBatch_RerunCreatesNoDuplicates() {
        // Given: the 6th merge takes effect, then the process dies
        Workflow workflow = workflow(WorkflowKind.BATCH_COUNTER, batchSettings());
        primary.crashAfter("mergeChangeSet", 6);

        // When
        assertThatThrownBy(() -> runner().run(workflow))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("simulated crash");

        // Then: five steps committed, six artefacts exist
        assertCounter(BATCH, 5);
        assertThat(primary.created("mergeChangeSet")).isEqualTo(6);

        // When: rerun
        WorkflowReport report = runner().run(workflow(WorkflowKind.BATCH_COUNTER, batchSettings()));

        // Then
        assertStatus(report, WorkflowStatus.COMPLETED);
        assertCounter(BATCH, 16);
        assertCompleted(BATCH);
        assertThat(primary.created("mergeChangeSet")).isEqualTo(16);
        assertThat(primary.calls("mergeChangeSet")).isEqualTo(17);
        assertThat(report.getStepsExecuted()).isEqualTo(11);
    }

    @Test
    void testResume_CompletedWorkflow_RerunMakesNoCalls() {
        // Given
        runner().run(workflow(WorkflowKind.BATCH_COUNTER, batchSettings()));
        int callsAfterFirstRun = primary.calls("mergeChangeSet");

        // When
        WorkflowReport report = runner().run(workflow(WorkflowKind.BATCH_COUNTER, batchSettings()));

        // Then
        assertStatus(report, WorkflowStatus.COMPLETED);
        assertThat(report.getStepsExecuted()).isZero();
        assertThat(primary.calls("mergeChangeSet")).isEqualTo(callsAfterFirstRun);
    }

    @Test
    void testResume_CounterAlreadyBeyondTarget_CompletesWithoutCalls() {
        // Given: progress from an earlier run with a higher target
        store.commit(BATCH, current -> current.advance(20, List.of(2L, 16L), StepId.indexed(BATCH, 20), clock.instant()));

        // When
        WorkflowReport report = runner().run(workflow(WorkflowKind.BATCH_COUNTER, batchSettings()));

        // Then
        assertStatus(report, WorkflowStatus.COMPLETED);
        assertCounter(BATCH, 20);
        assertCompleted(BATCH);
        assertThat(primary.calls("mergeChangeSet")).isZero();
    }

    @Test
    void testResume_AlternatingCrashOnSecondaryCommit_NoDuplicateCommit() {
        // Given: step 2 is authored by the secondary identity
        WorkflowSettings settings = WorkflowKind.ALTERNATING.defaults()
            .withThresholds(List.of(4L))
            .withPacing(Duration.ZERO, Duration.ZERO);
        secondary.crashAfter("createCoAuthoredCommit");

        // When
        assertThatThrownBy(() -> runner().run(workflow(WorkflowKind.ALTERNATING, settings)))
            .isInstanceOf(IllegalStateException.class);
        WorkflowReport report = runner().run(workflow(WorkflowKind.ALTERNATING, settings));

        // Then
        assertStatus(report, WorkflowStatus.COMPLETED);
        assertThat(primary.created("createCoAuthoredCommit")).isEqualTo(2);
        assertThat(secondary.created("createCoAuthoredCommit")).isEqualTo(2);
        assertThat(secondary.calls("createCoAuthoredCommit")).isEqualTo(3);
    }
}
