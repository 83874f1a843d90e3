package com.ryuqq.milestone.testkit.contract;

import com.ryuqq.milestone.application.runner.WorkflowReport;
import com.ryuqq.milestone.application.workflow.WorkflowKind;
import com.ryuqq.milestone.core.model.ProgressRecord;
import com.ryuqq.milestone.core.model.WorkflowName;
import com.ryuqq.milestone.core.outcome.FailureKind;
import com.ryuqq.milestone.core.statemachine.WorkflowStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract Test: time-boxed workflow deadline.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Open-to-close within the deadline completes</li>
 *   <li>Slow remote calls push the attempt past the deadline: STOPPED_UNACHIEVABLE</li>
 *   <li>The next run starts a fresh attempt instead of reusing the late issue</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class TimeBoxContractTest extends AbstractContractTest {

    private static final WorkflowName QUICK = WorkflowKind.TIME_BOXED.workflowName();

    @Test
    void testTimeBox_FastRemote_Completes() {
        // When
        WorkflowReport report = runner().run(workflow(WorkflowKind.TIME_BOXED, WorkflowKind.TIME_BOXED.defaults()));

        // Then
        assertStatus(report, WorkflowStatus.COMPLETED);
        assertCounter(QUICK, 1);
        assertThat(primary.created("createIssue")).isEqualTo(1);
        assertThat(primary.created("closeIssue")).isEqualTo(1);
    }

    @Test
    void testTimeBox_SlowRemote_StopsUnachievableThenNextAttemptCompletes() {
        // Given: every call takes three minutes against a five minute deadline
        primary.withLatency(Duration.ofMinutes(3));

        // When
        WorkflowReport late = runner().run(workflow(WorkflowKind.TIME_BOXED, WorkflowKind.TIME_BOXED.defaults()));

        // Then
        assertStatus(late, WorkflowStatus.STOPPED_UNACHIEVABLE);
        assertThat(late.getFailureKind()).isEqualTo(FailureKind.DEADLINE);
        assertThat(late.getStepId().getValue()).isEqualTo("quickdraw/attempt-1");
        assertCounter(QUICK, 0);

        // When: the remote is fast again
        primary.withLatency(Duration.ZERO);
        WorkflowReport retried = runner().run(workflow(WorkflowKind.TIME_BOXED, WorkflowKind.TIME_BOXED.defaults()));

        // Then
        assertStatus(retried, WorkflowStatus.COMPLETED);
        ProgressRecord record = store.load(QUICK).orElseThrow();
        assertThat(record.counter()).isEqualTo(1);
        assertThat(record.attribute("attempt")).contains("2");
        assertThat(record.lastStepId().getValue()).isEqualTo("quickdraw/attempt-2");
        assertThat(primary.created("createIssue")).isEqualTo(2);
    }

    @Test
    void testTimeBox_CrashAfterOpen_StaleIssueClosedAndNewAttemptStarted() {
        // Given: the issue is opened, then the process dies
        primary.crashAfter("createIssue");
        assertThatThrownBy(() -> runner().run(workflow(WorkflowKind.TIME_BOXED, WorkflowKind.TIME_BOXED.defaults())))
            .isInstanceOf(IllegalStateException.class);

        // When: the rerun happens well after the deadline
        clock.advance(Duration.ofMinutes(30));
        WorkflowReport report = runner().run(workflow(WorkflowKind.TIME_BOXED, WorkflowKind.TIME_BOXED.defaults()));

        // Then
        assertStatus(report, WorkflowStatus.COMPLETED);
        assertThat(store.load(QUICK).orElseThrow().attribute("attempt")).contains("2");
        assertThat(primary.created("createIssue")).isEqualTo(2);
        assertThat(primary.calls("closeIssue")).isEqualTo(2);
    }
}
