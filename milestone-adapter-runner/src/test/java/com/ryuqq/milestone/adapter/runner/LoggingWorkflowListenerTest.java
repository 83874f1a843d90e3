package com.ryuqq.milestone.adapter.runner;

import com.ryuqq.milestone.application.runner.WorkflowListener;
import com.ryuqq.milestone.application.runner.WorkflowReport;
import com.ryuqq.milestone.core.model.ProgressRecord;
import com.ryuqq.milestone.core.model.StepId;
import com.ryuqq.milestone.core.model.WorkflowName;
import com.ryuqq.milestone.core.statemachine.WorkflowStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.inOrder;

/**
 * LoggingWorkflowListener 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class LoggingWorkflowListenerTest {

    private static final WorkflowName NAME = WorkflowName.of("counter");

    @Mock
    private WorkflowListener delegate;

    @Test
    void 모든_이벤트를_순서대로_위임() {
        // given
        LoggingWorkflowListener listener = new LoggingWorkflowListener(delegate);
        Instant now = Instant.parse("2024-01-01T00:00:00Z");
        StepId step = StepId.indexed(NAME, 1);
        ProgressRecord record = ProgressRecord.initial(NAME, now).advance(1, List.of(1L), step, now);
        WorkflowReport report = WorkflowReport.completed(NAME, record, 1);

        // when
        listener.statusChanged(NAME, WorkflowStatus.PENDING, WorkflowStatus.RUNNING);
        listener.stepStarted(NAME, step, "step 1");
        listener.stepCommitted(NAME, step, record);
        listener.thresholdCrossed(NAME, 1L);
        listener.workflowFinished(report);

        // then
        InOrder order = inOrder(delegate);
        order.verify(delegate).statusChanged(NAME, WorkflowStatus.PENDING, WorkflowStatus.RUNNING);
        order.verify(delegate).stepStarted(NAME, step, "step 1");
        order.verify(delegate).stepCommitted(NAME, step, record);
        order.verify(delegate).thresholdCrossed(NAME, 1L);
        order.verify(delegate).workflowFinished(report);
    }

    @Test
    void null_위임대상_거부() {
        assertThatThrownBy(() -> new LoggingWorkflowListener(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("delegate cannot be null");
    }
}
