package com.ryuqq.milestone.application.workflow;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * WorkflowKind / WorkflowSettings 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class WorkflowKindTest {

    @Test
    void fromName_AcceptsWorkflowAndKindNames() {
        assertThat(WorkflowKind.fromName("pull-shark")).isEqualTo(WorkflowKind.BATCH_COUNTER);
        assertThat(WorkflowKind.fromName("PULL_SHARK")).isEqualTo(WorkflowKind.BATCH_COUNTER);
        assertThat(WorkflowKind.fromName("batch-counter")).isEqualTo(WorkflowKind.BATCH_COUNTER);
        assertThat(WorkflowKind.fromName(" question_answer ")).isEqualTo(WorkflowKind.QUESTION_ANSWER);
        assertThat(WorkflowKind.fromName("yolo")).isEqualTo(WorkflowKind.REVIEW_BYPASS);
    }

    @Test
    void fromName_Unknown_ThrowsException() {
        assertThatThrownBy(() -> WorkflowKind.fromName("starstruck"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("starstruck");
        assertThatThrownBy(() -> WorkflowKind.fromName(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void defaults_BatchCounter_HasMilestoneLadder() {
        WorkflowSettings defaults = WorkflowKind.BATCH_COUNTER.defaults();

        assertThat(defaults.thresholds()).containsExactly(2L, 16L, 128L, 1024L);
        assertThat(defaults.target()).isEqualTo(1024L);
        assertThat(defaults.batchSize()).isEqualTo(10);
    }

    @Test
    void defaults_TimeBoxed_HasFiveMinuteDeadline() {
        assertThat(WorkflowKind.TIME_BOXED.defaults().deadline()).isEqualTo(Duration.ofMinutes(5));
    }

    // ============================================================
    // WorkflowSettings
    // ============================================================

    @Test
    void settings_UnsortedThresholds_AreSorted() {
        WorkflowSettings settings = WorkflowKind.BATCH_COUNTER.defaults().withThresholds(List.of(16L, 2L));

        assertThat(settings.thresholds()).containsExactly(2L, 16L);
        assertThat(settings.target()).isEqualTo(16L);
    }

    @Test
    void settings_InvalidValues_ThrowException() {
        WorkflowSettings base = WorkflowKind.BATCH_COUNTER.defaults();

        assertThatThrownBy(() -> base.withThresholds(List.of()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> base.withThresholds(List.of(0L, 2L)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("positive");
        assertThatThrownBy(() -> base.withThresholds(List.of(2L, 2L)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("distinct");
        assertThatThrownBy(() -> base.withBatchSize(0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> base.withPacing(Duration.ofSeconds(-1), Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void settings_BlankReviewer_BecomesNull() {
        assertThat(WorkflowKind.REVIEW_BYPASS.defaults().withReviewer("  ").reviewer()).isNull();
    }
}
