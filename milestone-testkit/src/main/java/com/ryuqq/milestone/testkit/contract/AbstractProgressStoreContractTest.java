package com.ryuqq.milestone.testkit.contract;

import com.ryuqq.milestone.core.model.ProgressRecord;
import com.ryuqq.milestone.core.model.StepId;
import com.ryuqq.milestone.core.model.WorkflowName;
import com.ryuqq.milestone.core.spi.ProgressStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract every {@link ProgressStore} implementation must satisfy.
 *
 * <p><strong>Covered guarantees:</strong></p>
 * <ul>
 *   <li>A committed record is visible to {@code load} and {@code loadAll}</li>
 *   <li>Counter, crossed thresholds, completion and attributes never regress</li>
 *   <li>A rejected mutation leaves the stored record untouched</li>
 *   <li>Concurrent commits to one workflow are applied one after another</li>
 *   <li>Workflows do not see each other's records</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractProgressStoreContractTest {

    protected static final WorkflowName BATCH = WorkflowName.of("pull-shark");
    protected static final WorkflowName QUESTIONS = WorkflowName.of("galaxy-brain");
    protected static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    protected ProgressStore store;

    /**
     * Creates a fresh, empty store for one test.
     *
     * @return the store under test
     * @throws Exception if the store cannot be created
     */
    protected abstract ProgressStore createStore() throws Exception;

    @BeforeEach
    void setUpStore() throws Exception {
        store = createStore();
    }

    @AfterEach
    void closeStore() {
        if (store != null) {
            store.close();
        }
    }

    @Test
    void load_NothingCommitted_Empty() {
        assertThat(store.load(BATCH)).isEmpty();
        assertThat(store.loadAll()).isEmpty();
    }

    @Test
    void commit_FirstCommit_StartsFromInitialRecord() {
        // when
        ProgressRecord committed = store.commit(BATCH, current -> current.advance(1, List.of(2L), step(1), NOW));

        // then
        assertThat(committed.counter()).isEqualTo(1);
        assertThat(store.load(BATCH)).contains(committed);
        assertThat(store.loadAll()).containsOnlyKeys(BATCH);
    }

    @Test
    void commit_AdvancesAcrossThreshold_RecordsThresholdAndLastStep() {
        // given
        store.commit(BATCH, current -> current.advance(1, List.of(2L, 16L), step(1), NOW));

        // when
        store.commit(BATCH, current -> current.advance(1, List.of(2L, 16L), step(2), NOW));

        // then
        ProgressRecord record = store.load(BATCH).orElseThrow();
        assertThat(record.counter()).isEqualTo(2);
        assertThat(record.crossedThresholds()).containsExactly(2L);
        assertThat(record.lastStepId()).isEqualTo(step(2));
    }

    @Test
    void commit_CheckpointsAndAttributes_RoundTrip() {
        // given
        StepId step = StepId.indexed(QUESTIONS, 1);

        // when
        store.commit(QUESTIONS, current -> current
            .withAttributes(Map.of("discussion.category", "DIC_qa"), NOW)
            .withCheckpoint(step, "question", "D_1", NOW));

        // then
        ProgressRecord record = store.load(QUESTIONS).orElseThrow();
        assertThat(record.attribute("discussion.category")).contains("DIC_qa");
        assertThat(record.checkpointsFor(step)).containsEntry("question", "D_1");
    }

    @Test
    void commit_DecreasingCounter_RejectedAndRecordUnchanged() {
        // given
        ProgressRecord stored = store.commit(BATCH, current -> current.advance(5, List.of(2L), step(5), NOW));

        // when / then
        assertThatThrownBy(() -> store.commit(BATCH, current ->
            new ProgressRecord(BATCH, 3, List.of(2L), step(3), false, NOW, null, Map.of(), Map.of())))
            .isInstanceOf(IllegalStateException.class);
        assertThat(store.load(BATCH)).contains(stored);
    }

    @Test
    void commit_ReopeningCompletedWorkflow_Rejected() {
        // given
        store.commit(BATCH, current -> current.advance(1, List.of(1L), step(1), NOW).markCompleted(NOW));

        // when / then
        assertThatThrownBy(() -> store.commit(BATCH, current ->
            new ProgressRecord(BATCH, 1, List.of(1L), step(1), false, NOW, null, Map.of(), Map.of())))
            .isInstanceOf(IllegalStateException.class);
        assertThat(store.load(BATCH).orElseThrow().completed()).isTrue();
    }

    @Test
    void commit_MutationThrows_RecordUnchanged() {
        // given
        ProgressRecord stored = store.commit(BATCH, current -> current.advance(1, List.of(), step(1), NOW));

        // when / then
        assertThatThrownBy(() -> store.commit(BATCH, current -> {
            throw new IllegalArgumentException("boom");
        })).isInstanceOf(IllegalArgumentException.class);
        assertThat(store.load(BATCH)).contains(stored);
    }

    @Test
    void commit_SeparateWorkflows_Isolated() {
        // when
        store.commit(BATCH, current -> current.advance(3, List.of(), step(3), NOW));
        store.commit(QUESTIONS, current -> current.advance(1, List.of(), StepId.indexed(QUESTIONS, 1), NOW));

        // then
        assertThat(store.load(BATCH).orElseThrow().counter()).isEqualTo(3);
        assertThat(store.load(QUESTIONS).orElseThrow().counter()).isEqualTo(1);
        assertThat(store.loadAll()).containsOnlyKeys(BATCH, QUESTIONS);
    }

    @Test
    void commit_ConcurrentIncrements_NoLostUpdates() throws Exception {
        // given
        int threads = 8;
        int perThread = 25;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);

        // when
        try {
            for (int t = 0; t < threads; t++) {
                executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        store.commit(BATCH, current ->
                            current.advance(1, List.of(), step(current.counter() + 1), NOW));
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            executor.shutdown();
        }
        assertThat(executor.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        // then
        assertThat(store.load(BATCH).orElseThrow().counter()).isEqualTo((long) threads * perThread);
    }

    protected static StepId step(long index) {
        return StepId.indexed(BATCH, index);
    }
}
