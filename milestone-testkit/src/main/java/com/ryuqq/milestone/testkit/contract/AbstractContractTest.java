package com.ryuqq.milestone.testkit.contract;

import com.ryuqq.milestone.adapter.inmemory.store.InMemoryProgressStore;
import com.ryuqq.milestone.adapter.runner.BackoffRetryPolicy;
import com.ryuqq.milestone.adapter.runner.BudgetRateLimiter;
import com.ryuqq.milestone.adapter.runner.ConcurrentMilestoneEngine;
import com.ryuqq.milestone.adapter.runner.DefaultWorkflowRunner;
import com.ryuqq.milestone.adapter.runner.EngineConfig;
import com.ryuqq.milestone.application.runner.WorkflowListener;
import com.ryuqq.milestone.application.runner.WorkflowReport;
import com.ryuqq.milestone.application.workflow.WorkflowEnvironment;
import com.ryuqq.milestone.application.workflow.WorkflowFactory;
import com.ryuqq.milestone.application.workflow.WorkflowKind;
import com.ryuqq.milestone.application.workflow.WorkflowPlan;
import com.ryuqq.milestone.application.workflow.WorkflowSettings;
import com.ryuqq.milestone.core.model.Credential;
import com.ryuqq.milestone.core.model.CredentialRole;
import com.ryuqq.milestone.core.model.ProgressRecord;
import com.ryuqq.milestone.core.model.RepositoryId;
import com.ryuqq.milestone.core.model.StepId;
import com.ryuqq.milestone.core.model.WorkflowName;
import com.ryuqq.milestone.core.protection.RateLimiter;
import com.ryuqq.milestone.core.protection.RateLimiterConfig;
import com.ryuqq.milestone.core.protection.RetryPolicyConfig;
import com.ryuqq.milestone.core.spi.ProgressStore;
import com.ryuqq.milestone.core.spi.RemoteClients;
import com.ryuqq.milestone.core.statemachine.WorkflowStatus;
import com.ryuqq.milestone.core.time.Sleeper;
import com.ryuqq.milestone.core.workflow.Workflow;
import com.ryuqq.milestone.testkit.ClockAdvancingSleeper;
import com.ryuqq.milestone.testkit.ManualClock;
import com.ryuqq.milestone.testkit.ScriptedRemoteClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Abstract base class for Contract Tests.
 *
 * <p>Wires the engine against scripted remote clients, a manual clock and an in-memory
 * progress store, so every scenario runs deterministically and without real waits.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>ManualClock: time only moves when a sleeper or scripted latency moves it</li>
 *   <li>ClockAdvancingSleeper: records requested waits and advances the clock</li>
 *   <li>InMemoryProgressStore: progress persistence simulation</li>
 *   <li>ScriptedRemoteClient: one per credential ({@code octocat} primary, {@code hubot} secondary)</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractContractTest {
 *     {@literal @}Test
 *     void scenario() {
 *         WorkflowReport report = runner().run(workflow(WorkflowKind.BATCH_COUNTER, settings));
 *
 *         assertStatus(report, WorkflowStatus.COMPLETED);
 *         assertCounter(WorkflowKind.BATCH_COUNTER.workflowName(), 16);
 *     }
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractContractTest {

    protected static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    protected static final RepositoryId REPOSITORY = RepositoryId.parse("octocat/milestones");

    protected ManualClock clock;
    protected ClockAdvancingSleeper sleeper;
    protected InMemoryProgressStore store;
    protected ScriptedRemoteClient primary;
    protected ScriptedRemoteClient secondary;
    protected WorkflowEnvironment environment;
    protected RecordingListener listener;

    /**
     * Sets up test fixtures before each test.
     *
     * <p>Creates fresh instances of all collaborators.</p>
     */
    @BeforeEach
    void setUp() {
        clock = new ManualClock(START);
        sleeper = new ClockAdvancingSleeper(clock);
        store = new InMemoryProgressStore(clock);
        primary = new ScriptedRemoteClient("octocat", clock);
        secondary = new ScriptedRemoteClient("hubot", clock);
        environment = new WorkflowEnvironment(REPOSITORY,
            Credential.of(CredentialRole.PRIMARY, "octocat", "token-primary"),
            Credential.of(CredentialRole.SECONDARY, "hubot", "token-secondary"));
        listener = new RecordingListener();
    }

    /**
     * Cleans up test fixtures after each test.
     */
    @AfterEach
    void tearDown() {
        if (store != null) {
            store.clear();
        }
        if (sleeper != null) {
            sleeper.reset();
        }
    }

    // ============================================================
    // Wiring
    // ============================================================

    protected RemoteClients clients() {
        return RemoteClients.of(primary, secondary);
    }

    protected RateLimiter rateLimiter(RateLimiterConfig config) {
        return new BudgetRateLimiter(config, clock, sleeper);
    }

    /**
     * Creates a runner with default limiter and retry settings against {@link #store}.
     *
     * @return a new runner
     */
    protected DefaultWorkflowRunner runner() {
        return runner(store, new RateLimiterConfig(), new RetryPolicyConfig());
    }

    protected DefaultWorkflowRunner runner(ProgressStore progressStore, RateLimiterConfig limiterConfig,
                                           RetryPolicyConfig retryConfig) {
        return runner(progressStore, rateLimiter(limiterConfig), retryConfig, sleeper);
    }

    protected DefaultWorkflowRunner runner(ProgressStore progressStore, RateLimiter limiter,
                                           RetryPolicyConfig retryConfig, Sleeper waits) {
        BackoffRetryPolicy retryPolicy = new BackoffRetryPolicy(limiter, retryConfig, clock, waits);
        return new DefaultWorkflowRunner(progressStore, retryPolicy, clients(), clock, waits, listener, true);
    }

    protected Workflow workflow(WorkflowKind kind, WorkflowSettings settings) {
        return WorkflowFactory.create(kind, plan(kind, settings));
    }

    protected WorkflowPlan plan(WorkflowKind kind, WorkflowSettings settings) {
        return onlyEnabled(kind).with(kind, settings);
    }

    /**
     * Creates a plan where only {@code kind} is enabled, with its default settings.
     *
     * @param kind the workflow to keep enabled
     * @return the plan
     */
    protected WorkflowPlan onlyEnabled(WorkflowKind kind) {
        WorkflowPlan plan = WorkflowPlan.defaults(environment);
        for (WorkflowKind other : WorkflowKind.values()) {
            if (other != kind) {
                plan = plan.with(other, other.defaults().withEnabled(false));
            }
        }
        return plan;
    }

    protected ConcurrentMilestoneEngine engine(WorkflowPlan plan, ProgressStore progressStore) {
        return engine(plan, progressStore, new EngineConfig());
    }

    protected ConcurrentMilestoneEngine engine(WorkflowPlan plan, ProgressStore progressStore, EngineConfig config) {
        return new ConcurrentMilestoneEngine(plan, clients(), progressStore, config, clock, sleeper, listener);
    }

    // ============================================================
    // Assertions
    // ============================================================

    protected void assertStatus(WorkflowReport report, WorkflowStatus expected) {
        assertEquals(expected, report.getStatus(),
            String.format("Expected status %s for %s but was: %s", expected, report.getWorkflow(), report));
    }

    protected void assertCounter(WorkflowName workflow, long expected) {
        long actual = store.load(workflow).map(ProgressRecord::counter).orElse(0L);
        assertEquals(expected, actual,
            String.format("Expected counter %d for %s but was %d", expected, workflow, actual));
    }

    protected void assertCompleted(WorkflowName workflow) {
        assertTrue(store.load(workflow).map(ProgressRecord::completed).orElse(false),
            String.format("Expected %s to be recorded as completed", workflow));
    }

    protected void assertThresholdsCrossed(WorkflowName workflow, List<Long> expected) {
        List<Long> actual = store.load(workflow).map(ProgressRecord::crossedThresholds).orElse(List.of());
        assertEquals(expected, actual,
            String.format("Expected crossed thresholds %s for %s but were %s", expected, workflow, actual));
    }

    protected static Duration minutes(long minutes) {
        return Duration.ofMinutes(minutes);
    }

    /**
     * Listener that keeps every notification in order.
     */
    protected static final class RecordingListener implements WorkflowListener {

        private final List<String> events = Collections.synchronizedList(new ArrayList<>());
        private final List<WorkflowReport> reports = Collections.synchronizedList(new ArrayList<>());
        private final List<ProgressRecord> commits = Collections.synchronizedList(new ArrayList<>());

        @Override
        public void statusChanged(WorkflowName workflow, WorkflowStatus from, WorkflowStatus to) {
            events.add(workflow + ":" + from + "->" + to);
        }

        @Override
        public void stepCommitted(WorkflowName workflow, StepId stepId, ProgressRecord record) {
            events.add(workflow + ":commit:" + stepId);
            commits.add(record);
        }

        @Override
        public void thresholdCrossed(WorkflowName workflow, long threshold) {
            events.add(workflow + ":threshold:" + threshold);
        }

        @Override
        public void workflowFinished(WorkflowReport report) {
            reports.add(report);
        }

        public List<String> events() {
            synchronized (events) {
                return List.copyOf(events);
            }
        }

        public List<String> events(WorkflowName workflow) {
            return events().stream().filter(e -> e.startsWith(workflow + ":")).toList();
        }

        public List<Long> thresholds(WorkflowName workflow) {
            String prefix = workflow + ":threshold:";
            return events().stream()
                .filter(e -> e.startsWith(prefix))
                .map(e -> Long.parseLong(e.substring(prefix.length())))
                .toList();
        }

        public List<String> transitions(WorkflowName workflow) {
            return events(workflow).stream().filter(e -> e.contains("->")).toList();
        }

        public List<ProgressRecord> commits(WorkflowName workflow) {
            synchronized (commits) {
                return commits.stream().filter(r -> r.workflow().equals(workflow)).toList();
            }
        }

        public List<WorkflowReport> reports() {
            synchronized (reports) {
                return List.copyOf(reports);
            }
        }

        public void clear() {
            events.clear();
            reports.clear();
            commits.clear();
        }
    }
}
