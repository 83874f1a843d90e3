package com.ryuqq.milestone.adapter.runner;

import com.ryuqq.milestone.application.engine.EngineReport;
import com.ryuqq.milestone.application.engine.EngineRequest;
import com.ryuqq.milestone.application.engine.MilestoneEngine;
import com.ryuqq.milestone.application.runner.WorkflowListener;
import com.ryuqq.milestone.application.runner.WorkflowReport;
import com.ryuqq.milestone.application.workflow.WorkflowEnvironment;
import com.ryuqq.milestone.application.workflow.WorkflowFactory;
import com.ryuqq.milestone.application.workflow.WorkflowKind;
import com.ryuqq.milestone.application.workflow.WorkflowPlan;
import com.ryuqq.milestone.core.model.Credential;
import com.ryuqq.milestone.core.model.CredentialRole;
import com.ryuqq.milestone.core.model.ProgressRecord;
import com.ryuqq.milestone.core.model.RateBudget;
import com.ryuqq.milestone.core.model.RateSnapshot;
import com.ryuqq.milestone.core.model.WorkflowName;
import com.ryuqq.milestone.core.outcome.AttemptOutcome;
import com.ryuqq.milestone.core.outcome.FailureKind;
import com.ryuqq.milestone.core.outcome.Success;
import com.ryuqq.milestone.core.protection.RateLimiter;
import com.ryuqq.milestone.core.protection.RetryPolicy;
import com.ryuqq.milestone.core.spi.ProgressStore;
import com.ryuqq.milestone.core.spi.RemoteClient;
import com.ryuqq.milestone.core.spi.RemoteClients;
import com.ryuqq.milestone.core.spi.noop.DryRunRemoteClient;
import com.ryuqq.milestone.core.statemachine.WorkflowStatus;
import com.ryuqq.milestone.core.time.Sleeper;
import com.ryuqq.milestone.core.workflow.Workflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 워크플로우마다 스레드 하나를 쓰는 MilestoneEngine 구현체.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * run(request)
 *   ↓
 * dry-run이면 DryRunRemoteClient로 교체
 *   ↓
 * 역할별 authenticatedLogin/rateLimit 조회 (RetryPolicy 경유) → RateLimiter.observe (예산 초기화)
 *   ↓
 * 저장소 준비 워크플로우 실행 (실패 시 선택된 워크플로우 모두 STOPPED_RESUMABLE)
 *   ↓
 * 선택된 워크플로우를 고정 스레드 풀에 제출 (비활성은 DISABLED)
 *   ↓
 * 결과 수집 (maxDuration 초과 시 cancel)
 *   ↓
 * 종료 시점 역할별 예산과 함께 EngineReport 반환
 * </pre>
 *
 * <p><strong>격리:</strong> 한 워크플로우 태스크의 예기치 않은 예외는 그 워크플로우만
 * STOPPED_RESUMABLE로 보고하고 다른 태스크는 계속 실행됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ConcurrentMilestoneEngine implements MilestoneEngine {

    private static final Logger log = LoggerFactory.getLogger(ConcurrentMilestoneEngine.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;

    private final WorkflowPlan plan;
    private final RemoteClients clients;
    private final ProgressStore store;
    private final EngineConfig config;
    private final Clock clock;
    private final Sleeper sleeper;
    private final WorkflowListener listener;

    private volatile ExecutorService active;
    private volatile boolean cancelled;

    /**
     * 생성자.
     *
     * @param plan 실행 대상과 워크플로우별 설정
     * @param clients 역할별 RemoteClient (dry-run에서는 사용하지 않음)
     * @param store 진행 기록 저장소
     * @param config 엔진 설정
     * @param clock 시계
     * @param sleeper 대기 수단
     * @param listener 진행 리스너 (null이면 통지 없음)
     * @throws IllegalArgumentException 필수 의존성이 null인 경우
     */
    public ConcurrentMilestoneEngine(WorkflowPlan plan, RemoteClients clients, ProgressStore store,
                                     EngineConfig config, Clock clock, Sleeper sleeper, WorkflowListener listener) {
        if (plan == null) {
            throw new IllegalArgumentException("plan cannot be null");
        }
        if (clients == null) {
            throw new IllegalArgumentException("clients cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.plan = plan;
        this.clients = clients;
        this.store = store;
        this.config = config;
        this.clock = clock;
        this.sleeper = sleeper;
        this.listener = listener == null ? WorkflowListener.NONE : listener;
    }

    @Override
    public EngineReport run(EngineRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        Instant startedAt = clock.instant();
        cancelled = false;

        RemoteClients effectiveClients = request.dryRun() ? dryRunClients() : clients;
        RateLimiter rateLimiter = new BudgetRateLimiter(config.rateLimiter(), clock, sleeper);
        BackoffRetryPolicy retryPolicy = new BackoffRetryPolicy(rateLimiter, config.retry(), clock, sleeper);
        DefaultWorkflowRunner runner = new DefaultWorkflowRunner(store, retryPolicy, effectiveClients,
            clock, sleeper, listener, !request.dryRun());

        List<WorkflowKind> selected = new ArrayList<>();
        for (WorkflowKind kind : WorkflowKind.values()) {
            if (request.selects(kind)) {
                selected.add(kind);
            }
        }
        long enabledCount = selected.stream().filter(k -> plan.settingsFor(k).enabled()).count();
        int threads = config.concurrency() > 0 ? config.concurrency() : (int) Math.max(1, enabledCount);

        log.info("Starting {} run for {} on {} ({} workflows, {} threads)",
            request.dryRun() ? "dry" : "live", plan.environment().repository(), selected, enabledCount, threads);

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        active = executor;
        Instant deadline = config.maxDuration() == null ? null : startedAt.plus(config.maxDuration());
        List<WorkflowReport> reports = new ArrayList<>();
        try {
            primeBudgets(effectiveClients, retryPolicy, rateLimiter, request.dryRun());

            Workflow setup = WorkflowFactory.repositorySetup(plan.environment());
            WorkflowReport setupReport = await(submit(executor, runner, setup), setup.name(), deadline);
            reports.add(setupReport);

            if (setupReport.getStatus() != WorkflowStatus.COMPLETED) {
                log.error("Repository setup did not complete ({}); skipping {} workflows",
                    setupReport.getStatus(), selected.size());
                for (WorkflowKind kind : selected) {
                    reports.add(skippedAfterSetup(kind, setupReport));
                }
                return finish(reports, request, startedAt, rateLimiter, effectiveClients);
            }

            Map<WorkflowKind, Future<WorkflowReport>> futures = new LinkedHashMap<>();
            for (WorkflowKind kind : selected) {
                if (!plan.settingsFor(kind).enabled()) {
                    continue;
                }
                futures.put(kind, submit(executor, runner, WorkflowFactory.create(kind, plan)));
            }

            for (WorkflowKind kind : selected) {
                Future<WorkflowReport> future = futures.get(kind);
                if (future == null) {
                    WorkflowReport disabled = WorkflowReport.disabled(kind.workflowName(),
                        store.load(kind.workflowName()).orElse(null));
                    listener.workflowFinished(disabled);
                    reports.add(disabled);
                } else {
                    reports.add(await(future, kind.workflowName(), deadline));
                }
            }
            return finish(reports, request, startedAt, rateLimiter, effectiveClients);
        } finally {
            active = null;
            shutdown(executor);
        }
    }

    /**
     * 실행 중인 워크플로우를 취소합니다.
     *
     * <p>실행 중인 태스크는 인터럽트되어 커밋 경계에서 CANCELLED로 끝나고,
     * 아직 시작하지 못한 태스크는 큐에서 꺼내 취소합니다. 두 경우 모두 run()은 CANCELLED 보고를 받아 반환합니다.</p>
     */
    @Override
    public void cancel() {
        cancelled = true;
        ExecutorService executor = active;
        if (executor != null) {
            log.warn("Cancelling running workflows");
            for (Runnable queued : executor.shutdownNow()) {
                if (queued instanceof Future<?> future) {
                    future.cancel(false);
                }
            }
        }
    }

    private Future<WorkflowReport> submit(ExecutorService executor, DefaultWorkflowRunner runner, Workflow workflow) {
        try {
            return executor.submit(() -> runGuarded(runner, workflow));
        } catch (RejectedExecutionException e) {
            // cancel() 이후 제출된 태스크
            return CompletableFuture.completedFuture(cancelledBeforeStart(workflow.name()));
        }
    }

    private WorkflowReport runGuarded(DefaultWorkflowRunner runner, Workflow workflow) {
        try {
            return runner.run(workflow);
        } catch (RuntimeException e) {
            log.error("Workflow {} failed unexpectedly", workflow.name(), e);
            WorkflowReport report = WorkflowReport.unexpected(workflow.name(),
                loadQuietly(workflow.name()), e.getClass().getSimpleName() + ": " + e.getMessage());
            listener.workflowFinished(report);
            return report;
        }
    }

    private WorkflowReport await(Future<WorkflowReport> future, WorkflowName name, Instant deadline) {
        try {
            if (!cancelled) {
                try {
                    if (deadline == null) {
                        return future.get();
                    }
                    long remainingMs = Duration.between(clock.instant(), deadline).toMillis();
                    return future.get(Math.max(0, remainingMs), TimeUnit.MILLISECONDS);
                } catch (TimeoutException e) {
                    log.warn("Run exceeded max duration {}; cancelling", config.maxDuration());
                    cancel();
                }
            }
            try {
                return future.get(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            } catch (TimeoutException e) {
                log.warn("Workflow {} did not stop within {}s of cancellation", name, SHUTDOWN_TIMEOUT_SECONDS);
                future.cancel(true);
                return cancelledBeforeStart(name);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            return WorkflowReport.cancelled(name, loadQuietly(name), null, 0);
        } catch (ExecutionException e) {
            log.error("Workflow {} task failed", name, e.getCause());
            return WorkflowReport.unexpected(name, loadQuietly(name), String.valueOf(e.getCause()));
        } catch (CancellationException e) {
            return cancelledBeforeStart(name);
        }
    }

    private WorkflowReport cancelledBeforeStart(WorkflowName name) {
        WorkflowReport report = WorkflowReport.cancelled(name, loadQuietly(name), null, 0);
        listener.workflowFinished(report);
        return report;
    }

    private WorkflowReport skippedAfterSetup(WorkflowKind kind, WorkflowReport setupReport) {
        WorkflowName name = kind.workflowName();
        WorkflowReport report;
        if (setupReport.getStatus() == WorkflowStatus.CANCELLED) {
            report = WorkflowReport.cancelled(name, loadQuietly(name), null, 0);
        } else {
            FailureKind cause = setupReport.getFailureKind() != null && setupReport.getFailureKind().isResumable()
                ? setupReport.getFailureKind()
                : FailureKind.PRECONDITION;
            report = WorkflowReport.stopped(name, loadQuietly(name), null, cause,
                "repository setup did not complete: " + setupReport.getMessage(), 0);
        }
        listener.workflowFinished(report);
        return report;
    }

    /**
     * 역할별 로그인 확인과 예산 초기화.
     *
     * <p>두 호출 모두 RetryPolicy를 거치므로 RateLimiter 예산을 사용합니다.
     * 실패는 경고로만 남기고, 실제 오류는 워크플로우 단계에서 분류되어 보고됩니다.</p>
     */
    private void primeBudgets(RemoteClients effectiveClients, RetryPolicy retryPolicy, RateLimiter rateLimiter,
                              boolean dryRun) {
        for (CredentialRole role : CredentialRole.values()) {
            Optional<RemoteClient> client = effectiveClients.forRole(role);
            if (client.isEmpty()) {
                continue;
            }
            RemoteClient remote = client.get();
            try {
                if (!dryRun) {
                    verifyLogin(role, retryPolicy.execute(role, remote::authenticatedLogin));
                }
                AttemptOutcome<RateSnapshot> outcome = retryPolicy.execute(role, remote::rateLimit);
                if (outcome instanceof Success<RateSnapshot> success) {
                    RateSnapshot snapshot = success.value();
                    rateLimiter.observe(role, snapshot);
                    log.info("{} budget: {}/{} (resets at {})", role, snapshot.remaining(), snapshot.limit(), snapshot.resetAt());
                } else {
                    log.warn("Could not read rate limit for {}: {}", role, outcome);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancel();
                return;
            } catch (RuntimeException e) {
                log.warn("Could not prime budget for {}: {}", role, e.toString());
            }
        }
    }

    private void verifyLogin(CredentialRole role, AttemptOutcome<String> outcome) {
        if (!(outcome instanceof Success<String> success)) {
            log.warn("Could not verify login for {}: {}", role, outcome);
            return;
        }
        Optional<Credential> credential = plan.environment().credential(role);
        String login = success.value();
        if (credential.isPresent() && login != null && !login.equalsIgnoreCase(credential.get().login())) {
            log.warn("{} credential authenticates as {} but is configured as {}", role, login, credential.get().login());
        }
    }

    private RemoteClients dryRunClients() {
        WorkflowEnvironment environment = plan.environment();
        RemoteClient primary = new DryRunRemoteClient(environment.primary().login(), clock);
        RemoteClient secondary = environment.secondary() == null
            ? null
            : new DryRunRemoteClient(environment.secondary().login(), clock);
        return RemoteClients.of(primary, secondary);
    }

    private EngineReport finish(List<WorkflowReport> reports, EngineRequest request, Instant startedAt,
                                RateLimiter rateLimiter, RemoteClients effectiveClients) {
        Map<CredentialRole, RateBudget> budgets = new EnumMap<>(CredentialRole.class);
        for (CredentialRole role : CredentialRole.values()) {
            if (effectiveClients.forRole(role).isPresent()) {
                budgets.put(role, rateLimiter.budget(role));
            }
        }
        EngineReport report = new EngineReport(reports, request.dryRun(),
            Duration.between(startedAt, clock.instant()), budgets);
        log.info("Run finished in {}s: {} ({} steps, {} remote calls)", report.elapsed().toSeconds(),
            report.allSuccessful() ? "ok" : "stopped", report.totalStepsExecuted(), report.totals().remoteCalls());
        return report;
    }

    private ProgressRecord loadQuietly(WorkflowName name) {
        try {
            return store.load(name).orElse(null);
        } catch (RuntimeException e) {
            log.warn("Could not load progress for {}: {}", name, e.getMessage());
            return null;
        }
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
