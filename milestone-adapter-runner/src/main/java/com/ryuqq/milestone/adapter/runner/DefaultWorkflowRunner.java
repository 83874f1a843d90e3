package com.ryuqq.milestone.adapter.runner;

import com.ryuqq.milestone.application.runner.WorkflowListener;
import com.ryuqq.milestone.application.runner.WorkflowReport;
import com.ryuqq.milestone.application.runner.RunStatistics;
import com.ryuqq.milestone.application.runner.WorkflowRunner;
import com.ryuqq.milestone.core.model.CredentialRole;
import com.ryuqq.milestone.core.model.ProgressMutation;
import com.ryuqq.milestone.core.model.ProgressRecord;
import com.ryuqq.milestone.core.model.StepId;
import com.ryuqq.milestone.core.model.WorkflowName;
import com.ryuqq.milestone.core.outcome.AttemptOutcome;
import com.ryuqq.milestone.core.outcome.Fatal;
import com.ryuqq.milestone.core.outcome.FailureKind;
import com.ryuqq.milestone.core.protection.RetryPolicy;
import com.ryuqq.milestone.core.spi.ProgressStore;
import com.ryuqq.milestone.core.spi.RemoteCallException;
import com.ryuqq.milestone.core.spi.RemoteClient;
import com.ryuqq.milestone.core.spi.RemoteClients;
import com.ryuqq.milestone.core.statemachine.StatusTransition;
import com.ryuqq.milestone.core.statemachine.WorkflowStatus;
import com.ryuqq.milestone.core.time.Sleeper;
import com.ryuqq.milestone.core.workflow.ClientCall;
import com.ryuqq.milestone.core.workflow.NextStep;
import com.ryuqq.milestone.core.workflow.StepContext;
import com.ryuqq.milestone.core.workflow.StepEffect;
import com.ryuqq.milestone.core.workflow.StepOutcome;
import com.ryuqq.milestone.core.workflow.Workflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * WorkflowRunner 기본 구현체.
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>진행 기록 로드 → nextStep → 단계 실행 → 커밋 반복</li>
 *   <li>단계 안의 원격 호출을 RetryPolicy로 전달 (역할별 RemoteClient 선택)</li>
 *   <li>체크포인트 즉시 커밋</li>
 *   <li>상태 전이 검증 ({@link StatusTransition}) 및 리스너 통지</li>
 *   <li>이번 실행의 호출 통계({@link RunStatistics})를 보고에 첨부</li>
 * </ul>
 *
 * <p><strong>커밋 구간:</strong> 단계 성공 후 커밋이 끝날 때까지 인터럽트 플래그를 내려 두었다가 복원합니다.
 * 그래서 취소는 항상 커밋 전후 경계에서만 관찰됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DefaultWorkflowRunner implements WorkflowRunner {

    private static final Logger log = LoggerFactory.getLogger(DefaultWorkflowRunner.class);

    private static final int PROGRESS_LOG_INTERVAL = 10;

    private final ProgressStore store;
    private final RetryPolicy retryPolicy;
    private final RemoteClients clients;
    private final Clock clock;
    private final Sleeper sleeper;
    private final WorkflowListener listener;
    private final boolean pacingEnabled;

    /**
     * 생성자.
     *
     * @param store 진행 기록 저장소
     * @param retryPolicy 재시도 정책 (RateLimiter 포함)
     * @param clients 역할별 RemoteClient
     * @param clock 시계
     * @param sleeper 간격 대기 수단
     * @param listener 진행 리스너
     * @param pacingEnabled false면 단계 간 간격 대기 생략 (dry-run)
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DefaultWorkflowRunner(ProgressStore store, RetryPolicy retryPolicy, RemoteClients clients,
                                 Clock clock, Sleeper sleeper, WorkflowListener listener, boolean pacingEnabled) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
        if (clients == null) {
            throw new IllegalArgumentException("clients cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.store = store;
        this.retryPolicy = retryPolicy;
        this.clients = clients;
        this.clock = clock;
        this.sleeper = sleeper;
        this.listener = listener == null ? WorkflowListener.NONE : listener;
        this.pacingEnabled = pacingEnabled;
    }

    @Override
    public WorkflowReport run(Workflow workflow) {
        if (workflow == null) {
            throw new IllegalArgumentException("workflow cannot be null");
        }
        Execution execution = new Execution(workflow);
        return execution.run();
    }

    /**
     * 워크플로우 한 번의 실행 상태.
     */
    private final class Execution {

        private final Workflow workflow;
        private final WorkflowName name;
        private WorkflowStatus status = WorkflowStatus.PENDING;
        private ProgressRecord progress;
        private StepId currentStep;
        private int stepsExecuted;
        private long remoteCalls;
        private long failedCalls;
        private long checkpoints;
        private Duration paused = Duration.ZERO;

        private Execution(Workflow workflow) {
            this.workflow = workflow;
            this.name = workflow.name();
        }

        private WorkflowReport run() {
            moveTo(WorkflowStatus.RUNNING);
            progress = store.load(name).orElseGet(() -> ProgressRecord.initial(name, clock.instant()));
            log.info("Starting workflow {} at counter {} (thresholds crossed: {})",
                name, progress.counter(), progress.crossedThresholds());

            try {
                while (true) {
                    if (Thread.currentThread().isInterrupted()) {
                        throw new InterruptedException("cancelled before step");
                    }
                    NextStep next = workflow.nextStep(progress);

                    if (next instanceof NextStep.Done done) {
                        if (!progress.completed()) {
                            progress = commitUninterruptibly(current -> current.markCompleted(clock.instant()));
                        }
                        return finish(WorkflowReport.completed(name, progress, stepsExecuted));
                    }
                    if (next instanceof NextStep.Blocked blocked) {
                        return finish(WorkflowReport.blocked(name, progress, null, blocked.reason(), stepsExecuted));
                    }

                    NextStep.Step step = (NextStep.Step) next;
                    currentStep = step.id();
                    listener.stepStarted(name, step.id(), step.description());
                    log.debug("Executing {} ({})", step.id(), step.description());

                    StepOutcome outcome = step.action().execute(new RunnerStepContext(step.id()));

                    if (outcome instanceof StepOutcome.Blocked blocked) {
                        return finish(WorkflowReport.blocked(name, progress, step.id(), blocked.reason(), stepsExecuted));
                    }
                    if (outcome instanceof StepOutcome.Failed failed) {
                        return finish(WorkflowReport.stopped(name, progress, step.id(), failed.kind(),
                            failed.code() + ": " + failed.message(), stepsExecuted));
                    }

                    commitStep(step.id(), ((StepOutcome.Advanced) outcome).effect());

                    if (pacingEnabled && !step.pauseAfter().isZero()) {
                        sleeper.sleep(step.pauseAfter());
                        paused = paused.plus(step.pauseAfter());
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return finish(WorkflowReport.cancelled(name, progress, currentStep, stepsExecuted));
            }
        }

        private void commitStep(StepId stepId, StepEffect effect) {
            ProgressRecord before = progress;
            List<Long> thresholds = workflow.thresholds();
            progress = commitUninterruptibly(current -> {
                Instant now = clock.instant();
                ProgressRecord next = current
                    .withAttributes(effect.attributes(), now)
                    .advance(effect.delta(), thresholds, stepId, now);
                return effect.completes() ? next.markCompleted(now) : next;
            });
            stepsExecuted++;
            listener.stepCommitted(name, stepId, progress);

            for (Long threshold : progress.thresholdsCrossedSince(before)) {
                log.info("Workflow {} crossed threshold {}", name, threshold);
                listener.thresholdCrossed(name, threshold);
            }
            if (effect.delta() > 0 && stepsExecuted % PROGRESS_LOG_INTERVAL == 0) {
                log.info("Workflow {} progress: counter {} after {} steps", name, progress.counter(), stepsExecuted);
            }
        }

        private ProgressRecord commitUninterruptibly(ProgressMutation mutation) {
            boolean interrupted = Thread.interrupted();
            try {
                return store.commit(name, mutation);
            } finally {
                if (interrupted) {
                    Thread.currentThread().interrupt();
                }
            }
        }

        private WorkflowReport finish(WorkflowReport outcome) {
            WorkflowReport report = outcome.withStatistics(
                new RunStatistics(remoteCalls, failedCalls, checkpoints, paused));
            moveTo(report.getStatus());
            if (report.getStatus() == WorkflowStatus.STOPPED_RESUMABLE
                || report.getStatus() == WorkflowStatus.STOPPED_UNACHIEVABLE) {
                log.error("Workflow {} stopped at {}: {} ({})",
                    name, report.getStepId(), report.getFailureKind(), report.getMessage());
            } else {
                log.info("Workflow {} finished: {} (counter {}, {} steps and {} remote calls this run)",
                    name, report.getStatus(), progress.counter(), stepsExecuted, remoteCalls);
            }
            listener.workflowFinished(report);
            return report;
        }

        private void moveTo(WorkflowStatus next) {
            WorkflowStatus previous = status;
            status = StatusTransition.transition(status, next);
            listener.statusChanged(name, previous, next);
        }

        /**
         * 단계 실행 중 동작에 제공되는 컨텍스트.
         */
        private final class RunnerStepContext implements StepContext {

            private final StepId stepId;

            private RunnerStepContext(StepId stepId) {
                this.stepId = stepId;
            }

            @Override
            public StepId stepId() {
                return stepId;
            }

            @Override
            public ProgressRecord progress() {
                return progress;
            }

            @Override
            public Map<String, String> checkpoints() {
                return progress.checkpointsFor(stepId);
            }

            @Override
            public Instant now() {
                return clock.instant();
            }

            @Override
            public boolean hasCredential(CredentialRole role) {
                return clients.forRole(role).isPresent();
            }

            @Override
            public <T> AttemptOutcome<T> call(CredentialRole role, ClientCall<T> call) throws InterruptedException {
                Optional<RemoteClient> client = clients.forRole(role);
                if (client.isEmpty()) {
                    return Fatal.of(FailureKind.PRECONDITION, "no credential configured for " + role);
                }
                RemoteClient remote = client.get();
                return retryPolicy.execute(role, () -> {
                    remoteCalls++;
                    try {
                        return call.invoke(remote);
                    } catch (RemoteCallException e) {
                        failedCalls++;
                        throw e;
                    }
                });
            }

            @Override
            public void checkpoint(String key, String value) {
                progress = commitUninterruptibly(current -> current.withCheckpoint(stepId, key, value, clock.instant()));
                checkpoints++;
                log.debug("Checkpoint {} {}={}", stepId, key, value);
            }
        }
    }
}
