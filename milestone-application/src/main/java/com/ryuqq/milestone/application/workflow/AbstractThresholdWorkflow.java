package com.ryuqq.milestone.application.workflow;

import com.ryuqq.milestone.core.model.ProgressRecord;
import com.ryuqq.milestone.core.model.StepId;
import com.ryuqq.milestone.core.model.WorkflowName;
import com.ryuqq.milestone.core.workflow.NextStep;
import com.ryuqq.milestone.core.workflow.StepAction;
import com.ryuqq.milestone.core.workflow.Workflow;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * 임계값 기반 워크플로우의 공통 골격.
 *
 * <p><strong>단계 결정 순서:</strong></p>
 * <ol>
 *   <li>완료 표시가 있거나 counter가 목표 이상이면 Done</li>
 *   <li>{@link #setup(ProgressRecord)}가 준비 단계를 돌려주면 그 단계</li>
 *   <li>그 외에는 index = counter + 1인 반복 단계</li>
 * </ol>
 *
 * <p>반복 단계 후의 대기: index가 batchSize의 배수이면 batchPause, 아니면 pacing.
 * 마지막 단계 뒤에는 대기하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractThresholdWorkflow implements Workflow {

    protected final WorkflowName name;
    protected final WorkflowEnvironment environment;
    protected final WorkflowSettings settings;

    protected AbstractThresholdWorkflow(WorkflowName name, WorkflowEnvironment environment, WorkflowSettings settings) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        if (settings == null) {
            throw new IllegalArgumentException("settings cannot be null");
        }
        this.name = name;
        this.environment = environment;
        this.settings = settings;
    }

    @Override
    public WorkflowName name() {
        return name;
    }

    @Override
    public List<Long> thresholds() {
        return settings.thresholds();
    }

    @Override
    public NextStep nextStep(ProgressRecord progress) {
        if (progress.completed() || progress.counter() >= settings.target()) {
            return new NextStep.Done(doneSummary(progress));
        }
        Optional<NextStep> setup = setup(progress);
        if (setup.isPresent()) {
            return setup.get();
        }
        long index = progress.counter() + 1;
        return new NextStep.Step(stepIdFor(progress, index), describe(index), action(index), pauseAfter(index));
    }

    /**
     * 반복 단계 전에 필요한 준비 단계.
     *
     * @param progress 현재 기록
     * @return 준비 단계 (없으면 empty)
     */
    protected Optional<NextStep> setup(ProgressRecord progress) {
        return Optional.empty();
    }

    protected StepId stepIdFor(ProgressRecord progress, long index) {
        return StepId.indexed(name, index);
    }

    protected String describe(long index) {
        return name.getValue() + " " + index + "/" + settings.target();
    }

    protected String doneSummary(ProgressRecord progress) {
        return "counter " + progress.counter() + " reached target " + settings.target();
    }

    /**
     * index번째 반복 단계의 동작.
     *
     * @param index 1부터 시작하는 단계 번호
     * @return StepAction
     */
    protected abstract StepAction action(long index);

    Duration pauseAfter(long index) {
        if (index >= settings.target()) {
            return Duration.ZERO;
        }
        return index % settings.batchSize() == 0 ? settings.batchPause() : settings.pacing();
    }
}
