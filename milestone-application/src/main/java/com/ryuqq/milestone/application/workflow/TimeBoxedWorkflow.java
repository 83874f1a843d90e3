package com.ryuqq.milestone.application.workflow;

import com.ryuqq.milestone.core.model.CredentialRole;
import com.ryuqq.milestone.core.model.ProgressRecord;
import com.ryuqq.milestone.core.model.StepId;
import com.ryuqq.milestone.core.outcome.AttemptOutcome;
import com.ryuqq.milestone.core.outcome.FailureKind;
import com.ryuqq.milestone.core.spi.RemoteArtifact;
import com.ryuqq.milestone.core.workflow.StepAction;
import com.ryuqq.milestone.core.workflow.StepContext;
import com.ryuqq.milestone.core.workflow.StepOutcome;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * 이슈를 열고 마감 시간 안에 닫는 일회성 워크플로우.
 *
 * <p><strong>체크포인트:</strong></p>
 * <ul>
 *   <li>openedAt: 열기 요청 직전 시각</li>
 *   <li>issue: 열린 이슈 번호</li>
 *   <li>closedAt: 마감을 넘겨 닫힌 시각 (다음 시도로 넘어가야 함)</li>
 * </ul>
 *
 * <p>마감을 넘긴 시도는 DEADLINE으로 실패합니다 (재개해도 달성 불가).
 * 재실행 시 이전 시도가 남긴 기록이 있으면 attempt 속성을 올려 새 이슈로 다시 시도합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TimeBoxedWorkflow extends AbstractThresholdWorkflow {

    static final String ATTEMPT_ATTRIBUTE = "attempt";
    static final String ISSUE = "issue";
    static final String OPENED_AT = "openedAt";
    static final String CLOSED_AT = "closedAt";

    public TimeBoxedWorkflow(WorkflowEnvironment environment, WorkflowSettings settings) {
        super(WorkflowKind.TIME_BOXED.workflowName(), environment, requireDeadline(settings));
    }

    private static WorkflowSettings requireDeadline(WorkflowSettings settings) {
        if (settings != null && settings.deadline() == null) {
            return settings.withDeadline(WorkflowKind.TIME_BOXED.defaults().deadline());
        }
        return settings;
    }

    @Override
    protected StepId stepIdFor(ProgressRecord progress, long index) {
        return StepId.attempt(name, attemptOf(progress));
    }

    @Override
    protected String describe(long index) {
        return "open and close an issue within " + settings.deadline();
    }

    @Override
    protected StepAction action(long index) {
        return this::attempt;
    }

    private StepOutcome attempt(StepContext context) throws InterruptedException {
        long attempt = attemptOf(context.progress());
        Map<String, String> checkpoints = context.checkpoints();
        Duration deadline = settings.deadline();

        if (checkpoints.containsKey(CLOSED_AT)) {
            return nextAttempt(attempt);
        }

        if (checkpoints.containsKey(ISSUE)) {
            Instant openedAt = Instant.parse(checkpoints.get(OPENED_AT));
            if (Duration.between(openedAt, context.now()).compareTo(deadline) > 0) {
                StepOutcome closed = close(context, Long.parseLong(checkpoints.get(ISSUE)));
                if (closed != null) {
                    return closed;
                }
                return nextAttempt(attempt);
            }
        } else {
            // openedAt without issue: the open call may have landed before a crash
            String previousOpen = checkpoints.get(OPENED_AT);
            if (previousOpen == null) {
                context.checkpoint(OPENED_AT, context.now().toString());
            }
            AttemptOutcome<RemoteArtifact> opened = context.call(CredentialRole.PRIMARY,
                client -> client.createIssue(environment.repository(),
                    "Quick issue #" + attempt,
                    "Opened and closed within " + deadline,
                    context.stepId().subKey("open")));
            if (!opened.isSuccess()) {
                return StepOutcome.failed(opened);
            }
            context.checkpoint(ISSUE, String.valueOf(opened.payload().number()));
            if (previousOpen != null
                && Duration.between(Instant.parse(previousOpen), context.now()).compareTo(deadline) > 0) {
                StepOutcome closed = close(context, opened.payload().number());
                return closed != null ? closed : nextAttempt(attempt);
            }
        }

        long issue = Long.parseLong(context.checkpoints().get(ISSUE));
        StepOutcome closed = close(context, issue);
        if (closed != null) {
            return closed;
        }

        Instant openedAt = Instant.parse(context.checkpoints().get(OPENED_AT));
        Instant closedAt = context.now();
        Duration elapsed = Duration.between(openedAt, closedAt);
        if (elapsed.compareTo(deadline) <= 0) {
            return StepOutcome.completed(1);
        }
        context.checkpoint(CLOSED_AT, closedAt.toString());
        return StepOutcome.failed(FailureKind.DEADLINE,
            "issue #" + issue + " closed after " + elapsed + " (deadline " + deadline + ")");
    }

    private StepOutcome close(StepContext context, long issue) throws InterruptedException {
        AttemptOutcome<RemoteArtifact> closed = context.call(CredentialRole.PRIMARY,
            client -> client.closeIssue(environment.repository(), issue, context.stepId().subKey("close")));
        return closed.isSuccess() ? null : StepOutcome.failed(closed);
    }

    private static StepOutcome nextAttempt(long attempt) {
        return StepOutcome.recorded(Map.of(ATTEMPT_ATTRIBUTE, String.valueOf(attempt + 1)));
    }

    static long attemptOf(ProgressRecord progress) {
        return progress.attribute(ATTEMPT_ATTRIBUTE).map(Long::parseLong).orElse(1L);
    }
}
