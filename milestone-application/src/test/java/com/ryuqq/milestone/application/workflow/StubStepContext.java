package com.ryuqq.milestone.application.workflow;

import com.ryuqq.milestone.core.model.CredentialRole;
import com.ryuqq.milestone.core.model.ProgressRecord;
import com.ryuqq.milestone.core.model.StepId;
import com.ryuqq.milestone.core.outcome.AttemptOutcome;
import com.ryuqq.milestone.core.outcome.Success;
import com.ryuqq.milestone.core.spi.RemoteClient;
import com.ryuqq.milestone.core.workflow.ClientCall;
import com.ryuqq.milestone.core.workflow.StepContext;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 워크플로우 단위 테스트용 StepContext.
 *
 * <p>호출은 역할별 RemoteClient(보통 Mockito mock)로 그대로 전달되고,
 * 호출마다 now가 callLatency만큼 진행합니다. 예약된 결과가 있으면 클라이언트 대신 그것을 돌려줍니다.</p>
 */
class StubStepContext implements StepContext {

    private final StepId stepId;
    private final ProgressRecord progress;
    private final RemoteClient primary;
    private final RemoteClient secondary;
    private final Map<String, String> checkpoints = new LinkedHashMap<>();
    private final Deque<AttemptOutcome<?>> scripted = new ArrayDeque<>();
    private final List<CredentialRole> callRoles = new ArrayList<>();
    private Instant now;
    private Duration callLatency = Duration.ZERO;

    StubStepContext(StepId stepId, ProgressRecord progress, RemoteClient primary, RemoteClient secondary, Instant now) {
        this.stepId = stepId;
        this.progress = progress;
        this.primary = primary;
        this.secondary = secondary;
        this.now = now;
        this.checkpoints.putAll(progress.checkpointsFor(stepId));
    }

    StubStepContext withCallLatency(Duration latency) {
        this.callLatency = latency;
        return this;
    }

    StubStepContext thenReturn(AttemptOutcome<?> outcome) {
        scripted.add(outcome);
        return this;
    }

    List<CredentialRole> callRoles() {
        return callRoles;
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
        return Map.copyOf(checkpoints);
    }

    @Override
    public Instant now() {
        return now;
    }

    @Override
    public boolean hasCredential(CredentialRole role) {
        return role == CredentialRole.PRIMARY ? primary != null : secondary != null;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> AttemptOutcome<T> call(CredentialRole role, ClientCall<T> call) {
        callRoles.add(role);
        now = now.plus(callLatency);
        if (!scripted.isEmpty()) {
            return (AttemptOutcome<T>) scripted.poll();
        }
        RemoteClient client = role == CredentialRole.PRIMARY ? primary : secondary;
        return new Success<>(call.invoke(client).value());
    }

    @Override
    public void checkpoint(String key, String value) {
        checkpoints.put(key, value);
    }
}
