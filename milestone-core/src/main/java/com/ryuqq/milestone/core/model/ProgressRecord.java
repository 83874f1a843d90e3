package com.ryuqq.milestone.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 워크플로우 하나의 진행 기록.
 *
 * <p>ProgressStore에 커밋된 값만이 진실이며, 재개 시 이 기록으로부터 다음 단계가 결정적으로 계산됩니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>counter는 감소하지 않음</li>
 *   <li>crossedThresholds는 오름차순이며 한번 기록되면 제거되지 않음</li>
 *   <li>completed가 true가 되면 다시 false가 되지 않음</li>
 *   <li>attributes는 키가 제거되지 않음</li>
 * </ul>
 *
 * <p>checkpoints는 {@code checkpointStepId} 단계의 하위 호출 결과이며, 해당 단계가
 * 완료되면 비워집니다.</p>
 *
 * @param workflow 워크플로우 이름
 * @param counter 완료된 단계 수
 * @param crossedThresholds 통과한 임계값 (오름차순)
 * @param lastStepId 마지막으로 완료된 단계 (없으면 null)
 * @param completed 완료 여부
 * @param updatedAt 마지막 갱신 시각
 * @param checkpointStepId 체크포인트가 속한 단계 (없으면 null)
 * @param checkpoints 진행 중 단계의 하위 호출 결과
 * @param attributes 설정 단계 등에서 확인된 사실
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ProgressRecord(
    WorkflowName workflow,
    long counter,
    List<Long> crossedThresholds,
    StepId lastStepId,
    boolean completed,
    Instant updatedAt,
    StepId checkpointStepId,
    Map<String, String> checkpoints,
    Map<String, String> attributes
) {

    public ProgressRecord {
        if (workflow == null) {
            throw new IllegalArgumentException("workflow cannot be null");
        }
        if (counter < 0) {
            throw new IllegalArgumentException("counter must be non-negative (current: " + counter + ")");
        }
        if (updatedAt == null) {
            throw new IllegalArgumentException("updatedAt cannot be null");
        }
        crossedThresholds = crossedThresholds == null ? List.of() : List.copyOf(crossedThresholds);
        for (int i = 1; i < crossedThresholds.size(); i++) {
            if (crossedThresholds.get(i - 1) >= crossedThresholds.get(i)) {
                throw new IllegalArgumentException("crossedThresholds must be strictly increasing: " + crossedThresholds);
            }
        }
        checkpoints = checkpoints == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(checkpoints));
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        if (checkpointStepId == null && !checkpoints.isEmpty()) {
            throw new IllegalArgumentException("checkpoints require a checkpointStepId");
        }
    }

    /**
     * 처음 실행되는 워크플로우의 빈 기록.
     *
     * @param workflow 워크플로우 이름
     * @param now 생성 시각
     * @return counter=0인 기록
     */
    public static ProgressRecord initial(WorkflowName workflow, Instant now) {
        return new ProgressRecord(workflow, 0, List.of(), null, false, now, null, Map.of(), Map.of());
    }

    /**
     * 단계 완료를 반영한 새 기록.
     *
     * <p>counter에 delta를 더하고, 새 counter 이하인 임계값 중 아직 기록되지 않은 것을
     * 오름차순으로 추가합니다. 체크포인트는 비워집니다.</p>
     *
     * @param delta counter 증가량 (0 이상)
     * @param thresholds 워크플로우의 임계값 목록
     * @param step 완료된 단계
     * @param now 갱신 시각
     * @return 새 ProgressRecord
     */
    public ProgressRecord advance(long delta, List<Long> thresholds, StepId step, Instant now) {
        if (delta < 0) {
            throw new IllegalArgumentException("delta must be non-negative (current: " + delta + ")");
        }
        long next = counter + delta;
        List<Long> crossed = new ArrayList<>(crossedThresholds);
        thresholds.stream()
            .sorted()
            .filter(t -> t <= next && !crossedThresholds.contains(t))
            .forEach(crossed::add);
        Collections.sort(crossed);
        return new ProgressRecord(workflow, next, crossed, step, completed, now, null, Map.of(), attributes);
    }

    /**
     * 이 기록 이후 새로 통과한 임계값.
     *
     * @param previous 이전 기록
     * @return previous에는 없고 이 기록에는 있는 임계값 (오름차순)
     */
    public List<Long> thresholdsCrossedSince(ProgressRecord previous) {
        List<Long> result = new ArrayList<>(crossedThresholds);
        result.removeAll(previous.crossedThresholds);
        return List.copyOf(result);
    }

    /**
     * 체크포인트를 추가한 새 기록.
     *
     * <p>다른 단계의 체크포인트가 남아 있으면 버리고 새로 시작합니다.</p>
     *
     * @param step 진행 중 단계
     * @param key 하위 호출 이름
     * @param value 결과 값
     * @param now 갱신 시각
     * @return 새 ProgressRecord
     */
    public ProgressRecord withCheckpoint(StepId step, String key, String value, Instant now) {
        Map<String, String> next = new LinkedHashMap<>(checkpointsFor(step));
        next.put(key, value);
        return new ProgressRecord(workflow, counter, crossedThresholds, lastStepId, completed, now, step, next, attributes);
    }

    /**
     * 특정 단계에 속한 체크포인트 조회.
     *
     * @param step 단계
     * @return 해당 단계의 체크포인트 (다른 단계 것이면 빈 Map)
     */
    public Map<String, String> checkpointsFor(StepId step) {
        return step.equals(checkpointStepId) ? checkpoints : Map.of();
    }

    /**
     * 속성을 병합한 새 기록.
     *
     * @param additions 추가할 속성
     * @param now 갱신 시각
     * @return 새 ProgressRecord
     */
    public ProgressRecord withAttributes(Map<String, String> additions, Instant now) {
        if (additions.isEmpty()) {
            return this;
        }
        Map<String, String> next = new LinkedHashMap<>(attributes);
        next.putAll(additions);
        return new ProgressRecord(workflow, counter, crossedThresholds, lastStepId, completed, now, checkpointStepId, checkpoints, next);
    }

    /**
     * 완료 표시한 새 기록.
     *
     * @param now 갱신 시각
     * @return completed=true인 ProgressRecord
     */
    public ProgressRecord markCompleted(Instant now) {
        return new ProgressRecord(workflow, counter, crossedThresholds, lastStepId, true, now, null, Map.of(), attributes);
    }

    /**
     * 속성 조회.
     *
     * @param key 속성 키
     * @return 속성 값
     */
    public Optional<String> attribute(String key) {
        return Optional.ofNullable(attributes.get(key));
    }

    /**
     * next가 이 기록의 유효한 후속 기록인지 검증.
     *
     * @param next 커밋하려는 기록
     * @throws IllegalStateException 불변식을 위반한 경우
     */
    public void requireValidSuccessor(ProgressRecord next) {
        if (!workflow.equals(next.workflow)) {
            throw new IllegalStateException("Workflow mismatch: " + workflow + " → " + next.workflow);
        }
        if (next.counter < counter) {
            throw new IllegalStateException(
                String.format("Counter cannot decrease for %s: %d → %d", workflow, counter, next.counter)
            );
        }
        if (!next.crossedThresholds.containsAll(crossedThresholds)) {
            throw new IllegalStateException(
                String.format("Crossed thresholds cannot shrink for %s: %s → %s", workflow, crossedThresholds, next.crossedThresholds)
            );
        }
        if (completed && !next.completed) {
            throw new IllegalStateException("Completed workflow cannot be reopened: " + workflow);
        }
        if (!next.attributes.keySet().containsAll(attributes.keySet())) {
            throw new IllegalStateException("Attributes cannot be removed for " + workflow);
        }
    }
}
