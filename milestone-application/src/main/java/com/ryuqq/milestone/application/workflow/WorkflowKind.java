package com.ryuqq.milestone.application.workflow;

import com.ryuqq.milestone.core.model.WorkflowName;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * 지원하는 워크플로우 변형 (닫힌 집합).
 *
 * <p>각 변형은 고정된 진행 기록 키와 기본 설정을 가집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum WorkflowKind {

    /**
     * 작은 변경을 반복 병합.
     */
    BATCH_COUNTER("pull-shark", new WorkflowSettings(true, List.of(2L, 16L, 128L, 1024L), 10,
        Duration.ofSeconds(2), Duration.ofSeconds(30), null, false, false, null)),

    /**
     * 이슈를 열고 마감 시간 내에 닫기.
     */
    TIME_BOXED("quickdraw", new WorkflowSettings(true, List.of(1L), 1,
        Duration.ZERO, Duration.ZERO, Duration.ofMinutes(5), false, false, null)),

    /**
     * 공동 작성자를 표기한 커밋, 작성자 교대.
     */
    ALTERNATING("pair-extraordinaire", new WorkflowSettings(true, List.of(10L, 24L, 48L), 5,
        Duration.ofSeconds(2), Duration.ofSeconds(10), null, true, true, null)),

    /**
     * 질문 → 답변 → 채택.
     */
    QUESTION_ANSWER("galaxy-brain", new WorkflowSettings(true, List.of(8L, 16L, 32L, 64L), 3,
        Duration.ofSeconds(5), Duration.ofSeconds(15), null, false, true, null)),

    /**
     * 리뷰 없이 병합 (일회성).
     */
    REVIEW_BYPASS("yolo", new WorkflowSettings(true, List.of(1L), 1,
        Duration.ZERO, Duration.ZERO, null, false, false, null));

    private final WorkflowName workflowName;
    private final WorkflowSettings defaults;

    WorkflowKind(String workflowName, WorkflowSettings defaults) {
        this.workflowName = WorkflowName.of(workflowName);
        this.defaults = defaults;
    }

    /**
     * 진행 기록 키.
     *
     * @return 워크플로우 이름
     */
    public WorkflowName workflowName() {
        return workflowName;
    }

    public WorkflowSettings defaults() {
        return defaults;
    }

    /**
     * 설정 파일이나 명령줄의 이름으로 조회.
     *
     * <p>워크플로우 이름("pull-shark", "pull_shark")과 변형 이름("batch-counter", "BATCH_COUNTER")을
     * 모두 받습니다.</p>
     *
     * @param value 이름
     * @return WorkflowKind
     * @throws IllegalArgumentException 알 수 없는 이름
     */
    public static WorkflowKind fromName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("workflow name cannot be null or blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (WorkflowKind kind : values()) {
            if (kind.workflowName.getValue().equals(normalized)
                || kind.name().toLowerCase(Locale.ROOT).replace('_', '-').equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown workflow: " + value);
    }
}
