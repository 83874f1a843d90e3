package com.ryuqq.milestone.application.workflow;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 워크플로우별 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>enabled: 실행 여부</li>
 *   <li>thresholds: 마일스톤 임계값, 가장 큰 값이 목표</li>
 *   <li>batchSize / pacing / batchPause: 단계 간격. 매 단계 후 pacing, batchSize 단계마다 batchPause</li>
 *   <li>deadline: 시간 제한 워크플로우의 마감</li>
 *   <li>alternateAuthors: 공동 작성 워크플로우에서 작성자 교대 여부</li>
 *   <li>autoAcceptInvitation: 협업 초대를 보조 자격 증명으로 자동 수락</li>
 *   <li>reviewer: 리뷰 우회 워크플로우의 리뷰 요청 대상</li>
 * </ul>
 *
 * @param enabled 실행 여부
 * @param thresholds 임계값 (양수, 1개 이상)
 * @param batchSize 배치 크기 (1 이상)
 * @param pacing 단계 간격
 * @param batchPause 배치 간격
 * @param deadline 마감 (시간 제한 워크플로우 외에는 null 허용)
 * @param alternateAuthors 작성자 교대 여부
 * @param autoAcceptInvitation 초대 자동 수락 여부
 * @param reviewer 리뷰어 로그인 (null 허용)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WorkflowSettings(
    boolean enabled,
    List<Long> thresholds,
    int batchSize,
    Duration pacing,
    Duration batchPause,
    Duration deadline,
    boolean alternateAuthors,
    boolean autoAcceptInvitation,
    String reviewer
) {

    /**
     * Compact constructor (유효성 검증, 임계값 정렬).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public WorkflowSettings {
        if (thresholds == null || thresholds.isEmpty()) {
            throw new IllegalArgumentException("thresholds cannot be null or empty");
        }
        List<Long> sorted = new ArrayList<>(thresholds);
        Collections.sort(sorted);
        for (int i = 0; i < sorted.size(); i++) {
            if (sorted.get(i) <= 0) {
                throw new IllegalArgumentException("thresholds must be positive (current: " + sorted.get(i) + ")");
            }
            if (i > 0 && sorted.get(i).equals(sorted.get(i - 1))) {
                throw new IllegalArgumentException("thresholds must be distinct (duplicate: " + sorted.get(i) + ")");
            }
        }
        thresholds = List.copyOf(sorted);
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive (current: " + batchSize + ")");
        }
        pacing = requireNonNegative("pacing", pacing);
        batchPause = requireNonNegative("batchPause", batchPause);
        if (deadline != null && (deadline.isZero() || deadline.isNegative())) {
            throw new IllegalArgumentException("deadline must be positive (current: " + deadline + ")");
        }
        if (reviewer != null && reviewer.isBlank()) {
            reviewer = null;
        }
    }

    private static Duration requireNonNegative(String field, Duration value) {
        if (value == null) {
            return Duration.ZERO;
        }
        if (value.isNegative()) {
            throw new IllegalArgumentException(field + " must be non-negative (current: " + value + ")");
        }
        return value;
    }

    /**
     * 목표 counter (가장 큰 임계값).
     *
     * @return 목표
     */
    public long target() {
        return thresholds.get(thresholds.size() - 1);
    }

    public WorkflowSettings withEnabled(boolean enabled) {
        return new WorkflowSettings(enabled, thresholds, batchSize, pacing, batchPause, deadline,
            alternateAuthors, autoAcceptInvitation, reviewer);
    }

    public WorkflowSettings withThresholds(List<Long> thresholds) {
        return new WorkflowSettings(enabled, thresholds, batchSize, pacing, batchPause, deadline,
            alternateAuthors, autoAcceptInvitation, reviewer);
    }

    public WorkflowSettings withBatchSize(int batchSize) {
        return new WorkflowSettings(enabled, thresholds, batchSize, pacing, batchPause, deadline,
            alternateAuthors, autoAcceptInvitation, reviewer);
    }

    /**
     * 간격만 변경한 새 인스턴스 생성.
     *
     * @param pacing 단계 간격
     * @param batchPause 배치 간격
     * @return 새 WorkflowSettings 인스턴스
     */
    public WorkflowSettings withPacing(Duration pacing, Duration batchPause) {
        return new WorkflowSettings(enabled, thresholds, batchSize, pacing, batchPause, deadline,
            alternateAuthors, autoAcceptInvitation, reviewer);
    }

    public WorkflowSettings withDeadline(Duration deadline) {
        return new WorkflowSettings(enabled, thresholds, batchSize, pacing, batchPause, deadline,
            alternateAuthors, autoAcceptInvitation, reviewer);
    }

    public WorkflowSettings withAlternateAuthors(boolean alternateAuthors) {
        return new WorkflowSettings(enabled, thresholds, batchSize, pacing, batchPause, deadline,
            alternateAuthors, autoAcceptInvitation, reviewer);
    }

    public WorkflowSettings withAutoAcceptInvitation(boolean autoAcceptInvitation) {
        return new WorkflowSettings(enabled, thresholds, batchSize, pacing, batchPause, deadline,
            alternateAuthors, autoAcceptInvitation, reviewer);
    }

    public WorkflowSettings withReviewer(String reviewer) {
        return new WorkflowSettings(enabled, thresholds, batchSize, pacing, batchPause, deadline,
            alternateAuthors, autoAcceptInvitation, reviewer);
    }
}
