package com.ryuqq.milestone.application.runner;

import java.time.Duration;

/**
 * 워크플로우 한 번 실행 동안의 원격 호출 통계.
 *
 * <p><strong>집계 항목:</strong></p>
 * <ul>
 *   <li>remoteCalls: 실제로 보낸 원격 호출 시도 수 (재시도 포함)</li>
 *   <li>failedCalls: 원격 오류로 끝난 시도 수</li>
 *   <li>checkpoints: 커밋한 체크포인트 수</li>
 *   <li>paused: 단계 간 간격 대기 합계</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param remoteCalls 원격 호출 시도 수
 * @param failedCalls 실패한 시도 수
 * @param checkpoints 체크포인트 커밋 수
 * @param paused 간격 대기 합계
 */
public record RunStatistics(long remoteCalls, long failedCalls, long checkpoints, Duration paused) {

    public static final RunStatistics EMPTY = new RunStatistics(0, 0, 0, Duration.ZERO);

    public RunStatistics {
        if (remoteCalls < 0 || failedCalls < 0 || checkpoints < 0) {
            throw new IllegalArgumentException("statistics must be non-negative");
        }
        if (failedCalls > remoteCalls) {
            throw new IllegalArgumentException(
                "failedCalls cannot exceed remoteCalls (failed: " + failedCalls + ", calls: " + remoteCalls + ")");
        }
        if (paused == null || paused.isNegative()) {
            throw new IllegalArgumentException("paused must be non-negative");
        }
    }

    public RunStatistics plus(RunStatistics other) {
        return new RunStatistics(remoteCalls + other.remoteCalls, failedCalls + other.failedCalls,
            checkpoints + other.checkpoints, paused.plus(other.paused));
    }
}
