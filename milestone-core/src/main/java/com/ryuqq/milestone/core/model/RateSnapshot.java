package com.ryuqq.milestone.core.model;

import java.time.Instant;

/**
 * 서버가 응답에 실어 보낸 요청 예산 값.
 *
 * <p>RateLimiter는 자체 예측보다 이 값을 신뢰합니다.</p>
 *
 * @param limit 윈도우당 허용 요청 수
 * @param remaining 남은 요청 수 (0 이상)
 * @param resetAt 윈도우 초기화 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RateSnapshot(long limit, long remaining, Instant resetAt) {

    public RateSnapshot {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
        }
        if (remaining < 0) {
            throw new IllegalArgumentException("remaining must be non-negative (current: " + remaining + ")");
        }
        if (resetAt == null) {
            throw new IllegalArgumentException("resetAt cannot be null");
        }
    }

    /**
     * 예산이 소진되었는지 확인.
     *
     * @return remaining이 0이면 true
     */
    public boolean isExhausted() {
        return remaining == 0;
    }
}
