package com.ryuqq.milestone.core.model;

import java.time.Instant;

/**
 * 자격 증명별 요청 예산의 읽기 전용 뷰.
 *
 * <p>RateLimiter만 내부 상태를 변경하며, 이 값은 보고용 스냅샷입니다.</p>
 *
 * @param role 자격 증명 역할
 * @param limit 윈도우당 허용 요청 수
 * @param remaining 남은 요청 수 (예측값 포함)
 * @param resetAt 윈도우 초기화 시각 (알 수 없으면 null)
 * @param buffer 안전 버퍼
 * @param cooldownUntil 강제 대기 종료 시각 (없으면 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RateBudget(
    CredentialRole role,
    long limit,
    long remaining,
    Instant resetAt,
    long buffer,
    Instant cooldownUntil
) {

    public RateBudget {
        if (role == null) {
            throw new IllegalArgumentException("role cannot be null");
        }
        if (remaining < 0) {
            throw new IllegalArgumentException("remaining must be non-negative (current: " + remaining + ")");
        }
        if (buffer < 0) {
            throw new IllegalArgumentException("buffer must be non-negative (current: " + buffer + ")");
        }
    }

    /**
     * 버퍼를 넘는, 지금 바로 쓸 수 있는 요청 수.
     *
     * @return max(0, remaining - buffer)
     */
    public long usable() {
        return Math.max(0, remaining - buffer);
    }
}
