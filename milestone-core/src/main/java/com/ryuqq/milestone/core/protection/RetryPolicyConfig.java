package com.ryuqq.milestone.core.protection;

import java.time.Duration;

/**
 * Retry Policy 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: TRANSIENT 실패 허용 횟수 (기본 5). THROTTLED는 횟수 제한 없음</li>
 *   <li>baseDelayMs / maxDelayMs: 지수 백오프 범위 (기본 1000ms / 300000ms)</li>
 *   <li>jitterFactor: 지연에 더하는 무작위 비율 (기본 0.2)</li>
 *   <li>throttleWait: 서버가 재시도 시각을 알려주지 않은 THROTTLED의 대기 시간 (기본 60초)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param maxAttempts 최대 시도 횟수 (1 이상)
 * @param baseDelayMs 기본 지연 (밀리초, 양수)
 * @param maxDelayMs 최대 지연 (밀리초, baseDelayMs 이상)
 * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
 * @param throttleWait 기본 THROTTLED 대기
 */
public record RetryPolicyConfig(
    int maxAttempts,
    long baseDelayMs,
    long maxDelayMs,
    double jitterFactor,
    Duration throttleWait
) {

    /**
     * 기본 설정 생성자.
     */
    public RetryPolicyConfig() {
        this(5, 1000, 300000, 0.2, Duration.ofSeconds(60));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryPolicyConfig {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive (current: " + maxAttempts + ")");
        }
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be positive (current: " + baseDelayMs + ")");
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")");
        }
        if (throttleWait == null || throttleWait.isNegative()) {
            throw new IllegalArgumentException("throttleWait must be non-negative");
        }
    }

    public RetryPolicyConfig withMaxAttempts(int maxAttempts) {
        return new RetryPolicyConfig(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor, throttleWait);
    }

    public RetryPolicyConfig withDelays(long baseDelayMs, long maxDelayMs) {
        return new RetryPolicyConfig(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor, throttleWait);
    }

    public RetryPolicyConfig withJitterFactor(double jitterFactor) {
        return new RetryPolicyConfig(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor, throttleWait);
    }
}
