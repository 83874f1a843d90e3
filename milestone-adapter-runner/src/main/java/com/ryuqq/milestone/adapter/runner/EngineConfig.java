package com.ryuqq.milestone.adapter.runner;

import com.ryuqq.milestone.core.protection.RateLimiterConfig;
import com.ryuqq.milestone.core.protection.RetryPolicyConfig;

import java.time.Duration;

/**
 * ConcurrentMilestoneEngine 설정.
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>concurrency: 워크플로우 스레드 수 (0 = 실행할 워크플로우 수)</li>
 *   <li>rateLimiter: 요청 예산 설정</li>
 *   <li>retry: 재시도 설정</li>
 *   <li>maxDuration: 전체 실행 제한 시간 (null = 제한 없음). 초과 시 cancel()</li>
 * </ul>
 *
 * @param concurrency 스레드 수 (0 이상)
 * @param rateLimiter 요청 예산 설정
 * @param retry 재시도 설정
 * @param maxDuration 실행 제한 시간 (null 허용)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record EngineConfig(
    int concurrency,
    RateLimiterConfig rateLimiter,
    RetryPolicyConfig retry,
    Duration maxDuration
) {

    /**
     * 기본 설정으로 생성.
     */
    public EngineConfig() {
        this(0, new RateLimiterConfig(), new RetryPolicyConfig(), null);
    }

    public EngineConfig {
        if (concurrency < 0) {
            throw new IllegalArgumentException("concurrency must be non-negative (current: " + concurrency + ")");
        }
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter cannot be null");
        }
        if (retry == null) {
            throw new IllegalArgumentException("retry cannot be null");
        }
        if (maxDuration != null && (maxDuration.isZero() || maxDuration.isNegative())) {
            throw new IllegalArgumentException("maxDuration must be positive (current: " + maxDuration + ")");
        }
    }

    public EngineConfig withConcurrency(int concurrency) {
        return new EngineConfig(concurrency, rateLimiter, retry, maxDuration);
    }

    public EngineConfig withRateLimiter(RateLimiterConfig rateLimiter) {
        return new EngineConfig(concurrency, rateLimiter, retry, maxDuration);
    }

    public EngineConfig withRetry(RetryPolicyConfig retry) {
        return new EngineConfig(concurrency, rateLimiter, retry, maxDuration);
    }

    public EngineConfig withMaxDuration(Duration maxDuration) {
        return new EngineConfig(concurrency, rateLimiter, retry, maxDuration);
    }
}
