package com.ryuqq.milestone.adapter.runner;

import com.ryuqq.milestone.core.protection.RetryPolicyConfig;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>일시적 실패(TRANSIENT)의 재시도 간격을 지수적으로 늘리고, 두 자격 증명의 재시도가
 * 같은 순간에 몰리지 않도록 Jitter를 더합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(baseDelay * 2^(attempt-1) + jitter, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=1000ms, jitterFactor=0.2):</strong></p>
 * <ul>
 *   <li>attempt=1: 1000-1200ms</li>
 *   <li>attempt=2: 2000-2400ms</li>
 *   <li>attempt=3: 4000-4800ms</li>
 *   <li>attempt=10: maxDelay=300000ms로 제한</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final RetryPolicyConfig config;
    private final DoubleSupplier random;

    public BackoffCalculator(RetryPolicyConfig config) {
        this(config, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 난수 공급자를 지정하여 생성.
     *
     * @param config 지연 범위와 Jitter 비율 (RetryPolicyConfig에서 이미 검증됨)
     * @param random [0, 1) 난수 공급자 (테스트에서 고정 가능)
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public BackoffCalculator(RetryPolicyConfig config, DoubleSupplier random) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.config = config;
        this.random = random;
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param attempt 실패한 시도 횟수 (1부터 시작)
     * @return 재시도 전 대기 시간
     * @throws IllegalArgumentException attempt가 양수가 아닌 경우
     */
    public Duration calculate(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
        long base = config.baseDelayMs();
        long max = config.maxDelayMs();

        // 2^62 이상은 어차피 max
        long multiplier = 1L << Math.min(attempt - 1, 62);
        long exponential = base > max / multiplier ? max : base * multiplier;
        long jitter = (long) (exponential * config.jitterFactor() * random.getAsDouble());

        return Duration.ofMillis(Math.min(exponential + jitter, max));
    }
}
