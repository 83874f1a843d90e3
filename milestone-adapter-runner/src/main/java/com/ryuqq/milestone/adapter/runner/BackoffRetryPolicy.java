package com.ryuqq.milestone.adapter.runner;

import com.ryuqq.milestone.core.model.CredentialRole;
import com.ryuqq.milestone.core.outcome.AttemptOutcome;
import com.ryuqq.milestone.core.outcome.Fatal;
import com.ryuqq.milestone.core.outcome.FailureKind;
import com.ryuqq.milestone.core.outcome.Retryable;
import com.ryuqq.milestone.core.outcome.Success;
import com.ryuqq.milestone.core.protection.RateLimiter;
import com.ryuqq.milestone.core.protection.RemoteCall;
import com.ryuqq.milestone.core.protection.RetryPolicy;
import com.ryuqq.milestone.core.protection.RetryPolicyConfig;
import com.ryuqq.milestone.core.spi.RemoteCallException;
import com.ryuqq.milestone.core.spi.RemoteResponse;
import com.ryuqq.milestone.core.time.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 분류 기반 재시도 정책.
 *
 * <p><strong>처리 흐름 (시도마다):</strong></p>
 * <pre>
 * rateLimiter.reserve(role)
 *   ↓
 * call.invoke()
 *   ├─ 성공 → 스냅샷 observe → Success
 *   └─ RemoteCallException → 스냅샷 observe → classify
 *        ├─ THROTTLED → (쿨다운이거나 resetAt이 이미 지났으면 imposeCooldown) → 다시 reserve (횟수 제한 없음)
 *        ├─ TRANSIENT → backoff 대기 → 재시도 (maxAttempts 도달 시 RETRIES_EXHAUSTED)
 *        └─ Fatal     → 즉시 반환
 * </pre>
 *
 * <p>원격 실패로 예외를 던지지 않습니다. 대기 중 인터럽트만 InterruptedException으로 전파합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class BackoffRetryPolicy implements RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(BackoffRetryPolicy.class);

    private final RateLimiter rateLimiter;
    private final RetryPolicyConfig config;
    private final BackoffCalculator backoffCalculator;
    private final RemoteErrorClassifier classifier;
    private final Clock clock;
    private final Sleeper sleeper;

    /**
     * 생성자 (config의 지연 설정으로 BackoffCalculator 생성).
     *
     * @param rateLimiter 요청 예산 관리자
     * @param config 재시도 설정
     * @param clock 시계
     * @param sleeper 대기 수단
     */
    public BackoffRetryPolicy(RateLimiter rateLimiter, RetryPolicyConfig config, Clock clock, Sleeper sleeper) {
        this(rateLimiter, config, new BackoffCalculator(config), clock, sleeper);
    }

    /**
     * 생성자 (커스텀 BackoffCalculator 주입).
     *
     * @param rateLimiter 요청 예산 관리자
     * @param config 재시도 설정
     * @param backoffCalculator 백오프 계산기
     * @param clock 시계
     * @param sleeper 대기 수단
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public BackoffRetryPolicy(RateLimiter rateLimiter, RetryPolicyConfig config, BackoffCalculator backoffCalculator,
                              Clock clock, Sleeper sleeper) {
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.rateLimiter = rateLimiter;
        this.config = config;
        this.backoffCalculator = backoffCalculator;
        this.classifier = new RemoteErrorClassifier(config.throttleWait());
        this.clock = clock;
        this.sleeper = sleeper;
    }

    @Override
    public <T> AttemptOutcome<T> execute(CredentialRole role, RemoteCall<T> call) throws InterruptedException {
        if (role == null) {
            throw new IllegalArgumentException("role cannot be null");
        }
        if (call == null) {
            throw new IllegalArgumentException("call cannot be null");
        }

        int transientFailures = 0;
        while (true) {
            rateLimiter.reserve(role);
            try {
                RemoteResponse<T> response = call.invoke();
                if (response.rateSnapshot() != null) {
                    rateLimiter.observe(role, response.rateSnapshot());
                }
                return new Success<>(response.value());
            } catch (RemoteCallException e) {
                if (e.getRateSnapshot() != null) {
                    rateLimiter.observe(role, e.getRateSnapshot());
                }
                Instant now = clock.instant();
                AttemptOutcome<T> outcome = classifier.classify(e, now);

                if (!(outcome instanceof Retryable<T> retryable)) {
                    log.warn("Remote call failed for {}: {} ({})", role, outcome.failureKind(), e.getMessage());
                    return outcome;
                }

                if (retryable.kind() == FailureKind.THROTTLED) {
                    if (classifier.isCooldown(e, now)) {
                        rateLimiter.imposeCooldown(role, retryable.retryAt());
                    }
                    log.warn("Throttled on {} (status {}), retry after {}", role, e.getStatus(), retryable.retryAt());
                    continue;
                }

                transientFailures++;
                if (transientFailures >= config.maxAttempts()) {
                    log.error("Giving up on {} after {} transient failures: {}", role, transientFailures, e.getMessage());
                    return new Fatal<>(FailureKind.RETRIES_EXHAUSTED, FailureKind.RETRIES_EXHAUSTED.name(),
                        "gave up after " + transientFailures + " attempts: " + retryable.message());
                }
                Duration delay = backoffCalculator.calculate(transientFailures);
                log.warn("Transient failure on {} (attempt {}/{}), retrying in {}ms: {}",
                    role, transientFailures, config.maxAttempts(), delay.toMillis(), e.getMessage());
                sleeper.sleep(delay);
            }
        }
    }
}
