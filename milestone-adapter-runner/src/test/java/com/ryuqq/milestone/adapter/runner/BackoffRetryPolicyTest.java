package com.ryuqq.milestone.adapter.runner;

import com.ryuqq.milestone.core.model.CredentialRole;
import com.ryuqq.milestone.core.model.RateSnapshot;
import com.ryuqq.milestone.core.outcome.AttemptOutcome;
import com.ryuqq.milestone.core.outcome.Fatal;
import com.ryuqq.milestone.core.outcome.FailureKind;
import com.ryuqq.milestone.core.outcome.Success;
import com.ryuqq.milestone.core.protection.RateLimiter;
import com.ryuqq.milestone.core.protection.RateLimiterConfig;
import com.ryuqq.milestone.core.protection.RemoteCall;
import com.ryuqq.milestone.core.protection.RetryPolicyConfig;
import com.ryuqq.milestone.core.spi.RemoteCallException;
import com.ryuqq.milestone.core.spi.RemoteResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * BackoffRetryPolicy 유닛 테스트.
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>모든 시도 전에 RateLimiter.reserve</li>
 *   <li>응답/오류의 예산 스냅샷을 RateLimiter에 반영</li>
 *   <li>THROTTLED는 재시도 횟수에 포함되지 않음</li>
 *   <li>TRANSIENT는 maxAttempts에서 RETRIES_EXHAUSTED</li>
 *   <li>Fatal 분류는 즉시 반환</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class BackoffRetryPolicyTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Mock
    private RateLimiter rateLimiter;

    private FakeTime time;
    private BackoffRetryPolicy policy;
    private RetryPolicyConfig config;

    @BeforeEach
    void setUp() {
        time = new FakeTime(T0);
        config = new RetryPolicyConfig().withMaxAttempts(3).withDelays(1000, 10000).withJitterFactor(0.0);
        policy = new BackoffRetryPolicy(rateLimiter, config, time, time);
    }

    /**
     * 순서대로 예외를 던지고, 다 던진 뒤에는 값을 반환하는 호출.
     */
    private static ScriptedCall script(RemoteCallException... failures) {
        return new ScriptedCall(List.of(failures));
    }

    private static final class ScriptedCall implements RemoteCall<String> {

        private final Deque<RemoteCallException> failures;
        private final AtomicInteger invocations = new AtomicInteger();
        private RateSnapshot snapshot;

        private ScriptedCall(List<RemoteCallException> failures) {
            this.failures = new ArrayDeque<>(failures);
        }

        private ScriptedCall withSnapshot(RateSnapshot snapshot) {
            this.snapshot = snapshot;
            return this;
        }

        @Override
        public RemoteResponse<String> invoke() {
            invocations.incrementAndGet();
            if (!failures.isEmpty()) {
                throw failures.poll();
            }
            return new RemoteResponse<>("ok", snapshot);
        }
    }

    // ============================================================
    // 성공
    // ============================================================

    @Test
    void execute_성공_reserve후_호출하고_스냅샷_반영() throws InterruptedException {
        // given
        RateSnapshot snapshot = new RateSnapshot(5000, 4999, T0.plusSeconds(3600));
        ScriptedCall call = script().withSnapshot(snapshot);

        // when
        AttemptOutcome<String> outcome = policy.execute(CredentialRole.PRIMARY, call);

        // then
        assertThat(outcome).isEqualTo(new Success<>("ok"));
        InOrder order = inOrder(rateLimiter);
        order.verify(rateLimiter).reserve(CredentialRole.PRIMARY);
        order.verify(rateLimiter).observe(CredentialRole.PRIMARY, snapshot);
        assertThat(time.sleeps()).isEmpty();
    }

    // ============================================================
    // THROTTLED
    // ============================================================

    @Test
    void execute_THROTTLED_반복_재시도횟수에_포함되지_않음() throws InterruptedException {
        // given
        RemoteCallException throttled = new RemoteCallException(429, null, "slow down", null, Duration.ofSeconds(30));
        ScriptedCall call = script(throttled, throttled, throttled, throttled, throttled);

        // when
        AttemptOutcome<String> outcome = policy.execute(CredentialRole.SECONDARY, call);

        // then
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(call.invocations.get()).isEqualTo(6);
        verify(rateLimiter, times(6)).reserve(CredentialRole.SECONDARY);
        verify(rateLimiter, times(5)).imposeCooldown(CredentialRole.SECONDARY, T0.plusSeconds(30));
    }

    @Test
    void execute_소진된_예산_cooldown_없이_스냅샷만_반영() throws InterruptedException {
        // given
        RateSnapshot exhausted = new RateSnapshot(5000, 0, T0.plusSeconds(600));
        ScriptedCall call = script(new RemoteCallException(403, "rate_limited", "limit exceeded", exhausted, null));

        // when
        AttemptOutcome<String> outcome = policy.execute(CredentialRole.PRIMARY, call);

        // then
        assertThat(outcome.isSuccess()).isTrue();
        verify(rateLimiter).observe(CredentialRole.PRIMARY, exhausted);
        verify(rateLimiter, never()).imposeCooldown(any(), any());
    }

    @Test
    void execute_소진된_스냅샷의_resetAt이_지났으면_기본_대기만큼_cooldown() throws InterruptedException {
        // given
        RateSnapshot stale = new RateSnapshot(5000, 0, T0.minusSeconds(1));
        ScriptedCall call = script(new RemoteCallException(403, "rate_limited", "limit exceeded", stale, null));

        // when
        AttemptOutcome<String> outcome = policy.execute(CredentialRole.PRIMARY, call);

        // then
        assertThat(outcome.isSuccess()).isTrue();
        verify(rateLimiter).observe(CredentialRole.PRIMARY, stale);
        verify(rateLimiter).imposeCooldown(CredentialRole.PRIMARY, T0.plus(config.throttleWait()));
    }

    @Test
    void execute_지난_resetAt_반복시_실제_RateLimiter가_매번_대기() throws InterruptedException {
        // given
        BudgetRateLimiter limiter = new BudgetRateLimiter(new RateLimiterConfig(), time, time);
        BackoffRetryPolicy realPolicy = new BackoffRetryPolicy(limiter, config, time, time);
        RateSnapshot stale = new RateSnapshot(5000, 0, T0.minusSeconds(1));
        RemoteCallException throttled = new RemoteCallException(403, "rate_limited", "limit exceeded", stale, null);
        ScriptedCall call = script(throttled, throttled, throttled);

        // when
        AttemptOutcome<String> outcome = realPolicy.execute(CredentialRole.PRIMARY, call);

        // then
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(call.invocations.get()).isEqualTo(4);
        assertThat(time.sleeps()).containsExactly(
            config.throttleWait(), config.throttleWait(), config.throttleWait());
        assertThat(time.instant()).isEqualTo(T0.plus(config.throttleWait().multipliedBy(3)));
    }

    // ============================================================
    // TRANSIENT
    // ============================================================

    @Test
    void execute_TRANSIENT_후_성공_백오프_대기() throws InterruptedException {
        // given
        ScriptedCall call = script(new RemoteCallException(503, "unavailable"), new RemoteCallException(502, "bad gateway"));

        // when
        AttemptOutcome<String> outcome = policy.execute(CredentialRole.PRIMARY, call);

        // then
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(time.sleeps()).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
    }

    @Test
    void execute_TRANSIENT_maxAttempts_도달시_RETRIES_EXHAUSTED() throws InterruptedException {
        // given
        RemoteCallException unavailable = new RemoteCallException(503, "unavailable");
        ScriptedCall call = script(unavailable, unavailable, unavailable, unavailable);

        // when
        AttemptOutcome<String> outcome = policy.execute(CredentialRole.PRIMARY, call);

        // then
        assertThat(outcome.failureKind()).isEqualTo(FailureKind.RETRIES_EXHAUSTED);
        assertThat(((Fatal<String>) outcome).message()).contains("gave up after 3 attempts");
        assertThat(call.invocations.get()).isEqualTo(3);
        assertThat(time.sleeps()).hasSize(2);
    }

    // ============================================================
    // Fatal
    // ============================================================

    @Test
    void execute_AUTH_즉시_반환() throws InterruptedException {
        // given
        ScriptedCall call = script(new RemoteCallException(401, "bad credentials"));

        // when
        AttemptOutcome<String> outcome = policy.execute(CredentialRole.PRIMARY, call);

        // then
        assertThat(outcome.failureKind()).isEqualTo(FailureKind.AUTH);
        assertThat(call.invocations.get()).isEqualTo(1);
        assertThat(time.sleeps()).isEmpty();
    }

    @Test
    void execute_RemoteCallException_아닌_예외는_전파() {
        // given
        RemoteCall<String> broken = () -> {
            throw new IllegalStateException("bug");
        };

        // when & then
        assertThatThrownBy(() -> policy.execute(CredentialRole.PRIMARY, broken))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("bug");
    }
}
