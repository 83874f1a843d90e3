package com.ryuqq.milestone.adapter.runner;

import com.ryuqq.milestone.core.model.CredentialRole;
import com.ryuqq.milestone.core.model.RateBudget;
import com.ryuqq.milestone.core.model.RateSnapshot;
import com.ryuqq.milestone.core.protection.RateLimiterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BudgetRateLimiter 유닛 테스트.
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>버퍼까지만 예산 사용, 이후 재설정 시각까지 대기</li>
 *   <li>cooldown 대기</li>
 *   <li>1분 버스트 한도</li>
 *   <li>역할별 예산 분리</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class BudgetRateLimiterTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private FakeTime time;

    @BeforeEach
    void setUp() {
        time = new FakeTime(T0);
    }

    private BudgetRateLimiter limiter(RateLimiterConfig config) {
        return new BudgetRateLimiter(config, time, time);
    }

    // ============================================================
    // 예산과 버퍼
    // ============================================================

    @Test
    void reserve_버퍼_위에서는_대기없이_차감() throws InterruptedException {
        // given
        BudgetRateLimiter limiter = limiter(new RateLimiterConfig().withBuffer(5).withBurstLimit(0));
        limiter.observe(CredentialRole.PRIMARY, new RateSnapshot(100, 10, T0.plusSeconds(600)));

        // when
        for (int i = 0; i < 5; i++) {
            limiter.reserve(CredentialRole.PRIMARY);
        }

        // then
        assertThat(time.sleeps()).isEmpty();
        assertThat(limiter.budget(CredentialRole.PRIMARY).remaining()).isEqualTo(5);
        assertThat(limiter.budget(CredentialRole.PRIMARY).usable()).isZero();
    }

    @Test
    void reserve_버퍼_도달시_재설정시각과_여유시간까지_대기() throws InterruptedException {
        // given
        BudgetRateLimiter limiter = limiter(new RateLimiterConfig().withBuffer(5).withBurstLimit(0));
        limiter.observe(CredentialRole.PRIMARY, new RateSnapshot(100, 5, T0.plusSeconds(600)));

        // when
        limiter.reserve(CredentialRole.PRIMARY);

        // then
        assertThat(time.sleeps()).containsExactly(Duration.ofSeconds(601));
        RateBudget budget = limiter.budget(CredentialRole.PRIMARY);
        assertThat(budget.remaining()).isEqualTo(99);
        assertThat(budget.resetAt()).isNull();
    }

    @Test
    void reserve_재설정시각_모르면_기본_윈도우_사용() throws InterruptedException {
        // given: 관측 없이 기본 한도 12, 버퍼 10
        RateLimiterConfig config = new RateLimiterConfig(10, 0, 12, Duration.ofMinutes(10), Duration.ZERO);
        BudgetRateLimiter limiter = limiter(config);

        // when
        limiter.reserve(CredentialRole.SECONDARY);
        limiter.reserve(CredentialRole.SECONDARY);
        limiter.reserve(CredentialRole.SECONDARY);

        // then
        assertThat(time.sleeps()).containsExactly(Duration.ofMinutes(10));
        assertThat(limiter.budget(CredentialRole.SECONDARY).remaining()).isEqualTo(11);
    }

    @Test
    void observe_역할별_예산_분리() throws InterruptedException {
        // given
        BudgetRateLimiter limiter = limiter(new RateLimiterConfig().withBuffer(5).withBurstLimit(0));
        limiter.observe(CredentialRole.PRIMARY, new RateSnapshot(100, 5, T0.plusSeconds(600)));

        // when
        limiter.reserve(CredentialRole.SECONDARY);

        // then
        assertThat(time.sleeps()).isEmpty();
        assertThat(limiter.budget(CredentialRole.PRIMARY).remaining()).isEqualTo(5);
    }

    @Test
    void observe_null_스냅샷_무시() {
        // given
        BudgetRateLimiter limiter = limiter(new RateLimiterConfig());

        // when
        limiter.observe(CredentialRole.PRIMARY, null);

        // then
        assertThat(limiter.budget(CredentialRole.PRIMARY).remaining()).isEqualTo(5000);
    }

    // ============================================================
    // Cooldown
    // ============================================================

    @Test
    void reserve_cooldown_중이면_끝날때까지_대기() throws InterruptedException {
        // given
        BudgetRateLimiter limiter = limiter(new RateLimiterConfig().withBurstLimit(0));
        limiter.imposeCooldown(CredentialRole.PRIMARY, T0.plusSeconds(45));

        // when
        limiter.reserve(CredentialRole.PRIMARY);

        // then
        assertThat(time.sleeps()).containsExactly(Duration.ofSeconds(45));
        assertThat(limiter.budget(CredentialRole.PRIMARY).cooldownUntil()).isNull();
    }

    @Test
    void imposeCooldown_더_늦은_시각만_반영() {
        // given
        BudgetRateLimiter limiter = limiter(new RateLimiterConfig());
        limiter.imposeCooldown(CredentialRole.PRIMARY, T0.plusSeconds(90));

        // when
        limiter.imposeCooldown(CredentialRole.PRIMARY, T0.plusSeconds(30));

        // then
        assertThat(limiter.budget(CredentialRole.PRIMARY).cooldownUntil()).isEqualTo(T0.plusSeconds(90));
    }

    @Test
    void imposeCooldown_null_예외() {
        BudgetRateLimiter limiter = limiter(new RateLimiterConfig());

        assertThatThrownBy(() -> limiter.imposeCooldown(CredentialRole.PRIMARY, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ============================================================
    // 버스트
    // ============================================================

    @Test
    void reserve_버스트_한도_초과시_윈도우_끝까지_대기() throws InterruptedException {
        // given
        BudgetRateLimiter limiter = limiter(new RateLimiterConfig().withBurstLimit(3));

        // when
        for (int i = 0; i < 4; i++) {
            limiter.reserve(CredentialRole.PRIMARY);
        }

        // then
        assertThat(time.sleeps()).containsExactly(RateLimiterConfig.BURST_WINDOW);
        assertThat(limiter.budget(CredentialRole.PRIMARY).remaining()).isEqualTo(4996);
    }

    @Test
    void reserve_인터럽트시_InterruptedException() {
        // given
        BudgetRateLimiter limiter = limiter(new RateLimiterConfig().withBuffer(5).withBurstLimit(0));
        limiter.observe(CredentialRole.PRIMARY, new RateSnapshot(100, 5, T0.plusSeconds(600)));
        Thread.currentThread().interrupt();

        // when & then
        try {
            assertThatThrownBy(() -> limiter.reserve(CredentialRole.PRIMARY))
                .isInstanceOf(InterruptedException.class);
        } finally {
            Thread.interrupted();
        }
    }
}
