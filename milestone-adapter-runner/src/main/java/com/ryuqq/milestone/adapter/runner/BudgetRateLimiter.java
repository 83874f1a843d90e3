package com.ryuqq.milestone.adapter.runner;

import com.ryuqq.milestone.core.model.CredentialRole;
import com.ryuqq.milestone.core.model.RateBudget;
import com.ryuqq.milestone.core.model.RateSnapshot;
import com.ryuqq.milestone.core.protection.RateLimiter;
import com.ryuqq.milestone.core.protection.RateLimiterConfig;
import com.ryuqq.milestone.core.time.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;

/**
 * 자격 증명별 요청 예산을 관리하는 RateLimiter.
 *
 * <p><strong>reserve 판단 순서 (역할별 잠금 안에서):</strong></p>
 * <ol>
 *   <li>resetAt이 지났으면 remaining을 limit으로 복원</li>
 *   <li>쿨다운 중이면 cooldownUntil까지 대기</li>
 *   <li>remaining ≤ buffer면 resetAt + resetMargin까지 대기 (resetAt을 모르면 now + defaultWindow)</li>
 *   <li>최근 60초 예약 수가 burstLimit 이상이면 가장 오래된 예약이 창을 벗어날 때까지 대기</li>
 *   <li>통과: remaining 1 감소, 예약 시각 기록</li>
 * </ol>
 *
 * <p>대기는 잠금 밖에서 {@link Sleeper}로 수행하고, 깨어나면 처음부터 다시 판단합니다.
 * 역할마다 잠금이 따로 있으므로 서로 다른 자격 증명의 호출은 서로를 막지 않습니다.</p>
 *
 * <p><strong>Thread-safe</strong></p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class BudgetRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(BudgetRateLimiter.class);

    private final RateLimiterConfig config;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Map<CredentialRole, RoleBudget> budgets = new EnumMap<>(CredentialRole.class);

    public BudgetRateLimiter(RateLimiterConfig config, Clock clock, Sleeper sleeper) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.config = config;
        this.clock = clock;
        this.sleeper = sleeper;
        for (CredentialRole role : CredentialRole.values()) {
            budgets.put(role, new RoleBudget(config.defaultLimit()));
        }
    }

    @Override
    public void reserve(CredentialRole role) throws InterruptedException {
        RoleBudget budget = budgetFor(role);
        while (true) {
            Duration wait;
            String reason;
            synchronized (budget) {
                Instant now = clock.instant();
                budget.refresh(now);

                if (budget.cooldownUntil != null && now.isBefore(budget.cooldownUntil)) {
                    wait = Duration.between(now, budget.cooldownUntil);
                    reason = "cooldown";
                } else if (budget.remaining <= config.buffer()) {
                    if (budget.resetAt == null) {
                        budget.resetAt = now.plus(config.defaultWindow());
                    }
                    wait = Duration.between(now, budget.resetAt).plus(config.resetMargin());
                    reason = "budget " + budget.remaining + "/" + budget.limit + " at buffer " + config.buffer();
                } else if (config.burstEnabled() && budget.burstFull(now, config.burstLimit())) {
                    wait = Duration.between(now, budget.reservations.peekFirst().plus(RateLimiterConfig.BURST_WINDOW));
                    reason = "burst limit " + config.burstLimit() + " per " + RateLimiterConfig.BURST_WINDOW.toSeconds() + "s";
                } else {
                    budget.remaining--;
                    if (config.burstEnabled()) {
                        budget.reservations.addLast(now);
                    }
                    return;
                }
            }
            log.warn("Rate limiter waiting {}ms for {} ({})", wait.toMillis(), role, reason);
            sleeper.sleep(wait);
        }
    }

    @Override
    public void observe(CredentialRole role, RateSnapshot snapshot) {
        if (snapshot == null) {
            return;
        }
        RoleBudget budget = budgetFor(role);
        synchronized (budget) {
            budget.limit = snapshot.limit();
            budget.remaining = snapshot.remaining();
            budget.resetAt = snapshot.resetAt();
        }
        log.debug("Observed budget for {}: {}/{} until {}", role, snapshot.remaining(), snapshot.limit(), snapshot.resetAt());
    }

    @Override
    public void imposeCooldown(CredentialRole role, Instant until) {
        if (until == null) {
            throw new IllegalArgumentException("until cannot be null");
        }
        RoleBudget budget = budgetFor(role);
        synchronized (budget) {
            if (budget.cooldownUntil == null || until.isAfter(budget.cooldownUntil)) {
                budget.cooldownUntil = until;
            }
        }
        log.warn("Cooldown imposed on {} until {}", role, until);
    }

    @Override
    public RateBudget budget(CredentialRole role) {
        RoleBudget budget = budgetFor(role);
        synchronized (budget) {
            budget.refresh(clock.instant());
            return new RateBudget(role, budget.limit, budget.remaining, budget.resetAt, config.buffer(), budget.cooldownUntil);
        }
    }

    private RoleBudget budgetFor(CredentialRole role) {
        if (role == null) {
            throw new IllegalArgumentException("role cannot be null");
        }
        return budgets.get(role);
    }

    /**
     * 역할별 가변 상태. 항상 자기 자신을 잠금으로 사용.
     */
    private static final class RoleBudget {

        private long limit;
        private long remaining;
        private Instant resetAt;
        private Instant cooldownUntil;
        private final Deque<Instant> reservations = new ArrayDeque<>();

        private RoleBudget(long limit) {
            this.limit = limit;
            this.remaining = limit;
        }

        private void refresh(Instant now) {
            if (resetAt != null && !now.isBefore(resetAt)) {
                remaining = limit;
                resetAt = null;
            }
            if (cooldownUntil != null && !now.isBefore(cooldownUntil)) {
                cooldownUntil = null;
            }
        }

        private boolean burstFull(Instant now, int burstLimit) {
            Instant windowStart = now.minus(RateLimiterConfig.BURST_WINDOW);
            while (!reservations.isEmpty() && !reservations.peekFirst().isAfter(windowStart)) {
                reservations.pollFirst();
            }
            return reservations.size() >= burstLimit;
        }
    }
}
