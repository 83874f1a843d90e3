package com.ryuqq.milestone.core.protection.noop;

import com.ryuqq.milestone.core.model.CredentialRole;
import com.ryuqq.milestone.core.model.RateBudget;
import com.ryuqq.milestone.core.model.RateSnapshot;
import com.ryuqq.milestone.core.protection.RateLimiter;

import java.time.Instant;

/**
 * Rate Limiter NoOp 구현.
 *
 * <p>모든 호출을 대기 없이 허용합니다. 예산 제한이 없는 시뮬레이션 테스트에서 사용합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>reserve(): 즉시 반환</li>
 *   <li>observe(), imposeCooldown(): 무시</li>
 *   <li>budget(): 무제한 예산 반환</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NoOpRateLimiter implements RateLimiter {

    @Override
    public void reserve(CredentialRole role) {
    }

    @Override
    public void observe(CredentialRole role, RateSnapshot snapshot) {
    }

    @Override
    public void imposeCooldown(CredentialRole role, Instant until) {
    }

    @Override
    public RateBudget budget(CredentialRole role) {
        return new RateBudget(role, Long.MAX_VALUE, Long.MAX_VALUE, null, 0, null);
    }
}
