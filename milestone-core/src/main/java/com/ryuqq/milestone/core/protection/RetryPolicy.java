package com.ryuqq.milestone.core.protection;

import com.ryuqq.milestone.core.model.CredentialRole;
import com.ryuqq.milestone.core.outcome.AttemptOutcome;

/**
 * 원격 호출 한 건을 재시도/백오프로 감싸는 정책.
 *
 * <p><strong>분류별 처리:</strong></p>
 * <ul>
 *   <li>THROTTLED: RateLimiter에 보고된 초기화 시각을 넘기고 재시도, 횟수 제한 없음</li>
 *   <li>TRANSIENT: 지수 백오프 + Jitter로 maxAttempts까지 재시도, 소진 시 RETRIES_EXHAUSTED</li>
 *   <li>그 외: 즉시 Fatal 반환</li>
 * </ul>
 *
 * <p>재시도를 포함한 모든 시도는 {@link RateLimiter#reserve(CredentialRole)}를 먼저 통과합니다.
 * 반환값은 {@link com.ryuqq.milestone.core.outcome.Success} 또는
 * {@link com.ryuqq.milestone.core.outcome.Fatal}입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface RetryPolicy {

    /**
     * 원격 호출 실행.
     *
     * @param role 호출할 자격 증명
     * @param call 원격 호출
     * @param <T> 응답 값 타입
     * @return Success 또는 Fatal
     * @throws InterruptedException 대기 중 인터럽트 발생 (취소)
     */
    <T> AttemptOutcome<T> execute(CredentialRole role, RemoteCall<T> call) throws InterruptedException;
}
