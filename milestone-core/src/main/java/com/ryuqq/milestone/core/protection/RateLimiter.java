package com.ryuqq.milestone.core.protection;

import com.ryuqq.milestone.core.model.CredentialRole;
import com.ryuqq.milestone.core.model.RateBudget;
import com.ryuqq.milestone.core.model.RateSnapshot;

import java.time.Instant;

/**
 * 자격 증명별 요청 예산 관리 SPI.
 *
 * <p>모든 원격 호출(재시도 포함)은 발행 전에 {@link #reserve(CredentialRole)}를 통과해야 합니다.
 * 동시성 제어와 백프레셔가 적용되는 유일한 지점입니다.</p>
 *
 * <p><strong>보장:</strong></p>
 * <ul>
 *   <li>remaining이 버퍼 이하이면 호출을 허용하지 않음 (초기화 시각까지 대기)</li>
 *   <li>서버가 보고한 예산이 로컬 예측보다 우선</li>
 *   <li>자격 증명별 예산이 독립적이라 서로 다른 자격 증명의 호출은 서로를 막지 않음</li>
 *   <li>남용 감지 신호는 카운터와 별개의 강제 대기로 처리</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * limiter.reserve(CredentialRole.PRIMARY);
 * RemoteResponse<RemoteArtifact> response = client.createIssue(...);
 * if (response.rateSnapshot() != null) {
 *     limiter.observe(CredentialRole.PRIMARY, response.rateSnapshot());
 * }
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface RateLimiter {

    /**
     * 호출 한 건을 발행해도 되는 시점까지 대기한 뒤 예산을 예약합니다.
     *
     * @param role 호출할 자격 증명
     * @throws InterruptedException 대기 중 인터럽트 발생 (취소)
     */
    void reserve(CredentialRole role) throws InterruptedException;

    /**
     * 서버가 보고한 예산으로 로컬 예측을 교정합니다.
     *
     * @param role 자격 증명
     * @param snapshot 서버 보고 값
     */
    void observe(CredentialRole role, RateSnapshot snapshot);

    /**
     * 지정 시각까지 해당 자격 증명의 호출을 막습니다.
     *
     * <p>이미 더 늦은 강제 대기가 설정되어 있으면 유지합니다.</p>
     *
     * @param role 자격 증명
     * @param until 강제 대기 종료 시각
     */
    void imposeCooldown(CredentialRole role, Instant until);

    /**
     * 현재 예산 조회.
     *
     * @param role 자격 증명
     * @return 예산 스냅샷
     */
    RateBudget budget(CredentialRole role);
}
