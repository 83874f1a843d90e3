package com.ryuqq.milestone.core.outcome;

/**
 * 원격 호출 실패 분류.
 *
 * <p><strong>전파 정책:</strong></p>
 * <ul>
 *   <li>THROTTLED, TRANSIENT: RetryPolicy/RateLimiter 내부에서 흡수, 워크플로우까지 전파되지 않음</li>
 *   <li>그 외: 해당 워크플로우만 중단, 이미 커밋된 진행 기록은 유지</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum FailureKind {

    /**
     * 요청 예산 소진 또는 남용 감지 신호. 초기화 시각까지 대기 후 횟수 제한 없이 재시도.
     */
    THROTTLED,

    /**
     * 네트워크, 타임아웃, 5xx. 지수 백오프로 제한 횟수까지 재시도.
     */
    TRANSIENT,

    /**
     * 인증/권한 실패.
     */
    AUTH,

    /**
     * 요청 검증 실패 (그 외 모든 4xx).
     */
    VALIDATION,

    /**
     * 필요한 전제 조건 부재 (리소스 없음, 협업자 관계 없음 등).
     */
    PRECONDITION,

    /**
     * 시간 제한 워크플로우가 마감을 놓침.
     */
    DEADLINE,

    /**
     * TRANSIENT 재시도 횟수 소진.
     */
    RETRIES_EXHAUSTED;

    /**
     * RetryPolicy가 재시도하는 분류인지 확인.
     *
     * @return THROTTLED 또는 TRANSIENT이면 true
     */
    public boolean isRetryable() {
        return this == THROTTLED || this == TRANSIENT;
    }

    /**
     * 환경 문제라서 다시 실행하면 진행될 수 있는지 확인.
     *
     * <p>DEADLINE은 이번 실행에서 달성 불가한 구조적 실패로 취급합니다.</p>
     *
     * @return DEADLINE이 아니면 true
     */
    public boolean isResumable() {
        return this != DEADLINE;
    }
}
