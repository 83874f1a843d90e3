package com.ryuqq.milestone.core.statemachine;

/**
 * 한 번의 실행 안에서 워크플로우의 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING
 *    │
 *    ├─► DISABLED (설정에서 비활성)
 *    ├─► STOPPED_RESUMABLE (저장소 준비 실패)
 *    ├─► CANCELLED
 *    │
 *    ▼ (시작)
 * RUNNING
 *    │
 *    ├─► COMPLETED
 *    ├─► BLOCKED (외부 전제 조건 대기)
 *    ├─► STOPPED_RESUMABLE (인증, 전제 조건, 검증, 재시도 소진)
 *    ├─► STOPPED_UNACHIEVABLE (마감 초과)
 *    └─► CANCELLED
 *
 * 종료 상태에서는 어떤 전이도 불가
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum WorkflowStatus {

    PENDING,

    RUNNING,

    /**
     * 목표 도달.
     */
    COMPLETED,

    /**
     * 외부 전제 조건 대기. 오류 아님.
     */
    BLOCKED,

    /**
     * 환경 문제로 중단. 다시 실행하면 이어서 진행.
     */
    STOPPED_RESUMABLE,

    /**
     * 구조적 실패로 중단. 이번 실행에서는 달성 불가.
     */
    STOPPED_UNACHIEVABLE,

    /**
     * 취소 신호 또는 실행 마감으로 중단.
     */
    CANCELLED,

    /**
     * 설정에서 비활성화되어 실행하지 않음.
     */
    DISABLED;

    /**
     * 종료 상태인지 확인.
     *
     * @return PENDING, RUNNING이 아니면 true
     */
    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }

    /**
     * 운영자 개입 없이 끝난 정상 종료인지 확인.
     *
     * @return COMPLETED, BLOCKED, DISABLED이면 true
     */
    public boolean isSuccessful() {
        return this == COMPLETED || this == BLOCKED || this == DISABLED;
    }
}
