package com.ryuqq.milestone.application.engine;

/**
 * 선택된 워크플로우를 모두 실행하는 최상위 Port.
 *
 * <p><strong>실행 순서:</strong></p>
 * <ol>
 *   <li>자격 증명별 요청 예산을 서버 값으로 초기화</li>
 *   <li>저장소 준비 워크플로우 실행</li>
 *   <li>선택된 워크플로우를 서로 독립적으로 실행</li>
 * </ol>
 *
 * <p>한 워크플로우의 실패는 다른 워크플로우에 영향을 주지 않습니다.
 * 비활성화된 워크플로우는 DISABLED로 보고됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface MilestoneEngine {

    /**
     * 요청된 워크플로우 실행 (블로킹).
     *
     * @param request 실행 요청
     * @return 워크플로우별 결과
     */
    EngineReport run(EngineRequest request);

    /**
     * 진행 중인 실행 취소.
     *
     * <p>실행 중인 단계는 커밋까지 마친 뒤 CANCELLED로 종료됩니다.</p>
     */
    void cancel();
}
