package com.ryuqq.milestone.application.runner;

import com.ryuqq.milestone.core.workflow.Workflow;

/**
 * 워크플로우 하나를 끝까지 구동하는 드라이버.
 *
 * <p><strong>Runner 루프:</strong></p>
 * <pre>
 * loop:
 *   1. ProgressStore.load(name)
 *   2. workflow.nextStep(progress)
 *      - Done    → completed 커밋 후 COMPLETED 보고
 *      - Blocked → BLOCKED 보고 (오류 아님)
 *      - Step    → action 실행 (모든 원격 호출은 RateLimiter → RetryPolicy 경유)
 *   3. Step 결과
 *      - Advanced → counter 증가, 새 임계값, lastStepId를 한 번에 커밋 → 간격 대기 → loop
 *      - Blocked  → BLOCKED 보고
 *      - Failed   → STOPPED_RESUMABLE 또는 STOPPED_UNACHIEVABLE 보고, 커밋된 진행은 유지
 * </pre>
 *
 * <p><strong>취소:</strong> 인터럽트 시 CANCELLED로 보고합니다. 원격 호출 성공부터 커밋 반환까지는
 * 인터럽트되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface WorkflowRunner {

    /**
     * 워크플로우 실행.
     *
     * @param workflow 워크플로우
     * @return 종료 보고 (원격 실패는 예외가 아닌 보고로 반환)
     */
    WorkflowReport run(Workflow workflow);
}
