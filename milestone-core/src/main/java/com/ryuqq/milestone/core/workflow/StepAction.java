package com.ryuqq.milestone.core.workflow;

/**
 * 단계의 동작.
 *
 * <p>원격 호출은 반드시 {@link StepContext#call}을 통해야 합니다. 여러 호출로 구성된 단계는
 * 각 호출 결과를 {@link StepContext#checkpoint}로 남기고, 재개 시 이미 남긴 호출을 건너뜁니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StepAction {

    /**
     * 단계 실행.
     *
     * @param context 실행 컨텍스트
     * @return 단계 결과
     * @throws InterruptedException 취소된 경우
     */
    StepOutcome execute(StepContext context) throws InterruptedException;
}
