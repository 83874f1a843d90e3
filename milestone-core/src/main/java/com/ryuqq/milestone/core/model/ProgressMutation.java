package com.ryuqq.milestone.core.model;

/**
 * 진행 기록에 적용할 변경.
 *
 * <p>{@code ProgressStore.commit}이 현재 기록을 넘기고, 반환값을 원자적으로 저장합니다.
 * 구현은 부작용이 없어야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProgressMutation {

    /**
     * 변경 적용.
     *
     * @param current 현재 기록 (처음이면 초기 기록)
     * @return 새 기록
     */
    ProgressRecord apply(ProgressRecord current);
}
