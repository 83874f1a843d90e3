package com.ryuqq.milestone.core.workflow;

import com.ryuqq.milestone.core.model.ProgressRecord;
import com.ryuqq.milestone.core.model.WorkflowName;

import java.util.List;

/**
 * 마일스톤 하나를 추구하는 상태 머신.
 *
 * <p>WorkflowRunner는 이 계약만으로 모든 변형을 구동합니다. {@link #nextStep(ProgressRecord)}는
 * 같은 진행 기록에 대해 항상 같은 단계를 반환해야 하며, 그래서 재개가 자동으로 이뤄집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Workflow {

    /**
     * 워크플로우 이름 (진행 기록 키).
     *
     * @return 이름
     */
    WorkflowName name();

    /**
     * 마일스톤 임계값 (오름차순).
     *
     * @return 임계값 목록, 임계값이 없는 일회성 워크플로우는 {@code [1]}
     */
    List<Long> thresholds();

    /**
     * 다음에 할 일 결정.
     *
     * @param progress 마지막으로 커밋된 기록
     * @return Step, Done, Blocked 중 하나
     */
    NextStep nextStep(ProgressRecord progress);
}
