/**
 * 워크플로우 상태 머신 계약.
 *
 * <p>{@link com.ryuqq.milestone.core.workflow.Workflow}는 진행 기록을 보고 다음 단계를 결정하고,
 * WorkflowRunner가 단계를 실행하고 효과를 커밋합니다.</p>
 *
 * <pre>
 * nextStep(progress)
 *   ├─ Step    → action.execute(context) → Advanced / Blocked / Failed
 *   ├─ Done    → 완료
 *   └─ Blocked → 대기
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.milestone.core.workflow;
