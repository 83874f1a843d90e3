/**
 * 워크플로우 변형과 설정.
 *
 * <p>각 변형은 {@link com.ryuqq.milestone.core.workflow.Workflow}를 구현하며,
 * 진행 기록만 보고 다음 단계를 결정합니다.</p>
 */
package com.ryuqq.milestone.application.workflow;
