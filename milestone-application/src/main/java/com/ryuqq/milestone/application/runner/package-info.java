/**
 * WorkflowRunner 포트.
 *
 * <p>구현체는 milestone-adapter-runner 모듈에 있습니다.</p>
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.milestone.application.runner.WorkflowRunner} - 워크플로우 하나의 구동</li>
 *   <li>{@link com.ryuqq.milestone.application.runner.WorkflowReport} - 종료 보고</li>
 *   <li>{@link com.ryuqq.milestone.application.runner.WorkflowListener} - 전이 관찰</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.milestone.application.runner;
