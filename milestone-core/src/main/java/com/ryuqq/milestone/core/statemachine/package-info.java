/**
 * 워크플로우 실행 상태와 전이 규칙.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.milestone.core.statemachine;
