/**
 * 원격 호출 결과 타입.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.milestone.core.outcome;
