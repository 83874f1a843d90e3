/**
 * 엔진이 다루는 값 객체.
 *
 * <p>자격 증명, 요청 예산, 진행 기록, 단계 식별자를 포함합니다. 모두 불변입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.milestone.core.model;
