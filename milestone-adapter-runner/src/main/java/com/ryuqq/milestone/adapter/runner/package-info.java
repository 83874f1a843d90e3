/**
 * 엔진 실행 어댑터.
 *
 * <p>RateLimiter, RetryPolicy, WorkflowRunner, MilestoneEngine의 기본 구현체를 제공합니다.</p>
 *
 * <p><strong>구성:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.milestone.adapter.runner.BudgetRateLimiter}: 자격 증명별 요청 예산</li>
 *   <li>{@link com.ryuqq.milestone.adapter.runner.BackoffRetryPolicy}: 분류 기반 재시도</li>
 *   <li>{@link com.ryuqq.milestone.adapter.runner.DefaultWorkflowRunner}: 단계 실행/커밋 루프</li>
 *   <li>{@link com.ryuqq.milestone.adapter.runner.ConcurrentMilestoneEngine}: 워크플로우 병렬 실행</li>
 * </ul>
 */
package com.ryuqq.milestone.adapter.runner;
