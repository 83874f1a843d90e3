/**
 * Protection SPI 패키지.
 *
 * <p>원격 호출을 감싸는 두 가지 보호 장치를 정의합니다.</p>
 *
 * <h2>적용 순서</h2>
 * <pre>
 * 1. RetryPolicy    → 시도 반복, 실패 분류
 * 2. RateLimiter    → 시도마다 예산 예약 (필요 시 대기)
 * 3. RemoteClient   → 실제 호출
 * </pre>
 *
 * <h2>NoOp 구현</h2>
 * <p>{@code noop} 하위 패키지의 {@link com.ryuqq.milestone.core.protection.noop.NoOpRateLimiter}는
 * 예산 제한 없이 실행할 때 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.milestone.core.protection;
