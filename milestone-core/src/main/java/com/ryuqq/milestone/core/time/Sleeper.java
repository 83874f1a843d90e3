package com.ryuqq.milestone.core.time;

import java.time.Duration;

/**
 * 대기 추상화.
 *
 * <p>모든 대기(예산 대기, 백오프, 단계 간격)는 이 인터페이스를 거칩니다.
 * 테스트는 시계를 앞당기는 구현으로 교체합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * 지정 시간 동안 대기.
     *
     * @param duration 대기 시간 (0 이하이면 즉시 반환)
     * @throws InterruptedException 대기 중 인터럽트 발생
     */
    void sleep(Duration duration) throws InterruptedException;

    /**
     * {@link Thread#sleep(long)} 기반 구현.
     *
     * @return 실제 대기하는 Sleeper
     */
    static Sleeper system() {
        return duration -> {
            if (duration.isNegative() || duration.isZero()) {
                return;
            }
            Thread.sleep(duration.toMillis());
        };
    }
}
