package com.ryuqq.milestone.core.protection;

import java.time.Duration;

/**
 * Rate Limiter 설정.
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>buffer: 항상 남겨두는 요청 수 (기본 100)</li>
 *   <li>burstLimit: 60초 이동 윈도우당 최대 요청 수, 0이면 비활성 (기본 30)</li>
 *   <li>defaultLimit: 서버 보고 전 가정하는 윈도우당 요청 수 (기본 5000)</li>
 *   <li>defaultWindow: 초기화 시각을 모를 때 가정하는 윈도우 길이 (기본 1시간)</li>
 *   <li>resetMargin: 초기화 시각 이후 추가로 기다리는 시간 (기본 1초)</li>
 * </ul>
 *
 * @param buffer 안전 버퍼 (0 이상)
 * @param burstLimit 분당 버스트 한도 (0 이상)
 * @param defaultLimit 기본 윈도우 한도 (buffer 초과)
 * @param defaultWindow 기본 윈도우 길이
 * @param resetMargin 초기화 후 여유 시간
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RateLimiterConfig(
    long buffer,
    int burstLimit,
    long defaultLimit,
    Duration defaultWindow,
    Duration resetMargin
) {

    /**
     * 버스트 한도가 적용되는 이동 윈도우.
     */
    public static final Duration BURST_WINDOW = Duration.ofMinutes(1);

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: buffer=100, burstLimit=30, defaultLimit=5000, defaultWindow=1h, resetMargin=1s</p>
     */
    public RateLimiterConfig() {
        this(100, 30, 5000, Duration.ofHours(1), Duration.ofSeconds(1));
    }

    /**
     * 값을 검증하는 compact constructor.
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RateLimiterConfig {
        if (buffer < 0) {
            throw new IllegalArgumentException("buffer must be non-negative (current: " + buffer + ")");
        }
        if (burstLimit < 0) {
            throw new IllegalArgumentException("burstLimit must be non-negative (current: " + burstLimit + ")");
        }
        if (defaultLimit <= buffer) {
            throw new IllegalArgumentException(
                "defaultLimit must be greater than buffer (limit: " + defaultLimit + ", buffer: " + buffer + ")"
            );
        }
        if (defaultWindow == null || defaultWindow.isZero() || defaultWindow.isNegative()) {
            throw new IllegalArgumentException("defaultWindow must be positive");
        }
        if (resetMargin == null || resetMargin.isNegative()) {
            throw new IllegalArgumentException("resetMargin must be non-negative");
        }
    }

    public RateLimiterConfig withBuffer(long buffer) {
        return new RateLimiterConfig(buffer, burstLimit, defaultLimit, defaultWindow, resetMargin);
    }

    public RateLimiterConfig withBurstLimit(int burstLimit) {
        return new RateLimiterConfig(buffer, burstLimit, defaultLimit, defaultWindow, resetMargin);
    }

    public RateLimiterConfig withDefaultLimit(long defaultLimit) {
        return new RateLimiterConfig(buffer, burstLimit, defaultLimit, defaultWindow, resetMargin);
    }

    /**
     * 버스트 한도 사용 여부.
     *
     * @return burstLimit이 0보다 크면 true
     */
    public boolean burstEnabled() {
        return burstLimit > 0;
    }
}
