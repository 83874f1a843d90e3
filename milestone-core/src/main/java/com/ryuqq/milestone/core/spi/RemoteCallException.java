package com.ryuqq.milestone.core.spi;

import com.ryuqq.milestone.core.model.RateSnapshot;

import java.time.Duration;

/**
 * {@link RemoteClient} 구현체가 호출 실패 시 던지는 예외.
 *
 * <p>재시도 정책이 실패를 분류하는 데 필요한 정보를 담습니다:</p>
 * <ul>
 *   <li>{@code status}: HTTP 상태 코드. 네트워크 실패나 타임아웃이면 {@link #NO_RESPONSE}</li>
 *   <li>{@code errorCode}: 서버가 보고한 오류 코드 (nullable)</li>
 *   <li>{@code rateSnapshot}: 보고된 경우 남은 할당량과 초기화 시각</li>
 *   <li>{@code retryAfter}: 2차 제한에서 서버가 요청한 대기 시간 (nullable)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RemoteCallException extends RuntimeException {

    /**
     * 응답을 받지 못했을 때의 상태 값.
     */
    public static final int NO_RESPONSE = 0;

    private final int status;
    private final String errorCode;
    private final transient RateSnapshot rateSnapshot;
    private final Duration retryAfter;

    public RemoteCallException(int status, String errorCode, String message,
                               RateSnapshot rateSnapshot, Duration retryAfter) {
        super(message);
        if (status < 0) {
            throw new IllegalArgumentException("status must be non-negative (current: " + status + ")");
        }
        this.status = status;
        this.errorCode = errorCode;
        this.rateSnapshot = rateSnapshot;
        this.retryAfter = retryAfter;
    }

    public RemoteCallException(int status, String message) {
        this(status, null, message, null, null);
    }

    /**
     * 응답을 받지 못한 호출의 예외를 만듭니다.
     *
     * @param message 실패 설명
     * @param cause 원인 I/O 실패
     * @return 네트워크 실패 예외
     */
    public static RemoteCallException network(String message, Throwable cause) {
        RemoteCallException exception = new RemoteCallException(NO_RESPONSE, message);
        exception.initCause(cause);
        return exception;
    }

    public int getStatus() {
        return status;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public RateSnapshot getRateSnapshot() {
        return rateSnapshot;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
