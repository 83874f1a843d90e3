package com.ryuqq.milestone.core.spi;

import com.ryuqq.milestone.core.model.RateSnapshot;

/**
 * 성공한 원격 응답.
 *
 * @param value 응답 값 (본문이 없는 연산이면 null일 수 있음)
 * @param rateSnapshot 서버가 보고한 예산 (보고하지 않았으면 null)
 * @param <T> 값 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RemoteResponse<T>(T value, RateSnapshot rateSnapshot) {

    /**
     * 예산 정보 없는 응답을 만듭니다.
     *
     * @param value 응답 값
     * @param <T> 값 타입
     * @return 응답
     */
    public static <T> RemoteResponse<T> of(T value) {
        return new RemoteResponse<>(value, null);
    }
}
