package com.ryuqq.milestone.core.protection;

import com.ryuqq.milestone.core.spi.RemoteCallException;
import com.ryuqq.milestone.core.spi.RemoteResponse;

/**
 * 한 번의 원격 호출. RetryPolicy가 시도마다 다시 실행합니다.
 *
 * @param <T> 응답 값 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RemoteCall<T> {

    /**
     * 호출 실행.
     *
     * @return 응답
     * @throws RemoteCallException 원격 호출 실패
     */
    RemoteResponse<T> invoke();
}
