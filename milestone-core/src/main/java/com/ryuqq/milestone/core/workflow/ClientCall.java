package com.ryuqq.milestone.core.workflow;

import com.ryuqq.milestone.core.spi.RemoteClient;
import com.ryuqq.milestone.core.spi.RemoteResponse;

/**
 * 자격 증명에 묶인 RemoteClient에 대한 호출.
 *
 * @param <T> 응답 값 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ClientCall<T> {

    RemoteResponse<T> invoke(RemoteClient client);
}
