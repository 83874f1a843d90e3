package com.ryuqq.milestone.cli.spi;

import com.ryuqq.milestone.core.model.Credential;
import com.ryuqq.milestone.core.spi.RemoteClient;

/**
 * 실제 원격 호출용 {@link RemoteClient}를 만드는 서비스 제공자.
 *
 * <p>구현체는 {@link java.util.ServiceLoader}로 찾습니다. 클래스패스의
 * {@code META-INF/services/com.ryuqq.milestone.cli.spi.RemoteClientProvider}에 클래스를 등록하세요.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface RemoteClientProvider {

    /**
     * 로그에 표시할 제공자 이름.
     *
     * @return 이름
     */
    String name();

    /**
     * {@code credential}로 인증된 클라이언트를 만듭니다.
     *
     * @param credential 한 역할의 자격 증명
     * @return 해당 신원으로 호출하는 클라이언트
     */
    RemoteClient create(Credential credential);
}
