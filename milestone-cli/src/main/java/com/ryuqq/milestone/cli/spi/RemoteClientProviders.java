package com.ryuqq.milestone.cli.spi;

import com.ryuqq.milestone.cli.config.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * 실제 실행에 쓸 {@link RemoteClientProvider}를 찾습니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RemoteClientProviders {

    private static final Logger log = LoggerFactory.getLogger(RemoteClientProviders.class);

    private RemoteClientProviders() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 클래스패스에서 제공자 하나를 불러옵니다.
     *
     * @return 제공자
     * @throws ConfigurationException 설치된 제공자가 없을 때
     */
    public static RemoteClientProvider load() {
        return select(ServiceLoader.load(RemoteClientProvider.class));
    }

    static RemoteClientProvider select(Iterable<RemoteClientProvider> candidates) {
        List<RemoteClientProvider> providers = new ArrayList<>();
        candidates.forEach(providers::add);
        if (providers.isEmpty()) {
            throw new ConfigurationException("No RemoteClientProvider found on the classpath; "
                + "live runs need one (use --dry-run to run without remote calls)");
        }
        RemoteClientProvider chosen = providers.get(0);
        if (providers.size() > 1) {
            log.warn("{} RemoteClientProviders found, using {}", providers.size(), chosen.name());
        }
        log.info("Using RemoteClientProvider {}", chosen.name());
        return chosen;
    }
}
