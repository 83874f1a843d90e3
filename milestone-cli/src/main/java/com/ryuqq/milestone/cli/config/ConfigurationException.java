package com.ryuqq.milestone.cli.config;

/**
 * 설정 파일이 없거나 읽을 수 없거나 잘못되었을 때 발생합니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
