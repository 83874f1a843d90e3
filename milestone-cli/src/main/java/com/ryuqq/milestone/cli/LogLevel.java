package com.ryuqq.milestone.cli;

import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;
import picocli.CommandLine.TypeConversionException;

import java.util.Locale;
import java.util.Optional;

/**
 * {@code --log-level} 옵션 값.
 *
 * <p>slf4j-simple은 첫 Logger 생성 시점에 기본 레벨을 확정합니다.
 * 따라서 {@link Main}은 picocli 파싱 전에 {@link #scan(String[])}으로 인자를 먼저 훑어 적용하고,
 * 파싱 단계의 {@link Options}는 값 검증과 이후 생성되는 Logger의 레벨을 맡습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum LogLevel {

    TRACE, DEBUG, INFO, WARN, ERROR;

    static final String OPTION = "--log-level";
    static final String DEFAULT_LEVEL_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";
    static final String PACKAGE_LEVEL_PROPERTY = "org.slf4j.simpleLogger.log.com.ryuqq.milestone";

    /**
     * 대소문자를 구분하지 않고 레벨을 해석합니다.
     *
     * @param value 옵션 값
     * @return 해석된 레벨
     * @throws IllegalArgumentException 알 수 없는 값
     */
    public static LogLevel parse(String value) {
        if (value != null) {
            for (LogLevel level : values()) {
                if (level.name().equalsIgnoreCase(value.trim())) {
                    return level;
                }
            }
        }
        throw new IllegalArgumentException(
            "Unknown log level: " + value + " (expected trace, debug, info, warn or error)");
    }

    /**
     * 명령행 인자에서 {@code --log-level}을 찾습니다.
     *
     * <p>{@code --log-level debug}와 {@code --log-level=debug} 두 형식을 모두 받습니다.
     * 값이 잘못된 경우 빈 값을 돌려주고 오류 보고는 picocli 파싱에 맡깁니다.</p>
     *
     * @param args 명령행 인자
     * @return 찾은 레벨 (없거나 잘못되면 empty)
     */
    public static Optional<LogLevel> scan(String[] args) {
        String value = null;
        for (int i = 0; i < args.length; i++) {
            if (args[i].equals(OPTION) && i + 1 < args.length) {
                value = args[i + 1];
            } else if (args[i].startsWith(OPTION + "=")) {
                value = args[i].substring(OPTION.length() + 1);
            }
        }
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(parse(value));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * 기본 레벨과 milestone 패키지 레벨을 시스템 프로퍼티로 설정합니다.
     */
    public void apply() {
        String name = name().toLowerCase(Locale.ROOT);
        System.setProperty(DEFAULT_LEVEL_PROPERTY, name);
        System.setProperty(PACKAGE_LEVEL_PROPERTY, name);
    }

    /**
     * picocli 타입 변환기.
     */
    static final class Converter implements ITypeConverter<LogLevel> {

        @Override
        public LogLevel convert(String value) {
            try {
                return parse(value);
            } catch (IllegalArgumentException e) {
                throw new TypeConversionException(e.getMessage());
            }
        }
    }

    /**
     * 하위 명령에 섞어 쓰는 로그 옵션.
     */
    static final class Options {

        @Option(names = OPTION, paramLabel = "LEVEL", converter = Converter.class,
            description = "Log level: trace, debug, info, warn or error (default: info)")
        void setLogLevel(LogLevel level) {
            level.apply();
        }
    }
}
