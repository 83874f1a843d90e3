package com.ryuqq.milestone.cli;

import picocli.CommandLine;

/**
 * 명령행 진입점.
 *
 * <p>Logger가 만들어지기 전에 {@code --log-level}을 먼저 적용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Main {

    private Main() {
    }

    public static void main(String[] args) {
        LogLevel.scan(args).ifPresent(LogLevel::apply);
        int code = new CommandLine(new MilestoneCommand()).execute(args);
        System.exit(code);
    }
}
