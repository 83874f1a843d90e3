package com.ryuqq.milestone.core.outcome;

/**
 * 원격 호출 성공.
 *
 * @param value 응답 값 (응답 본문이 없는 호출은 null 허용)
 * @param <T> 응답 값 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Success<T>(T value) implements AttemptOutcome<T> {
}
