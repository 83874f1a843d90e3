package com.ryuqq.milestone.core.workflow;

import com.ryuqq.milestone.core.model.CredentialRole;
import com.ryuqq.milestone.core.model.ProgressRecord;
import com.ryuqq.milestone.core.model.StepId;
import com.ryuqq.milestone.core.outcome.AttemptOutcome;

import java.time.Instant;
import java.util.Map;

/**
 * 단계 실행 중 사용할 수 있는 기능.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface StepContext {

    /**
     * 실행 중인 단계.
     *
     * @return 단계 식별자
     */
    StepId stepId();

    /**
     * 단계 시작 시점의 진행 기록.
     *
     * @return 진행 기록
     */
    ProgressRecord progress();

    /**
     * 이 단계에 대해 이미 커밋된 하위 호출 결과.
     *
     * @return 체크포인트 (없으면 빈 Map)
     */
    Map<String, String> checkpoints();

    /**
     * 엔진 시계 기준 현재 시각.
     *
     * @return 현재 시각
     */
    Instant now();

    /**
     * 자격 증명이 설정되어 있는지 확인.
     *
     * @param role 역할
     * @return 해당 역할의 RemoteClient가 있으면 true
     */
    boolean hasCredential(CredentialRole role);

    /**
     * RateLimiter와 RetryPolicy를 거쳐 원격 호출 실행.
     *
     * @param role 호출할 자격 증명
     * @param call 호출
     * @param <T> 응답 값 타입
     * @return Success 또는 Fatal (자격 증명이 없으면 PRECONDITION)
     * @throws InterruptedException 취소된 경우
     */
    <T> AttemptOutcome<T> call(CredentialRole role, ClientCall<T> call) throws InterruptedException;

    /**
     * 하위 호출 결과를 즉시 커밋.
     *
     * @param key 하위 호출 이름
     * @param value 결과 값
     */
    void checkpoint(String key, String value);
}
