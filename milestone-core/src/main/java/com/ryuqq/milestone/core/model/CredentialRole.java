package com.ryuqq.milestone.core.model;

/**
 * 원격 호출에 사용되는 자격 증명의 역할.
 *
 * <p>엔진은 정확히 두 개의 자격 증명을 다룹니다. 각 역할은 독립적인 요청 예산을 가집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum CredentialRole {

    /**
     * 저장소 소유자. 대부분의 호출을 수행합니다.
     */
    PRIMARY,

    /**
     * 협업자. 공동 작업 단계(답변 작성, 초대 수락 등)에 사용됩니다.
     */
    SECONDARY;

    /**
     * 반대 역할 조회.
     *
     * @return PRIMARY이면 SECONDARY, SECONDARY이면 PRIMARY
     */
    public CredentialRole other() {
        return this == PRIMARY ? SECONDARY : PRIMARY;
    }
}
