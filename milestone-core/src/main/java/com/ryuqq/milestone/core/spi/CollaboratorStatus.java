package com.ryuqq.milestone.core.spi;

/**
 * 협업자 추가 결과.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum CollaboratorStatus {

    /** 이미 협업자. */
    ACTIVE,

    /** 초대가 수락 대기 중. */
    INVITED
}
