package com.ryuqq.milestone.core.spi;

import com.ryuqq.milestone.core.model.CredentialRole;

import java.util.Optional;

/**
 * 엔진 실행 한 번에 쓰는 자격 증명별 원격 클라이언트.
 *
 * <p>보조 클라이언트는 선택 사항입니다. 보조 클라이언트가 필요한 워크플로우는 없을 때
 * 사전 조건 오류로 실패합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RemoteClients {

    private final RemoteClient primary;
    private final RemoteClient secondary;

    private RemoteClients(RemoteClient primary, RemoteClient secondary) {
        if (primary == null) {
            throw new IllegalArgumentException("primary cannot be null");
        }
        this.primary = primary;
        this.secondary = secondary;
    }

    /**
     * 클라이언트 쌍을 만듭니다.
     *
     * @param primary 주 클라이언트
     * @param secondaryOrNull 보조 클라이언트 (nullable)
     * @return RemoteClients
     */
    public static RemoteClients of(RemoteClient primary, RemoteClient secondaryOrNull) {
        return new RemoteClients(primary, secondaryOrNull);
    }

    /**
     * 역할에 묶인 클라이언트를 반환합니다.
     *
     * @param role 자격 증명 역할
     * @return 클라이언트 (보조 자격 증명이 없으면 empty)
     */
    public Optional<RemoteClient> forRole(CredentialRole role) {
        if (role == null) {
            throw new IllegalArgumentException("role cannot be null");
        }
        return Optional.ofNullable(role == CredentialRole.PRIMARY ? primary : secondary);
    }

    public boolean hasSecondary() {
        return secondary != null;
    }
}
