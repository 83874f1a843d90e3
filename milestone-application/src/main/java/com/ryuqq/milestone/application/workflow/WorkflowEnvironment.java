package com.ryuqq.milestone.application.workflow;

import com.ryuqq.milestone.core.model.Credential;
import com.ryuqq.milestone.core.model.CredentialRole;
import com.ryuqq.milestone.core.model.RepositoryId;

import java.util.Optional;

/**
 * 모든 워크플로우가 공유하는 실행 대상.
 *
 * @param repository 대상 저장소
 * @param primary 주 자격 증명
 * @param secondary 보조 자격 증명 (null 허용)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WorkflowEnvironment(RepositoryId repository, Credential primary, Credential secondary) {

    public WorkflowEnvironment {
        if (repository == null) {
            throw new IllegalArgumentException("repository cannot be null");
        }
        if (primary == null) {
            throw new IllegalArgumentException("primary cannot be null");
        }
        if (primary.role() != CredentialRole.PRIMARY) {
            throw new IllegalArgumentException("primary credential must have PRIMARY role");
        }
        if (secondary != null && secondary.role() != CredentialRole.SECONDARY) {
            throw new IllegalArgumentException("secondary credential must have SECONDARY role");
        }
    }

    /**
     * 역할별 자격 증명 조회.
     *
     * @param role 역할
     * @return 자격 증명 (보조가 없으면 empty)
     */
    public Optional<Credential> credential(CredentialRole role) {
        return Optional.ofNullable(role == CredentialRole.PRIMARY ? primary : secondary);
    }
}
