package com.ryuqq.milestone.core.spi;

import com.ryuqq.milestone.core.model.RepositoryId;

/**
 * 서버가 보고한 원격 저장소.
 *
 * @param id owner/name
 * @param defaultBranch 변경이 병합되는 브랜치
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RemoteRepository(RepositoryId id, String defaultBranch) {

    public RemoteRepository {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (defaultBranch == null || defaultBranch.isBlank()) {
            defaultBranch = "main";
        }
    }
}
