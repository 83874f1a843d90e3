package com.ryuqq.milestone.core.model;

/**
 * 대상 저장소 식별자 (owner/name).
 *
 * @param owner 소유자 로그인
 * @param name 저장소 이름
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RepositoryId(String owner, String name) {

    public RepositoryId {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("owner cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (!name.matches("^[A-Za-z0-9._\\-]+$")) {
            throw new IllegalArgumentException("name contains invalid characters: " + name);
        }
    }

    /**
     * "owner/name" 형식 문자열 파싱.
     *
     * @param fullName owner/name
     * @return RepositoryId
     * @throws IllegalArgumentException 형식이 잘못된 경우
     */
    public static RepositoryId parse(String fullName) {
        if (fullName == null || fullName.indexOf('/') <= 0 || fullName.indexOf('/') != fullName.lastIndexOf('/')) {
            throw new IllegalArgumentException("Repository must be in owner/name form: " + fullName);
        }
        int slash = fullName.indexOf('/');
        return new RepositoryId(fullName.substring(0, slash), fullName.substring(slash + 1));
    }

    @Override
    public String toString() {
        return owner + "/" + name;
    }
}
