package com.ryuqq.milestone.core.model;

/**
 * 커밋 메시지 trailer로 기록되는 공동 작성자 신원.
 *
 * @param name 표시 이름 (로그인)
 * @param email 이메일
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CoAuthor(String name, String email) {

    /**
     * 이메일이 설정되지 않은 사용자에게 부여되는 noreply 도메인.
     */
    public static final String NOREPLY_DOMAIN = "users.noreply.github.com";

    public CoAuthor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email cannot be null or blank");
        }
    }

    /**
     * 로그인과 선택적 이메일로 생성.
     *
     * @param login 로그인
     * @param emailOrNull 이메일 (null이면 noreply 주소)
     * @return CoAuthor
     */
    public static CoAuthor of(String login, String emailOrNull) {
        String email = (emailOrNull == null || emailOrNull.isBlank())
            ? login + "@" + NOREPLY_DOMAIN
            : emailOrNull;
        return new CoAuthor(login, email);
    }

    /**
     * 커밋 메시지 trailer 형식.
     *
     * @return {@code Co-authored-by: name <email>}
     */
    public String trailer() {
        return "Co-authored-by: " + name + " <" + email + ">";
    }
}
