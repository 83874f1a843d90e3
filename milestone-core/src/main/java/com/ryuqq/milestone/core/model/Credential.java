package com.ryuqq.milestone.core.model;

/**
 * 인증된 원격 API 사용자.
 *
 * <p>로드 후 변경되지 않는 불변 값입니다. {@link #toString()}은 토큰을 출력하지 않습니다.</p>
 *
 * @param role 자격 증명 역할
 * @param login 원격 사용자 식별자
 * @param token 비밀 토큰
 * @param apiBaseUrl 원격 API 기본 URL
 * @param email 커밋 작성자 이메일 (선택, null 허용)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Credential(
    CredentialRole role,
    String login,
    String token,
    String apiBaseUrl,
    String email
) {

    /**
     * 원격 API 기본 URL 기본값.
     */
    public static final String DEFAULT_API_BASE_URL = "https://api.github.com";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 누락된 경우
     */
    public Credential {
        if (role == null) {
            throw new IllegalArgumentException("role cannot be null");
        }
        if (login == null || login.isBlank()) {
            throw new IllegalArgumentException("login cannot be null or blank");
        }
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("token cannot be null or blank");
        }
        if (apiBaseUrl == null || apiBaseUrl.isBlank()) {
            apiBaseUrl = DEFAULT_API_BASE_URL;
        }
        if (email != null && email.isBlank()) {
            email = null;
        }
    }

    /**
     * 이메일 없이 기본 URL로 생성.
     *
     * @param role 자격 증명 역할
     * @param login 원격 사용자 식별자
     * @param token 비밀 토큰
     * @return Credential
     */
    public static Credential of(CredentialRole role, String login, String token) {
        return new Credential(role, login, token, DEFAULT_API_BASE_URL, null);
    }

    /**
     * 이 사용자를 공동 작성자로 표기할 때의 신원.
     *
     * @return CoAuthor (이메일이 없으면 noreply 주소 사용)
     */
    public CoAuthor asCoAuthor() {
        return CoAuthor.of(login, email);
    }

    @Override
    public String toString() {
        return "Credential{role=" + role + ", login=" + login + ", apiBaseUrl=" + apiBaseUrl + ", token=****}";
    }
}
