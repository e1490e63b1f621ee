package com.ryuqq.maintenance.core.model;

/**
 * 저장소에 연결된 클라이언트의 신원 ({@code user@host}).
 *
 * <p>연결 계층이 제공하는 principal에서 파생되며, 유지보수 파라미터의
 * {@code owner} 필드와 비교하는 데 사용됩니다.</p>
 *
 * @param username 사용자 이름 (빈 문자열 불가, '@' 불가)
 * @param hostname 호스트 이름 (빈 문자열 불가)
 *
 * @author Maintenance Team
 * @since 1.0.0
 */
public record ClientIdentity(String username, String hostname) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException username 또는 hostname이 null/빈 문자열이거나 username에 '@'가 포함된 경우
     */
    public ClientIdentity {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("username cannot be null or blank");
        }
        if (hostname == null || hostname.isBlank()) {
            throw new IllegalArgumentException("hostname cannot be null or blank");
        }
        if (username.indexOf('@') >= 0) {
            throw new IllegalArgumentException("username cannot contain '@' (current: " + username + ")");
        }
    }

    /**
     * ClientIdentity 생성.
     *
     * @param username 사용자 이름
     * @param hostname 호스트 이름
     * @return ClientIdentity 인스턴스
     */
    public static ClientIdentity of(String username, String hostname) {
        return new ClientIdentity(username, hostname);
    }

    /**
     * {@code user@host} 문자열 파싱.
     *
     * <p>첫 번째 '@'를 기준으로 나눕니다.</p>
     *
     * @param usernameAtHost {@code user@host} 형식 문자열
     * @return ClientIdentity 인스턴스
     * @throws IllegalArgumentException 형식이 올바르지 않은 경우
     */
    public static ClientIdentity parse(String usernameAtHost) {
        if (usernameAtHost == null) {
            throw new IllegalArgumentException("usernameAtHost cannot be null");
        }
        int at = usernameAtHost.indexOf('@');
        if (at <= 0 || at == usernameAtHost.length() - 1) {
            throw new IllegalArgumentException("expected user@host but was: " + usernameAtHost);
        }
        return new ClientIdentity(usernameAtHost.substring(0, at), usernameAtHost.substring(at + 1));
    }

    /**
     * {@code user@host} 형식 문자열.
     *
     * @return 신원 문자열
     */
    public String usernameAtHost() {
        return username + "@" + hostname;
    }
}
