package com.sunny.notepillar.server.security;

/**
 * 重认证Cookie校验结果
 *
 * @author Sunny
 * @date 2026-03-04
 */
public enum ReauthOutcome {

    ABSENT(false, false),
    TAMPERED(false, true),
    EXPIRED(false, true),
    INCOMPLETE(false, false),
    REJECTED(false, true),
    UNVERIFIED(false, false),
    AUTHENTICATED(true, false);

    private final boolean authenticated;
    private final boolean deleteCookie;

    ReauthOutcome(boolean authenticated, boolean deleteCookie) {
        this.authenticated = authenticated;
        this.deleteCookie = deleteCookie;
    }

    public boolean isAuthenticated() {
        return authenticated;
    }

    public boolean isDeleteCookie() {
        return deleteCookie;
    }
}
