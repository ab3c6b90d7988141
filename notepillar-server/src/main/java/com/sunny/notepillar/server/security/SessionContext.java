package com.sunny.notepillar.server.security;

/**
 * 会话上下文
 * 承载恢复出的访问令牌、身份摘要与视图状态
 *
 * @author Sunny
 * @date 2026-03-04
 */
public class SessionContext {

    private String accessToken;
    private IdentitySummary identity;
    private ViewState viewState = ViewState.empty();

    public void restore(String accessToken, IdentitySummary identity, ViewState viewState) {
        this.accessToken = accessToken;
        this.identity = identity;
        this.viewState = viewState == null ? ViewState.empty() : viewState;
    }

    public void refreshIdentity(IdentitySummary identity) {
        this.identity = identity;
    }

    /**
     * 清除令牌与身份，视图状态保留
     */
    public void clearAuthentication() {
        this.accessToken = null;
        this.identity = null;
    }

    public boolean isAuthenticated() {
        return accessToken != null && identity != null;
    }

    public String getAccessToken() {
        return accessToken;
    }

    public IdentitySummary getIdentity() {
        return identity;
    }

    public ViewState getViewState() {
        return viewState;
    }
}
