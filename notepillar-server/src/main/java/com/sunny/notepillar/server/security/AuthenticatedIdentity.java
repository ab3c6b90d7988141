package com.sunny.notepillar.server.security;

/**
 * 已认证身份
 * 由拦截器解析后作为控制器方法参数传递
 *
 * @author Sunny
 * @date 2026-03-04
 */
public record AuthenticatedIdentity(Long userId, String username, String email, String accessToken) {

    public IdentitySummary toSummary() {
        return new IdentitySummary(userId, username, email);
    }
}
