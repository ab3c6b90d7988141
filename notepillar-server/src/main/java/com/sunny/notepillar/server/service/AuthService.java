package com.sunny.notepillar.server.service;

import com.sunny.notepillar.server.dto.AuthDto;
import com.sunny.notepillar.server.entity.User;
import com.sunny.notepillar.server.security.AuthenticatedIdentity;
import com.sunny.notepillar.server.security.IdentitySummary;

/**
 * 认证服务
 * 提供注册、登录与访问令牌解析能力
 *
 * @author Sunny
 * @date 2026-03-05
 */
public interface AuthService {

    User register(AuthDto.RegisterRequest request);

    LoginResult login(AuthDto.LoginRequest request);

    /**
     * 校验访问令牌并加载身份，身份不存在或已禁用时抛出认证异常
     */
    AuthenticatedIdentity authenticate(String accessToken);

    record LoginResult(String accessToken, String tokenType, IdentitySummary identity) {
    }
}
