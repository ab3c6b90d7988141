package com.sunny.notepillar.server.service;

import com.sunny.notepillar.server.dto.SessionDto;
import com.sunny.notepillar.server.security.AuthenticatedIdentity;
import com.sunny.notepillar.server.security.IdentitySummary;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * 会话延续服务
 * 基于重认证Cookie恢复登录状态与界面视图状态
 *
 * @author Sunny
 * @date 2026-03-05
 */
public interface SessionService {

    SessionDto.RestoreResponse restore(HttpServletRequest request, HttpServletResponse response);

    void rememberLogin(String accessToken, IdentitySummary identity, HttpServletResponse response);

    SessionDto.ViewStateResponse saveViewState(AuthenticatedIdentity identity,
                                               SessionDto.ViewStateRequest request,
                                               HttpServletResponse response);

    void forget(HttpServletResponse response);
}
