package com.sunny.notepillar.server.security;

import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

import com.sunny.notepillar.common.constant.HeaderConstants;
import com.sunny.notepillar.common.exception.UnauthorizedException;
import com.sunny.notepillar.server.service.AuthService;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * Bearer令牌认证拦截器
 * 解析出的身份写入请求属性，由 {@link CurrentIdentityArgumentResolver} 注入控制器
 *
 * @author Sunny
 * @date 2026-03-04
 */
@Component
@RequiredArgsConstructor
public class BearerAuthInterceptor implements HandlerInterceptor {

    public static final String IDENTITY_ATTRIBUTE = BearerAuthInterceptor.class.getName() + ".IDENTITY";

    private final AuthService authService;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod)) {
            return true;
        }
        String token = extractBearerToken(request);
        if (token == null) {
            throw new UnauthorizedException("缺少认证凭证");
        }
        request.setAttribute(IDENTITY_ATTRIBUTE, authService.authenticate(token));
        return true;
    }

    static String extractBearerToken(HttpServletRequest request) {
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization == null || !authorization.startsWith(HeaderConstants.BEARER_PREFIX)) {
            return null;
        }
        String token = authorization.substring(HeaderConstants.BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }
}
