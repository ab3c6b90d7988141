package com.sunny.notepillar.server.security;

import com.sunny.notepillar.common.exception.BadRequestException;
import com.sunny.notepillar.common.exception.token.TokenInvalidException;
import com.sunny.notepillar.common.utils.JwtUtil;
import io.jsonwebtoken.Claims;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;

/**
 * 访问令牌签发与校验
 *
 * @author Sunny
 * @date 2026-03-04
 */
public class AccessTokenService {

    private final JwtUtil jwtUtil;
    private final Duration defaultTtl;

    public AccessTokenService(JwtUtil jwtUtil, Duration defaultTtl) {
        this.jwtUtil = jwtUtil;
        this.defaultTtl = defaultTtl;
    }

    public String issue(Object subject) {
        return issue(subject, defaultTtl);
    }

    /**
     * subject 统一转为字符串后签名
     */
    public String issue(Object subject, Duration ttl) {
        if (subject == null) {
            throw new BadRequestException("令牌主体不能为空");
        }
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new BadRequestException("令牌有效期必须为正数");
        }
        Instant now = jwtUtil.getClock().instant();
        return jwtUtil.sign(new HashMap<>(), String.valueOf(subject), now, now.plus(ttl));
    }

    public AccessTokenClaims verify(String token) {
        Claims claims = jwtUtil.parseToken(token);
        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new TokenInvalidException("Token缺少主体");
        }
        if (claims.getExpiration() == null) {
            throw new TokenInvalidException("Token缺少过期时间");
        }
        return new AccessTokenClaims(
                subject,
                claims.getIssuedAt() == null ? null : claims.getIssuedAt().toInstant(),
                claims.getExpiration().toInstant());
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public record AccessTokenClaims(String subject, Instant issuedAt, Instant expiresAt) {
    }
}
