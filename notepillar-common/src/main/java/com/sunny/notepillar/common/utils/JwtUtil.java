package com.sunny.notepillar.common.utils;

import com.sunny.notepillar.common.exception.BadRequestException;
import com.sunny.notepillar.common.exception.InternalException;
import com.sunny.notepillar.common.exception.token.TokenExpiredException;
import com.sunny.notepillar.common.exception.token.TokenInvalidException;
import com.sunny.notepillar.common.exception.token.TokenMalformedException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.io.DecodingException;
import io.jsonwebtoken.security.MacAlgorithm;
import io.jsonwebtoken.security.SecurityException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.Locale;
import java.util.Map;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

/**
 * JWT工具类
 * 基于HMAC算法签发与校验JWT，过期判断使用注入的时钟
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class JwtUtil {

    private final SecretKey key;
    private final MacAlgorithm algorithm;
    private final String issuer;
    private final Clock clock;

    public JwtUtil(String secret, String algorithmName, String issuer, Clock clock) {
        if (secret == null || secret.isBlank()) {
            throw new InternalException("JWT 密钥不能为空");
        }
        this.algorithm = resolveAlgorithm(algorithmName);
        this.key = buildKey(secret, algorithm);
        this.issuer = issuer;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public String sign(Map<String, Object> claims, String subject, Instant issuedAt, Instant expiration) {
        if (claims == null || issuedAt == null || expiration == null) {
            throw new BadRequestException("参数错误");
        }
        JwtBuilder builder = Jwts.builder()
                .claims(claims)
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(expiration));
        if (subject != null) {
            builder.subject(subject);
        }
        if (issuer != null && !issuer.isBlank()) {
            builder.issuer(issuer);
        }
        return builder.signWith(key, algorithm).compact();
    }

    public Claims parseToken(String token) {
        if (token == null || token.isBlank()) {
            throw new TokenMalformedException("Token不能为空");
        }
        Claims claims;
        try {
            Jws<Claims> jws = Jwts.parser()
                    .verifyWith(key)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token);
            if (!algorithm.getId().equals(jws.getHeader().getAlgorithm())) {
                throw new TokenMalformedException("Token签名算法不匹配: %s", jws.getHeader().getAlgorithm());
            }
            claims = jws.getPayload();
        } catch (ExpiredJwtException e) {
            throw new TokenExpiredException(e, "Token已过期");
        } catch (MalformedJwtException | SecurityException | DecodingException e) {
            throw new TokenMalformedException(e, "Token格式非法或签名不匹配");
        } catch (JwtException | IllegalArgumentException e) {
            throw new TokenInvalidException(e, "Token无效");
        }
        Date expiration = claims.getExpiration();
        if (expiration != null && !clock.instant().isBefore(expiration.toInstant())) {
            throw new TokenExpiredException("Token已过期");
        }
        return claims;
    }

    public String getAlgorithm() {
        return algorithm.getId();
    }

    public Clock getClock() {
        return clock;
    }

    private static MacAlgorithm resolveAlgorithm(String algorithmName) {
        String name = algorithmName == null ? "HS256" : algorithmName.trim().toUpperCase(Locale.ROOT);
        return switch (name) {
            case "HS256" -> Jwts.SIG.HS256;
            case "HS384" -> Jwts.SIG.HS384;
            case "HS512" -> Jwts.SIG.HS512;
            default -> throw new InternalException("不支持的JWT签名算法: %s", algorithmName);
        };
    }

    /**
     * 密钥长度不足算法要求时，用同位宽的SHA-2摘要拉伸
     */
    private static SecretKey buildKey(String secret, MacAlgorithm algorithm) {
        int bits = algorithm.getKeyBitLength();
        String jcaName = "HmacSHA" + bits;
        byte[] raw = secret.getBytes(StandardCharsets.UTF_8);
        if (raw.length * 8 >= bits) {
            return new SecretKeySpec(raw, jcaName);
        }
        try {
            byte[] derived = MessageDigest.getInstance("SHA-" + bits).digest(raw);
            return new SecretKeySpec(derived, jcaName);
        } catch (NoSuchAlgorithmException e) {
            throw new InternalException(e, "摘要算法不可用: SHA-%s", bits);
        }
    }
}
