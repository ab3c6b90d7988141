package com.sunny.notepillar.server.config;

import java.time.Clock;
import java.time.Duration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.sunny.notepillar.common.exception.InternalException;
import com.sunny.notepillar.common.utils.JwtUtil;
import com.sunny.notepillar.server.security.AccessTokenSecretPolicy;
import com.sunny.notepillar.server.security.AccessTokenService;
import com.sunny.notepillar.server.security.CookieKeyProvisioningPolicy;
import com.sunny.notepillar.server.security.DeploymentEnvironment;
import com.sunny.notepillar.server.security.IdentityVerifier;
import com.sunny.notepillar.server.security.ProvisionedKey;
import com.sunny.notepillar.server.security.ReauthCookieManager;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 签名密钥配置
 * 在容器启动阶段确定访问令牌与重认证Cookie的签名密钥，校验失败时启动中止
 *
 * @author Sunny
 * @date 2026-03-06
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class SigningKeyConfig {

    private final NotepillarProperties properties;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DeploymentEnvironment deploymentEnvironment() {
        return DeploymentEnvironment.from(properties.getEnvironment());
    }

    @Bean
    public AccessTokenService accessTokenService(DeploymentEnvironment environment, Clock clock) {
        NotepillarProperties.Jwt jwt = properties.getJwt();
        if (jwt.getAccessTokenTtlMinutes() <= 0) {
            throw new InternalException("ACCESS_TOKEN_TTL_MINUTES 必须为正数");
        }
        ProvisionedKey secret = new AccessTokenSecretPolicy().provision(environment, jwt.getSecret());
        JwtUtil jwtUtil = new JwtUtil(secret.value(), jwt.getAlgorithm(), jwt.getIssuer(), clock);
        log.info("访问令牌签名已就绪: algorithm={}, keySource={}, ttlMinutes={}",
                jwtUtil.getAlgorithm(), secret.source(), jwt.getAccessTokenTtlMinutes());
        return new AccessTokenService(jwtUtil, Duration.ofMinutes(jwt.getAccessTokenTtlMinutes()));
    }

    @Bean
    public ReauthCookieManager reauthCookieManager(DeploymentEnvironment environment,
                                                   Clock clock,
                                                   IdentityVerifier identityVerifier) {
        NotepillarProperties.Cookie cookie = properties.getCookie();
        if (cookie.getTtlDays() <= 0) {
            throw new InternalException("COOKIE_TTL_DAYS 必须为正数");
        }
        ProvisionedKey key = new CookieKeyProvisioningPolicy()
                .provision(environment, cookie.getSigningKey(), cookie.isAllowGeneratedKey());
        JwtUtil jwtUtil = new JwtUtil(key.value(), properties.getJwt().getAlgorithm(), properties.getJwt().getIssuer(), clock);
        log.info("重认证Cookie签名已就绪: keySource={}, ttlDays={}", key.source(), cookie.getTtlDays());
        return new ReauthCookieManager(jwtUtil, Duration.ofDays(cookie.getTtlDays()), identityVerifier);
    }
}
