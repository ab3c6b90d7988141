package com.sunny.notepillar.server.config;

import java.time.Duration;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.sunny.notepillar.server.security.IdentityVerifier;
import com.sunny.notepillar.server.security.LocalIdentityVerifier;
import com.sunny.notepillar.server.security.RemoteIdentityVerifier;
import com.sunny.notepillar.server.service.AuthService;

/**
 * 会话复核配置
 *
 * @author Sunny
 * @date 2026-03-06
 */
@Configuration
public class SessionConfig {

    private static final String VERIFIER_REMOTE = "remote";

    @Bean
    public IdentityVerifier identityVerifier(NotepillarProperties properties,
                                             RestTemplateBuilder builder,
                                             AuthService authService) {
        NotepillarProperties.Session session = properties.getSession();
        if (VERIFIER_REMOTE.equalsIgnoreCase(session.getVerifier())) {
            Duration timeout = Duration.ofMillis(Math.max(1, session.getVerifyTimeoutMs()));
            return new RemoteIdentityVerifier(
                    builder.setConnectTimeout(timeout).setReadTimeout(timeout).build(),
                    session.getIdentityEndpoint());
        }
        return new LocalIdentityVerifier(authService);
    }
}
