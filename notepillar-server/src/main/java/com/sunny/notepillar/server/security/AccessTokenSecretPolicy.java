package com.sunny.notepillar.server.security;

import com.sunny.notepillar.server.exception.security.WeakProductionKeyException;
import lombok.extern.slf4j.Slf4j;

/**
 * 访问令牌签名密钥策略
 *
 * @author Sunny
 * @date 2026-03-04
 */
@Slf4j
public class AccessTokenSecretPolicy {

    public static final String DEFAULT_SECRET = "supersecretkey";
    static final int MIN_PRODUCTION_SECRET_LENGTH = 32;

    public ProvisionedKey provision(DeploymentEnvironment environment, String configuredSecret) {
        boolean configured = configuredSecret != null && !configuredSecret.isBlank();
        if (environment == DeploymentEnvironment.PRODUCTION) {
            if (!configured || DEFAULT_SECRET.equals(configuredSecret)) {
                log.error("security_event event=weak_signing_key environment=production reason=missing_or_default");
                throw new WeakProductionKeyException("生产环境必须通过 SIGNING_KEY 配置非默认的访问令牌签名密钥");
            }
            if (configuredSecret.length() < MIN_PRODUCTION_SECRET_LENGTH) {
                log.error("security_event event=weak_signing_key environment=production reason=too_short");
                throw new WeakProductionKeyException("生产环境访问令牌签名密钥长度至少 %s 位", MIN_PRODUCTION_SECRET_LENGTH);
            }
            return new ProvisionedKey(configuredSecret, ProvisionedKey.Source.CONFIGURED);
        }
        if (configured) {
            return new ProvisionedKey(configuredSecret, ProvisionedKey.Source.CONFIGURED);
        }
        log.warn("security_event event=signing_key_default environment=development "
                + "detail=使用内置默认访问令牌签名密钥，仅限开发环境");
        return new ProvisionedKey(DEFAULT_SECRET, ProvisionedKey.Source.DEFAULT);
    }
}
