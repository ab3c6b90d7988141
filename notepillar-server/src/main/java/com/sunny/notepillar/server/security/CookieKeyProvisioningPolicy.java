package com.sunny.notepillar.server.security;

import com.sunny.notepillar.server.exception.security.WeakProductionKeyException;
import java.security.SecureRandom;
import java.util.HexFormat;
import lombok.extern.slf4j.Slf4j;

/**
 * 重认证Cookie签名密钥策略
 * 启动阶段执行一次，生产环境缺少强密钥时拒绝启动
 *
 * @author Sunny
 * @date 2026-03-04
 */
@Slf4j
public class CookieKeyProvisioningPolicy {

    public static final String DEFAULT_COOKIE_KEY = "notes_app_cookie_key";
    private static final int GENERATED_KEY_BYTES = 32;

    private final SecureRandom secureRandom;

    public CookieKeyProvisioningPolicy() {
        this(new SecureRandom());
    }

    CookieKeyProvisioningPolicy(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    public ProvisionedKey provision(DeploymentEnvironment environment, String configuredKey, boolean allowGenerate) {
        boolean configured = configuredKey != null && !configuredKey.isBlank();
        if (environment == DeploymentEnvironment.PRODUCTION) {
            if (configured && !DEFAULT_COOKIE_KEY.equals(configuredKey)) {
                return new ProvisionedKey(configuredKey, ProvisionedKey.Source.CONFIGURED);
            }
            if (allowGenerate) {
                log.warn("security_event event=cookie_key_generated environment=production "
                        + "detail=未配置COOKIE_SIGNING_KEY，已为当前进程生成随机密钥，每次重启后所有已签发的重认证Cookie都将失效");
                return new ProvisionedKey(generateKey(), ProvisionedKey.Source.GENERATED);
            }
            String message = "生产环境未配置安全的Cookie签名密钥，拒绝启动。可选处理方式: "
                    + "1) 设置环境变量 COOKIE_SIGNING_KEY 为高强度随机值; "
                    + "2) 在配置文件中设置 notepillar.cookie.signing-key; "
                    + "3) 设置 ALLOW_GENERATED_COOKIE_KEY=true 使用进程内随机密钥(重启后所有重认证Cookie失效)";
            log.error("security_event event=weak_cookie_key environment=production detail={}", message);
            throw new WeakProductionKeyException(message);
        }
        if (configured) {
            return new ProvisionedKey(configuredKey, ProvisionedKey.Source.CONFIGURED);
        }
        log.warn("security_event event=cookie_key_default environment=development "
                + "detail=使用内置默认Cookie签名密钥，仅限开发环境");
        return new ProvisionedKey(DEFAULT_COOKIE_KEY, ProvisionedKey.Source.DEFAULT);
    }

    private String generateKey() {
        byte[] bytes = new byte[GENERATED_KEY_BYTES];
        secureRandom.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
