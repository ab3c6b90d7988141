package com.sunny.notepillar.server.security;

import com.sunny.notepillar.common.exception.InternalException;
import java.util.Locale;

/**
 * 部署环境
 *
 * @author Sunny
 * @date 2026-03-04
 */
public enum DeploymentEnvironment {

    DEVELOPMENT,
    PRODUCTION;

    /**
     * 未识别的取值直接拒绝，避免误配时退化为开发环境
     */
    public static DeploymentEnvironment from(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "", "development", "dev" -> DEVELOPMENT;
            case "production", "prod" -> PRODUCTION;
            default -> throw new InternalException("无法识别的部署环境: %s", value);
        };
    }
}
