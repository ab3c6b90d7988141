package com.sunny.notepillar.server.security;

/**
 * 启动期确定的签名密钥及其来源
 *
 * @author Sunny
 * @date 2026-03-04
 */
public record ProvisionedKey(String value, Source source) {

    public enum Source {
        CONFIGURED,
        DEFAULT,
        GENERATED
    }

    @Override
    public String toString() {
        return "ProvisionedKey[source=" + source + "]";
    }
}
