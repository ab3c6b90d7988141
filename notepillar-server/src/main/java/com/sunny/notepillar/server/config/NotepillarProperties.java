package com.sunny.notepillar.server.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * 笔记服务配置属性
 * 启动时一次性绑定，运行期只读
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Data
@ConfigurationProperties(prefix = "notepillar")
public class NotepillarProperties {

    /**
     * 部署环境: development / production
     */
    private String environment = "development";
    private List<String> allowedOrigins = new ArrayList<>();
    private Jwt jwt = new Jwt();
    private Cookie cookie = new Cookie();
    private Session session = new Session();
    private Translation translation = new Translation();
    private Password password = new Password();

    @Data
    public static class Jwt {
        private String secret;
        private String algorithm = "HS256";
        private long accessTokenTtlMinutes = 60;
        private String issuer = "notepillar";
    }

    @Data
    public static class Cookie {
        private String name = "notes_auth";
        private String signingKey;
        private boolean allowGeneratedKey = false;
        private int ttlDays = 30;
        private boolean secure = false;
    }

    @Data
    public static class Session {
        /**
         * 身份复核方式: local 直接查身份库，remote 调用 /auth/me
         */
        private String verifier = "local";
        private String identityEndpoint = "http://localhost:8080/auth/me";
        private int verifyTimeoutMs = 3000;
    }

    @Data
    public static class Translation {
        private boolean useOffline = true;
        private String apiUrl = "https://deep-translate1.p.rapidapi.com/language/translate/v2";
        private String apiKey;
        private String apiHost = "deep-translate1.p.rapidapi.com";
        private String sourceLanguage = "ru";
        private String targetLanguage = "en";
        /**
         * 源语言文字系统，取值为 Character.UnicodeScript 枚举名
         */
        private String sourceScript = "CYRILLIC";
        private int connectTimeoutMs = 3000;
        private int timeoutMs = 10000;
        private int lockWaitMs = 15000;
    }

    @Data
    public static class Password {
        private Argon2 argon2 = new Argon2();

        @Data
        public static class Argon2 {
            /**
             * Argon2 salt 长度（字节）
             */
            private int saltLength = 16;
            /**
             * Argon2 hash 长度（字节）
             */
            private int hashLength = 32;
            private int parallelism = 1;
            /**
             * Argon2 内存成本（MB）
             */
            private int memoryMb = 64;
            private int iterations = 3;
        }
    }
}
