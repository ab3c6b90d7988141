package com.sunny.notepillar.server.config;

import java.time.Duration;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.sunny.notepillar.server.translation.NoteLockRegistry;
import com.sunny.notepillar.server.translation.OfflineTranslationProvider;
import com.sunny.notepillar.server.translation.RapidApiTranslationProvider;
import com.sunny.notepillar.server.translation.SourceScriptClassifier;
import com.sunny.notepillar.server.translation.TextTranslator;
import com.sunny.notepillar.server.translation.TranslationProvider;

import lombok.extern.slf4j.Slf4j;

/**
 * 翻译配置
 * 负责翻译服务客户端装配与Bean初始化
 *
 * @author Sunny
 * @date 2026-03-06
 */
@Slf4j
@Configuration
public class TranslationConfig {

    @Bean
    public SourceScriptClassifier sourceScriptClassifier(NotepillarProperties properties) {
        return new SourceScriptClassifier(properties.getTranslation().getSourceScript());
    }

    @Bean
    public TranslationProvider translationProvider(NotepillarProperties properties, RestTemplateBuilder builder) {
        NotepillarProperties.Translation translation = properties.getTranslation();
        if (translation.isUseOffline()) {
            log.info("使用离线翻译");
            return new OfflineTranslationProvider();
        }
        if (translation.getApiKey() == null || translation.getApiKey().isBlank()) {
            log.warn("未配置 TRANSLATION_API_KEY，翻译请求可能被拒绝");
        }
        return new RapidApiTranslationProvider(
                builder.setConnectTimeout(Duration.ofMillis(Math.max(1, translation.getConnectTimeoutMs())))
                        .setReadTimeout(Duration.ofMillis(Math.max(1, translation.getTimeoutMs())))
                        .build(),
                translation.getApiUrl(),
                translation.getApiKey(),
                translation.getApiHost());
    }

    @Bean
    public TextTranslator textTranslator(SourceScriptClassifier classifier,
                                         TranslationProvider provider,
                                         NotepillarProperties properties) {
        return new TextTranslator(classifier, provider,
                properties.getTranslation().getSourceLanguage(),
                properties.getTranslation().getTargetLanguage());
    }

    @Bean
    public NoteLockRegistry noteLockRegistry() {
        return new NoteLockRegistry();
    }
}
