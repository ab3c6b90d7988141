package com.sunny.notepillar.server.translation;

/**
 * 翻译服务提供方
 *
 * @author Sunny
 * @date 2026-03-05
 */
public interface TranslationProvider {

    /**
     * 翻译文本，失败时抛出翻译异常，不返回空译文
     */
    String translate(String text, String sourceLanguage, String targetLanguage);

    String name();
}
