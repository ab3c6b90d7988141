package com.sunny.notepillar.server.translation;

/**
 * 翻译结果
 *
 * @author Sunny
 * @date 2026-03-05
 */
public record TranslationResult(
        String translatedText,
        String originalText,
        String sourceLanguage,
        String targetLanguage,
        boolean translated) {

    public static TranslationResult unchanged(String text, String sourceLanguage, String targetLanguage) {
        return new TranslationResult(text, text, sourceLanguage, targetLanguage, false);
    }
}
