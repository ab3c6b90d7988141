package com.sunny.notepillar.server.translation;

import lombok.extern.slf4j.Slf4j;

/**
 * 文本翻译组件
 * 不含源文字的文本直接原样返回，不调用翻译服务
 *
 * @author Sunny
 * @date 2026-03-05
 */
@Slf4j
public class TextTranslator {

    private final SourceScriptClassifier classifier;
    private final TranslationProvider provider;
    private final String sourceLanguage;
    private final String targetLanguage;

    public TextTranslator(SourceScriptClassifier classifier,
                          TranslationProvider provider,
                          String sourceLanguage,
                          String targetLanguage) {
        this.classifier = classifier;
        this.provider = provider;
        this.sourceLanguage = sourceLanguage;
        this.targetLanguage = targetLanguage;
    }

    public boolean isTranslatable(String text) {
        return classifier.containsSourceScript(text);
    }

    public TranslationResult translate(String text) {
        if (!classifier.containsSourceScript(text)) {
            return TranslationResult.unchanged(text, sourceLanguage, targetLanguage);
        }
        String translated = provider.translate(text, sourceLanguage, targetLanguage);
        log.debug("翻译完成: provider={}, length={}", provider.name(), text.length());
        return new TranslationResult(translated, text, sourceLanguage, targetLanguage, true);
    }

    public String getSourceLanguage() {
        return sourceLanguage;
    }

    public String getTargetLanguage() {
        return targetLanguage;
    }
}
