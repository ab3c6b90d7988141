package com.sunny.notepillar.server.translation;

/**
 * 离线翻译替身
 * 不访问网络，输出可预测的标记文本
 *
 * @author Sunny
 * @date 2026-03-05
 */
public class OfflineTranslationProvider implements TranslationProvider {

    @Override
    public String translate(String text, String sourceLanguage, String targetLanguage) {
        return "[Translated from " + sourceLanguage + " to " + targetLanguage + "]: " + text;
    }

    @Override
    public String name() {
        return "offline";
    }
}
