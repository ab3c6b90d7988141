package com.sunny.notepillar.server.translation;

import com.sunny.notepillar.common.exception.InternalException;
import java.lang.Character.UnicodeScript;
import java.util.Locale;

/**
 * 源语言文字判定
 * 翻译与预览共用同一判定，文本含任一源文字字符即视为可翻译
 *
 * @author Sunny
 * @date 2026-03-05
 */
public class SourceScriptClassifier {

    private final UnicodeScript script;

    public SourceScriptClassifier(String scriptName) {
        this.script = resolveScript(scriptName);
    }

    public boolean containsSourceScript(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        return text.codePoints().anyMatch(codePoint -> UnicodeScript.of(codePoint) == script);
    }

    public UnicodeScript getScript() {
        return script;
    }

    private static UnicodeScript resolveScript(String scriptName) {
        if (scriptName == null || scriptName.isBlank()) {
            return UnicodeScript.CYRILLIC;
        }
        try {
            return UnicodeScript.valueOf(scriptName.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InternalException(e, "无法识别的源文字系统: %s", scriptName);
        }
    }
}
