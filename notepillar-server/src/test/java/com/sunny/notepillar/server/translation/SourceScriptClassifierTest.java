package com.sunny.notepillar.server.translation;

import com.sunny.notepillar.common.exception.InternalException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SourceScriptClassifierTest {

    private final SourceScriptClassifier classifier = new SourceScriptClassifier("cyrillic");

    @Test
    void containsSourceScript_shouldDetectAnyCyrillicCharacter() {
        assertTrue(classifier.containsSourceScript("Привет"));
        assertTrue(classifier.containsSourceScript("Meeting at 10, затем обед"));
        assertTrue(classifier.containsSourceScript("ё"));
    }

    @Test
    void containsSourceScript_shouldIgnoreOtherScripts() {
        assertFalse(classifier.containsSourceScript("Hello, world 123"));
        assertFalse(classifier.containsSourceScript("Γειά σου"));
        assertFalse(classifier.containsSourceScript(""));
        assertFalse(classifier.containsSourceScript(null));
    }

    @Test
    void constructor_shouldDefaultToCyrillicAndRejectUnknownScript() {
        assertEquals(Character.UnicodeScript.CYRILLIC, new SourceScriptClassifier(null).getScript());
        assertThrows(InternalException.class, () -> new SourceScriptClassifier("klingon"));
    }

    @Test
    void textTranslator_shouldNotCallProviderForNonSourceText() {
        TranslationProvider failing = new TranslationProvider() {
            @Override
            public String translate(String text, String sourceLanguage, String targetLanguage) {
                throw new IllegalStateException("provider must not be called");
            }

            @Override
            public String name() {
                return "failing";
            }
        };
        TextTranslator translator = new TextTranslator(classifier, failing, "ru", "en");

        TranslationResult result = translator.translate("Hello");

        assertFalse(result.translated());
        assertEquals("Hello", result.translatedText());
    }

    @Test
    void offlineProvider_shouldProduceMarkedText() {
        TextTranslator translator = new TextTranslator(classifier, new OfflineTranslationProvider(), "ru", "en");

        TranslationResult result = translator.translate("Привет");

        assertTrue(result.translated());
        assertEquals("[Translated from ru to en]: Привет", result.translatedText());
        assertEquals("Привет", result.originalText());
    }
}
