package com.phillippitts.livetranslate.testutil;

import com.phillippitts.livetranslate.exception.TranslationException;
import com.phillippitts.livetranslate.exception.UnsupportedLanguagePairException;
import com.phillippitts.livetranslate.service.translation.Translator;

import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Translator double: prefixes the text with the target code, e.g. {@code "[ar] hello"}.
 * Pairs outside {@code supportedPairs} raise {@link UnsupportedLanguagePairException}.
 */
public class FakeTranslator implements Translator {
    private final Set<String> supportedPairs;
    public volatile boolean failing;
    private final AtomicInteger calls = new AtomicInteger();

    public FakeTranslator() {
        this(Set.of("en-ar", "ar-en"));
    }

    public FakeTranslator(Set<String> supportedPairs) {
        this.supportedPairs = supportedPairs;
    }

    @Override
    public String translate(String text, String sourceLanguage, String targetLanguage) {
        calls.incrementAndGet();
        if (!supports(sourceLanguage, targetLanguage)) {
            throw new UnsupportedLanguagePairException(sourceLanguage, targetLanguage);
        }
        if (failing) {
            throw new TranslationException("translation service down", sourceLanguage, targetLanguage);
        }
        return "[" + targetLanguage + "] " + text;
    }

    @Override
    public boolean supports(String sourceLanguage, String targetLanguage) {
        return supportedPairs.contains(sourceLanguage + "-" + targetLanguage);
    }

    public int calls() {
        return calls.get();
    }
}
