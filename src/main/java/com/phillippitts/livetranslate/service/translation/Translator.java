package com.phillippitts.livetranslate.service.translation;

import com.phillippitts.livetranslate.exception.TranslationException;
import com.phillippitts.livetranslate.exception.UnsupportedLanguagePairException;

/**
 * Machine-translation collaborator. Loaded once and shared by all sessions; every call is
 * independent.
 */
public interface Translator {

    /**
     * @param text           text to translate (non-blank)
     * @param sourceLanguage language of {@code text}
     * @param targetLanguage requested language
     * @return translated text
     * @throws UnsupportedLanguagePairException if no model exists for the pair
     * @throws TranslationException             on any other translation failure
     */
    String translate(String text, String sourceLanguage, String targetLanguage);

    /** Whether a model exists for the pair. */
    boolean supports(String sourceLanguage, String targetLanguage);
}
