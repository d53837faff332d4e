package com.phillippitts.livetranslate.exception;

/**
 * Thrown when no translation model exists for the requested language pair.
 *
 * <p>Never fatal for a processing job: the pipeline degrades to the untranslated text
 * and flags the result as {@code translationSkipped}.
 */
public class UnsupportedLanguagePairException extends TranslationException {

    public UnsupportedLanguagePairException(String sourceLanguage, String targetLanguage) {
        super("Unsupported language pair", sourceLanguage, targetLanguage);
    }
}
