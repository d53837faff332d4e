package com.phillippitts.livetranslate.domain;

import java.util.Objects;

/**
 * Text after the translation step.
 *
 * @param text    translated text, or the original text when translation was skipped
 * @param skipped true when no translation model exists for the language pair
 */
public record TranslationResult(String text, boolean skipped) {

    public TranslationResult {
        Objects.requireNonNull(text, "text must not be null");
    }

    public static TranslationResult translated(String text) {
        return new TranslationResult(text, false);
    }

    /** Source and target language are the same, so the text is passed through. */
    public static TranslationResult identity(String text) {
        return new TranslationResult(text, false);
    }

    public static TranslationResult skipped(String original) {
        return new TranslationResult(original, true);
    }
}
