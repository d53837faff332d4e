package com.phillippitts.livetranslate.domain;

import java.util.Objects;

/**
 * Most recent text a session has seen, used to answer a flush that has no new audio.
 *
 * @param text             transcribed text
 * @param detectedLanguage language of {@code text}
 * @param translatedText   translation of {@code text}, or null if none was produced
 * @param targetLanguage   language of {@code translatedText}, or null
 * @param translationSkipped whether the language pair was unsupported
 */
public record PartialTranscript(
        String text,
        String detectedLanguage,
        String translatedText,
        String targetLanguage,
        boolean translationSkipped
) {

    public PartialTranscript {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(detectedLanguage, "detectedLanguage must not be null");
    }

    /** True when the stored translation was produced for {@code target}. */
    public boolean hasTranslationFor(String target) {
        return translatedText != null && target != null && target.equals(targetLanguage);
    }
}
