package com.phillippitts.livetranslate.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable result of a speech-to-text call.
 *
 * @param text             transcribed text (never null; empty for silence)
 * @param detectedLanguage language reported by the engine, or the hint when the engine reports none
 * @param timestamp        when the transcription completed
 * @param engineName       engine that produced the result (e.g. "whisper")
 */
public record TranscriptionResult(
        String text,
        String detectedLanguage,
        Instant timestamp,
        String engineName
) {

    /** Language code used when neither the engine nor the client names a language. */
    public static final String UNKNOWN_LANGUAGE = "unknown";

    public TranscriptionResult {
        Objects.requireNonNull(text, "Transcription text must not be null");
        Objects.requireNonNull(timestamp, "Timestamp must not be null");
        Objects.requireNonNull(engineName, "Engine name must not be null");
        if (detectedLanguage == null || detectedLanguage.isBlank()) {
            detectedLanguage = UNKNOWN_LANGUAGE;
        }
    }

    public static TranscriptionResult of(String text, String detectedLanguage, String engineName) {
        return new TranscriptionResult(text, detectedLanguage, Instant.now(), engineName);
    }

    public boolean isBlank() {
        return text.isBlank();
    }
}
