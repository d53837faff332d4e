package com.phillippitts.livetranslate.domain;

import java.util.Objects;

/**
 * Effective configuration of one streaming session.
 *
 * @param sourceLanguage optional language hint; {@code null} means auto-detect
 * @param targetLanguage language results are translated into
 */
public record SessionConfig(String sourceLanguage, String targetLanguage) {

    public SessionConfig {
        Objects.requireNonNull(targetLanguage, "targetLanguage must not be null");
        if (sourceLanguage != null && sourceLanguage.isBlank()) {
            sourceLanguage = null;
        }
    }

    public boolean hasSourceHint() {
        return sourceLanguage != null;
    }
}
