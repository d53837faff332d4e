package com.phillippitts.livetranslate.domain.message;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Result of a flush.
 */
@JsonPropertyOrder({"type", "original_text", "translated_text", "detected_language", "target_language",
        "translation_skipped"})
public record FinalMessage(
        @JsonProperty("original_text") String originalText,
        @JsonProperty("translated_text") String translatedText,
        @JsonProperty("detected_language") String detectedLanguage,
        @JsonProperty("target_language") String targetLanguage,
        @JsonProperty("translation_skipped") boolean translationSkipped
) implements OutboundMessage {

    public static final String TYPE = "final";

    @Override
    @JsonProperty("type")
    public String type() {
        return TYPE;
    }
}
