package com.phillippitts.livetranslate.domain.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Partial result of a threshold-triggered pass. The translation fields are omitted when interim
 * translation is switched off.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "text", "detected_language", "translated_text", "target_language",
        "translation_skipped"})
public record InterimMessage(
        @JsonProperty("text") String text,
        @JsonProperty("detected_language") String detectedLanguage,
        @JsonProperty("translated_text") String translatedText,
        @JsonProperty("target_language") String targetLanguage,
        @JsonProperty("translation_skipped") Boolean translationSkipped
) implements OutboundMessage {

    public static final String TYPE = "interim";

    public static InterimMessage untranslated(String text, String detectedLanguage) {
        return new InterimMessage(text, detectedLanguage, null, null, null);
    }

    @Override
    @JsonProperty("type")
    public String type() {
        return TYPE;
    }
}
