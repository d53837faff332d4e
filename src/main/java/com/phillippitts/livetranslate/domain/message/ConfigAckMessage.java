package com.phillippitts.livetranslate.domain.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.phillippitts.livetranslate.domain.SessionConfig;

/**
 * Configuration accepted; echoes the effective values.
 */
@JsonPropertyOrder({"type", "config"})
public record ConfigAckMessage(@JsonProperty("config") EffectiveConfig config) implements OutboundMessage {

    public static final String TYPE = "config_ack";

    public static ConfigAckMessage of(SessionConfig config) {
        return new ConfigAckMessage(new EffectiveConfig(config.sourceLanguage(), config.targetLanguage()));
    }

    @Override
    @JsonProperty("type")
    public String type() {
        return TYPE;
    }

    /** Wire view of a session configuration; {@code source_language} is null for auto-detect. */
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public record EffectiveConfig(
            @JsonProperty("source_language") String sourceLanguage,
            @JsonProperty("target_language") String targetLanguage) {
    }
}
