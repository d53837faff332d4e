package com.phillippitts.livetranslate.domain.message;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Non-fatal processing or validation failure. The connection stays open.
 */
@JsonPropertyOrder({"type", "detail"})
public record ErrorMessage(@JsonProperty("detail") String detail) implements OutboundMessage {

    public static final String TYPE = "error";

    @Override
    @JsonProperty("type")
    public String type() {
        return TYPE;
    }
}
