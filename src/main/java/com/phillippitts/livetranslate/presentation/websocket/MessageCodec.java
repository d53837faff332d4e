package com.phillippitts.livetranslate.presentation.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.livetranslate.domain.message.OutboundMessage;
import com.phillippitts.livetranslate.exception.LiveTranslateException;
import com.phillippitts.livetranslate.exception.MalformedMessageException;
import com.phillippitts.livetranslate.util.LogSanitizer;
import org.springframework.stereotype.Component;

import java.util.Base64;

/**
 * JSON wire format of the streaming protocol.
 *
 * <p>Inbound messages are objects with a {@code type} of {@code config}, {@code chunk},
 * {@code flush} or {@code close}. Anything else is a {@link MalformedMessageException}.
 */
@Component
public class MessageCodec {

    static final String BASE64 = "base64";

    private final ObjectMapper mapper;

    public MessageCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public InboundMessage decode(String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedMessageException("Message must be a JSON object");
        }
        String type = text(root, "type");
        if (type == null) {
            throw new MalformedMessageException("Missing message type");
        }
        return switch (type) {
            case "config" -> new InboundMessage.Config(text(root, "source_language"), text(root, "target_language"));
            case "chunk" -> new InboundMessage.Chunk(chunkData(root));
            case "flush" -> new InboundMessage.Flush();
            case "close" -> new InboundMessage.Close();
            default -> throw new MalformedMessageException(
                    "Unknown message type: " + LogSanitizer.clientValue(type));
        };
    }

    public String encode(OutboundMessage message) {
        try {
            return mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new LiveTranslateException("Failed to serialize " + message.type() + " message", e);
        }
    }

    private static byte[] chunkData(JsonNode root) {
        String encoding = text(root, "encoding");
        if (encoding != null && !BASE64.equalsIgnoreCase(encoding)) {
            throw new MalformedMessageException("Unsupported chunk encoding: " + LogSanitizer.clientValue(encoding));
        }
        JsonNode data = root.get("data");
        if (data == null || !data.isTextual()) {
            throw new MalformedMessageException("Chunk data must be a base64 string");
        }
        try {
            return Base64.getDecoder().decode(data.textValue());
        } catch (IllegalArgumentException e) {
            throw new MalformedMessageException("Chunk data is not valid base64", e);
        }
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw new MalformedMessageException("Field '" + field + "' must be a string");
        }
        return node.textValue();
    }
}
