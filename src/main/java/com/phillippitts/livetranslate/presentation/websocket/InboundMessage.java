package com.phillippitts.livetranslate.presentation.websocket;

/**
 * A parsed client-to-server message.
 */
public interface InboundMessage {

    /** {@code config}: set or replace the session configuration. */
    record Config(String sourceLanguage, String targetLanguage) implements InboundMessage {
    }

    /** {@code chunk}: audio bytes, already decoded from the wire encoding. */
    record Chunk(byte[] data) implements InboundMessage {
    }

    /** {@code flush}: force a final pass. */
    record Flush() implements InboundMessage {
    }

    /** {@code close}: terminate the session. */
    record Close() implements InboundMessage {
    }
}
