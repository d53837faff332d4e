package com.phillippitts.livetranslate.domain.message;

/**
 * A server-to-client message. Serialized as a JSON object whose {@code type} field names the kind.
 */
public interface OutboundMessage {

    String type();
}
