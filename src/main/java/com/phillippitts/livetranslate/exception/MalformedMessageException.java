package com.phillippitts.livetranslate.exception;

/**
 * Thrown when an inbound client message cannot be interpreted: invalid JSON, unknown
 * message type, missing fields, unsupported chunk encoding, invalid base64 payload or
 * an oversized chunk.
 *
 * <p>Always rejected at the message layer; the session and its buffer are left untouched.
 */
public class MalformedMessageException extends LiveTranslateException {

    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
