package com.phillippitts.livetranslate.exception;

/**
 * Base exception for all livetranslate application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class LiveTranslateException extends RuntimeException {

    public LiveTranslateException(String message) {
        super(message);
    }

    public LiveTranslateException(String message, Throwable cause) {
        super(message, cause);
    }

    public LiveTranslateException(Throwable cause) {
        super(cause);
    }
}
