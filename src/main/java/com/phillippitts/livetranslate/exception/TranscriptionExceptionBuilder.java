package com.phillippitts.livetranslate.exception;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Fluent builder for {@link TranscriptionException} carrying process diagnostics.
 *
 * <p>Produces messages of the form
 * {@code <message> (exitCode=1, durationMs=1500, binaryPath=..., stderr=...)}.
 * <pre>
 * throw TranscriptionExceptionBuilder.create("Non-zero exit")
 *         .engine("whisper")
 *         .exitCode(2)
 *         .metadata("stderr", snippet)
 *         .build();
 * </pre>
 */
public final class TranscriptionExceptionBuilder {

    private final String message;
    private final Map<String, String> details = new LinkedHashMap<>();
    private String engineName = "unknown";
    private Throwable cause;

    private TranscriptionExceptionBuilder(String message) {
        this.message = message;
    }

    public static TranscriptionExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new TranscriptionExceptionBuilder(message);
    }

    public TranscriptionExceptionBuilder engine(String engineName) {
        if (engineName != null) {
            this.engineName = engineName;
        }
        return this;
    }

    public TranscriptionExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public TranscriptionExceptionBuilder exitCode(int exitCode) {
        details.put("exitCode", String.valueOf(exitCode));
        return this;
    }

    public TranscriptionExceptionBuilder durationMs(long durationMs) {
        details.put("durationMs", String.valueOf(durationMs));
        return this;
    }

    /**
     * Adds a diagnostic key/value pair. Null keys or values are ignored.
     */
    public TranscriptionExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            details.put(key, String.valueOf(value));
        }
        return this;
    }

    public TranscriptionException build() {
        String detailed = message;
        if (!details.isEmpty()) {
            StringJoiner joiner = new StringJoiner(", ", " (", ")");
            details.forEach((k, v) -> joiner.add(k + "=" + v));
            detailed = message + joiner;
        }
        return cause != null
                ? new TranscriptionException(detailed, engineName, cause)
                : new TranscriptionException(detailed, engineName);
    }
}
