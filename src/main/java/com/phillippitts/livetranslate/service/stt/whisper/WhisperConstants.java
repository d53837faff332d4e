package com.phillippitts.livetranslate.service.stt.whisper;

/**
 * Constants for whisper.cpp invocation.
 */
final class WhisperConstants {

    static final String ENGINE = "whisper";

    /** Language argument that makes whisper.cpp detect the spoken language. */
    static final String AUTO_LANGUAGE = "auto";

    /** Stderr characters included in error messages (roughly the first 30 lines). */
    static final int ERROR_SNIPPET_MAX_CHARS = 2048;

    private WhisperConstants() {
        // Utility class - prevent instantiation
    }
}
