package com.phillippitts.livetranslate.config.stt;

/**
 * Constants related to the transcription model file.
 */
public final class SttModelConstants {

    /**
     * Smallest plausible GGML model in bytes. The multilingual tiny model is ~75 MB;
     * anything under 30 MB is treated as truncated or corrupt.
     */
    public static final long MIN_WHISPER_MODEL_SIZE_BYTES = 30L * 1024 * 1024;

    private SttModelConstants() {}
}
