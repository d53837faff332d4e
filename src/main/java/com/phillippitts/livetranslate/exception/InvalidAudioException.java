package com.phillippitts.livetranslate.exception;

/**
 * Thrown when a chunk decoder cannot turn buffered bytes into PCM audio
 * (corrupt container, decoder process failure, unsupported encoding).
 */
public class InvalidAudioException extends LiveTranslateException {

    private final int audioSize;
    private final String reason;

    public InvalidAudioException(String reason) {
        super("Invalid audio data: " + reason);
        this.audioSize = 0;
        this.reason = reason;
    }

    public InvalidAudioException(int audioSize, String reason) {
        super("Invalid audio data (" + audioSize + " bytes): " + reason);
        this.audioSize = audioSize;
        this.reason = reason;
    }

    public InvalidAudioException(int audioSize, String reason, Throwable cause) {
        super("Invalid audio data (" + audioSize + " bytes): " + reason, cause);
        this.audioSize = audioSize;
        this.reason = reason;
    }

    public int getAudioSize() {
        return audioSize;
    }

    public String getReason() {
        return reason;
    }
}
