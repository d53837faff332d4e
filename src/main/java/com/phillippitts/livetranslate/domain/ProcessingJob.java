package com.phillippitts.livetranslate.domain;

import java.util.Objects;

/**
 * One unit of decode, transcribe and translate work submitted by a session.
 *
 * @param sessionId owning session
 * @param kind      interim or final
 * @param audio     snapshot of buffered compressed bytes (may be empty for a final job)
 * @param config    session configuration at submission time
 * @param fallback  text to use for a final result when the audio yields none (nullable)
 */
public record ProcessingJob(
        String sessionId,
        JobKind kind,
        byte[] audio,
        SessionConfig config,
        PartialTranscript fallback
) {

    public ProcessingJob {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(audio, "audio must not be null");
        Objects.requireNonNull(config, "config must not be null");
    }

    public static ProcessingJob interim(String sessionId, byte[] audio, SessionConfig config) {
        return new ProcessingJob(sessionId, JobKind.INTERIM, audio, config, null);
    }

    public static ProcessingJob fin(String sessionId, byte[] audio, SessionConfig config,
                                    PartialTranscript fallback) {
        return new ProcessingJob(sessionId, JobKind.FINAL, audio, config, fallback);
    }

    public int size() {
        return audio.length;
    }
}
