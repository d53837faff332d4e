package com.phillippitts.livetranslate.util;

import java.time.Duration;

/**
 * Timeouts for external processes (whisper.cpp, ffmpeg) and their stream reader threads.
 *
 * @see com.phillippitts.livetranslate.util.process.ExternalProcessRunner
 */
public final class ProcessTimeouts {

    /** How long reader threads get to drain remaining output after the process exits. */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /** Join timeout for reader threads during cleanup; they are daemons. */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /** Wait after {@link Process#destroy()} before escalating. */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /** Wait after {@link Process#destroyForcibly()}. */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /** Bound on writing a chunk to a decoder's stdin. */
    public static final Duration STDIN_WRITE_TIMEOUT = Duration.ofSeconds(5);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
