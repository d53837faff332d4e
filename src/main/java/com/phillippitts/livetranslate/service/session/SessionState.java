package com.phillippitts.livetranslate.service.session;

/**
 * Lifecycle of a {@link StreamingSession}.
 *
 * <pre>
 * UNCONFIGURED -> CONFIGURED -> (STREAMING <-> PROCESSING) -> CLOSED
 * </pre>
 */
public enum SessionState {
    /** Connected; only a configuration (or close) message is accepted. */
    UNCONFIGURED,
    /** Configured with an empty buffer. */
    CONFIGURED,
    /** Audio is buffered, no job in flight. */
    STREAMING,
    /** A job for this session is in flight. */
    PROCESSING,
    /** Terminal; further messages are dropped. */
    CLOSED
}
