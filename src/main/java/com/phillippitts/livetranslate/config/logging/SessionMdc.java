package com.phillippitts.livetranslate.config.logging;

import org.apache.logging.log4j.ThreadContext;

/**
 * Scoped {@code sessionId} entry in the Log4j2 {@link ThreadContext}.
 *
 * <pre>
 * try (SessionMdc ignored = SessionMdc.open(sessionId)) {
 *     LOG.info("...");   // pattern prints [sessionId]
 * }
 * </pre>
 *
 * <p>The previous value, if any, is restored on close so nested scopes behave.
 */
public final class SessionMdc implements AutoCloseable {

    public static final String SESSION_ID = "sessionId";

    private final String previous;

    private SessionMdc(String sessionId) {
        this.previous = ThreadContext.get(SESSION_ID);
        ThreadContext.put(SESSION_ID, sessionId);
    }

    public static SessionMdc open(String sessionId) {
        return new SessionMdc(sessionId);
    }

    @Override
    public void close() {
        if (previous == null) {
            ThreadContext.remove(SESSION_ID);
        } else {
            ThreadContext.put(SESSION_ID, previous);
        }
    }
}
