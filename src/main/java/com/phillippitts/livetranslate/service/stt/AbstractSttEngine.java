package com.phillippitts.livetranslate.service.stt;

import com.phillippitts.livetranslate.exception.TranscriptionException;
import com.phillippitts.livetranslate.service.events.EngineEventPublisher;
import jakarta.annotation.PreDestroy;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Map;

/**
 * Lifecycle template for {@link SttEngine}s: synchronized, idempotent initialize and close,
 * plus a shared failure path that publishes an event and wraps the cause.
 */
public abstract class AbstractSttEngine implements SttEngine {

    protected final Object lock = new Object();

    protected boolean initialized = false;

    protected boolean closed = false;

    @Override
    public final void initialize() {
        synchronized (lock) {
            if (initialized && !closed) {
                return;
            }
            doInitialize();
            initialized = true;
            closed = false;
        }
    }

    protected abstract void doInitialize();

    @Override
    public final boolean isHealthy() {
        synchronized (lock) {
            return initialized && !closed;
        }
    }

    @Override
    @PreDestroy
    public final void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            doClose();
            closed = true;
            initialized = false;
        }
    }

    protected abstract void doClose();

    /**
     * Lazily initializes on first use and rejects calls after close.
     */
    protected final void ensureInitialized() {
        synchronized (lock) {
            if (closed) {
                throw new TranscriptionException(getEngineName() + " engine closed", getEngineName());
            }
            if (!initialized) {
                doInitialize();
                initialized = true;
            }
        }
    }

    /**
     * Publishes a failure event and returns the exception to throw, without double-wrapping
     * a {@link TranscriptionException}.
     */
    protected final TranscriptionException transcriptionFailure(Exception exception,
                                                                ApplicationEventPublisher publisher,
                                                                Map<String, String> context) {
        EngineEventPublisher.publishFailure(publisher, getEngineName(), "transcription failure",
                exception, context);
        if (exception instanceof TranscriptionException te) {
            return te;
        }
        return new TranscriptionException(getEngineName() + " transcription failed: " + exception.getMessage(),
                getEngineName(), exception);
    }
}
