package com.phillippitts.livetranslate.service.stt.util;

import com.phillippitts.livetranslate.exception.TranscriptionException;
import com.phillippitts.livetranslate.service.events.EngineEventPublisher;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Map;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Semaphore with bounded waiting around engine calls.
 *
 * <pre>{@code
 * guard.acquire();          // waits up to timeoutMs
 * try {
 *     // ... run the engine ...
 * } finally {
 *     guard.release();
 * }
 * }</pre>
 *
 * <p>Thread-safe. A timed-out acquire publishes an engine failure event and throws.
 */
public final class ConcurrencyGuard {

    private final Semaphore semaphore;
    private final long timeoutMs;
    private final String engineName;
    private final ApplicationEventPublisher publisher;

    /**
     * @param permits    maximum concurrent holders
     * @param timeoutMs  maximum wait for a permit
     * @param engineName used in messages and events
     * @param publisher  event publisher (nullable)
     */
    public ConcurrencyGuard(int permits, long timeoutMs, String engineName, ApplicationEventPublisher publisher) {
        this.semaphore = new Semaphore(Math.max(1, permits), true);
        this.timeoutMs = Math.max(0, timeoutMs);
        this.engineName = engineName;
        this.publisher = publisher;
    }

    /**
     * @throws TranscriptionException if no permit became available in time, or on interrupt
     */
    public void acquire() {
        try {
            if (!semaphore.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS)) {
                EngineEventPublisher.publishFailure(publisher, engineName,
                        "concurrency limit reached after " + timeoutMs + "ms wait", null,
                        Map.of("reason", "concurrency-limit", "timeoutMs", String.valueOf(timeoutMs)));
                throw new TranscriptionException(
                        engineName + " concurrency limit reached after " + timeoutMs + "ms wait", engineName);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TranscriptionException(engineName + " interrupted while waiting for a slot", engineName, e);
        }
    }

    public void release() {
        semaphore.release();
    }

    public int availablePermits() {
        return semaphore.availablePermits();
    }
}
