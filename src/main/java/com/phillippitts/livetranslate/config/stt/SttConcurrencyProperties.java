package com.phillippitts.livetranslate.config.stt;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Engine-level cap on simultaneous whisper.cpp processes, independent of the processing pool size.
 *
 * <p>Properties:
 * <ul>
 *   <li>stt.concurrency.whisper-max - maximum parallel whisper.cpp processes (default: 2)</li>
 *   <li>stt.concurrency.acquire-timeout-ms - how long a job waits for a slot (default: 30000)</li>
 * </ul>
 *
 * <p>The wait is long on purpose: a saturated engine should delay jobs, not fail them.
 */
@ConfigurationProperties(prefix = "stt.concurrency")
@Validated
public class SttConcurrencyProperties {

    @Positive(message = "Whisper max concurrency must be positive")
    private int whisperMax = 2;

    /** Semaphore wait in milliseconds; 0 rejects immediately when all slots are busy. */
    @PositiveOrZero(message = "Acquire timeout must not be negative")
    private int acquireTimeoutMs = 30_000;

    public int getWhisperMax() {
        return whisperMax;
    }

    public void setWhisperMax(int whisperMax) {
        this.whisperMax = whisperMax;
    }

    public int getAcquireTimeoutMs() {
        return acquireTimeoutMs;
    }

    public void setAcquireTimeoutMs(int acquireTimeoutMs) {
        this.acquireTimeoutMs = acquireTimeoutMs;
    }
}
