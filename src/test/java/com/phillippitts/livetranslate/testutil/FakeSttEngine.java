package com.phillippitts.livetranslate.testutil;

import com.phillippitts.livetranslate.domain.TranscriptionResult;
import com.phillippitts.livetranslate.exception.TranscriptionException;
import com.phillippitts.livetranslate.service.stt.SttEngine;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test double for SttEngine with configurable transcription output.
 *
 * <p>Allows tests to control:
 * <ul>
 *   <li>Returned text and detected language (mutable fields)</li>
 *   <li>Failure mode (throws {@link TranscriptionException})</li>
 *   <li>Delay simulation, for concurrency tests</li>
 * </ul>
 * Also records language hints and the peak number of overlapping calls.
 */
public class FakeSttEngine implements SttEngine {
    public volatile String cannedText;
    public volatile String cannedLanguage;
    public volatile boolean failing;
    public volatile int delayMs;
    public final List<String> hints = new CopyOnWriteArrayList<>();
    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger maxRunning = new AtomicInteger();
    private final AtomicInteger calls = new AtomicInteger();

    public FakeSttEngine(String text, String language) {
        this.cannedText = text;
        this.cannedLanguage = language;
    }

    @Override
    public void initialize() {
        // No-op for fake
    }

    @Override
    public TranscriptionResult transcribe(byte[] pcm, String languageHint) {
        calls.incrementAndGet();
        hints.add(String.valueOf(languageHint));
        int now = running.incrementAndGet();
        maxRunning.accumulateAndGet(now, Math::max);
        try {
            if (delayMs > 0) {
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new TranscriptionException("Transcription interrupted", "fake", e);
                }
            }
            if (failing) {
                throw new TranscriptionException("Engine configured to fail", "fake");
            }
            return TranscriptionResult.of(cannedText, cannedLanguage, "fake");
        } finally {
            running.decrementAndGet();
        }
    }

    public int calls() {
        return calls.get();
    }

    public int maxConcurrentCalls() {
        return maxRunning.get();
    }

    @Override
    public String getEngineName() {
        return "fake";
    }

    @Override
    public boolean isHealthy() {
        return true;
    }

    @Override
    public void close() {
        // No-op for fake
    }
}
