package com.phillippitts.livetranslate.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics for streaming sessions.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Processing jobs by kind (interim/final) and outcome</li>
 *   <li>Job latency by kind</li>
 *   <li>Rejected inbound messages by reason</li>
 *   <li>Collaborator failures by component</li>
 *   <li>Currently open sessions</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class StreamingMetrics {

    private static final String METRIC_PREFIX = "livetranslate";

    private final MeterRegistry registry;
    private final AtomicInteger activeSessions = new AtomicInteger();

    public StreamingMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder(METRIC_PREFIX + ".sessions.active", activeSessions, AtomicInteger::get)
                .description("Open streaming sessions")
                .register(registry);
    }

    public void sessionOpened() {
        activeSessions.incrementAndGet();
    }

    public void sessionClosed() {
        activeSessions.updateAndGet(n -> Math.max(0, n - 1));
    }

    public int activeSessions() {
        return activeSessions.get();
    }

    /**
     * Records one completed processing job.
     *
     * @param kind          interim or final
     * @param outcome       success, no_audio, too_short or failed
     * @param durationNanos wall time of the job
     */
    public void recordJob(String kind, String outcome, long durationNanos) {
        Counter.builder(METRIC_PREFIX + ".jobs")
                .description("Processing jobs by kind and outcome")
                .tag("kind", kind)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        Timer.builder(METRIC_PREFIX + ".jobs.latency")
                .description("Time taken to decode, transcribe and translate buffered audio")
                .tag("kind", kind)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementRejected(String reason) {
        Counter.builder(METRIC_PREFIX + ".messages.rejected")
                .description("Inbound messages answered with an error")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementCollaboratorFailure(String component) {
        Counter.builder(METRIC_PREFIX + ".collaborator.failures")
                .description("Failures reported by decode, transcription or translation collaborators")
                .tag("component", component)
                .register(registry)
                .increment();
    }
}
