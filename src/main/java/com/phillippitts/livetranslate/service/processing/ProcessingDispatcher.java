package com.phillippitts.livetranslate.service.processing;

import com.phillippitts.livetranslate.domain.ProcessingJob;
import com.phillippitts.livetranslate.domain.ProcessingOutcome;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs {@link ProcessingJob}s on the shared, bounded processing pool, off every session's
 * message-handling path.
 *
 * <p>When all workers are busy, jobs wait in the pool's queue; saturation delays a job but never
 * fails it. The returned future always completes normally with an outcome.
 */
@Component
public class ProcessingDispatcher {

    private static final Logger LOG = LogManager.getLogger(ProcessingDispatcher.class);

    private final TranscriptionPipeline pipeline;
    private final Executor executor;
    private final AtomicInteger inFlight = new AtomicInteger();

    public ProcessingDispatcher(TranscriptionPipeline pipeline,
                                @Qualifier("processingExecutor") Executor executor) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public CompletableFuture<ProcessingOutcome> submit(ProcessingJob job) {
        Objects.requireNonNull(job, "job");
        inFlight.incrementAndGet();
        LOG.debug("Submitting {} job: {} bytes", job.kind().tag(), job.size());
        return CompletableFuture.supplyAsync(() -> pipeline.process(job), executor)
                .exceptionally(e -> ProcessingOutcome.failed(job, "Internal processing error: " + e.getMessage()))
                .whenComplete((outcome, e) -> inFlight.decrementAndGet());
    }

    /** Jobs submitted and not yet completed, across all sessions. */
    public int inFlight() {
        return inFlight.get();
    }
}
