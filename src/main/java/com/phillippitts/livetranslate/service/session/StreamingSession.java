package com.phillippitts.livetranslate.service.session;

import com.phillippitts.livetranslate.config.logging.SessionMdc;
import com.phillippitts.livetranslate.domain.JobKind;
import com.phillippitts.livetranslate.domain.PartialTranscript;
import com.phillippitts.livetranslate.domain.ProcessingJob;
import com.phillippitts.livetranslate.domain.ProcessingOutcome;
import com.phillippitts.livetranslate.domain.SessionConfig;
import com.phillippitts.livetranslate.domain.TranscriptionResult;
import com.phillippitts.livetranslate.service.audio.AudioBuffer;
import com.phillippitts.livetranslate.service.metrics.StreamingMetrics;
import com.phillippitts.livetranslate.service.processing.ProcessingDispatcher;
import com.phillippitts.livetranslate.service.translation.LanguageCatalog;
import com.phillippitts.livetranslate.util.LogSanitizer;
import com.phillippitts.livetranslate.util.SerialExecutor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * State machine of one client connection.
 *
 * <p>Every public method only enqueues a command on the session's {@link SerialExecutor}; all
 * state below is read and written exclusively by tasks on that executor, including the
 * completion callbacks of processing jobs. That gives three guarantees without locks:
 * <ul>
 *   <li>at most one processing job per session is in flight ({@code processing} is checked and
 *       set on the same serial path that clears it)</li>
 *   <li>responses are emitted in the order of the inputs that triggered them</li>
 *   <li>heavy work never runs here; it is handed to the {@link ProcessingDispatcher}</li>
 * </ul>
 *
 * <p>Buffer accounting: a job receives a snapshot of the buffer, which is left untouched while
 * the job runs. On completion the submitted prefix is discarded (SUCCESS, NO_AUDIO, FAILED) or
 * kept (TOO_SHORT), so chunks that arrived meanwhile wait for the next round. A flush drains the
 * whole buffer into one final job.
 *
 * <p>While a flush is waiting or running, later messages are held and replayed after the final
 * result, so their responses follow it. Held chunks count against the buffer limit together
 * with the buffered audio; a chunk over the limit is held as its error response instead.
 */
public class StreamingSession {

    private static final Logger LOG = LogManager.getLogger(StreamingSession.class);

    private static final String AUTO = "auto";

    private final String id;
    private final SessionSettings settings;
    private final ProcessingDispatcher dispatcher;
    private final ResultEmitter emitter;
    private final LanguageCatalog languages;
    private final StreamingMetrics metrics;
    private final SerialExecutor mailbox;
    private final Consumer<StreamingSession> onClosed;

    // Confined to the mailbox
    private final AudioBuffer buffer = new AudioBuffer();
    private final Deque<Runnable> deferred = new ArrayDeque<>();
    private SessionConfig config;
    private boolean processing;
    private boolean flushInProgress;
    private boolean flushWaiting;
    private int retainedBytes;
    private long deferredBytes;
    private PartialTranscript lastPartial;

    private volatile SessionState state = SessionState.UNCONFIGURED;
    private volatile boolean closeRequested;

    public StreamingSession(String id,
                            SessionSettings settings,
                            ProcessingDispatcher dispatcher,
                            ResultEmitter emitter,
                            LanguageCatalog languages,
                            StreamingMetrics metrics,
                            SerialExecutor mailbox,
                            Consumer<StreamingSession> onClosed) {
        this.id = Objects.requireNonNull(id, "id");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.emitter = Objects.requireNonNull(emitter, "emitter");
        this.languages = Objects.requireNonNull(languages, "languages");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.mailbox = Objects.requireNonNull(mailbox, "mailbox");
        this.onClosed = onClosed == null ? s -> { } : onClosed;
    }

    public String id() {
        return id;
    }

    public SessionState state() {
        return state;
    }

    // ---- commands ---------------------------------------------------------------------------

    public void configure(String sourceLanguage, String targetLanguage) {
        submit(() -> handleConfigure(sourceLanguage, targetLanguage));
    }

    public void appendChunk(byte[] bytes) {
        if (closeRequested) {
            LOG.debug("Session {} closed; dropping chunk", id);
            return;
        }
        mailbox.execute(() -> inMdc(() -> dispatchChunk(bytes)));
    }

    public void flush() {
        submit(this::handleFlush);
    }

    /**
     * Answers an inbound message that could not be parsed. Goes through the mailbox so the
     * error is ordered with the other responses.
     */
    public void rejectMalformed(String detail) {
        submit(() -> rejected("malformed", detail));
    }

    /**
     * Terminal. Does not flush; buffered audio is discarded and results of an in-flight job are
     * dropped when it completes.
     */
    public void close() {
        if (closeRequested) {
            return;
        }
        closeRequested = true;
        mailbox.execute(() -> inMdc(this::handleClose));
    }

    private void submit(Runnable command) {
        if (closeRequested) {
            LOG.debug("Session {} closed; dropping message", id);
            return;
        }
        mailbox.execute(() -> inMdc(() -> dispatch(command)));
    }

    private void dispatch(Runnable command) {
        if (state == SessionState.CLOSED) {
            return;
        }
        if (flushInProgress) {
            deferred.add(command);
            return;
        }
        command.run();
    }

    private void dispatchChunk(byte[] bytes) {
        if (state == SessionState.CLOSED) {
            return;
        }
        if (!flushInProgress) {
            handleChunk(bytes);
            return;
        }
        int size = bytes == null ? 0 : bytes.length;
        Runnable violation = limitViolation(size, buffer.size() + deferredBytes);
        if (violation != null) {
            deferred.add(violation);
            return;
        }
        deferredBytes += size;
        deferred.add(() -> {
            deferredBytes -= size;
            handleChunk(bytes);
        });
    }

    private void inMdc(Runnable r) {
        try (SessionMdc ignored = SessionMdc.open(id)) {
            r.run();
        }
    }

    // ---- handlers (mailbox only) --------------------------------------------------------------

    private void handleConfigure(String sourceLanguage, String targetLanguage) {
        String target = normalize(targetLanguage);
        String source = normalize(sourceLanguage);
        if (AUTO.equals(source)) {
            source = null;
        }
        if (target == null) {
            rejected("config", "target_language is required");
            return;
        }
        if (!languages.isSupported(target)) {
            rejected("config", "Unsupported target_language: " + LogSanitizer.clientValue(target));
            return;
        }
        if (source != null && !languages.isSupported(source)) {
            rejected("config", "Unsupported source_language: " + LogSanitizer.clientValue(source));
            return;
        }
        boolean replaced = config != null;
        config = new SessionConfig(source, target);
        if (state == SessionState.UNCONFIGURED) {
            state = SessionState.CONFIGURED;
        }
        LOG.info("Session {} {}: source={}, target={}", id, replaced ? "reconfigured" : "configured",
                source == null ? AUTO : source, target);
        emitter.configAck(config);
    }

    private void handleChunk(byte[] bytes) {
        if (config == null) {
            rejected("not_configured", "Session is not configured; send a config message first");
            return;
        }
        if (bytes == null || bytes.length == 0) {
            return;
        }
        Runnable violation = limitViolation(bytes.length, buffer.size());
        if (violation != null) {
            violation.run();
            return;
        }
        buffer.append(bytes);
        if (!processing) {
            state = SessionState.STREAMING;
        }
        maybeSubmitInterim();
    }

    /**
     * Returns the rejection for a chunk of {@code size} bytes arriving while {@code heldBytes}
     * are already held, or null if it fits.
     */
    private Runnable limitViolation(int size, long heldBytes) {
        if (size > settings.maxChunkBytes()) {
            return () -> rejected("chunk_too_large", "Chunk of " + size + " bytes exceeds the limit of "
                    + settings.maxChunkBytes() + " bytes");
        }
        if (heldBytes + size > settings.maxBufferBytes()) {
            return () -> rejected("buffer_full", "Audio buffer limit of " + settings.maxBufferBytes()
                    + " bytes reached; send flush before more audio");
        }
        return null;
    }

    private void handleFlush() {
        if (config == null) {
            rejected("not_configured", "Session is not configured; send a config message first");
            return;
        }
        flushInProgress = true;
        if (processing) {
            flushWaiting = true;
            LOG.debug("Flush queued behind in-flight job");
            return;
        }
        runFinal();
    }

    private void handleClose() {
        state = SessionState.CLOSED;
        int discarded = buffer.size();
        buffer.clear();
        deferred.clear();
        deferredBytes = 0;
        LOG.info("Session {} closed (discarded {} buffered bytes, job in flight={})", id, discarded, processing);
        onClosed.accept(this);
    }

    private void rejected(String reason, String detail) {
        metrics.incrementRejected(reason);
        emitter.error(detail);
    }

    // ---- processing ---------------------------------------------------------------------------

    private void maybeSubmitInterim() {
        if (processing || flushInProgress || closeRequested || state == SessionState.CLOSED) {
            return;
        }
        int size = buffer.size();
        if (size >= settings.interimThresholdBytes() && size > retainedBytes) {
            startJob(ProcessingJob.interim(id, buffer.snapshot(), config));
        }
    }

    private void runFinal() {
        byte[] audio = buffer.drainAll();
        retainedBytes = 0;
        if (audio.length == 0) {
            if (lastPartial != null && lastPartial.hasTranslationFor(config.targetLanguage())) {
                PartialTranscript repeat = lastPartial;
                emitThenFinishFlush(() -> emitter.fin(repeat));
                return;
            }
            if (lastPartial == null) {
                String language = config.hasSourceHint()
                        ? config.sourceLanguage()
                        : TranscriptionResult.UNKNOWN_LANGUAGE;
                PartialTranscript empty = new PartialTranscript("", language, "", config.targetLanguage(), false);
                emitThenFinishFlush(() -> emitter.fin(empty));
                return;
            }
        }
        startJob(ProcessingJob.fin(id, audio, config, lastPartial));
    }

    private void startJob(ProcessingJob job) {
        processing = true;
        state = SessionState.PROCESSING;
        dispatcher.submit(job).whenComplete((outcome, error) ->
                mailbox.execute(() -> inMdc(() -> onJobComplete(job, outcome, error))));
    }

    private void onJobComplete(ProcessingJob job, ProcessingOutcome outcome, Throwable error) {
        processing = false;
        if (state == SessionState.CLOSED) {
            LOG.debug("Dropping {} result for closed session", job.kind().tag());
            return;
        }
        ProcessingOutcome result = error == null ? outcome : ProcessingOutcome.failed(job, error.toString());
        if (job.kind() == JobKind.INTERIM) {
            onInterimComplete(result);
        } else {
            onFinalComplete(result);
        }
    }

    private void onInterimComplete(ProcessingOutcome outcome) {
        int submitted = Math.min(outcome.submittedBytes(), buffer.size());
        try {
            applyInterim(outcome, submitted);
        } finally {
            state = buffer.isEmpty() ? SessionState.CONFIGURED : SessionState.STREAMING;
            if (flushWaiting) {
                flushWaiting = false;
                runFinal();
            } else {
                maybeSubmitInterim();
            }
        }
    }

    private void applyInterim(ProcessingOutcome outcome, int submitted) {
        switch (outcome.status()) {
            case SUCCESS -> {
                buffer.discardPrefix(submitted);
                retainedBytes = 0;
                if (outcome.hasText()) {
                    lastPartial = toPartial(outcome);
                    emitter.interim(outcome);
                }
            }
            case NO_AUDIO -> {
                buffer.discardPrefix(submitted);
                retainedBytes = 0;
                LOG.debug("Interim pass found no audio in {} bytes", submitted);
            }
            case TOO_SHORT -> {
                retainedBytes = outcome.submittedBytes();
                LOG.debug("Interim pass too short; keeping {} bytes", retainedBytes);
            }
            case FAILED -> {
                buffer.discardPrefix(submitted);
                retainedBytes = 0;
                emitter.error("Processing failed: " + outcome.reason());
            }
        }
    }

    private void onFinalComplete(ProcessingOutcome outcome) {
        if (!outcome.originalText().isBlank()) {
            lastPartial = toPartial(outcome);
        }
        emitThenFinishFlush(() -> {
            if (outcome.status() == ProcessingOutcome.Status.FAILED) {
                emitter.error("Processing failed: " + outcome.reason());
            }
            emitter.fin(outcome);
        });
    }

    /** The flush ends even when emitting its result fails, so held messages are not stranded. */
    private void emitThenFinishFlush(Runnable emission) {
        try {
            emission.run();
        } finally {
            finishFlush();
        }
    }

    private void finishFlush() {
        flushInProgress = false;
        state = buffer.isEmpty() ? SessionState.CONFIGURED : SessionState.STREAMING;
        while (!deferred.isEmpty() && !flushInProgress && !closeRequested && state != SessionState.CLOSED) {
            Runnable next = deferred.poll();
            try {
                next.run();
            } catch (RuntimeException e) {
                LOG.error("Held message failed on replay: {}", e.toString(), e);
            }
        }
        maybeSubmitInterim();
    }

    private static PartialTranscript toPartial(ProcessingOutcome outcome) {
        String translated = outcome.translatedText().isEmpty() ? null : outcome.translatedText();
        return new PartialTranscript(outcome.originalText(), outcome.detectedLanguage(), translated,
                translated == null ? null : outcome.targetLanguage(), outcome.translationSkipped());
    }

    private static String normalize(String language) {
        if (language == null || language.isBlank()) {
            return null;
        }
        return language.trim().toLowerCase(Locale.ROOT);
    }
}
