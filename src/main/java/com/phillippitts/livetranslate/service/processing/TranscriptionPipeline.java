package com.phillippitts.livetranslate.service.processing;

import com.phillippitts.livetranslate.config.logging.SessionMdc;
import com.phillippitts.livetranslate.config.properties.StreamingProperties;
import com.phillippitts.livetranslate.domain.JobKind;
import com.phillippitts.livetranslate.domain.PartialTranscript;
import com.phillippitts.livetranslate.domain.ProcessingJob;
import com.phillippitts.livetranslate.domain.ProcessingOutcome;
import com.phillippitts.livetranslate.domain.TranscriptionResult;
import com.phillippitts.livetranslate.domain.TranslationResult;
import com.phillippitts.livetranslate.exception.LiveTranslateException;
import com.phillippitts.livetranslate.exception.UnsupportedLanguagePairException;
import com.phillippitts.livetranslate.service.audio.AudioFormat;
import com.phillippitts.livetranslate.service.audio.AudioSilenceDetector;
import com.phillippitts.livetranslate.service.audio.decode.ChunkDecoder;
import com.phillippitts.livetranslate.service.metrics.StreamingMetrics;
import com.phillippitts.livetranslate.service.stt.SttEngine;
import com.phillippitts.livetranslate.service.stt.TranscriptCleaner;
import com.phillippitts.livetranslate.service.translation.Translator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Decode, transcribe and translate for one {@link ProcessingJob}.
 *
 * <p>Never throws: every collaborator exception becomes a {@link ProcessingOutcome.Status#FAILED}
 * outcome. Steps:
 * <ol>
 *   <li>decode; no samples or silence gives NO_AUDIO</li>
 *   <li>fewer samples than {@code streaming.min-duration-ms} gives TOO_SHORT</li>
 *   <li>transcribe with the session's source hint</li>
 *   <li>translate when the text is non-blank and the detected language differs from the target;
 *       an unsupported pair keeps the original text and flags the skip</li>
 * </ol>
 * A final job that ends without text of its own takes the session's last partial transcript,
 * translated into the current target when needed.
 */
@Component
public class TranscriptionPipeline {

    private static final Logger LOG = LogManager.getLogger(TranscriptionPipeline.class);

    private final ChunkDecoder decoder;
    private final SttEngine sttEngine;
    private final Translator translator;
    private final StreamingProperties props;
    private final StreamingMetrics metrics;

    public TranscriptionPipeline(ChunkDecoder decoder,
                                 SttEngine sttEngine,
                                 Translator translator,
                                 StreamingProperties props,
                                 StreamingMetrics metrics) {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.sttEngine = Objects.requireNonNull(sttEngine, "sttEngine");
        this.translator = Objects.requireNonNull(translator, "translator");
        this.props = Objects.requireNonNull(props, "props");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public ProcessingOutcome process(ProcessingJob job) {
        long start = System.nanoTime();
        try (SessionMdc ignored = SessionMdc.open(job.sessionId())) {
            ProcessingOutcome outcome = runSafely(job);
            if (job.kind() == JobKind.FINAL && !outcome.hasText()) {
                outcome = applyFallback(job, outcome);
            }
            metrics.recordJob(job.kind().tag(), outcome.status().tag(), System.nanoTime() - start);
            LOG.debug("{} job finished: status={}, bytes={}, chars={}", job.kind().tag(), outcome.status(),
                    outcome.submittedBytes(), outcome.originalText().length());
            return outcome;
        }
    }

    private ProcessingOutcome runSafely(ProcessingJob job) {
        try {
            return run(job);
        } catch (LiveTranslateException | IllegalArgumentException | IllegalStateException e) {
            LOG.warn("{} job failed for {} bytes: {}", job.kind().tag(), job.size(), e.getMessage(), e);
            return ProcessingOutcome.failed(job, e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Unexpected {} job failure for {} bytes", job.kind().tag(), job.size(), e);
            return ProcessingOutcome.failed(job, "Internal processing error");
        }
    }

    private ProcessingOutcome run(ProcessingJob job) {
        if (job.size() == 0) {
            return ProcessingOutcome.noAudio(job);
        }
        byte[] pcm = decoder.decode(job.audio());
        if (pcm.length == 0 || AudioSilenceDetector.isSilent(pcm, props.getSilenceRmsThreshold())) {
            LOG.debug("No usable audio in {} bytes ({} PCM bytes)", job.size(), pcm.length);
            return ProcessingOutcome.noAudio(job);
        }
        int samples = AudioFormat.sampleCount(pcm.length);
        if (samples < AudioFormat.samplesFor(props.getMinDurationMs())) {
            LOG.debug("Audio too short: {} samples < {} ms", samples, props.getMinDurationMs());
            return ProcessingOutcome.tooShort(job);
        }

        String hint = job.config().sourceLanguage();
        TranscriptionResult raw = sttEngine.transcribe(pcm, hint);
        TranscriptionResult transcription = new TranscriptionResult(TranscriptCleaner.clean(raw.text()),
                raw.detectedLanguage(), raw.timestamp(), raw.engineName());
        if (transcription.isBlank()) {
            return ProcessingOutcome.success(job, transcription, TranslationResult.identity(""));
        }

        TranslationResult translation;
        if (job.kind() == JobKind.INTERIM && !props.isTranslateInterim()) {
            translation = TranslationResult.identity("");
        } else {
            translation = translate(transcription.text(), transcription.detectedLanguage(),
                    job.config().targetLanguage());
        }
        return ProcessingOutcome.success(job, transcription, translation);
    }

    private TranslationResult translate(String text, String source, String target) {
        if (target.equalsIgnoreCase(source)) {
            return TranslationResult.identity(text);
        }
        try {
            return TranslationResult.translated(translator.translate(text, source, target));
        } catch (UnsupportedLanguagePairException e) {
            LOG.info("No translation model for {}->{}; returning original text", source, target);
            return TranslationResult.skipped(text);
        }
    }

    private ProcessingOutcome applyFallback(ProcessingJob job, ProcessingOutcome outcome) {
        PartialTranscript fallback = job.fallback();
        if (fallback == null) {
            return outcome;
        }
        String target = job.config().targetLanguage();
        if (fallback.hasTranslationFor(target)) {
            return outcome.withFallback(fallback);
        }
        try {
            TranslationResult t = translate(fallback.text(), fallback.detectedLanguage(), target);
            return outcome.withFallback(new PartialTranscript(fallback.text(), fallback.detectedLanguage(),
                    t.text(), target, t.skipped()));
        } catch (LiveTranslateException e) {
            LOG.warn("Translating the last partial transcript failed: {}", e.getMessage());
            ProcessingOutcome failed = ProcessingOutcome.failed(job, e.getMessage());
            return failed.withFallback(new PartialTranscript(fallback.text(), fallback.detectedLanguage(),
                    fallback.text(), target, false));
        }
    }
}
