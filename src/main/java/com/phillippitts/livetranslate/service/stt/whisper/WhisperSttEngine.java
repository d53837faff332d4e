package com.phillippitts.livetranslate.service.stt.whisper;

import com.phillippitts.livetranslate.config.stt.SttConcurrencyProperties;
import com.phillippitts.livetranslate.config.stt.WhisperConfig;
import com.phillippitts.livetranslate.domain.TranscriptionResult;
import com.phillippitts.livetranslate.exception.TranscriptionException;
import com.phillippitts.livetranslate.service.audio.AudioFormat;
import com.phillippitts.livetranslate.service.audio.WavWriter;
import com.phillippitts.livetranslate.service.stt.AbstractSttEngine;
import com.phillippitts.livetranslate.service.stt.TranscriptCleaner;
import com.phillippitts.livetranslate.service.stt.util.ConcurrencyGuard;
import com.phillippitts.livetranslate.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * {@link com.phillippitts.livetranslate.service.stt.SttEngine} backed by the whisper.cpp binary.
 *
 * <p>Each call writes the PCM to a temporary WAV file, runs whisper.cpp with the session's
 * language hint (or {@code auto}), parses the JSON output for text and detected language and
 * deletes the temp file. Concurrent calls are capped by a {@link ConcurrencyGuard}.
 *
 * <p><b>Privacy:</b> never logs transcript text at INFO; only durations and character counts.
 */
@Component
public class WhisperSttEngine extends AbstractSttEngine {

    private static final Logger LOG = LogManager.getLogger(WhisperSttEngine.class);

    private final WhisperConfig cfg;
    private final WhisperProcessManager manager;
    private final ConcurrencyGuard concurrencyGuard;
    private final ApplicationEventPublisher publisher;

    @Autowired
    public WhisperSttEngine(WhisperConfig cfg,
                            SttConcurrencyProperties concurrencyProperties,
                            WhisperProcessManager manager,
                            ApplicationEventPublisher publisher) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.manager = Objects.requireNonNull(manager, "manager");
        this.publisher = publisher;
        this.concurrencyGuard = new ConcurrencyGuard(concurrencyProperties.getWhisperMax(),
                concurrencyProperties.getAcquireTimeoutMs(), WhisperConstants.ENGINE, publisher);
    }

    @Override
    protected void doInitialize() {
        LOG.info("Whisper engine initialized: bin={}, model={}, timeout={}s, threads={}",
                cfg.binaryPath(), cfg.modelPath(), cfg.timeoutSeconds(), cfg.threads());
    }

    @Override
    public TranscriptionResult transcribe(byte[] pcm, String languageHint) {
        if (pcm == null || pcm.length == 0) {
            throw new IllegalArgumentException("pcm must not be null or empty");
        }
        ensureInitialized();
        concurrencyGuard.acquire();
        Path wav = null;
        long startTime = System.nanoTime();
        try {
            wav = Files.createTempFile("whisper-", ".wav");
            WavWriter.writePcm16LeMono16kHz(pcm, wav);
            String json = manager.transcribe(wav, cfg, languageHint);
            String text = TranscriptCleaner.clean(WhisperJsonParser.extractText(json));
            String detected = WhisperJsonParser.extractLanguage(json);
            if (detected == null) {
                detected = languageHint;
            }
            LOG.debug("Whisper transcribed {} ms of audio in {} ms (chars={}, lang={})",
                    TimeUtils.pcmDurationMillis(pcm.length, AudioFormat.SAMPLE_RATE), TimeUtils.elapsedMillis(startTime),
                    text.length(), detected);
            return TranscriptionResult.of(text, detected, WhisperConstants.ENGINE);
        } catch (IOException | JSONException | TranscriptionException e) {
            throw transcriptionFailure(e, publisher,
                    Map.of("binaryPath", cfg.binaryPath(), "modelPath", cfg.modelPath()));
        } finally {
            concurrencyGuard.release();
            cleanupTempFile(wav);
        }
    }

    private static void cleanupTempFile(Path wav) {
        if (wav == null) {
            return;
        }
        try {
            Files.deleteIfExists(wav);
        } catch (IOException e) {
            LOG.warn("Could not delete temp WAV {}: {}", wav, e.toString());
        }
    }

    @Override
    public String getEngineName() {
        return WhisperConstants.ENGINE;
    }

    @Override
    protected void doClose() {
        LOG.info("Whisper engine closed");
    }
}
