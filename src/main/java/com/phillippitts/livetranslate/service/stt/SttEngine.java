package com.phillippitts.livetranslate.service.stt;

import com.phillippitts.livetranslate.domain.TranscriptionResult;

/**
 * Speech-to-text collaborator used by the processing pipeline.
 *
 * <p>Implementations are loaded once per process and shared by all sessions. Every call is
 * independent: all per-request state (audio, language hint) is passed explicitly, so concurrent
 * jobs from different sessions cannot interfere.
 *
 * <p>Audio contract: PCM16LE mono 16 kHz, as produced by the chunk decoders.
 */
public interface SttEngine extends AutoCloseable {

    /**
     * Prepares the engine. Idempotent.
     */
    void initialize();

    /**
     * Transcribes decoded audio.
     *
     * @param pcm          PCM16LE mono 16 kHz samples (non-empty)
     * @param languageHint source language code, or null to auto-detect
     * @return text (possibly empty for silence) and detected language
     * @throws com.phillippitts.livetranslate.exception.TranscriptionException on engine failure
     */
    TranscriptionResult transcribe(byte[] pcm, String languageHint);

    String getEngineName();

    boolean isHealthy();

    @Override
    void close();
}
