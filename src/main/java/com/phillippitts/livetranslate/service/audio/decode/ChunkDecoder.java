package com.phillippitts.livetranslate.service.audio.decode;

import com.phillippitts.livetranslate.exception.InvalidAudioException;

/**
 * Converts buffered compressed audio into PCM in the fixed
 * {@link com.phillippitts.livetranslate.service.audio.AudioFormat}.
 *
 * <p>Implementations are stateless and shared by all sessions.
 */
public interface ChunkDecoder {

    /**
     * @param encoded compressed bytes accumulated by a session
     * @return PCM16LE mono 16 kHz samples; empty when nothing usable was recovered
     * @throws InvalidAudioException if the bytes cannot be decoded
     */
    byte[] decode(byte[] encoded);

    /** Short name for logs and metrics. */
    String name();
}
