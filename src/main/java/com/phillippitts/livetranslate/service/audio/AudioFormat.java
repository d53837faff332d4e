package com.phillippitts.livetranslate.service.audio;

/**
 * Single source of truth for the PCM format handed to the transcription engine.
 * Decoders always produce: 16 kHz, 16-bit signed PCM, mono, little-endian.
 */
public final class AudioFormat {

    /** Sample rate in Hz. */
    public static final int SAMPLE_RATE = 16_000;
    /** Bits per sample. */
    public static final int BITS_PER_SAMPLE = 16;
    /** Channels (mono). */
    public static final int CHANNELS = 1;
    public static final boolean SIGNED = true;
    /** false = little-endian. */
    public static final boolean BIG_ENDIAN = false;

    /** Bytes per PCM frame. */
    public static final int BLOCK_ALIGN = (BITS_PER_SAMPLE / 8) * CHANNELS; // 2 bytes
    /** Bytes per second. */
    public static final int BYTE_RATE = SAMPLE_RATE * BLOCK_ALIGN;          // 32,000

    public static final int WAV_HEADER_SIZE = 44;

    private AudioFormat() {}

    /** The target format as a Java Sound descriptor. */
    public static javax.sound.sampled.AudioFormat javaSound() {
        return new javax.sound.sampled.AudioFormat(SAMPLE_RATE, BITS_PER_SAMPLE, CHANNELS, SIGNED, BIG_ENDIAN);
    }

    /** Number of samples in {@code pcmBytes} of target-format audio. */
    public static int sampleCount(int pcmBytes) {
        return pcmBytes / BLOCK_ALIGN;
    }

    /** Samples needed for {@code millis} of audio. */
    public static int samplesFor(long millis) {
        return (int) (SAMPLE_RATE * millis / 1000L);
    }
}
