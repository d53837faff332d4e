package com.phillippitts.livetranslate.service.audio;

/**
 * RMS-based silence check on decoded PCM16LE mono audio.
 *
 * <p>The processing pipeline treats a buffer whose RMS amplitude does not exceed the configured
 * threshold as "no audio". A threshold of 0 therefore only matches digital silence (every sample
 * zero).
 */
public final class AudioSilenceDetector {

    private AudioSilenceDetector() {
        // Utility class
    }

    /**
     * @param pcm       PCM16LE mono audio
     * @param threshold RMS amplitude at or below which the audio counts as silent (0-32767)
     * @return true for null, empty or silent audio
     */
    public static boolean isSilent(byte[] pcm, int threshold) {
        if (pcm == null || pcm.length < 2) {
            return true;
        }
        return rms(pcm) <= threshold;
    }

    /**
     * Root mean square amplitude over all complete 16-bit samples.
     */
    public static double rms(byte[] pcm) {
        long sumSquares = 0;
        int count = 0;
        for (int i = 0; i + 1 < pcm.length; i += 2) {
            int sample = (short) ((pcm[i] & 0xFF) | (pcm[i + 1] << 8));
            sumSquares += (long) sample * sample;
            count++;
        }
        if (count == 0) {
            return 0;
        }
        return Math.sqrt((double) sumSquares / count);
    }
}
