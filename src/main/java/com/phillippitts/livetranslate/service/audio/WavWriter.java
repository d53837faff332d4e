package com.phillippitts.livetranslate.service.audio;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import static com.phillippitts.livetranslate.service.audio.AudioFormat.BITS_PER_SAMPLE;
import static com.phillippitts.livetranslate.service.audio.AudioFormat.BLOCK_ALIGN;
import static com.phillippitts.livetranslate.service.audio.AudioFormat.BYTE_RATE;
import static com.phillippitts.livetranslate.service.audio.AudioFormat.CHANNELS;
import static com.phillippitts.livetranslate.service.audio.AudioFormat.SAMPLE_RATE;

/**
 * Writes minimal PCM WAV files in the fixed {@link AudioFormat}. Used to hand decoded audio to
 * whisper.cpp, which reads its input from a file.
 */
public final class WavWriter {

    private WavWriter() {}

    /**
     * Writes a WAV file containing the given raw PCM16LE mono 16 kHz payload.
     *
     * @param pcm     raw PCM16LE mono audio at 16 kHz
     * @param wavPath output file path (created or overwritten)
     * @throws IOException if the file cannot be written
     */
    public static void writePcm16LeMono16kHz(byte[] pcm, Path wavPath) throws IOException {
        Objects.requireNonNull(pcm, "pcm must not be null");
        Objects.requireNonNull(wavPath, "wavPath must not be null");
        try (OutputStream os = Files.newOutputStream(wavPath)) {
            os.write(header(pcm.length));
            os.write(pcm);
            os.flush();
        }
    }

    /** 44-byte RIFF/WAVE header for {@code dataSize} bytes of PCM. */
    public static byte[] header(int dataSize) {
        byte[] h = new byte[AudioFormat.WAV_HEADER_SIZE];
        putAscii(h, 0, "RIFF");
        putLEInt(h, 4, 36 + dataSize);
        putAscii(h, 8, "WAVE");
        putAscii(h, 12, "fmt ");
        putLEInt(h, 16, 16);                // PCM fmt chunk size
        putLEShort(h, 20, 1);               // format tag: PCM
        putLEShort(h, 22, CHANNELS);
        putLEInt(h, 24, SAMPLE_RATE);
        putLEInt(h, 28, BYTE_RATE);
        putLEShort(h, 32, BLOCK_ALIGN);
        putLEShort(h, 34, BITS_PER_SAMPLE);
        putAscii(h, 36, "data");
        putLEInt(h, 40, dataSize);
        return h;
    }

    /** Header followed by {@code pcm}, as one in-memory WAV file. */
    public static byte[] toWavBytes(byte[] pcm) {
        byte[] h = header(pcm.length);
        byte[] out = new byte[h.length + pcm.length];
        System.arraycopy(h, 0, out, 0, h.length);
        System.arraycopy(pcm, 0, out, h.length, pcm.length);
        return out;
    }

    private static void putAscii(byte[] b, int off, String s) {
        for (int i = 0; i < s.length(); i++) {
            b[off + i] = (byte) s.charAt(i);
        }
    }

    private static void putLEShort(byte[] b, int off, int v) {
        b[off] = (byte) (v & 0xFF);
        b[off + 1] = (byte) ((v >>> 8) & 0xFF);
    }

    private static void putLEInt(byte[] b, int off, int v) {
        b[off] = (byte) (v & 0xFF);
        b[off + 1] = (byte) ((v >>> 8) & 0xFF);
        b[off + 2] = (byte) ((v >>> 16) & 0xFF);
        b[off + 3] = (byte) ((v >>> 24) & 0xFF);
    }
}
