package com.phillippitts.livetranslate.service.audio.decode;

import com.phillippitts.livetranslate.exception.InvalidAudioException;
import com.phillippitts.livetranslate.service.audio.AudioFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Decoder built on {@code javax.sound.sampled}.
 *
 * <p>Container formats Java Sound recognizes (WAV, AIFF, AU) are converted to 16-bit signed
 * little-endian PCM, down-mixed to mono and linearly resampled to 16 kHz. Bytes that are not a
 * recognizable container are taken as raw PCM16LE mono 16 kHz; an odd trailing byte is padded
 * with zero.
 */
@Component
@ConditionalOnProperty(name = "audio.decoder.type", havingValue = "javasound", matchIfMissing = true)
public class JavaSoundChunkDecoder implements ChunkDecoder {

    private static final Logger LOG = LogManager.getLogger(JavaSoundChunkDecoder.class);

    @Override
    public byte[] decode(byte[] encoded) {
        if (encoded == null || encoded.length == 0) {
            return new byte[0];
        }
        try (AudioInputStream source = AudioSystem.getAudioInputStream(new ByteArrayInputStream(encoded))) {
            return convert(source, encoded.length);
        } catch (UnsupportedAudioFileException e) {
            LOG.debug("No audio container recognized in {} bytes; treating as raw PCM16LE", encoded.length);
            return rawPcm(encoded);
        } catch (IOException | IllegalArgumentException e) {
            throw new InvalidAudioException(encoded.length, "Java Sound decode failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String name() {
        return "javasound";
    }

    private static byte[] convert(AudioInputStream source, int encodedSize) throws IOException {
        javax.sound.sampled.AudioFormat sf = source.getFormat();
        int channels = Math.max(1, sf.getChannels());
        float rate = sf.getSampleRate();
        javax.sound.sampled.AudioFormat pcm16 = new javax.sound.sampled.AudioFormat(
                javax.sound.sampled.AudioFormat.Encoding.PCM_SIGNED, rate, 16, channels,
                channels * 2, rate, false);
        byte[] interleaved;
        try (AudioInputStream pcm = AudioSystem.getAudioInputStream(pcm16, source)) {
            interleaved = pcm.readAllBytes();
        }
        short[] mono = downmix(interleaved, channels);
        short[] resampled = resample(mono, Math.round(rate), AudioFormat.SAMPLE_RATE);
        LOG.debug("Decoded {} container bytes ({} Hz, {} ch) into {} samples",
                encodedSize, rate, channels, resampled.length);
        return toBytes(resampled);
    }

    static byte[] rawPcm(byte[] encoded) {
        if (encoded.length % 2 == 0) {
            return encoded.clone();
        }
        byte[] padded = new byte[encoded.length + 1];
        System.arraycopy(encoded, 0, padded, 0, encoded.length);
        return padded;
    }

    static short[] downmix(byte[] interleaved, int channels) {
        int frames = interleaved.length / (2 * channels);
        short[] out = new short[frames];
        for (int f = 0; f < frames; f++) {
            int sum = 0;
            for (int c = 0; c < channels; c++) {
                int i = (f * channels + c) * 2;
                sum += (short) ((interleaved[i] & 0xFF) | (interleaved[i + 1] << 8));
            }
            out[f] = (short) (sum / channels);
        }
        return out;
    }

    static short[] resample(short[] in, int fromRate, int toRate) {
        if (fromRate == toRate || in.length == 0 || fromRate <= 0) {
            return in;
        }
        int outLen = (int) ((long) in.length * toRate / fromRate);
        short[] out = new short[outLen];
        double step = (double) fromRate / toRate;
        for (int i = 0; i < outLen; i++) {
            double pos = i * step;
            int idx = (int) pos;
            double frac = pos - idx;
            int a = in[Math.min(idx, in.length - 1)];
            int b = in[Math.min(idx + 1, in.length - 1)];
            out[i] = (short) Math.round(a + (b - a) * frac);
        }
        return out;
    }

    private static byte[] toBytes(short[] samples) {
        byte[] out = new byte[samples.length * 2];
        for (int i = 0; i < samples.length; i++) {
            out[2 * i] = (byte) (samples[i] & 0xFF);
            out[2 * i + 1] = (byte) ((samples[i] >> 8) & 0xFF);
        }
        return out;
    }
}
