package com.phillippitts.livetranslate.service.audio.decode;

import com.phillippitts.livetranslate.service.audio.WavWriter;
import com.phillippitts.livetranslate.testutil.TestAudio;
import org.junit.jupiter.api.Test;

import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class JavaSoundChunkDecoderTest {

    private final JavaSoundChunkDecoder decoder = new JavaSoundChunkDecoder();

    @Test
    void targetFormatWavDecodesToItsPayload() {
        byte[] pcm = TestAudio.tone(3200);

        byte[] decoded = decoder.decode(WavWriter.toWavBytes(pcm));

        assertThat(decoded).isEqualTo(pcm);
    }

    @Test
    void stereoEightKilohertzWavIsDownmixedAndResampled() throws IOException {
        int frames = 800;
        byte[] stereo = new byte[frames * 4];
        for (int f = 0; f < frames; f++) {
            // left 1000, right 3000 -> mono 2000
            stereo[f * 4] = (byte) (1000 & 0xFF);
            stereo[f * 4 + 1] = (byte) (1000 >> 8);
            stereo[f * 4 + 2] = (byte) (3000 & 0xFF);
            stereo[f * 4 + 3] = (byte) (3000 >> 8);
        }
        AudioFormat format = new AudioFormat(8000f, 16, 2, true, false);
        ByteArrayOutputStream wav = new ByteArrayOutputStream();
        AudioSystem.write(new AudioInputStream(new ByteArrayInputStream(stereo), format, frames),
                AudioFileFormat.Type.WAVE, wav);

        byte[] decoded = decoder.decode(wav.toByteArray());

        // 800 frames at 8 kHz = 1600 samples at 16 kHz
        assertThat(decoded).hasSize(1600 * 2);
        short first = (short) ((decoded[0] & 0xFF) | (decoded[1] << 8));
        assertThat(first).isEqualTo((short) 2000);
    }

    @Test
    void unrecognizedBytesAreTakenAsRawPcm() {
        byte[] raw = TestAudio.tone(1000);

        assertThat(decoder.decode(raw)).isEqualTo(raw);
    }

    @Test
    void oddRawLengthIsPadded() {
        byte[] decoded = JavaSoundChunkDecoder.rawPcm(new byte[]{1, 2, 3});

        assertThat(decoded).containsExactly(1, 2, 3, 0);
    }

    @Test
    void emptyInputYieldsNoSamples() {
        assertThat(decoder.decode(new byte[0])).isEmpty();
    }

    @Test
    void resampleAndDownmixHelpers() {
        assertThat(JavaSoundChunkDecoder.resample(new short[]{0, 100}, 8000, 16000))
                .containsExactly((short) 0, (short) 50, (short) 100, (short) 100);
        assertThat(JavaSoundChunkDecoder.resample(new short[]{1, 2, 3}, 16000, 16000))
                .containsExactly((short) 1, (short) 2, (short) 3);
        assertThat(JavaSoundChunkDecoder.downmix(new byte[]{10, 0, 30, 0}, 2)).containsExactly((short) 20);
    }
}
