package com.phillippitts.livetranslate.service.audio;

import com.phillippitts.livetranslate.testutil.TestAudio;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AudioSilenceDetectorTest {

    @Test
    void digitalSilenceIsSilentAtZeroThreshold() {
        assertThat(AudioSilenceDetector.isSilent(TestAudio.silence(3200), 0)).isTrue();
    }

    @Test
    void toneIsNotSilent() {
        assertThat(AudioSilenceDetector.isSilent(TestAudio.tone(3200), 0)).isFalse();
        assertThat(AudioSilenceDetector.rms(TestAudio.tone(3200))).isEqualTo(4000.0);
    }

    @Test
    void quietAudioBelowThresholdIsSilent() {
        byte[] pcm = new byte[3200];
        for (int i = 0; i < pcm.length; i += 2) {
            pcm[i] = 10;
        }
        assertThat(AudioSilenceDetector.isSilent(pcm, 0)).isFalse();
        assertThat(AudioSilenceDetector.isSilent(pcm, 50)).isTrue();
    }

    @Test
    void emptyOrSingleByteIsSilent() {
        assertThat(AudioSilenceDetector.isSilent(null, 0)).isTrue();
        assertThat(AudioSilenceDetector.isSilent(new byte[1], 0)).isTrue();
    }
}
