package com.phillippitts.livetranslate.service.audio.decode;

import com.phillippitts.livetranslate.config.properties.AudioDecoderProperties;
import com.phillippitts.livetranslate.exception.InvalidAudioException;
import com.phillippitts.livetranslate.testutil.FakeProcess;
import com.phillippitts.livetranslate.util.process.ExternalProcessRunner;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FfmpegChunkDecoderTest {

    private final AudioDecoderProperties props = new AudioDecoderProperties();

    @Test
    void pipesChunkThroughFfmpegAndReturnsPcm() {
        byte[] pcm = {1, 0, 2, 0};
        FakeProcess process = FakeProcess.exits(0, pcm, "");
        FakeProcess.Factory factory = FakeProcess.factory(process);
        FfmpegChunkDecoder decoder = new FfmpegChunkDecoder(props, new ExternalProcessRunner(factory));

        byte[] decoded = decoder.decode(new byte[]{0x1A, 0x45, (byte) 0xDF, (byte) 0xA3});

        assertThat(decoded).isEqualTo(pcm);
        assertThat(factory.commands).hasSize(1);
        assertThat(factory.commands.get(0))
                .startsWith("ffmpeg")
                .containsSequence("-f", "s16le")
                .containsSequence("-ac", "1")
                .containsSequence("-ar", "16000")
                .endsWith("pipe:1");
    }

    @Test
    void nonZeroExitBecomesInvalidAudio() {
        FakeProcess process = FakeProcess.exits(1, new byte[0], "Invalid data found when processing input");
        FfmpegChunkDecoder decoder = new FfmpegChunkDecoder(props,
                new ExternalProcessRunner(FakeProcess.factory(process)));

        assertThatThrownBy(() -> decoder.decode(new byte[]{1, 2, 3}))
                .isInstanceOf(InvalidAudioException.class)
                .hasMessageContaining("ffmpeg exit 1")
                .hasMessageContaining("Invalid data");
    }

    @Test
    void emptyInputDoesNotStartFfmpeg() {
        FakeProcess.Factory factory = FakeProcess.factory(FakeProcess.exits(0, new byte[0], ""));
        FfmpegChunkDecoder decoder = new FfmpegChunkDecoder(props, new ExternalProcessRunner(factory));

        assertThat(decoder.decode(new byte[0])).isEmpty();
        assertThat(factory.commands).isEmpty();
    }

    @Test
    void usesConfiguredBinary() {
        props.setFfmpegPath("/opt/ffmpeg/bin/ffmpeg");
        FfmpegChunkDecoder decoder = new FfmpegChunkDecoder(props,
                new ExternalProcessRunner(FakeProcess.factory(FakeProcess.exits(0, new byte[0], ""))));

        assertThat(decoder.command().get(0)).isEqualTo("/opt/ffmpeg/bin/ffmpeg");
        assertThat(decoder.name()).isEqualTo("ffmpeg");
    }
}
