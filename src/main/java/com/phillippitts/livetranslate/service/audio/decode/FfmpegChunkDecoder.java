package com.phillippitts.livetranslate.service.audio.decode;

import com.phillippitts.livetranslate.config.properties.AudioDecoderProperties;
import com.phillippitts.livetranslate.exception.InvalidAudioException;
import com.phillippitts.livetranslate.service.audio.AudioFormat;
import com.phillippitts.livetranslate.util.process.ExternalProcessRunner;
import com.phillippitts.livetranslate.util.process.ProcessResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Decoder that pipes the buffered bytes through an ffmpeg process. Handles anything ffmpeg
 * can demux from a pipe, notably the WebM/Opus streams browsers record.
 *
 * <pre>
 * ffmpeg -hide_banner -loglevel error -i pipe:0 -f s16le -ac 1 -ar 16000 pipe:1
 * </pre>
 */
@Component
@ConditionalOnProperty(name = "audio.decoder.type", havingValue = "ffmpeg")
public class FfmpegChunkDecoder implements ChunkDecoder {

    private static final Logger LOG = LogManager.getLogger(FfmpegChunkDecoder.class);

    /** Ten minutes of target-format PCM. */
    static final int MAX_PCM_BYTES = AudioFormat.BYTE_RATE * 600;

    private static final int STDERR_SNIPPET_CHARS = 512;

    private final AudioDecoderProperties props;
    private final ExternalProcessRunner runner;

    @Autowired
    public FfmpegChunkDecoder(AudioDecoderProperties props) {
        this(props, new ExternalProcessRunner());
    }

    FfmpegChunkDecoder(AudioDecoderProperties props, ExternalProcessRunner runner) {
        this.props = Objects.requireNonNull(props, "props");
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    @Override
    public byte[] decode(byte[] encoded) {
        if (encoded == null || encoded.length == 0) {
            return new byte[0];
        }
        ProcessResult result;
        try {
            result = runner.run("ffmpeg", command(), null, encoded,
                    Duration.ofSeconds(props.getTimeoutSeconds()), MAX_PCM_BYTES);
        } catch (IOException e) {
            throw new InvalidAudioException(encoded.length, "ffmpeg could not be started: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InvalidAudioException(encoded.length, "ffmpeg decode interrupted", e);
        }
        if (result.timedOut()) {
            throw new InvalidAudioException(encoded.length,
                    "ffmpeg timed out after " + props.getTimeoutSeconds() + "s");
        }
        if (result.exitCode() != 0) {
            throw new InvalidAudioException(encoded.length, "ffmpeg exit " + result.exitCode() + ": "
                    + result.stderrSnippet(STDERR_SNIPPET_CHARS).trim());
        }
        byte[] pcm = result.stdout();
        LOG.debug("ffmpeg decoded {} bytes into {} PCM bytes in {} ms",
                encoded.length, pcm.length, result.durationMs());
        return pcm.length % 2 == 0 ? pcm : JavaSoundChunkDecoder.rawPcm(pcm);
    }

    @Override
    public String name() {
        return "ffmpeg";
    }

    List<String> command() {
        return List.of(props.getFfmpegPath(),
                "-hide_banner", "-loglevel", "error",
                "-i", "pipe:0",
                "-f", "s16le",
                "-ac", String.valueOf(AudioFormat.CHANNELS),
                "-ar", String.valueOf(AudioFormat.SAMPLE_RATE),
                "pipe:1");
    }
}
