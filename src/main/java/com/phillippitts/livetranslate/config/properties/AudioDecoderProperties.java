package com.phillippitts.livetranslate.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Chunk decoder selection.
 *
 * <p>Properties:
 * <ul>
 *   <li>audio.decoder.type - {@code javasound} (WAV/AIFF/AU or raw PCM16LE, default) or {@code ffmpeg}</li>
 *   <li>audio.decoder.ffmpeg-path - ffmpeg executable (default: ffmpeg on PATH)</li>
 *   <li>audio.decoder.timeout-seconds - per-decode process timeout (default: 10)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "audio.decoder")
@Validated
public class AudioDecoderProperties {

    @Pattern(regexp = "javasound|ffmpeg", message = "Decoder type must be 'javasound' or 'ffmpeg'")
    private String type = "javasound";

    @NotBlank(message = "ffmpeg path must not be blank")
    private String ffmpegPath = "ffmpeg";

    @Positive(message = "Decoder timeout must be positive")
    private int timeoutSeconds = 10;

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getFfmpegPath() {
        return ffmpegPath;
    }

    public void setFfmpegPath(String ffmpegPath) {
        this.ffmpegPath = ffmpegPath;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }
}
