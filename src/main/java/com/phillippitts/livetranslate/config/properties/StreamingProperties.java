package com.phillippitts.livetranslate.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Streaming session tunables, bound from {@code streaming.*}.
 *
 * <p>{@code interimThresholdBytes} and {@code minDurationMs} are process-wide; clients
 * cannot change them per session.
 */
@ConfigurationProperties(prefix = "streaming")
@Validated
public class StreamingProperties {

    /** Buffered compressed bytes that trigger an interim pass. */
    @Positive(message = "Interim threshold must be positive")
    private int interimThresholdBytes = 32_000;

    /** Decoded audio shorter than this is too short to transcribe. */
    @PositiveOrZero(message = "Minimum duration must not be negative")
    private int minDurationMs = 500;

    @Positive(message = "Max chunk size must be positive")
    private int maxChunkBytes = 1024 * 1024;

    @Positive(message = "Max buffer size must be positive")
    private int maxBufferBytes = 16 * 1024 * 1024;

    private boolean translateInterim = true;

    /** RMS at or below which decoded audio counts as no audio; 0 matches digital silence only. */
    @Min(value = 0, message = "Silence threshold must not be negative")
    private int silenceRmsThreshold = 0;

    @NotBlank(message = "WebSocket path must not be blank")
    private String websocketPath = "/ws/transcribe-translate";

    @NotEmpty(message = "At least one allowed origin is required")
    private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

    @Positive(message = "Send time limit must be positive")
    private int sendTimeLimitMs = 10_000;

    @Positive(message = "Send buffer size limit must be positive")
    private int sendBufferSizeLimit = 512 * 1024;

    public int getInterimThresholdBytes() {
        return interimThresholdBytes;
    }

    public void setInterimThresholdBytes(int interimThresholdBytes) {
        this.interimThresholdBytes = interimThresholdBytes;
    }

    public int getMinDurationMs() {
        return minDurationMs;
    }

    public void setMinDurationMs(int minDurationMs) {
        this.minDurationMs = minDurationMs;
    }

    public int getMaxChunkBytes() {
        return maxChunkBytes;
    }

    public void setMaxChunkBytes(int maxChunkBytes) {
        this.maxChunkBytes = maxChunkBytes;
    }

    public int getMaxBufferBytes() {
        return maxBufferBytes;
    }

    public void setMaxBufferBytes(int maxBufferBytes) {
        this.maxBufferBytes = maxBufferBytes;
    }

    public boolean isTranslateInterim() {
        return translateInterim;
    }

    public void setTranslateInterim(boolean translateInterim) {
        this.translateInterim = translateInterim;
    }

    public int getSilenceRmsThreshold() {
        return silenceRmsThreshold;
    }

    public void setSilenceRmsThreshold(int silenceRmsThreshold) {
        this.silenceRmsThreshold = silenceRmsThreshold;
    }

    public String getWebsocketPath() {
        return websocketPath;
    }

    public void setWebsocketPath(String websocketPath) {
        this.websocketPath = websocketPath;
    }

    public List<String> getAllowedOrigins() {
        return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    public int getSendTimeLimitMs() {
        return sendTimeLimitMs;
    }

    public void setSendTimeLimitMs(int sendTimeLimitMs) {
        this.sendTimeLimitMs = sendTimeLimitMs;
    }

    public int getSendBufferSizeLimit() {
        return sendBufferSizeLimit;
    }

    public void setSendBufferSizeLimit(int sendBufferSizeLimit) {
        this.sendBufferSizeLimit = sendBufferSizeLimit;
    }
}
