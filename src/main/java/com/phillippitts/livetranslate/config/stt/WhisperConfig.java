package com.phillippitts.livetranslate.config.stt;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the whisper.cpp transcription engine.
 * Binds to properties prefixed with "stt.whisper".
 *
 * <p>Example application.properties:
 * <pre>
 * stt.whisper.binary-path=tools/whisper.cpp/main
 * stt.whisper.model-path=models/ggml-base.bin
 * stt.whisper.timeout-seconds=30
 * stt.whisper.threads=4
 * stt.whisper.max-stdout-bytes=1048576
 * </pre>
 *
 * <p>The model must be multilingual (not a {@code .en} model) for language detection to work.
 * There is no fixed language: each call passes the session's source hint or {@code auto}.
 *
 * @param binaryPath     path to the whisper.cpp binary executable
 * @param modelPath      path to the GGML model file (.bin)
 * @param timeoutSeconds maximum time to wait for one transcription
 * @param threads        CPU threads per whisper.cpp invocation
 * @param maxStdoutBytes stdout accumulation cap
 */
@ConfigurationProperties(prefix = "stt.whisper")
@Validated
public record WhisperConfig(
        @NotBlank(message = "Whisper binary path must not be blank")
        @DefaultValue("tools/whisper.cpp/main")
        String binaryPath,

        @NotBlank(message = "Whisper model path must not be blank")
        @DefaultValue("models/ggml-base.bin")
        String modelPath,

        @Positive(message = "Timeout must be positive")
        @DefaultValue("30")
        int timeoutSeconds,

        @Positive(message = "Thread count must be positive")
        @DefaultValue("4")
        int threads,

        @Positive(message = "Max stdout bytes must be positive")
        @DefaultValue("1048576")
        int maxStdoutBytes
) {
}
