package com.phillippitts.livetranslate.config.stt;

import com.phillippitts.livetranslate.exception.ModelNotFoundException;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Fail-fast startup check of the whisper.cpp binary and model.
 *
 * <p>Aborts startup with an actionable {@link ModelNotFoundException} when the model is missing
 * or implausibly small, or the binary is missing or not executable. Disable with
 * {@code stt.validation.enabled=false} (tests, or hosts that install the engine later).
 */
@Component
@ConditionalOnProperty(name = "stt.validation.enabled", havingValue = "true", matchIfMissing = true)
class ModelValidationService {

    private static final Logger LOG = LogManager.getLogger(ModelValidationService.class);

    private static final long BYTES_PER_MB = 1024 * 1024;

    private final WhisperConfig whisper;

    ModelValidationService(WhisperConfig whisper) {
        this.whisper = whisper;
    }

    @PostConstruct
    void validateOnStartup() {
        LOG.info("Validating transcription engine... os={}, arch={}",
                System.getProperty("os.name"), System.getProperty("os.arch"));
        validateWhisper();
    }

    // Visible for tests
    void validateWhisper() {
        Path model = resolve(whisper.modelPath(), "Whisper model");
        Path binary = resolve(whisper.binaryPath(), "Whisper binary");

        if (!Files.isRegularFile(model)) {
            throw new ModelNotFoundException("Whisper model not found: " + model
                    + " (configured as: " + whisper.modelPath() + ")");
        }
        long sizeBytes;
        try {
            sizeBytes = Files.size(model);
        } catch (IOException e) {
            throw new ModelNotFoundException("Failed to read Whisper model metadata at: " + model, e);
        }
        if (sizeBytes < SttModelConstants.MIN_WHISPER_MODEL_SIZE_BYTES) {
            throw new ModelNotFoundException("Whisper model too small (" + sizeBytes + " bytes) at: " + model);
        }
        LOG.info("Whisper model size: {} MB (threshold: {} MB)", sizeBytes / BYTES_PER_MB,
                SttModelConstants.MIN_WHISPER_MODEL_SIZE_BYTES / BYTES_PER_MB);

        if (!Files.isRegularFile(binary)) {
            throw new ModelNotFoundException("Whisper binary not found: " + binary
                    + " (configured as: " + whisper.binaryPath() + ")");
        }
        if (!Files.isExecutable(binary)) {
            throw new ModelNotFoundException("Whisper binary not executable: " + binary
                    + " (try: chmod +x '" + binary + "')");
        }
        LOG.info("Whisper validation OK: model='{}', binary='{}'", model, binary);
    }

    private static Path resolve(String pathString, String description) {
        Path path = Paths.get(pathString);
        if (path.isAbsolute()) {
            return path;
        }
        Path resolved = Paths.get(".").toAbsolutePath().normalize().resolve(path).normalize();
        LOG.warn("{} uses relative path '{}' - resolved to '{}'. Prefer absolute paths in production.",
                description, pathString, resolved);
        return resolved;
    }
}
