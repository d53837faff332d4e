package com.phillippitts.livetranslate.service.stt.whisper;

import com.phillippitts.livetranslate.config.stt.WhisperConfig;
import com.phillippitts.livetranslate.exception.TranscriptionException;
import com.phillippitts.livetranslate.exception.TranscriptionExceptionBuilder;
import com.phillippitts.livetranslate.util.process.ExternalProcessRunner;
import com.phillippitts.livetranslate.util.process.ProcessFactory;
import com.phillippitts.livetranslate.util.process.ProcessResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs whisper.cpp on one WAV file and returns its JSON output.
 *
 * <p>CLI contract:
 * <pre>
 * ${binary} -m ${model} -f ${wav} -l ${language|auto} -oj -of ${wav-without-ext} -t ${threads} -np
 * </pre>
 * whisper.cpp writes {@code ${wav-without-ext}.json} next to the input; the manager reads and
 * deletes it, falling back to stdout when no file was written.
 *
 * <p>Stateless between calls: each call owns its process, so the manager is shared by all
 * concurrent jobs.
 */
@Component
public class WhisperProcessManager {

    private static final Logger LOG = LogManager.getLogger(WhisperProcessManager.class);

    private final ExternalProcessRunner runner;

    @Autowired
    public WhisperProcessManager() {
        this(new ExternalProcessRunner());
    }

    WhisperProcessManager(ProcessFactory processFactory) {
        this(new ExternalProcessRunner(processFactory));
    }

    WhisperProcessManager(ExternalProcessRunner runner) {
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    /**
     * @param wavPath  WAV file written by the caller
     * @param cfg      engine configuration
     * @param language language code or {@code auto}
     * @return JSON produced by whisper.cpp (may be empty)
     * @throws TranscriptionException on timeout, non-zero exit or I/O failure
     */
    public String transcribe(Path wavPath, WhisperConfig cfg, String language) {
        Objects.requireNonNull(wavPath, "wavPath");
        Objects.requireNonNull(cfg, "cfg");
        Path outputBase = outputBase(wavPath);
        Path jsonFile = outputBase.resolveSibling(outputBase.getFileName() + ".json");
        List<String> command = buildCommand(cfg, wavPath, outputBase, language);

        ProcessResult result;
        try {
            result = runner.run(WhisperConstants.ENGINE, command, wavPath.toAbsolutePath().getParent(), null,
                    Duration.ofSeconds(cfg.timeoutSeconds()), cfg.maxStdoutBytes());
        } catch (IOException e) {
            throw error("I/O failure: " + e.getMessage(), cfg, -1, 0, "", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw error("Interrupted", cfg, -1, 0, "", e);
        }

        try {
            if (result.timedOut()) {
                throw error("Timeout after " + cfg.timeoutSeconds() + "s", cfg, -1, result.durationMs(),
                        result.stderrSnippet(WhisperConstants.ERROR_SNIPPET_MAX_CHARS), null);
            }
            if (result.exitCode() != 0) {
                throw error("Non-zero exit: " + result.exitCode(), cfg, result.exitCode(), result.durationMs(),
                        result.stderrSnippet(WhisperConstants.ERROR_SNIPPET_MAX_CHARS), null);
            }
            return readOutput(jsonFile, result);
        } finally {
            deleteQuietly(jsonFile);
        }
    }

    List<String> buildCommand(WhisperConfig cfg, Path wavPath, Path outputBase, String language) {
        List<String> cmd = new ArrayList<>();
        cmd.add(resolvePath(cfg.binaryPath()).toString());
        cmd.add("-m");
        cmd.add(resolvePath(cfg.modelPath()).toString());
        cmd.add("-f");
        cmd.add(wavPath.toAbsolutePath().toString());
        cmd.add("-l");
        cmd.add(language == null || language.isBlank() ? WhisperConstants.AUTO_LANGUAGE : language);
        cmd.add("-oj");
        cmd.add("-of");
        cmd.add(outputBase.toAbsolutePath().toString());
        cmd.add("-t");
        cmd.add(String.valueOf(cfg.threads()));
        cmd.add("-np");
        return cmd;
    }

    private static String readOutput(Path jsonFile, ProcessResult result) {
        if (Files.isRegularFile(jsonFile)) {
            try {
                return Files.readString(jsonFile, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new TranscriptionException("Failed to read whisper output " + jsonFile,
                        WhisperConstants.ENGINE, e);
            }
        }
        LOG.debug("No JSON file at {}; using stdout ({} bytes)", jsonFile, result.stdout().length);
        return result.stdoutText();
    }

    private static Path outputBase(Path wavPath) {
        String name = wavPath.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return wavPath.toAbsolutePath().resolveSibling(base);
    }

    private static Path resolvePath(String pathString) {
        Path path = Path.of(pathString);
        if (path.isAbsolute()) {
            return path;
        }
        return Path.of(".").toAbsolutePath().normalize().resolve(path).normalize();
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warn("Could not delete whisper output {}: {}", file, e.toString());
        }
    }

    private static TranscriptionException error(String msg, WhisperConfig cfg, int exitCode, long durationMs,
                                                String stderr, Throwable cause) {
        return TranscriptionExceptionBuilder.create(msg)
                .engine(WhisperConstants.ENGINE)
                .exitCode(exitCode)
                .durationMs(durationMs)
                .metadata("binaryPath", cfg.binaryPath())
                .metadata("modelPath", cfg.modelPath())
                .metadata("stderr", stderr)
                .cause(cause)
                .build();
    }
}
