package com.phillippitts.livetranslate.util.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} so process-backed collaborators can be tested hermetically.
 *
 * <p>Production code uses {@link DefaultProcessFactory}. Tests supply a fake {@link Process}
 * with scripted stdout, stderr and exit behavior.
 */
@FunctionalInterface
public interface ProcessFactory {

    /**
     * Starts a new process.
     *
     * @param command    full command line, executable first
     * @param workingDir working directory (may be null)
     * @return the started process
     * @throws IOException if the process cannot be started
     */
    Process start(List<String> command, Path workingDir) throws IOException;
}
