package com.phillippitts.livetranslate.util.process;

import com.phillippitts.livetranslate.util.ProcessTimeouts;
import com.phillippitts.livetranslate.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs one external process to completion with bounded output capture and a hard timeout.
 *
 * <p>Every call owns its process and reader threads, so one runner can be shared by concurrent
 * jobs. Stdout and stderr are drained on daemon threads started before waiting, which avoids
 * pipe deadlocks; output beyond the cap is read and discarded. Optional stdin bytes are written
 * on a separate thread and the stream is closed afterwards.
 */
public final class ExternalProcessRunner {

    private static final Logger LOG = LogManager.getLogger(ExternalProcessRunner.class);

    /** Stderr kept for diagnostics. */
    public static final int STDERR_MAX_BYTES = 256 * 1024;

    private static final int READ_BUFFER = 8192;

    private final ProcessFactory processFactory;

    public ExternalProcessRunner() {
        this(new DefaultProcessFactory());
    }

    public ExternalProcessRunner(ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    /**
     * Starts {@code command}, feeds {@code stdin} (may be null) and waits up to {@code timeout}.
     *
     * @param name           short label used for reader thread names and logs
     * @param command        command line, executable first
     * @param workingDir     working directory (may be null)
     * @param stdin          bytes to write to the process stdin, or null to close it immediately
     * @param timeout        hard limit; the process is destroyed when exceeded
     * @param maxStdoutBytes stdout cap
     * @return captured result; {@link ProcessResult#timedOut()} reports a timeout
     * @throws IOException          if the process cannot be started
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public ProcessResult run(String name, List<String> command, Path workingDir, byte[] stdin,
                             Duration timeout, int maxStdoutBytes) throws IOException, InterruptedException {
        long start = System.nanoTime();
        Process process = processFactory.start(command, workingDir);
        CappedSink out = new CappedSink(maxStdoutBytes);
        CappedSink err = new CappedSink(STDERR_MAX_BYTES);
        Thread outReader = startReader(process.getInputStream(), out, name + "-out");
        Thread errReader = startReader(process.getErrorStream(), err, name + "-err");
        Thread writer = startWriter(process.getOutputStream(), stdin, name + "-in");
        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                destroy(process);
                join(outReader, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
                join(errReader, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
                return new ProcessResult(-1, true, out.bytes(), err.text(), TimeUtils.elapsedMillis(start));
            }
            join(outReader, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            join(errReader, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            join(writer, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
            int exit = process.exitValue();
            long durationMs = TimeUtils.elapsedMillis(start);
            LOG.debug("Process '{}' exited {} in {} ms (stdout={} bytes)", name, exit, durationMs, out.size());
            return new ProcessResult(exit, false, out.bytes(), err.text(), durationMs);
        } catch (InterruptedException e) {
            destroy(process);
            throw e;
        }
    }

    private static Thread startReader(InputStream in, CappedSink sink, String threadName) {
        Thread t = new Thread(() -> {
            byte[] buf = new byte[READ_BUFFER];
            try (InputStream is = in) {
                int n;
                while ((n = is.read(buf)) != -1) {
                    sink.write(buf, n, threadName);
                }
            } catch (IOException e) {
                LOG.debug("Stream reader '{}' stopped: {}", threadName, e.toString());
            }
        }, threadName);
        t.setDaemon(true);
        t.start();
        return t;
    }

    private static Thread startWriter(OutputStream os, byte[] stdin, String threadName) {
        Thread t = new Thread(() -> {
            try (OutputStream o = os) {
                if (stdin != null && stdin.length > 0) {
                    o.write(stdin);
                    o.flush();
                }
            } catch (IOException e) {
                // Process exited before consuming all input; its exit code reports the problem
                LOG.debug("Stdin writer '{}' stopped: {}", threadName, e.toString());
            }
        }, threadName);
        t.setDaemon(true);
        t.start();
        return t;
    }

    private static void join(Thread thread, Duration timeout) {
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void destroy(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying process");
        }
    }

    /** Byte sink that stops accumulating at its cap but keeps accepting (and dropping) input. */
    private static final class CappedSink {
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private final int max;
        private boolean capReached;

        CappedSink(int max) {
            this.max = max;
        }

        synchronized void write(byte[] data, int len, String name) {
            int room = max - buffer.size();
            if (room <= 0) {
                if (!capReached) {
                    LOG.warn("Stream '{}' reached {}B cap; discarding further output", name, max);
                    capReached = true;
                }
                return;
            }
            buffer.write(data, 0, Math.min(room, len));
        }

        synchronized byte[] bytes() {
            return buffer.toByteArray();
        }

        synchronized String text() {
            return buffer.toString(StandardCharsets.UTF_8);
        }

        synchronized int size() {
            return buffer.size();
        }
    }
}
