package com.phillippitts.livetranslate.testutil;

import com.phillippitts.livetranslate.util.process.ProcessFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Minimal fake Process that allows controlling stdout/stderr, exit code and termination timing.
 * Enables hermetic testing of process-backed collaborators without spawning real subprocesses.
 */
public final class FakeProcess extends Process {
    private final byte[] out;
    private final byte[] err;
    private final int exitCode;
    private final boolean hangs;
    private final ByteArrayOutputStream stdin = new ByteArrayOutputStream();
    private volatile boolean alive = true;
    private volatile boolean destroyCalled;

    private FakeProcess(byte[] out, String err, int exitCode, boolean hangs) {
        this.out = out;
        this.err = err.getBytes(StandardCharsets.UTF_8);
        this.exitCode = exitCode;
        this.hangs = hangs;
    }

    public static FakeProcess exits(int exitCode, byte[] stdout, String stderr) {
        return new FakeProcess(stdout, stderr, exitCode, false);
    }

    public static FakeProcess exits(int exitCode, String stdout, String stderr) {
        return exits(exitCode, stdout.getBytes(StandardCharsets.UTF_8), stderr);
    }

    /** Never finishes on its own; only destroy ends it. */
    public static FakeProcess hangs() {
        return new FakeProcess(new byte[0], "", 0, true);
    }

    /** Factory that hands out {@code process} and records every command line it was asked to start. */
    public static Factory factory(Process process) {
        return new Factory(process);
    }

    public boolean wasDestroyCalled() {
        return destroyCalled;
    }

    public synchronized byte[] stdinBytes() {
        return stdin.toByteArray();
    }

    @Override
    public OutputStream getOutputStream() {
        return new OutputStream() {
            @Override
            public void write(int b) {
                synchronized (FakeProcess.this) {
                    stdin.write(b);
                }
            }

            @Override
            public void write(byte[] b, int off, int len) {
                synchronized (FakeProcess.this) {
                    stdin.write(b, off, len);
                }
            }
        };
    }

    @Override
    public InputStream getInputStream() {
        return new ByteArrayInputStream(out);
    }

    @Override
    public InputStream getErrorStream() {
        return new ByteArrayInputStream(err);
    }

    @Override
    public int waitFor() {
        alive = false;
        return exitCode;
    }

    @Override
    public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
        if (hangs && alive) {
            Thread.sleep(Math.min(unit.toMillis(timeout), 50));
            return !alive;
        }
        alive = false;
        return true;
    }

    @Override
    public int exitValue() {
        return exitCode;
    }

    @Override
    public void destroy() {
        destroyCalled = true;
        alive = false;
    }

    @Override
    public Process destroyForcibly() {
        destroyCalled = true;
        alive = false;
        return this;
    }

    @Override
    public boolean isAlive() {
        return alive;
    }

    /** Stub ProcessFactory that returns a pre-configured Process. */
    public static final class Factory implements ProcessFactory {
        private final Process process;
        public final List<List<String>> commands = new CopyOnWriteArrayList<>();

        private Factory(Process process) {
            this.process = process;
        }

        @Override
        public Process start(List<String> command, Path workingDir) {
            commands.add(List.copyOf(command));
            return process;
        }
    }
}
