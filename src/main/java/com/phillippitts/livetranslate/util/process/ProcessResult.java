package com.phillippitts.livetranslate.util.process;

import java.nio.charset.StandardCharsets;

/**
 * Captured outcome of an external process run.
 *
 * @param exitCode   process exit code, or -1 when the process timed out
 * @param timedOut   true when the process was killed after exceeding its timeout
 * @param stdout     captured stdout (capped)
 * @param stderr     captured stderr (capped)
 * @param durationMs wall time of the run
 */
public record ProcessResult(int exitCode, boolean timedOut, byte[] stdout, String stderr, long durationMs) {

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }

    public String stdoutText() {
        return new String(stdout, StandardCharsets.UTF_8);
    }

    public String stderrSnippet(int maxChars) {
        if (stderr == null) {
            return "";
        }
        return stderr.length() <= maxChars ? stderr : stderr.substring(0, maxChars);
    }
}
