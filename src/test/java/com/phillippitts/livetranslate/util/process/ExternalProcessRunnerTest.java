package com.phillippitts.livetranslate.util.process;

import com.phillippitts.livetranslate.testutil.FakeProcess;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class ExternalProcessRunnerTest {

    @Test
    void capturesOutputAndExitCode() throws Exception {
        FakeProcess process = FakeProcess.exits(3, "out", "err");
        ExternalProcessRunner runner = new ExternalProcessRunner(FakeProcess.factory(process));

        ProcessResult result = runner.run("test", List.of("tool"), null, null, Duration.ofSeconds(1), 1024);

        assertThat(result.exitCode()).isEqualTo(3);
        assertThat(result.timedOut()).isFalse();
        assertThat(result.succeeded()).isFalse();
        assertThat(result.stdoutText()).isEqualTo("out");
        assertThat(result.stderr()).isEqualTo("err");
    }

    @Test
    void capsStdout() throws Exception {
        FakeProcess process = FakeProcess.exits(0, "x".repeat(5000), "");
        ExternalProcessRunner runner = new ExternalProcessRunner(FakeProcess.factory(process));

        ProcessResult result = runner.run("test", List.of("tool"), null, null, Duration.ofSeconds(1), 100);

        assertThat(result.stdout()).hasSize(100);
    }

    @Test
    void writesStdin() throws Exception {
        FakeProcess process = FakeProcess.exits(0, "", "");
        ExternalProcessRunner runner = new ExternalProcessRunner(FakeProcess.factory(process));

        runner.run("test", List.of("tool"), null, new byte[]{1, 2, 3}, Duration.ofSeconds(1), 100);

        await().atMost(Duration.ofSeconds(2)).until(() -> process.stdinBytes().length == 3);
        assertThat(process.stdinBytes()).containsExactly(1, 2, 3);
    }

    @Test
    void destroysProcessOnTimeout() throws Exception {
        FakeProcess process = FakeProcess.hangs();
        ExternalProcessRunner runner = new ExternalProcessRunner(FakeProcess.factory(process));

        ProcessResult result = runner.run("test", List.of("tool"), null, null, Duration.ofMillis(20), 100);

        assertThat(result.timedOut()).isTrue();
        assertThat(result.exitCode()).isEqualTo(-1);
        assertThat(process.wasDestroyCalled()).isTrue();
    }

    @Test
    void stderrSnippetIsBounded() {
        ProcessResult result = new ProcessResult(1, false, new byte[0], "abcdef", 5);

        assertThat(result.stderrSnippet(3)).isEqualTo("abc");
        assertThat(result.stderrSnippet(10)).isEqualTo("abcdef");
    }
}
