package com.phillippitts.geminibridge.service.cli.process;

import org.awaitility.Awaitility;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static com.phillippitts.geminibridge.service.cli.process.ProcessTestDoubles.ProcessBehavior;
import static com.phillippitts.geminibridge.service.cli.process.ProcessTestDoubles.StubProcessFactory;
import static com.phillippitts.geminibridge.service.cli.process.ProcessTestDoubles.TestProcess;
import static org.assertj.core.api.Assertions.assertThat;

class ProcessRunnerTest {

    private static final List<String> CMD = List.of("gemini", "-m", "gemini-2.5-flash");

    @Test
    void capturesStdoutStderrAndExitCode() throws Exception {
        TestProcess tp = new TestProcess(ProcessBehavior.exits(3, "line one\nline two", "warning"));
        ProcessRunner runner = new ProcessRunner(new StubProcessFactory(tp));

        ProcessOutcome outcome = runner.run(CMD, null, null, Duration.ofSeconds(2), 1024, 1024, "test");

        assertThat(outcome.exitCode()).isEqualTo(3);
        assertThat(outcome.stdout()).isEqualTo("line one\nline two");
        assertThat(outcome.stderr()).isEqualTo("warning");
        assertThat(outcome.timedOut()).isFalse();
        assertThat(outcome.succeeded()).isFalse();
    }

    @Test
    void writesStdinAsUtf8() throws Exception {
        TestProcess tp = new TestProcess(ProcessBehavior.exits(0, "ok", ""));
        ProcessRunner runner = new ProcessRunner(new StubProcessFactory(tp));

        runner.run(CMD, null, "[User]\nこんにちは", Duration.ofSeconds(2), 1024, 1024, "test");

        Awaitility.await().atMost(1, TimeUnit.SECONDS)
                .untilAsserted(() -> assertThat(tp.writtenStdin()).isEqualTo("[User]\nこんにちは"));
    }

    @Test
    void stdoutIsCappedAtConfiguredBytes() throws Exception {
        TestProcess tp = new TestProcess(ProcessBehavior.exits(0, "0123456789\nabcdefghij", ""));
        ProcessRunner runner = new ProcessRunner(new StubProcessFactory(tp));

        ProcessOutcome outcome = runner.run(CMD, null, null, Duration.ofSeconds(2), 5, 1024, "test");

        assertThat(outcome.stdout()).isEqualTo("01234");
    }

    @Test
    void outputIsKeptByteForByte() throws Exception {
        String raw = "\nfirst\r\nsecond\rthird\n";
        TestProcess tp = new TestProcess(ProcessBehavior.exits(0, raw, "warn\r\n"));
        ProcessRunner runner = new ProcessRunner(new StubProcessFactory(tp));

        ProcessOutcome outcome = runner.run(CMD, null, null, Duration.ofSeconds(2), 1024, 1024, "test");

        assertThat(outcome.stdout()).isEqualTo(raw);
        assertThat(outcome.stderr()).isEqualTo("warn\r\n");
    }

    @Test
    void capCountsEncodedBytesNotCharacters() throws Exception {
        // each character is three bytes in UTF-8
        TestProcess tp = new TestProcess(ProcessBehavior.exits(0, "ありがとう", ""));
        ProcessRunner runner = new ProcessRunner(new StubProcessFactory(tp));

        ProcessOutcome outcome = runner.run(CMD, null, null, Duration.ofSeconds(2), 6, 1024, "test");

        assertThat(outcome.stdout()).isEqualTo("あり");
    }

    @Test
    void timeoutKillsProcessAndReportsTimedOut() throws Exception {
        TestProcess tp = new TestProcess(ProcessBehavior.hangs());
        ProcessRunner runner = new ProcessRunner(new StubProcessFactory(tp));

        long start = System.nanoTime();
        ProcessOutcome outcome = runner.run(CMD, null, "prompt", Duration.ofMillis(300), 1024, 1024, "test");
        long durationMs = (System.nanoTime() - start) / 1_000_000L;

        assertThat(outcome.timedOut()).isTrue();
        assertThat(outcome.exitCode()).isEqualTo(-1);
        assertThat(tp.wasDestroyCalled()).isTrue();
        assertThat(durationMs).isLessThan(3000);
    }

    @Test
    void passesWorkingDirectoryToFactory() throws Exception {
        TestProcess tp = new TestProcess(ProcessBehavior.exits(0, "ok", ""));
        StubProcessFactory factory = new StubProcessFactory(tp);
        ProcessRunner runner = new ProcessRunner(factory);

        runner.run(CMD, java.nio.file.Path.of("/tmp/work"), null, Duration.ofSeconds(1), 64, 64, "test");

        assertThat(factory.lastCommand()).isEqualTo(CMD);
        assertThat(factory.lastWorkingDir()).isEqualTo(java.nio.file.Path.of("/tmp/work"));
    }
}
