package com.phillippitts.geminibridge.service.cli;

import com.phillippitts.geminibridge.config.cli.GeminiCliConfig;
import com.phillippitts.geminibridge.domain.ExecutionResult;
import com.phillippitts.geminibridge.service.cli.process.ProcessRunner;
import com.phillippitts.geminibridge.service.cli.process.ProcessTestDoubles.ProcessBehavior;
import com.phillippitts.geminibridge.service.cli.process.ProcessTestDoubles.StubProcessFactory;
import com.phillippitts.geminibridge.service.cli.process.ProcessTestDoubles.TestProcess;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GeminiProcessExecutorTest {

    @TempDir
    Path tempRoot;

    private final List<Path> createdDirs = new ArrayList<>();

    private GeminiProcessExecutor executorFor(TestProcess process, GeminiCliConfig cfg) {
        ProcessRunner runner = new ProcessRunner(new StubProcessFactory(process));
        return new GeminiProcessExecutor(runner, new GeminiCommandBuilder("Linux"), cfg,
                (prefix, requestId) -> {
                    WorkingDirectory dir = WorkingDirectory.create(tempRoot, prefix, requestId);
                    createdDirs.add(dir.path());
                    return dir;
                }, false);
    }

    @Test
    void successReturnsTrimmedStdout() {
        TestProcess tp = new TestProcess(ProcessBehavior.exits(0, "  Hello from Gemini  \n", ""));
        GeminiProcessExecutor executor = executorFor(tp, GeminiCliConfig.defaults());

        ExecutionResult result = executor.run("[User]\nhi", "gemini-2.5-flash", "req-1");

        assertThat(result.success()).isTrue();
        assertThat(result.content()).isEqualTo("Hello from Gemini");
        assertThat(result.exitCode()).isZero();
        assertThat(tp.writtenStdin()).isEqualTo("[User]\nhi");
    }

    @Test
    void nonZeroExitReturnsFailureWithStderr() {
        TestProcess tp = new TestProcess(ProcessBehavior.exits(1, "", "quota exceeded"));
        GeminiProcessExecutor executor = executorFor(tp, GeminiCliConfig.defaults());

        ExecutionResult result = executor.run("prompt", "gemini-2.5-pro", "req-2");

        assertThat(result.success()).isFalse();
        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.stderr()).isEqualTo("quota exceeded");
        assertThat(result.error()).contains("code 1");
    }

    @Test
    void blankStdoutIsEmptyResponseFailure() {
        TestProcess tp = new TestProcess(ProcessBehavior.exits(0, "   \n", ""));
        GeminiProcessExecutor executor = executorFor(tp, GeminiCliConfig.defaults());

        ExecutionResult result = executor.run("prompt", "gemini-2.5-flash", "req-3");

        assertThat(result.success()).isFalse();
        assertThat(result.exitCode()).isZero();
        assertThat(result.error()).isEqualTo(ExecutionResult.EMPTY_RESPONSE_ERROR);
    }

    @Test
    void timeoutReturnsTimeoutSentinel() {
        TestProcess tp = new TestProcess(ProcessBehavior.hangs());
        GeminiProcessExecutor executor = executorFor(tp, GeminiCliConfig.defaults().withBinary("gemini", 1));

        ExecutionResult result = executor.run("prompt", "gemini-2.5-flash", "req-4");

        assertThat(result.isTimeout()).isTrue();
        assertThat(result.exitCode()).isEqualTo(ExecutionResult.TIMEOUT_EXIT_CODE);
        assertThat(result.error()).isEqualTo(ExecutionResult.TIMEOUT_ERROR);
        assertThat(tp.wasDestroyCalled()).isTrue();
    }

    @Test
    void workingDirectoryRemovedOnSuccessFailureAndTimeout() {
        executorFor(new TestProcess(ProcessBehavior.exits(0, "ok", "")), GeminiCliConfig.defaults())
                .run("p", "gemini-2.5-flash", "ok");
        executorFor(new TestProcess(ProcessBehavior.exits(2, "", "boom")), GeminiCliConfig.defaults())
                .run("p", "gemini-2.5-flash", "fail");
        executorFor(new TestProcess(ProcessBehavior.hangs()), GeminiCliConfig.defaults().withBinary("gemini", 1))
                .run("p", "gemini-2.5-flash", "slow");

        assertThat(createdDirs).hasSize(3);
        assertThat(createdDirs).allSatisfy(dir -> assertThat(Files.exists(dir)).isFalse());
    }

    @Test
    void workdirCreationFailureIsInternalError() {
        ProcessRunner runner = new ProcessRunner(new StubProcessFactory(
                new TestProcess(ProcessBehavior.exits(0, "unused", ""))));
        GeminiProcessExecutor executor = new GeminiProcessExecutor(runner, new GeminiCommandBuilder("Linux"),
                GeminiCliConfig.defaults(),
                (prefix, requestId) -> {
                    throw new IOException("disk full");
                }, false);

        ExecutionResult result = executor.run("prompt", "gemini-2.5-flash", "req-5");

        assertThat(result.isInternalError()).isTrue();
        assertThat(result.exitCode()).isEqualTo(ExecutionResult.INTERNAL_ERROR_EXIT_CODE);
        assertThat(result.error()).contains("disk full");
    }

    @Test
    void processStartFailureIsInternalError() {
        ProcessRunner runner = new ProcessRunner((command, dir) -> {
            throw new IOException("gemini: not found");
        });
        GeminiProcessExecutor executor = new GeminiProcessExecutor(runner, new GeminiCommandBuilder("Linux"),
                GeminiCliConfig.defaults(),
                (prefix, requestId) -> WorkingDirectory.create(tempRoot, prefix, requestId), false);

        ExecutionResult result = executor.run("prompt", "gemini-2.5-flash", "req-6");

        assertThat(result.isInternalError()).isTrue();
    }

    @Test
    void runsInRequestWorkingDirectoryWithSandboxFlag() {
        TestProcess tp = new TestProcess(ProcessBehavior.exits(0, "ok", ""));
        StubProcessFactory factory = new StubProcessFactory(tp);
        GeminiProcessExecutor executor = new GeminiProcessExecutor(new ProcessRunner(factory),
                new GeminiCommandBuilder("Linux"), GeminiCliConfig.defaults(),
                (prefix, requestId) -> WorkingDirectory.create(tempRoot, prefix, requestId), false);

        executor.run("prompt", "gemini-2.5-pro", "abc");

        assertThat(factory.lastCommand()).containsExactly("gemini", "-m", "gemini-2.5-pro", "--sandbox");
        assertThat(factory.lastWorkingDir().getFileName().toString()).startsWith("gemini-bridge-abc-");
        assertThat(factory.lastWorkingDir().getParent()).isEqualTo(tempRoot);
    }
}
