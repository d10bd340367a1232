package com.phillippitts.geminibridge.service.cli;

import com.phillippitts.geminibridge.config.cli.GeminiCliConfig;
import com.phillippitts.geminibridge.domain.ExecutionResult;
import com.phillippitts.geminibridge.service.cli.process.ProcessOutcome;
import com.phillippitts.geminibridge.service.cli.process.ProcessRunner;
import com.phillippitts.geminibridge.util.LogSanitizer;
import com.phillippitts.geminibridge.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Executes the Gemini CLI once per call.
 *
 * <p>Responsibilities:
 * - Create an isolated working directory and remove it on every exit path
 * - Build the command via {@link GeminiCommandBuilder} and pass the prompt on stdin
 * - Enforce the execution timeout (delegated to {@link ProcessRunner})
 * - Classify the outcome: non-zero exit, empty output, timeout, success
 *
 * <p>Never throws for tool failures. Local faults (working directory creation, process start)
 * become {@link ExecutionResult#INTERNAL_ERROR_EXIT_CODE} results.
 */
public class GeminiProcessExecutor implements CliExecutor {

    private static final Logger LOG = LogManager.getLogger(GeminiProcessExecutor.class);

    private final ProcessRunner runner;
    private final GeminiCommandBuilder commandBuilder;
    private final GeminiCliConfig config;
    private final WorkdirFactory workdirFactory;
    private final boolean debug;

    /**
     * Creates request working directories; replaced in tests to observe cleanup.
     */
    @FunctionalInterface
    interface WorkdirFactory {
        WorkingDirectory create(String prefix, String requestId) throws IOException;
    }

    public GeminiProcessExecutor(ProcessRunner runner,
                                 GeminiCommandBuilder commandBuilder,
                                 GeminiCliConfig config,
                                 boolean debug) {
        this(runner, commandBuilder, config, WorkingDirectory::create, debug);
    }

    GeminiProcessExecutor(ProcessRunner runner,
                          GeminiCommandBuilder commandBuilder,
                          GeminiCliConfig config,
                          WorkdirFactory workdirFactory,
                          boolean debug) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.commandBuilder = Objects.requireNonNull(commandBuilder, "commandBuilder");
        this.config = Objects.requireNonNull(config, "config");
        this.workdirFactory = Objects.requireNonNull(workdirFactory, "workdirFactory");
        this.debug = debug;
    }

    @Override
    public ExecutionResult run(String prompt, String model, String requestId) {
        Objects.requireNonNull(prompt, "prompt");
        Objects.requireNonNull(model, "model");
        GeminiCliConfig cfg = config;
        long startTime = System.nanoTime();

        try (WorkingDirectory workdir = workdirFactory.create(cfg.workdirPrefix(), requestId)) {
            return invoke(cfg, prompt, model, requestId, workdir.path(), startTime);
        } catch (IOException e) {
            LOG.error("Failed to prepare CLI execution requestId={}: {}", requestId, e.toString());
            return ExecutionResult.internalError(e.getMessage() == null ? e.toString() : e.getMessage(),
                    TimeUtils.elapsedMillis(startTime));
        } catch (RuntimeException e) {
            LOG.error("Unexpected CLI execution failure requestId={}", requestId, e);
            return ExecutionResult.internalError(e.toString(), TimeUtils.elapsedMillis(startTime));
        }
    }

    private ExecutionResult invoke(GeminiCliConfig cfg,
                                   String prompt,
                                   String model,
                                   String requestId,
                                   Path workdir,
                                   long startTime) throws IOException {
        List<String> command = commandBuilder.build(cfg, model);
        LOG.info("Starting Gemini CLI requestId={} model={} shell={} promptLength={} promptPreview={}",
                requestId, model, commandBuilder.requiresShell(), prompt.length(), preview(prompt, 100));

        ProcessOutcome outcome;
        try {
            outcome = runner.run(command, workdir, prompt, Duration.ofSeconds(cfg.timeoutSeconds()),
                    cfg.maxStdoutBytes(), cfg.maxStderrBytes(), "gemini");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExecutionResult.internalError("Interrupted while waiting for CLI",
                    TimeUtils.elapsedMillis(startTime));
        }

        long elapsedMs = TimeUtils.elapsedMillis(startTime);
        if (outcome.timedOut()) {
            LOG.warn("Gemini CLI timed out requestId={} after {}s", requestId, cfg.timeoutSeconds());
            return ExecutionResult.timeout(elapsedMs);
        }

        String stdout = outcome.stdout().trim();
        String stderr = outcome.stderr().trim();
        LOG.debug("CLI stdout received requestId={} stdoutLength={}", requestId, stdout.length());

        if (outcome.exitCode() != 0) {
            return ExecutionResult.failure("CLI exited with code " + outcome.exitCode(),
                    outcome.exitCode(), stderr, elapsedMs);
        }
        if (stdout.isEmpty()) {
            return ExecutionResult.failure(ExecutionResult.EMPTY_RESPONSE_ERROR, 0, stderr, elapsedMs);
        }

        LOG.info("Extracted content from CLI output requestId={} contentLength={} contentPreview={}",
                requestId, stdout.length(), preview(stdout, 100));
        return ExecutionResult.success(stdout, stderr, elapsedMs);
    }

    private String preview(String text, int max) {
        return debug ? LogSanitizer.truncate(text, max) : LogSanitizer.maskContent(text, max);
    }
}
