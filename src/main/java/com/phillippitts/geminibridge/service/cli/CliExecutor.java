package com.phillippitts.geminibridge.service.cli;

import com.phillippitts.geminibridge.domain.ExecutionResult;

/**
 * Runs a prompt through the Gemini CLI.
 *
 * <p>Implementations never throw for expected external-tool failures; every outcome, including
 * timeouts and local faults, is returned as an {@link ExecutionResult}.
 */
public interface CliExecutor {

    /**
     * @param prompt fully rendered prompt text (written to the CLI's stdin)
     * @param model resolved Gemini model identifier
     * @param requestId request correlation id, also used to name the working directory
     * @return execution outcome
     */
    ExecutionResult run(String prompt, String model, String requestId);
}
