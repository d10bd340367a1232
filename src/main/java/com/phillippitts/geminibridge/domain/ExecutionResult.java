package com.phillippitts.geminibridge.domain;

/**
 * Immutable outcome of one Gemini CLI execution (possibly after retries).
 *
 * <p>Failures are represented as values rather than exceptions so the retry loop and the queue
 * can pass them up unchanged. Exit code sentinels {@link #TIMEOUT_EXIT_CODE} and
 * {@link #INTERNAL_ERROR_EXIT_CODE} are negative and therefore never collide with a real
 * process exit status.
 *
 * @param success whether usable content was produced
 * @param content trimmed stdout on success, otherwise null
 * @param error short failure description, null on success
 * @param exitCode process exit code or one of the sentinels
 * @param stderr captured stderr (never null)
 * @param elapsedMs wall-clock duration of the execution
 */
public record ExecutionResult(
        boolean success,
        String content,
        String error,
        int exitCode,
        String stderr,
        long elapsedMs
) {

    /** Exit code reported when the process was killed after exceeding its timeout. */
    public static final int TIMEOUT_EXIT_CODE = -1;

    /** Exit code reported for local faults that prevented or aborted the invocation. */
    public static final int INTERNAL_ERROR_EXIT_CODE = -2;

    public static final String TIMEOUT_ERROR = "Execution timeout";
    public static final String EMPTY_RESPONSE_ERROR = "Empty response from CLI";

    public ExecutionResult {
        if (stderr == null) {
            stderr = "";
        }
        if (elapsedMs < 0) {
            elapsedMs = 0;
        }
    }

    public static ExecutionResult success(String content, String stderr, long elapsedMs) {
        return new ExecutionResult(true, content, null, 0, stderr, elapsedMs);
    }

    public static ExecutionResult failure(String error, int exitCode, String stderr, long elapsedMs) {
        return new ExecutionResult(false, null, error, exitCode, stderr, elapsedMs);
    }

    public static ExecutionResult timeout(long elapsedMs) {
        return failure(TIMEOUT_ERROR, TIMEOUT_EXIT_CODE, "Process killed due to timeout", elapsedMs);
    }

    public static ExecutionResult internalError(String error, long elapsedMs) {
        return failure(error, INTERNAL_ERROR_EXIT_CODE, "", elapsedMs);
    }

    public boolean isTimeout() {
        return !success && exitCode == TIMEOUT_EXIT_CODE;
    }

    public boolean isInternalError() {
        return !success && exitCode == INTERNAL_ERROR_EXIT_CODE;
    }
}
