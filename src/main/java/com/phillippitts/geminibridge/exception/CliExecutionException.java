package com.phillippitts.geminibridge.exception;

/**
 * Thrown at the HTTP boundary when a Gemini CLI execution finished without a usable response.
 *
 * <p>The message carries diagnostic detail (exit code, stderr snippet) for logs only;
 * {@link com.phillippitts.geminibridge.presentation.exception.GlobalExceptionHandler} never
 * returns it to the client.
 */
public class CliExecutionException extends GeminiBridgeException {

    /**
     * Failure classes as seen by callers.
     */
    public enum Kind {
        /** The process exceeded its execution budget and was killed. */
        TIMEOUT,
        /** Non-zero exit or empty output. */
        TOOL_FAILURE,
        /** Sandbox container name conflict persisted after all retries. */
        CONFLICT_EXHAUSTED,
        /** Local fault such as a working directory that could not be created. */
        INTERNAL
    }

    private final Kind kind;
    private final int exitCode;

    public CliExecutionException(String message, Kind kind, int exitCode) {
        super(message);
        this.kind = kind;
        this.exitCode = exitCode;
    }

    public CliExecutionException(String message, Kind kind, int exitCode, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.exitCode = exitCode;
    }

    public Kind getKind() {
        return kind;
    }

    public int getExitCode() {
        return exitCode;
    }

    public boolean isTimeout() {
        return kind == Kind.TIMEOUT;
    }
}
