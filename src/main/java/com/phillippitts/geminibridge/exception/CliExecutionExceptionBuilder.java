package com.phillippitts.geminibridge.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing {@link CliExecutionException} with rich contextual information.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw CliExecutionExceptionBuilder.create("CLI exited with code 1")
 *         .kind(CliExecutionException.Kind.TOOL_FAILURE)
 *         .exitCode(1)
 *         .durationMs(1500)
 *         .metadata("model", "gemini-2.5-flash")
 *         .metadata("stderr", stderrSnippet)
 *         .build();
 * </pre>
 */
public final class CliExecutionExceptionBuilder {

    private final String message;
    private CliExecutionException.Kind kind = CliExecutionException.Kind.TOOL_FAILURE;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private CliExecutionExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static CliExecutionExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new CliExecutionExceptionBuilder(message);
    }

    public CliExecutionExceptionBuilder kind(CliExecutionException.Kind kind) {
        if (kind != null) {
            this.kind = kind;
        }
        return this;
    }

    public CliExecutionExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public CliExecutionExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public CliExecutionExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     */
    public CliExecutionExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (kind={kind}, exitCode={code}, durationMs={ms}, {key1}={val1}, ...)
     * </pre>
     */
    public CliExecutionException build() {
        String detailed = buildDetailedMessage();
        int code = exitCode != null ? exitCode : -1;
        if (cause != null) {
            return new CliExecutionException(detailed, kind, code, cause);
        }
        return new CliExecutionException(detailed, kind, code);
    }

    private String buildDetailedMessage() {
        StringBuilder sb = new StringBuilder(message);
        sb.append(" (kind=").append(kind);
        if (exitCode != null) {
            sb.append(", exitCode=").append(exitCode);
        }
        if (durationMs != null) {
            sb.append(", durationMs=").append(durationMs);
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            sb.append(", ").append(entry.getKey()).append("=").append(entry.getValue());
        }
        sb.append(")");
        return sb.toString();
    }
}
