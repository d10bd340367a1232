package com.phillippitts.geminibridge.exception;

/**
 * Thrown when a request could not obtain an admission slot within the configured queue timeout.
 * The queued operation is never invoked when this is raised.
 */
public class QueueTimeoutException extends GeminiBridgeException {

    private final String requestId;
    private final long timeoutMs;

    public QueueTimeoutException(String requestId, long timeoutMs) {
        super("Request timeout: queued for " + timeoutMs + "ms");
        this.requestId = requestId;
        this.timeoutMs = timeoutMs;
    }

    public QueueTimeoutException(String requestId, long timeoutMs, Throwable cause) {
        super("Interrupted while queued (waited up to " + timeoutMs + "ms)", cause);
        this.requestId = requestId;
        this.timeoutMs = timeoutMs;
    }

    public String getRequestId() {
        return requestId;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
