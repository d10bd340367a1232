package com.phillippitts.geminibridge.exception;

/**
 * Base exception for all GeminiBridge application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class GeminiBridgeException extends RuntimeException {

    public GeminiBridgeException(String message) {
        super(message);
    }

    public GeminiBridgeException(String message, Throwable cause) {
        super(message, cause);
    }

    public GeminiBridgeException(Throwable cause) {
        super(cause);
    }
}
