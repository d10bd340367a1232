package com.phillippitts.geminibridge.presentation.exception;

import com.phillippitts.geminibridge.exception.CliExecutionException;
import com.phillippitts.geminibridge.exception.InvalidChatRequestException;
import com.phillippitts.geminibridge.exception.QueueTimeoutException;
import com.phillippitts.geminibridge.presentation.dto.OpenAiError;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Maps domain exceptions to OpenAI error responses. Client-facing messages are fixed strings;
 * CLI stderr and internal error text never leave the server.
 */
public final class OpenAiErrors {

    static final String API_ERROR = "api_error";
    static final String INVALID_REQUEST = "invalid_request_error";

    private OpenAiErrors() {
        // Utility class - prevent instantiation
    }

    public static ResponseEntity<OpenAiError> forException(Throwable ex) {
        if (ex instanceof QueueTimeoutException) {
            return of(HttpStatus.GATEWAY_TIMEOUT,
                    "Request timed out waiting for an available worker", API_ERROR, "timeout", null);
        }
        if (ex instanceof CliExecutionException cli) {
            if (cli.isTimeout()) {
                return of(HttpStatus.GATEWAY_TIMEOUT,
                        "Request timed out while processing", API_ERROR, "timeout", null);
            }
            return of(HttpStatus.INTERNAL_SERVER_ERROR,
                    "Gemini CLI execution failed", API_ERROR, "model_error", null);
        }
        if (ex instanceof InvalidChatRequestException invalid) {
            return of(HttpStatus.BAD_REQUEST, invalid.getMessage(), INVALID_REQUEST, INVALID_REQUEST,
                    invalid.getParam());
        }
        return of(HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred", API_ERROR, "internal_server_error", null);
    }

    static ResponseEntity<OpenAiError> of(HttpStatus status, String message, String type, String code, String param) {
        return ResponseEntity.status(status).body(OpenAiError.of(message, type, code, param));
    }
}
