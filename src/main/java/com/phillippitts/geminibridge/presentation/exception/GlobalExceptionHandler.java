package com.phillippitts.geminibridge.presentation.exception;

import com.phillippitts.geminibridge.exception.CliExecutionException;
import com.phillippitts.geminibridge.exception.InvalidChatRequestException;
import com.phillippitts.geminibridge.exception.QueueTimeoutException;
import com.phillippitts.geminibridge.presentation.dto.OpenAiError;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.concurrent.CompletionException;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to OpenAI error bodies with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Admission slot not obtained in time (HTTP 504).
     */
    @ExceptionHandler(QueueTimeoutException.class)
    ResponseEntity<OpenAiError> handleQueueTimeout(QueueTimeoutException ex) {
        LOG.warn("Queue timeout: requestId={}, timeoutMs={}", ex.getRequestId(), ex.getTimeoutMs());
        return OpenAiErrors.forException(ex);
    }

    /**
     * Upstream CLI failure: timeout (HTTP 504) or anything else (HTTP 500).
     */
    @ExceptionHandler(CliExecutionException.class)
    ResponseEntity<OpenAiError> handleCliFailure(CliExecutionException ex) {
        LOG.error("CLI execution failed: {}", ex.getMessage());
        return OpenAiErrors.forException(ex);
    }

    /**
     * Client error - invalid messages (HTTP 400).
     */
    @ExceptionHandler(InvalidChatRequestException.class)
    ResponseEntity<OpenAiError> handleInvalidRequest(InvalidChatRequestException ex) {
        LOG.warn("Invalid chat request: {}", ex.getMessage());
        return OpenAiErrors.forException(ex);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<OpenAiError> handleBeanValidation(MethodArgumentNotValidException ex) {
        FieldError field = ex.getBindingResult().getFieldError();
        String message = field != null ? field.getDefaultMessage() : "Invalid request";
        String param = field != null ? field.getField() : null;
        LOG.warn("Request validation failed: {}", message);
        return OpenAiErrors.of(HttpStatus.BAD_REQUEST, message,
                OpenAiErrors.INVALID_REQUEST, OpenAiErrors.INVALID_REQUEST, param);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<OpenAiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return OpenAiErrors.of(HttpStatus.BAD_REQUEST, "Request body is not valid JSON",
                OpenAiErrors.INVALID_REQUEST, OpenAiErrors.INVALID_REQUEST, null);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    ResponseEntity<OpenAiError> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        return OpenAiErrors.of(HttpStatus.METHOD_NOT_ALLOWED, ex.getMessage(),
                OpenAiErrors.INVALID_REQUEST, "method_not_allowed", null);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    ResponseEntity<OpenAiError> handleNotFound(NoResourceFoundException ex) {
        return OpenAiErrors.of(HttpStatus.NOT_FOUND, "Unknown endpoint",
                OpenAiErrors.INVALID_REQUEST, "not_found", null);
    }

    /**
     * Async failures arrive wrapped; map the cause.
     */
    @ExceptionHandler(CompletionException.class)
    ResponseEntity<OpenAiError> handleCompletion(CompletionException ex) {
        Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof QueueTimeoutException qte) {
            return handleQueueTimeout(qte);
        }
        if (cause instanceof CliExecutionException cli) {
            return handleCliFailure(cli);
        }
        if (cause instanceof InvalidChatRequestException invalid) {
            return handleInvalidRequest(invalid);
        }
        LOG.error("Unexpected async error", cause);
        return OpenAiErrors.forException(cause);
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<OpenAiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return OpenAiErrors.forException(ex);
    }
}
