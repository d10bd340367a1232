/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.geminibridge.exception.GeminiBridgeException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.geminibridge.exception.QueueTimeoutException} - No admission slot
 *       within the queue timeout; the work never started</li>
 *   <li>{@link com.phillippitts.geminibridge.exception.CliExecutionException} - The Gemini CLI
 *       finished without a usable response (timeout, tool failure, exhausted conflict retries)</li>
 *   <li>{@link com.phillippitts.geminibridge.exception.InvalidChatRequestException} - Chat request
 *       failed validation</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and map to OpenAI-style error bodies via
 * {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.geminibridge.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.geminibridge.exception;
