package com.phillippitts.geminibridge.service.chat;

import com.phillippitts.geminibridge.domain.ChatCompletion;
import com.phillippitts.geminibridge.domain.ExecutionResult;
import com.phillippitts.geminibridge.exception.CliExecutionException;
import com.phillippitts.geminibridge.exception.CliExecutionExceptionBuilder;
import com.phillippitts.geminibridge.exception.QueueTimeoutException;
import com.phillippitts.geminibridge.presentation.dto.ChatCompletionRequest;
import com.phillippitts.geminibridge.service.cli.CliExecutor;
import com.phillippitts.geminibridge.service.cli.conflict.ConflictDetector;
import com.phillippitts.geminibridge.service.metrics.CliMetrics;
import com.phillippitts.geminibridge.service.queue.AdmissionQueue;
import com.phillippitts.geminibridge.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Orchestrates one chat completion: validate, resolve the model, render the prompt, then run the
 * CLI through the admission queue on the {@code cliExecutor} pool.
 *
 * <p>Validation and queue registration happen on the calling thread, so malformed requests fail
 * before anything is queued and a request's queue timeout starts when it arrives, not when a
 * worker picks it up. Everything after that runs asynchronously; a request the worker pool
 * refuses fails with {@link QueueTimeoutException}. Otherwise the returned future completes with a
 * {@link ChatCompletion} or fails with {@link QueueTimeoutException} or
 * {@link CliExecutionException}.
 */
@Service
public class ChatCompletionService {

    private static final Logger LOG = LogManager.getLogger(ChatCompletionService.class);

    private static final int PREVIEW_CHARS = 100;
    private static final int STDERR_SNIPPET_CHARS = 200;

    private final AdmissionQueue queue;
    private final CliExecutor cliExecutor;
    private final ModelResolver modelResolver;
    private final CliMetrics metrics;
    private final Executor executor;
    private final boolean debug;

    public ChatCompletionService(AdmissionQueue queue,
                                 CliExecutor cliExecutor,
                                 ModelResolver modelResolver,
                                 CliMetrics metrics,
                                 @Qualifier("cliExecutor") Executor executor,
                                 @Value("${bridge.debug:false}") boolean debug) {
        this.queue = queue;
        this.cliExecutor = cliExecutor;
        this.modelResolver = modelResolver;
        this.metrics = metrics;
        this.executor = executor;
        this.debug = debug;
    }

    /**
     * @param request OpenAI chat completion request
     * @param requestId correlation id, also the suffix of the completion id
     * @return future completion
     * @throws com.phillippitts.geminibridge.exception.InvalidChatRequestException if the
     *         messages fail validation (thrown synchronously)
     */
    public CompletableFuture<ChatCompletion> complete(ChatCompletionRequest request, String requestId) {
        ChatRequestValidator.validate(request.messages());
        String model = modelResolver.resolve(request.model());
        String prompt = PromptBuilder.build(request.messages());
        long startTime = System.nanoTime();
        AdmissionQueue.Ticket ticket = queue.enqueue(requestId);
        try {
            return CompletableFuture.supplyAsync(
                    () -> execute(ticket, startTime, requestId, request.model(), model, prompt), executor);
        } catch (RejectedExecutionException e) {
            queue.abandon(ticket);
            metrics.incrementFailure(model, "rejected");
            LOG.warn("Worker pool saturated, rejecting request {}", requestId);
            return CompletableFuture.failedFuture(
                    new QueueTimeoutException(requestId, queue.getQueueTimeoutMs(), e));
        }
    }

    private ChatCompletion execute(AdmissionQueue.Ticket ticket, long startTime, String requestId,
                                   String requestedModel, String model, String prompt) {
        ExecutionResult result;
        try {
            result = queue.awaitAndRun(ticket, () -> cliExecutor.run(prompt, model, requestId));
        } catch (QueueTimeoutException e) {
            metrics.incrementFailure(model, "queue_timeout");
            throw e;
        }
        metrics.recordLatency(model, System.nanoTime() - startTime);

        if (!result.success()) {
            CliExecutionException failure = toException(result, model);
            metrics.incrementFailure(model, failure.getKind().name().toLowerCase(Locale.ROOT));
            LOG.error("Request failed: {} prompt={}", failure.getMessage(), preview(prompt));
            throw failure;
        }

        metrics.incrementSuccess(model);
        LOG.info("Request completed in {}ms model={} responseLength={} prompt={} response={}",
                result.elapsedMs(), model, result.content().length(),
                preview(prompt), preview(result.content()));
        return new ChatCompletion("chatcmpl-" + requestId, Instant.now().getEpochSecond(),
                requestedModel, model, result.content());
    }

    static CliExecutionException toException(ExecutionResult result, String model) {
        CliExecutionException.Kind kind;
        if (result.isTimeout()) {
            kind = CliExecutionException.Kind.TIMEOUT;
        } else if (result.isInternalError()) {
            kind = CliExecutionException.Kind.INTERNAL;
        } else if (ConflictDetector.isConflict(result.exitCode(), result.stderr())) {
            kind = CliExecutionException.Kind.CONFLICT_EXHAUSTED;
        } else {
            kind = CliExecutionException.Kind.TOOL_FAILURE;
        }
        String message = result.error() == null ? "Unknown error" : result.error();
        return CliExecutionExceptionBuilder.create(message)
                .kind(kind)
                .exitCode(result.exitCode())
                .durationMs(result.elapsedMs())
                .metadata("model", model)
                .metadata("stderr", result.stderr().isEmpty()
                        ? null : LogSanitizer.truncate(result.stderr(), STDERR_SNIPPET_CHARS))
                .build();
    }

    private String preview(String text) {
        return debug ? LogSanitizer.truncate(text, PREVIEW_CHARS) : LogSanitizer.maskContent(text, PREVIEW_CHARS);
    }
}
