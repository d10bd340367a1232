package com.phillippitts.geminibridge.presentation.controller;

import com.phillippitts.geminibridge.config.logging.MdcFilter;
import com.phillippitts.geminibridge.domain.ChatCompletion;
import com.phillippitts.geminibridge.presentation.dto.ChatCompletionChunk;
import com.phillippitts.geminibridge.presentation.dto.ChatCompletionRequest;
import com.phillippitts.geminibridge.presentation.dto.ChatCompletionResponse;
import com.phillippitts.geminibridge.presentation.exception.OpenAiErrors;
import com.phillippitts.geminibridge.service.chat.ChatCompletionService;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * OpenAI-compatible {@code POST /v1/chat/completions}.
 *
 * <p>Requests return a {@link CompletableFuture} so the servlet thread is released while the
 * request waits for an admission slot. Streaming requests get the whole reply as one
 * content chunk, framed by a role chunk and a stop chunk, then {@code [DONE]}. A failure while
 * streaming is reported as a single error chunk.
 */
@RestController
class ChatCompletionsController {

    private static final Logger LOG = LogManager.getLogger(ChatCompletionsController.class);

    static final String DONE = "[DONE]";

    private final ChatCompletionService service;

    ChatCompletionsController(ChatCompletionService service) {
        this.service = service;
    }

    /**
     * The future completes with a {@link ChatCompletionResponse} or, for streaming requests, an
     * {@link SseEmitter}; Spring MVC renders the value according to its runtime type.
     */
    @PostMapping("/v1/chat/completions")
    CompletableFuture<Object> complete(@Valid @RequestBody ChatCompletionRequest request) {
        String requestId = currentRequestId();
        CompletableFuture<ChatCompletion> future = service.complete(request, requestId);
        if (request.isStreaming()) {
            return CompletableFuture.completedFuture(stream(future));
        }
        return future.<Object>thenApply(c -> ChatCompletionResponse.of(c.id(), c.created(), c.requestedModel(), c.content()));
    }

    private SseEmitter stream(CompletableFuture<ChatCompletion> future) {
        SseEmitter emitter = new SseEmitter(0L);
        future.whenComplete((completion, failure) -> {
            try {
                if (failure != null) {
                    Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                            ? failure.getCause() : failure;
                    LOG.warn("Streaming request failed: {}", cause.getMessage());
                    emitter.send(OpenAiErrors.forException(cause).getBody(), MediaType.APPLICATION_JSON);
                    emitter.complete();
                    return;
                }
                sendChunks(emitter, completion);
                emitter.complete();
            } catch (IOException e) {
                LOG.debug("Client disconnected before stream finished: {}", e.getMessage());
                emitter.completeWithError(e);
            }
        });
        return emitter;
    }

    private static void sendChunks(SseEmitter emitter, ChatCompletion c) throws IOException {
        emitter.send(ChatCompletionChunk.role(c.id(), c.created(), c.requestedModel()), MediaType.APPLICATION_JSON);
        if (c.content() != null && !c.content().isEmpty()) {
            emitter.send(ChatCompletionChunk.content(c.id(), c.created(), c.requestedModel(), c.content()),
                    MediaType.APPLICATION_JSON);
        }
        emitter.send(ChatCompletionChunk.stop(c.id(), c.created(), c.requestedModel()), MediaType.APPLICATION_JSON);
        emitter.send(DONE, MediaType.TEXT_PLAIN);
    }

    private static String currentRequestId() {
        String id = ThreadContext.get(MdcFilter.REQUEST_ID_KEY);
        return id == null || id.isBlank() ? UUID.randomUUID().toString() : id;
    }
}
