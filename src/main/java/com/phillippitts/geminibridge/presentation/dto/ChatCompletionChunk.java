package com.phillippitts.geminibridge.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One {@code chat.completion.chunk} server-sent event.
 */
public record ChatCompletionChunk(
        String id,
        String object,
        long created,
        String model,
        List<Choice> choices
) {

    public static final String OBJECT = "chat.completion.chunk";

    public static ChatCompletionChunk role(String id, long created, String model) {
        return single(id, created, model, new Delta("assistant", null), null);
    }

    public static ChatCompletionChunk content(String id, long created, String model, String content) {
        return single(id, created, model, new Delta(null, content), null);
    }

    public static ChatCompletionChunk stop(String id, long created, String model) {
        return single(id, created, model, new Delta(null, null), "stop");
    }

    private static ChatCompletionChunk single(String id, long created, String model, Delta delta, String finish) {
        return new ChatCompletionChunk(id, OBJECT, created, model, List.of(new Choice(0, delta, finish)));
    }

    public record Choice(
            int index,
            Delta delta,
            @JsonProperty("finish_reason") String finishReason
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Delta(String role, String content) {}
}
