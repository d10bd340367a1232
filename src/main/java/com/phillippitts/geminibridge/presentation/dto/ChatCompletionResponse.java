package com.phillippitts.geminibridge.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Non-streaming {@code chat.completion} response with a single choice.
 */
public record ChatCompletionResponse(
        String id,
        String object,
        long created,
        String model,
        List<Choice> choices
) {

    public static final String OBJECT = "chat.completion";

    public static ChatCompletionResponse of(String id, long created, String model, String content) {
        return new ChatCompletionResponse(id, OBJECT, created, model,
                List.of(new Choice(0, new ChatMessage("assistant", content), "stop")));
    }

    public record Choice(
            int index,
            ChatMessage message,
            @JsonProperty("finish_reason") String finishReason
    ) {}
}
