package com.phillippitts.geminibridge.presentation.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * OpenAI chat completion request. Sampling parameters are accepted for compatibility but the
 * Gemini CLI does not expose them, so they are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatCompletionRequest(
        @NotBlank(message = "model is required") String model,
        @NotNull(message = "messages is required") List<ChatMessage> messages,
        Boolean stream,
        Double temperature,
        @JsonProperty("top_p") Double topP,
        @JsonProperty("max_tokens") Integer maxTokens
) {
    public boolean isStreaming() {
        return Boolean.TRUE.equals(stream);
    }
}
