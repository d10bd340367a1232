package com.phillippitts.geminibridge.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * OpenAI {@code GET /v1/models} response.
 */
public record ModelsListResponse(String object, List<ModelInfo> data) {

    public static ModelsListResponse of(List<ModelInfo> data) {
        return new ModelsListResponse("list", data);
    }

    public record ModelInfo(
            String id,
            String object,
            long created,
            @JsonProperty("owned_by") String ownedBy
    ) {
        public static ModelInfo of(String id, long created) {
            return new ModelInfo(id, "model", created, "gemini-bridge");
        }
    }
}
