package com.phillippitts.geminibridge.presentation.controller;

import com.phillippitts.geminibridge.presentation.dto.ModelsListResponse;
import com.phillippitts.geminibridge.service.chat.ModelResolver;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * Lists the OpenAI model names this bridge accepts.
 */
@RestController
class ModelsController {

    private final ModelResolver modelResolver;

    ModelsController(ModelResolver modelResolver) {
        this.modelResolver = modelResolver;
    }

    @GetMapping("/v1/models")
    ModelsListResponse list() {
        long created = Instant.now().getEpochSecond();
        List<ModelsListResponse.ModelInfo> models = modelResolver.advertisedModels().stream()
                .map(id -> ModelsListResponse.ModelInfo.of(id, created))
                .toList();
        return ModelsListResponse.of(models);
    }
}
