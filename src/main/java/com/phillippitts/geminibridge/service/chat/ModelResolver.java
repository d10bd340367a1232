package com.phillippitts.geminibridge.service.chat;

import com.phillippitts.geminibridge.config.properties.ModelMappingProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Maps requested OpenAI model names to Gemini models.
 *
 * <p>Names starting with {@code gemini-} pass through unchanged; mapped names are translated;
 * anything else falls back to the default model.
 */
@Component
public class ModelResolver {

    private static final Logger LOG = LogManager.getLogger(ModelResolver.class);

    static final String GEMINI_PREFIX = "gemini-";

    private final ModelMappingProperties properties;

    public ModelResolver(ModelMappingProperties properties) {
        this.properties = properties;
    }

    public String resolve(String requested) {
        if (requested != null && requested.startsWith(GEMINI_PREFIX)) {
            LOG.debug("Direct Gemini model request: {}", requested);
            return requested;
        }
        Map<String, String> mappings = properties.getMappings();
        String mapped = requested == null ? null : mappings.get(requested);
        if (mapped != null) {
            LOG.debug("Model mapping applied: {} -> {}", requested, mapped);
            return mapped;
        }
        String fallback = properties.getDefaultModel();
        LOG.warn("Model '{}' not in mappings, using fallback {}", requested, fallback);
        return fallback;
    }

    /**
     * @return the OpenAI-facing model names advertised by {@code GET /v1/models}
     */
    public List<String> advertisedModels() {
        return List.copyOf(properties.getMappings().keySet());
    }
}
