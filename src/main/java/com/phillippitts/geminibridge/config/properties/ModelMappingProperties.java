package com.phillippitts.geminibridge.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * OpenAI model name to Gemini model mappings.
 *
 * <p>Example:
 * <pre>
 * bridge.models.mappings.gpt-4=gemini-2.5-pro
 * bridge.models.mappings.gpt-3.5-turbo=gemini-2.5-flash
 * bridge.models.default-model=gemini-2.5-flash
 * </pre>
 *
 * <p>Map keys containing dots must be bracketed in properties files
 * ({@code bridge.models.mappings[gpt-3.5-turbo]}).
 */
@ConfigurationProperties(prefix = "bridge.models")
@Validated
public class ModelMappingProperties {

    private Map<String, String> mappings = defaultMappings();

    @NotBlank(message = "Default model must not be blank")
    private String defaultModel = "gemini-2.5-flash";

    private static Map<String, String> defaultMappings() {
        Map<String, String> defaults = new LinkedHashMap<>();
        defaults.put("gpt-3.5-turbo", "gemini-2.5-flash");
        defaults.put("gpt-4", "gemini-2.5-pro");
        return defaults;
    }

    public Map<String, String> getMappings() {
        return mappings;
    }

    public void setMappings(Map<String, String> mappings) {
        this.mappings = mappings;
    }

    public String getDefaultModel() {
        return defaultModel;
    }

    public void setDefaultModel(String defaultModel) {
        this.defaultModel = defaultModel;
    }
}
