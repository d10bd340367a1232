package com.phillippitts.geminibridge.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Bearer token authentication for the OpenAI-compatible endpoints.
 *
 * <p>{@code bridge.security.bearer-token} is required; startup fails when it is blank.
 */
@ConfigurationProperties(prefix = "bridge.security")
@Validated
public class SecurityProperties {

    /** Placeholder shipped in sample configuration; never acceptable in production. */
    public static final String PLACEHOLDER_TOKEN = "your-secret-token-here-change-this-in-production";

    /** Tokens shorter than this trigger a startup warning. */
    public static final int RECOMMENDED_TOKEN_LENGTH = 32;

    @NotBlank(message = "Bearer token must be configured (bridge.security.bearer-token)")
    private String bearerToken;

    public String getBearerToken() {
        return bearerToken;
    }

    public void setBearerToken(String bearerToken) {
        this.bearerToken = bearerToken;
    }
}
