package com.phillippitts.geminibridge.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Per-client sliding window rate limit.
 *
 * <p>Properties:
 * <ul>
 *   <li>bridge.rate-limit.max-requests - Requests allowed per window (default: 100)</li>
 *   <li>bridge.rate-limit.window-seconds - Window length (default: 60)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "bridge.rate-limit")
@Validated
public class RateLimitProperties {

    @Positive(message = "Max requests must be positive")
    private int maxRequests = 100;

    @Positive(message = "Window must be positive")
    private int windowSeconds = 60;

    public int getMaxRequests() {
        return maxRequests;
    }

    public void setMaxRequests(int maxRequests) {
        this.maxRequests = maxRequests;
    }

    public int getWindowSeconds() {
        return windowSeconds;
    }

    public void setWindowSeconds(int windowSeconds) {
        this.windowSeconds = windowSeconds;
    }
}
