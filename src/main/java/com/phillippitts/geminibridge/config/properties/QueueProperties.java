package com.phillippitts.geminibridge.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Admission queue limits for Gemini CLI executions.
 *
 * <p>When all slots are busy, requests wait up to the queue timeout before being rejected with
 * a gateway-timeout error. The minimum request gap spaces out process starts so the CLI's
 * sandbox containers have time to release their names.
 *
 * <p>Properties:
 * <ul>
 *   <li>bridge.queue.max-concurrent - Concurrent CLI processes (default: 5)</li>
 *   <li>bridge.queue.queue-timeout-seconds - Admission wait limit (default: 30)</li>
 *   <li>bridge.queue.min-request-gap-ms - Minimum delay between a completion and the next
 *       start (default: 500)</li>
 *   <li>bridge.queue.jitter-min-ms / jitter-max-ms - Randomized pre-admission delay bounds
 *       (default: 10-50)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "bridge.queue")
@Validated
public class QueueProperties {

    @Positive(message = "Max concurrent must be positive")
    @Max(value = 50, message = "Max concurrent must not exceed 50")
    private int maxConcurrent = 5;

    @Positive(message = "Queue timeout must be positive")
    @Max(value = 300, message = "Queue timeout must not exceed 300 seconds")
    private int queueTimeoutSeconds = 30;

    @Min(value = 0, message = "Minimum request gap must not be negative")
    private long minRequestGapMs = 500;

    @Min(value = 0, message = "Jitter bounds must not be negative")
    private long jitterMinMs = 10;

    @Min(value = 0, message = "Jitter bounds must not be negative")
    private long jitterMaxMs = 50;

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public void setMaxConcurrent(int maxConcurrent) {
        this.maxConcurrent = maxConcurrent;
    }

    public int getQueueTimeoutSeconds() {
        return queueTimeoutSeconds;
    }

    public void setQueueTimeoutSeconds(int queueTimeoutSeconds) {
        this.queueTimeoutSeconds = queueTimeoutSeconds;
    }

    public long getMinRequestGapMs() {
        return minRequestGapMs;
    }

    public void setMinRequestGapMs(long minRequestGapMs) {
        this.minRequestGapMs = minRequestGapMs;
    }

    public long getJitterMinMs() {
        return jitterMinMs;
    }

    public void setJitterMinMs(long jitterMinMs) {
        this.jitterMinMs = jitterMinMs;
    }

    public long getJitterMaxMs() {
        return jitterMaxMs;
    }

    public void setJitterMaxMs(long jitterMaxMs) {
        this.jitterMaxMs = jitterMaxMs;
    }
}
