package com.phillippitts.geminibridge.config.cli;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Retry and conflict-recovery policy for sandbox container name collisions.
 *
 * <p>Properties:
 * <ul>
 *   <li>gemini.cli.retry.max-retries - Retries after a detected conflict (default: 3, 0 disables)</li>
 *   <li>gemini.cli.retry.conflict-cleanup-timeout-seconds - How long to wait for a conflicting
 *       container to exit on its own before force-removing it (default: 0 = execution timeout)</li>
 *   <li>gemini.cli.retry.proactive-cleanup - Remove stopped sandbox containers before the first
 *       attempt (default: true)</li>
 *   <li>gemini.cli.retry.settle-delay-ms - Fixed delay after cleanup, before backoff (default: 500)</li>
 *   <li>gemini.cli.retry.container-prefix - Name prefix of the CLI's sandbox containers
 *       (default: sandbox-)</li>
 *   <li>gemini.cli.retry.docker-binary - Container runtime CLI (default: docker)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "gemini.cli.retry")
@Validated
public class RetryProperties {

    @Min(value = 0, message = "Max retries must not be negative")
    @Max(value = 10, message = "Max retries must not exceed 10")
    private int maxRetries = 3;

    @Min(value = 0, message = "Conflict cleanup timeout must not be negative")
    private int conflictCleanupTimeoutSeconds = 0;

    private boolean proactiveCleanup = true;

    @Min(value = 0, message = "Settle delay must not be negative")
    private long settleDelayMs = 500;

    @NotBlank(message = "Container prefix must not be blank")
    private String containerPrefix = "sandbox-";

    @NotBlank(message = "Docker binary must not be blank")
    private String dockerBinary = "docker";

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public int getConflictCleanupTimeoutSeconds() {
        return conflictCleanupTimeoutSeconds;
    }

    public void setConflictCleanupTimeoutSeconds(int conflictCleanupTimeoutSeconds) {
        this.conflictCleanupTimeoutSeconds = conflictCleanupTimeoutSeconds;
    }

    /**
     * Resolves the effective natural-release wait, falling back to the execution timeout.
     *
     * @param executionTimeoutSeconds configured CLI execution timeout
     * @return seconds to wait for a conflicting container to exit
     */
    public int effectiveCleanupTimeoutSeconds(int executionTimeoutSeconds) {
        return conflictCleanupTimeoutSeconds > 0 ? conflictCleanupTimeoutSeconds : executionTimeoutSeconds;
    }

    public boolean isProactiveCleanup() {
        return proactiveCleanup;
    }

    public void setProactiveCleanup(boolean proactiveCleanup) {
        this.proactiveCleanup = proactiveCleanup;
    }

    public long getSettleDelayMs() {
        return settleDelayMs;
    }

    public void setSettleDelayMs(long settleDelayMs) {
        this.settleDelayMs = settleDelayMs;
    }

    public String getContainerPrefix() {
        return containerPrefix;
    }

    public void setContainerPrefix(String containerPrefix) {
        this.containerPrefix = containerPrefix;
    }

    public String getDockerBinary() {
        return dockerBinary;
    }

    public void setDockerBinary(String dockerBinary) {
        this.dockerBinary = dockerBinary;
    }
}
