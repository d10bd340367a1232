package com.phillippitts.geminibridge.service.cli;

import com.phillippitts.geminibridge.domain.ExecutionResult;
import com.phillippitts.geminibridge.service.cli.conflict.ConflictRecoveryStrategy;
import com.phillippitts.geminibridge.service.cli.conflict.RecoveryOutcome;
import com.phillippitts.geminibridge.service.cli.conflict.event.ConflictDetectedEvent;
import com.phillippitts.geminibridge.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Objects;

/**
 * Wraps a {@link CliExecutor} with bounded retries for sandbox container name conflicts.
 *
 * <p>Only conflicts are retried. Any other failure (including timeouts) is returned after the
 * first attempt. A request makes at most {@code maxRetries + 1} CLI invocations; when every one
 * of them conflicts, the last result is returned unchanged.
 *
 * <p>Thread-safe; holds no per-request state.
 */
public class RetryingCliExecutor implements CliExecutor {

    private static final Logger LOG = LogManager.getLogger(RetryingCliExecutor.class);

    private final CliExecutor delegate;
    private final ConflictRecoveryStrategy recovery;
    private final BackoffPolicy backoff;
    private final int maxRetries;
    private final int cleanupTimeoutSeconds;
    private final boolean proactiveCleanup;
    private final ApplicationEventPublisher publisher;

    /**
     * @param delegate single-attempt executor
     * @param recovery conflict recovery policy
     * @param backoff delay between a recovery and the next attempt
     * @param maxRetries retries after the initial attempt (0 disables retrying)
     * @param cleanupTimeoutSeconds natural-release wait handed to the recovery policy
     * @param proactiveCleanup sweep stopped sandbox containers before the first attempt
     * @param publisher event publisher (nullable)
     */
    public RetryingCliExecutor(CliExecutor delegate,
                               ConflictRecoveryStrategy recovery,
                               BackoffPolicy backoff,
                               int maxRetries,
                               int cleanupTimeoutSeconds,
                               boolean proactiveCleanup,
                               ApplicationEventPublisher publisher) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.recovery = Objects.requireNonNull(recovery, "recovery");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.maxRetries = maxRetries;
        this.cleanupTimeoutSeconds = Math.max(0, cleanupTimeoutSeconds);
        this.proactiveCleanup = proactiveCleanup;
        this.publisher = publisher;
    }

    @Override
    public ExecutionResult run(String prompt, String model, String requestId) {
        if (proactiveCleanup) {
            sweepQuietly();
        }

        ExecutionResult last = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            ExecutionResult result = delegate.run(prompt, model, requestId);
            last = result;
            switch (AttemptOutcome.of(result)) {
                case SUCCESS -> {
                    if (attempt > 0) {
                        LOG.info("CLI succeeded after {} conflict retr{} requestId={}",
                                attempt, attempt == 1 ? "y" : "ies", requestId);
                    }
                    return result;
                }
                case NON_RETRYABLE_FAILURE -> {
                    return result;
                }
                case CONFLICT_DETECTED -> {
                    boolean exhausted = attempt >= maxRetries;
                    publish(requestId, result, attempt, exhausted);
                    if (exhausted) {
                        LOG.error("Container conflict persisted after {} attempt(s) requestId={}",
                                attempt + 1, requestId);
                        return result;
                    }
                    LOG.warn("Container conflict on attempt {}/{} requestId={}",
                            attempt + 1, maxRetries + 1, requestId);
                    if (!recoverAndBackOff(result, attempt, requestId)) {
                        return result;
                    }
                }
                default -> throw new IllegalStateException("Unhandled attempt outcome");
            }
        }
        return last;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    private boolean recoverAndBackOff(ExecutionResult result, int attempt, String requestId) {
        RecoveryOutcome outcome = recovery.recover(result.stderr(), cleanupTimeoutSeconds);
        LOG.debug("Conflict recovery outcome={} requestId={}", outcome, requestId);
        if (!outcome.shouldRetry()) {
            return false;
        }
        long delayMs = backoff.delayFor(attempt).toMillis();
        if (delayMs > 0) {
            LOG.debug("Backing off {}ms before retry requestId={}", delayMs, requestId);
            return TimeUtils.sleepQuietly(delayMs);
        }
        return true;
    }

    private void sweepQuietly() {
        try {
            recovery.sweepStoppedContainers();
        } catch (RuntimeException e) {
            LOG.warn("Proactive container cleanup failed: {}", e.getMessage());
        }
    }

    private void publish(String requestId, ExecutionResult result, int attempt, boolean exhausted) {
        if (publisher == null) {
            return;
        }
        String container = recovery.extractResourceName(result.stderr()).orElse(null);
        publisher.publishEvent(new ConflictDetectedEvent(requestId, container, attempt, exhausted, Instant.now()));
    }
}
