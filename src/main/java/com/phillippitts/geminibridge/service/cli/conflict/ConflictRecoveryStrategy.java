package com.phillippitts.geminibridge.service.cli.conflict;

import com.phillippitts.geminibridge.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Clears sandbox container name conflicts between Gemini CLI invocations.
 *
 * <p>Policy for a detected conflict:
 * <ol>
 *   <li>extract the container name from stderr; without one, skip straight to retry</li>
 *   <li>poll the container once per interval until it stops or disappears, bounded by the
 *       cleanup timeout</li>
 *   <li>released: remove it without force; still running: stop and force-remove it</li>
 * </ol>
 *
 * <p>A non-forced reclaim never touches a running container, since a concurrent in-flight
 * request may still own it.
 */
public class ConflictRecoveryStrategy {

    private static final Logger LOG = LogManager.getLogger(ConflictRecoveryStrategy.class);

    static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);

    private final ContainerRuntime runtime;
    private final String containerPrefix;
    private final Duration pollInterval;

    public ConflictRecoveryStrategy(ContainerRuntime runtime, String containerPrefix) {
        this(runtime, containerPrefix, DEFAULT_POLL_INTERVAL);
    }

    ConflictRecoveryStrategy(ContainerRuntime runtime, String containerPrefix, Duration pollInterval) {
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.containerPrefix = Objects.requireNonNull(containerPrefix, "containerPrefix");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    }

    public boolean isConflict(int exitCode, String stderr) {
        return ConflictDetector.isConflict(exitCode, stderr);
    }

    public Optional<String> extractResourceName(String stderr) {
        return ConflictDetector.extractContainerName(stderr);
    }

    /**
     * Polls the container until it is stopped or gone.
     *
     * @param name container name
     * @param timeoutSeconds upper bound on the wait; 0 checks once
     * @return {@code true} if the container released its name on its own
     */
    public boolean waitForNaturalRelease(String name, int timeoutSeconds) {
        long deadline = System.nanoTime() + Duration.ofSeconds(Math.max(0, timeoutSeconds)).toNanos();
        long startTime = System.nanoTime();
        while (true) {
            ContainerState state = runtime.state(name);
            if (state.isReleased()) {
                LOG.info("Container released naturally container={} state={} waitedMs={}",
                        name, state, TimeUtils.elapsedMillis(startTime));
                return true;
            }
            long remainingMs = TimeUtils.nanosToMillis(deadline - System.nanoTime());
            if (remainingMs <= 0) {
                LOG.warn("Container still held after {}s container={} state={}", timeoutSeconds, name, state);
                return false;
            }
            if (!TimeUtils.sleepQuietly(Math.min(pollInterval.toMillis(), remainingMs))) {
                return false;
            }
        }
    }

    /**
     * Removes the named container.
     *
     * @param name container name
     * @param forceStop stop and force-remove regardless of state; when false, only a container
     *                  that is already stopped is removed
     * @return whether the container is gone afterwards
     */
    public boolean reclaim(String name, boolean forceStop) {
        if (forceStop) {
            if (!runtime.stop(name)) {
                LOG.debug("Stop failed before forced removal container={}", name);
            }
            return runtime.remove(name, true);
        }
        ContainerState state = runtime.state(name);
        return switch (state) {
            case NOT_FOUND -> true;
            case STOPPED -> runtime.remove(name, false);
            default -> {
                LOG.debug("Leaving container in place container={} state={}", name, state);
                yield false;
            }
        };
    }

    /**
     * Applies the full recovery policy to a conflict's stderr.
     *
     * @param stderr CLI stderr that matched the conflict signature
     * @param cleanupTimeoutSeconds bound on the natural-release wait
     * @return what was done
     */
    public RecoveryOutcome recover(String stderr, int cleanupTimeoutSeconds) {
        Optional<String> name = extractResourceName(stderr);
        if (name.isEmpty()) {
            LOG.warn("Docker conflict detected but couldn't extract container name");
            return RecoveryOutcome.NO_CONTAINER_NAME;
        }
        String container = name.get();
        boolean released = waitForNaturalRelease(container, cleanupTimeoutSeconds);
        if (Thread.currentThread().isInterrupted()) {
            return RecoveryOutcome.INTERRUPTED;
        }
        boolean removed = reclaim(container, !released);
        if (!removed) {
            LOG.warn("Cleanup failed, retrying anyway container={}", container);
            return RecoveryOutcome.RECLAIM_FAILED;
        }
        return released ? RecoveryOutcome.RELEASED : RecoveryOutcome.FORCE_RECLAIMED;
    }

    /**
     * Removes every stopped sandbox container. Running containers are left alone.
     *
     * @return number of containers removed
     */
    public int sweepStoppedContainers() {
        List<ContainerInfo> containers = runtime.list(containerPrefix);
        int removed = 0;
        for (ContainerInfo info : containers) {
            if (info.state() == ContainerState.STOPPED && runtime.remove(info.name(), false)) {
                removed++;
            }
        }
        if (removed > 0) {
            LOG.info("Proactive cleanup removed {} stopped sandbox container(s)", removed);
        }
        return removed;
    }
}
