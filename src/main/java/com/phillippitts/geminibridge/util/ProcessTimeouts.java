package com.phillippitts.geminibridge.util;

import java.time.Duration;

/**
 * Standard timeout values for process and thread management.
 *
 * <p>Centralized timeout constants keep subprocess handling consistent between the Gemini CLI
 * executor and the container runtime commands issued during conflict recovery.
 *
 * @see com.phillippitts.geminibridge.service.cli.process.ProcessRunner
 * @since 1.0
 */
public final class ProcessTimeouts {

    /**
     * Timeout for stream gobbler threads to flush buffered output after process completion.
     */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for stream gobbler threads during cleanup (best-effort).
     */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /**
     * Timeout for graceful process shutdown via {@link Process#destroy()}.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for forceful process termination via {@link Process#destroyForcibly()}.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Budget for a single container runtime command ({@code docker inspect}, {@code rm}, ...).
     */
    public static final Duration CONTAINER_COMMAND_TIMEOUT = Duration.ofSeconds(5);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
