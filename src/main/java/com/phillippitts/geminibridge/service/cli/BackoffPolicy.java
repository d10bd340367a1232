package com.phillippitts.geminibridge.service.cli;

import java.time.Duration;

/**
 * Delay inserted between a conflict recovery and the next attempt.
 */
@FunctionalInterface
public interface BackoffPolicy {

    /**
     * @param attempt zero-based index of the attempt that just failed
     * @return delay before the next attempt (never negative)
     */
    Duration delayFor(int attempt);

    static BackoffPolicy none() {
        return attempt -> Duration.ZERO;
    }
}
