package com.phillippitts.geminibridge.service.cli;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Settle delay plus a randomized component that widens with each attempt:
 * 100-500ms after the first conflict, 500-1500ms after the second, 1000-3000ms afterwards.
 *
 * <p>Randomization keeps concurrent requests that conflicted together from retrying in lockstep.
 */
public class RandomizedBackoffPolicy implements BackoffPolicy {

    private static final long[][] RANGES_MS = {
            {100, 500},
            {500, 1500},
            {1000, 3000}
    };

    private final long settleDelayMs;

    public RandomizedBackoffPolicy(long settleDelayMs) {
        if (settleDelayMs < 0) {
            throw new IllegalArgumentException("settleDelayMs must not be negative");
        }
        this.settleDelayMs = settleDelayMs;
    }

    @Override
    public Duration delayFor(int attempt) {
        long[] range = RANGES_MS[Math.min(Math.max(attempt, 0), RANGES_MS.length - 1)];
        long random = ThreadLocalRandom.current().nextLong(range[0], range[1] + 1);
        return Duration.ofMillis(settleDelayMs + random);
    }

    static long minDelayMs(int attempt) {
        return RANGES_MS[Math.min(Math.max(attempt, 0), RANGES_MS.length - 1)][0];
    }

    static long maxDelayMs(int attempt) {
        return RANGES_MS[Math.min(Math.max(attempt, 0), RANGES_MS.length - 1)][1];
    }
}
