package com.phillippitts.geminibridge.service.cli.process;

/**
 * Raw result of running an external command through {@link ProcessRunner}.
 *
 * @param exitCode process exit status; meaningless when {@code timedOut} is true
 * @param stdout captured standard output (capped)
 * @param stderr captured standard error (capped)
 * @param timedOut whether the process was killed for exceeding its timeout
 * @param durationMs wall-clock duration
 */
public record ProcessOutcome(int exitCode, String stdout, String stderr, boolean timedOut, long durationMs) {

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }
}
