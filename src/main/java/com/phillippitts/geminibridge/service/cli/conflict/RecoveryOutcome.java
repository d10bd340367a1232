package com.phillippitts.geminibridge.service.cli.conflict;

/**
 * What {@link ConflictRecoveryStrategy#recover(String, int)} did about a detected conflict.
 */
public enum RecoveryOutcome {
    /** The stderr did not name a container; nothing was reclaimed. */
    NO_CONTAINER_NAME,
    /** The container exited on its own and was removed. */
    RELEASED,
    /** The container did not exit in time and was stopped and removed. */
    FORCE_RECLAIMED,
    /** Removal failed; the retry proceeds anyway and may conflict again. */
    RECLAIM_FAILED,
    /** The thread was interrupted while waiting; shutting down, do not retry. */
    INTERRUPTED;

    public boolean shouldRetry() {
        return this != INTERRUPTED;
    }
}
