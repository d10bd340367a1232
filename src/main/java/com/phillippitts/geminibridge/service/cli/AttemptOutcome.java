package com.phillippitts.geminibridge.service.cli;

import com.phillippitts.geminibridge.domain.ExecutionResult;
import com.phillippitts.geminibridge.service.cli.conflict.ConflictDetector;

/**
 * Classification of a single CLI attempt, driving the retry loop.
 */
enum AttemptOutcome {
    SUCCESS,
    NON_RETRYABLE_FAILURE,
    CONFLICT_DETECTED;

    static AttemptOutcome of(ExecutionResult result) {
        if (result.success()) {
            return SUCCESS;
        }
        if (ConflictDetector.isConflict(result.exitCode(), result.stderr())) {
            return CONFLICT_DETECTED;
        }
        return NON_RETRYABLE_FAILURE;
    }
}
