package com.phillippitts.geminibridge.service.queue;

import com.phillippitts.geminibridge.domain.ExecutionResult;

/**
 * Unit of work admitted by the {@link AdmissionQueue}: one Gemini CLI execution, retries included.
 */
@FunctionalInterface
public interface CliOperation {

    ExecutionResult execute();
}
