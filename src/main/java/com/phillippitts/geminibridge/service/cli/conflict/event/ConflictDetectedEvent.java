package com.phillippitts.geminibridge.service.cli.conflict.event;

import java.time.Instant;

/**
 * Published each time a Gemini CLI attempt fails with a sandbox container name conflict.
 *
 * @param requestId request correlation id
 * @param containerName conflicting container, or null when it could not be parsed
 * @param attempt zero-based attempt index that hit the conflict
 * @param exhausted whether the retry budget is spent and the conflict goes back to the caller
 * @param timestamp detection time
 */
public record ConflictDetectedEvent(
        String requestId,
        String containerName,
        int attempt,
        boolean exhausted,
        Instant timestamp
) {}
