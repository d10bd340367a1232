package com.phillippitts.geminibridge.service.queue.event;

import java.time.Instant;

/**
 * Published when a request could not obtain an admission slot before the queue timeout.
 *
 * @param requestId request correlation id
 * @param timeoutMs configured admission wait limit
 * @param queuedRequests pending requests at rejection time, this one included
 * @param at rejection time
 */
public record AdmissionRejectedEvent(
        String requestId,
        long timeoutMs,
        int queuedRequests,
        Instant at
) {
    public AdmissionRejectedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
