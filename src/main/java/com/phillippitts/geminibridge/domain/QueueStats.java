package com.phillippitts.geminibridge.domain;

/**
 * Point-in-time snapshot of the admission queue, surfaced by the health endpoint.
 *
 * @param activeRequests executions currently holding a slot
 * @param queuedRequests requests recorded as pending (waiting for admission)
 * @param totalProcessed executions completed since startup
 * @param averageWaitTimeMs total wait divided by total processed (0 before the first completion)
 * @param maxConcurrent current admission capacity
 */
public record QueueStats(
        int activeRequests,
        int queuedRequests,
        long totalProcessed,
        long averageWaitTimeMs,
        int maxConcurrent
) {}
