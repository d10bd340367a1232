package com.phillippitts.geminibridge.service.queue;

import com.phillippitts.geminibridge.exception.QueueTimeoutException;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Bounds concurrent Gemini CLI executions with a fair semaphore.
 *
 * <p>Threads that reach {@link #acquire(String)} are granted permits in arrival order. The
 * guard only throws; publishing the rejection event is left to the queue, which knows the
 * pending count.
 *
 * <p><b>Usage Pattern:</b>
 * <pre>{@code
 * AdmissionGuard guard = new AdmissionGuard(5, 30_000);
 * guard.acquire(requestId); // blocks until a slot frees up or the timeout elapses
 * try {
 *     // ... run the CLI ...
 * } finally {
 *     guard.release();
 * }
 * }</pre>
 */
final class AdmissionGuard {

    private final Semaphore semaphore;
    private final int capacity;
    private final long timeoutMs;

    /**
     * @param capacity number of concurrent slots
     * @param timeoutMs maximum time to wait for a slot in milliseconds
     */
    AdmissionGuard(int capacity, long timeoutMs) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.semaphore = new Semaphore(capacity, true);
        this.capacity = capacity;
        this.timeoutMs = timeoutMs;
    }

    /**
     * Acquires a slot, blocking up to the configured timeout.
     *
     * @throws QueueTimeoutException if no slot frees up in time or the thread is interrupted
     */
    void acquire(String requestId) {
        acquire(requestId, timeoutMs);
    }

    /**
     * Acquires a slot, blocking up to {@code waitMs}. A request that already spent part of its
     * budget elsewhere passes what is left; zero still takes a free slot without blocking.
     *
     * @throws QueueTimeoutException reporting the configured timeout if no slot frees up in time
     */
    void acquire(String requestId, long waitMs) {
        try {
            if (!semaphore.tryAcquire(Math.max(0, waitMs), TimeUnit.MILLISECONDS)) {
                throw new QueueTimeoutException(requestId, timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueueTimeoutException(requestId, timeoutMs, e);
        }
    }

    /**
     * Releases a previously acquired slot. Call from a finally block.
     */
    void release() {
        semaphore.release();
    }

    int availablePermits() {
        return semaphore.availablePermits();
    }

    int capacity() {
        return capacity;
    }

    long timeoutMs() {
        return timeoutMs;
    }
}
