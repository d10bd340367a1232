package com.phillippitts.geminibridge.service.queue;

import com.phillippitts.geminibridge.domain.QueueStats;
import com.phillippitts.geminibridge.util.TimeUtils;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bookkeeping for the admission queue. Every mutation happens under one lock and the pending
 * collection never escapes this class.
 *
 * <p>Pending entries are keyed by an internal ticket rather than the request id, so two requests
 * carrying the same client-supplied id are tracked separately.
 */
final class QueueState {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Long, PendingEntry> pending = new LinkedHashMap<>();

    private long nextTicket;
    private int capacity;
    private int activeCount;
    private long totalProcessed;
    private long totalWaitMs;
    private long lastCompletionNanos;
    private boolean hasCompletion;

    private record PendingEntry(String requestId, long enqueueNanos) {}

    QueueState(int capacity) {
        this.capacity = capacity;
    }

    /**
     * Records a request as pending.
     *
     * @return ticket identifying this entry for {@link #admit(long)} or {@link #abandon(long)}
     */
    long enqueue(String requestId) {
        lock.lock();
        try {
            long ticket = nextTicket++;
            pending.put(ticket, new PendingEntry(requestId, System.nanoTime()));
            return ticket;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves a pending entry to active and accumulates its wait time.
     *
     * @return milliseconds the request waited since enqueue
     */
    long admit(long ticket) {
        lock.lock();
        try {
            PendingEntry entry = pending.remove(ticket);
            long waitMs = entry == null ? 0 : TimeUtils.elapsedMillis(entry.enqueueNanos());
            activeCount++;
            totalWaitMs += waitMs;
            return waitMs;
        } finally {
            lock.unlock();
        }
    }

    /** Drops a pending entry that will never be admitted. No-op if already admitted. */
    void abandon(long ticket) {
        lock.lock();
        try {
            pending.remove(ticket);
        } finally {
            lock.unlock();
        }
    }

    void complete() {
        lock.lock();
        try {
            activeCount--;
            totalProcessed++;
            lastCompletionNanos = System.nanoTime();
            hasCompletion = true;
        } finally {
            lock.unlock();
        }
    }

    OptionalLong lastCompletionNanos() {
        lock.lock();
        try {
            return hasCompletion ? OptionalLong.of(lastCompletionNanos) : OptionalLong.empty();
        } finally {
            lock.unlock();
        }
    }

    int pendingCount() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    void setCapacity(int capacity) {
        lock.lock();
        try {
            this.capacity = capacity;
        } finally {
            lock.unlock();
        }
    }

    QueueStats snapshot() {
        lock.lock();
        try {
            long average = totalProcessed == 0 ? 0 : totalWaitMs / totalProcessed;
            return new QueueStats(activeCount, pending.size(), totalProcessed, average, capacity);
        } finally {
            lock.unlock();
        }
    }
}
