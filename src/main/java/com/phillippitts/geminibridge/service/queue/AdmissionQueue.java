package com.phillippitts.geminibridge.service.queue;

import com.phillippitts.geminibridge.domain.ExecutionResult;
import com.phillippitts.geminibridge.domain.QueueStats;
import com.phillippitts.geminibridge.exception.GeminiBridgeException;
import com.phillippitts.geminibridge.exception.QueueTimeoutException;
import com.phillippitts.geminibridge.service.queue.event.AdmissionRejectedEvent;
import com.phillippitts.geminibridge.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Admission control for Gemini CLI executions.
 *
 * <p>A request goes through {@link #enqueue(String)}, usually on the accepting thread, and then
 * {@link #awaitAndRun(Ticket, CliOperation)} on a worker; {@link #execute(String, CliOperation)}
 * does both on the calling thread. Together they:
 * <ol>
 *   <li>record the request as pending and start its timeout clock</li>
 *   <li>sleep a short randomized jitter so simultaneous arrivals do not start in lockstep</li>
 *   <li>wait for one of {@code capacity} slots, bounded by the queue timeout counted from
 *       enqueue (the jitter is not counted against it)</li>
 *   <li>wait out the minimum gap since the last completion, serialized across all callers</li>
 *   <li>run the operation and release the slot it acquired</li>
 * </ol>
 *
 * <p>A request that times out in step 3 is rejected with {@link QueueTimeoutException} and its
 * operation is never invoked. Ordering among waiters is best-effort FIFO: the slot semaphore is
 * fair, but the jitter can reorder arrivals.
 *
 * <p><b>Thread Safety:</b> thread-safe. Statistics live in {@link QueueState} behind its own lock.
 */
public class AdmissionQueue {

    private static final Logger LOG = LogManager.getLogger(AdmissionQueue.class);

    private final QueueState state;
    private final ReentrantLock startGate = new ReentrantLock();
    private final long queueTimeoutMs;
    private final long minRequestGapMs;
    private final long jitterMinMs;
    private final long jitterMaxMs;
    private final ApplicationEventPublisher publisher;

    private volatile AdmissionGuard guard;

    /**
     * @param capacity concurrent execution slots
     * @param queueTimeout maximum wait for a slot
     * @param minRequestGap minimum delay between the last completion and the next start
     * @param jitterMinMs lower bound of the pre-admission delay
     * @param jitterMaxMs upper bound of the pre-admission delay
     * @param publisher event publisher for rejections (nullable)
     */
    public AdmissionQueue(int capacity,
                          Duration queueTimeout,
                          Duration minRequestGap,
                          long jitterMinMs,
                          long jitterMaxMs,
                          ApplicationEventPublisher publisher) {
        Objects.requireNonNull(queueTimeout, "queueTimeout");
        Objects.requireNonNull(minRequestGap, "minRequestGap");
        if (jitterMinMs < 0 || jitterMaxMs < 0) {
            throw new IllegalArgumentException("jitter bounds must not be negative");
        }
        this.queueTimeoutMs = queueTimeout.toMillis();
        this.minRequestGapMs = Math.max(0, minRequestGap.toMillis());
        this.jitterMinMs = Math.min(jitterMinMs, jitterMaxMs);
        this.jitterMaxMs = Math.max(jitterMinMs, jitterMaxMs);
        this.publisher = publisher;
        this.guard = new AdmissionGuard(capacity, queueTimeoutMs);
        this.state = new QueueState(capacity);
    }

    /**
     * Records the request as pending and starts its queue-timeout clock. Call on the thread that
     * accepted the request, before handing the work to a worker pool, so time spent waiting for a
     * worker counts against the timeout and shows up in {@link #getStats()}.
     *
     * <p>The returned ticket must be passed to exactly one of
     * {@link #awaitAndRun(Ticket, CliOperation)} or {@link #abandon(Ticket)}.
     *
     * @param requestId request correlation id
     * @return ticket for the pending entry
     */
    public Ticket enqueue(String requestId) {
        long enqueueNanos = System.nanoTime();
        return new Ticket(requestId, state.enqueue(requestId), enqueueNanos);
    }

    /**
     * Drops a ticket whose work will never run, for example because the worker pool refused it.
     */
    public void abandon(Ticket ticket) {
        state.abandon(ticket.id);
    }

    /**
     * Runs the operation once a slot is available.
     *
     * @param requestId request correlation id
     * @param operation the CLI work to run
     * @return whatever the operation returns
     * @throws QueueTimeoutException if no slot was obtained within the queue timeout
     */
    public ExecutionResult execute(String requestId, CliOperation operation) {
        return awaitAndRun(enqueue(requestId), operation);
    }

    /**
     * Waits for admission of an enqueued request and runs the operation. The queue timeout is
     * measured from {@link #enqueue(String)}, excluding the pre-admission jitter.
     *
     * @param ticket ticket from {@link #enqueue(String)}
     * @param operation the CLI work to run
     * @return whatever the operation returns
     * @throws QueueTimeoutException if no slot was obtained within the queue timeout
     */
    public ExecutionResult awaitAndRun(Ticket ticket, CliOperation operation) {
        Objects.requireNonNull(ticket, "ticket");
        Objects.requireNonNull(operation, "operation");
        String requestId = ticket.requestId;
        boolean admitted = false;
        try {
            long jitterMs = nextJitterMs();
            if (!TimeUtils.sleepQuietly(jitterMs)) {
                throw new GeminiBridgeException("Interrupted before admission: " + requestId);
            }

            long waitedMs = TimeUtils.elapsedMillis(ticket.enqueueNanos) - jitterMs;
            long remainingMs = Math.max(0, queueTimeoutMs - waitedMs);

            AdmissionGuard acquired = this.guard;
            try {
                acquired.acquire(requestId, remainingMs);
            } catch (QueueTimeoutException e) {
                publishRejection(requestId, e.getTimeoutMs());
                LOG.warn("Queue timeout for request {} after {}ms (queued={})",
                        requestId, e.getTimeoutMs(), state.pendingCount());
                throw e;
            }

            try {
                long waitMs = awaitStartGapAndAdmit(requestId, ticket.id);
                admitted = true;
                LOG.debug("Admitted request {} after {}ms wait", requestId, waitMs);
                return operation.execute();
            } finally {
                if (admitted) {
                    state.complete();
                }
                acquired.release();
            }
        } finally {
            if (!admitted) {
                state.abandon(ticket.id);
            }
        }
    }

    /**
     * @return current queue statistics
     */
    public QueueStats getStats() {
        return state.snapshot();
    }

    /**
     * Replaces the admission semaphore. In-flight executions release to the semaphore they
     * acquired; the new capacity applies to later admissions.
     *
     * @param capacity new number of concurrent slots
     */
    public void setCapacity(int capacity) {
        AdmissionGuard replacement = new AdmissionGuard(capacity, queueTimeoutMs);
        this.guard = replacement;
        state.setCapacity(capacity);
        LOG.info("Admission capacity set to {}", capacity);
    }

    public long getQueueTimeoutMs() {
        return queueTimeoutMs;
    }

    private long awaitStartGapAndAdmit(String requestId, long ticket) {
        startGate.lock();
        try {
            OptionalLong last = state.lastCompletionNanos();
            if (last.isPresent() && minRequestGapMs > 0) {
                long sinceLast = TimeUtils.nanosToMillis(System.nanoTime() - last.getAsLong());
                long remaining = minRequestGapMs - sinceLast;
                if (remaining > 0) {
                    LOG.debug("Waiting {}ms to honor minimum request gap for {}", remaining, requestId);
                    if (!TimeUtils.sleepQuietly(remaining)) {
                        throw new GeminiBridgeException("Interrupted while waiting for request gap: " + requestId);
                    }
                }
            }
            return state.admit(ticket);
        } finally {
            startGate.unlock();
        }
    }

    private long nextJitterMs() {
        if (jitterMaxMs == 0) {
            return 0;
        }
        if (jitterMaxMs == jitterMinMs) {
            return jitterMinMs;
        }
        return ThreadLocalRandom.current().nextLong(jitterMinMs, jitterMaxMs + 1);
    }

    private void publishRejection(String requestId, long timeoutMs) {
        if (publisher != null) {
            publisher.publishEvent(new AdmissionRejectedEvent(
                    requestId, timeoutMs, state.pendingCount(), Instant.now()));
        }
    }

    /**
     * Handle for a pending request, issued by {@link #enqueue(String)}.
     */
    public static final class Ticket {

        private final String requestId;
        private final long id;
        private final long enqueueNanos;

        private Ticket(String requestId, long id, long enqueueNanos) {
            this.requestId = requestId;
            this.id = id;
            this.enqueueNanos = enqueueNanos;
        }

        public String requestId() {
            return requestId;
        }
    }
}
