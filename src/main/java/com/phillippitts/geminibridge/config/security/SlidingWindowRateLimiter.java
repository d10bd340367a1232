package com.phillippitts.geminibridge.config.security;

import com.phillippitts.geminibridge.config.properties.RateLimitProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * In-memory sliding window rate limiter keyed by client address.
 *
 * <p>Each key keeps the timestamps of its requests inside the window. A request is allowed when
 * fewer than {@code maxRequests} timestamps remain after expiring old ones. Per-key updates go
 * through {@link ConcurrentHashMap#compute}, so a key is never checked and evicted at once.
 */
@Component
public class SlidingWindowRateLimiter {

    private static final Logger LOG = LogManager.getLogger(SlidingWindowRateLimiter.class);

    static final int LARGE_STORE_WARNING = 10_000;

    private final Map<String, Deque<Long>> requestLog = new ConcurrentHashMap<>();
    private final int maxRequests;
    private final long windowNanos;
    private final LongSupplier clock;

    /**
     * Outcome of a rate limit check.
     *
     * @param allowed whether the request may proceed
     * @param remaining requests left in the current window after this one
     */
    public record Decision(boolean allowed, int remaining) {}

    @Autowired
    public SlidingWindowRateLimiter(RateLimitProperties properties) {
        this(properties.getMaxRequests(), properties.getWindowSeconds(), System::nanoTime);
    }

    SlidingWindowRateLimiter(int maxRequests, long windowSeconds, LongSupplier clock) {
        this.maxRequests = maxRequests;
        this.windowNanos = TimeUnit.SECONDS.toNanos(windowSeconds);
        this.clock = clock;
    }

    public Decision tryAcquire(String key) {
        long now = clock.getAsLong();
        Decision[] decision = new Decision[1];
        requestLog.compute(key, (k, timestamps) -> {
            Deque<Long> log = timestamps == null ? new ArrayDeque<>() : timestamps;
            expire(log, now);
            if (log.size() >= maxRequests) {
                decision[0] = new Decision(false, 0);
            } else {
                log.addLast(now);
                decision[0] = new Decision(true, maxRequests - log.size());
            }
            return log;
        });
        return decision[0];
    }

    /**
     * Drops keys whose requests have all left the window.
     */
    @Scheduled(fixedRate = 60_000)
    public void evictExpired() {
        long now = clock.getAsLong();
        for (String key : requestLog.keySet()) {
            requestLog.computeIfPresent(key, (k, timestamps) -> {
                expire(timestamps, now);
                return timestamps.isEmpty() ? null : timestamps;
            });
        }
        if (requestLog.size() > LARGE_STORE_WARNING) {
            LOG.warn("Rate limit store has many entries: {}", requestLog.size());
        }
    }

    int trackedKeys() {
        return requestLog.size();
    }

    private void expire(Deque<Long> timestamps, long now) {
        while (!timestamps.isEmpty() && now - timestamps.peekFirst() >= windowNanos) {
            timestamps.pollFirst();
        }
    }
}
