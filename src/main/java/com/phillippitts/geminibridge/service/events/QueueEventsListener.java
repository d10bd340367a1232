package com.phillippitts.geminibridge.service.events;

import com.phillippitts.geminibridge.service.cli.conflict.event.ConflictDetectedEvent;
import com.phillippitts.geminibridge.service.metrics.CliMetrics;
import com.phillippitts.geminibridge.service.queue.event.AdmissionRejectedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operational handler for queue and conflict events: counts every event, logs throttled
 * summaries to avoid log spam under sustained overload.
 */
@Component
class QueueEventsListener {
    private static final Logger LOG = LogManager.getLogger(QueueEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final CliMetrics metrics;

    QueueEventsListener(CliMetrics metrics) {
        this.metrics = metrics;
    }

    @EventListener
    void onAdmissionRejected(AdmissionRejectedEvent e) {
        metrics.incrementQueueRejection();
        if (shouldLog("admission-rejected")) {
            LOG.warn("Admission queue saturated: request {} waited {}ms with {} queued. "
                    + "Consider raising bridge.queue.max-concurrent.", e.requestId(), e.timeoutMs(), e.queuedRequests());
        }
    }

    @EventListener
    void onConflictDetected(ConflictDetectedEvent e) {
        metrics.incrementConflict(e.exhausted());
        if (e.exhausted() && shouldLog("conflict-exhausted")) {
            LOG.warn("Sandbox container conflicts are exhausting retries (container={}). "
                    + "Check for stuck containers with 'docker ps -a'.", e.containerName());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
