package com.phillippitts.geminibridge.service.health;

import com.phillippitts.geminibridge.domain.QueueStats;
import com.phillippitts.geminibridge.service.queue.AdmissionQueue;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the admission queue.
 *
 * <ul>
 *   <li>UP: at least one slot free, or nobody waiting</li>
 *   <li>SATURATED: every slot busy and requests are waiting for admission</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class QueueHealthIndicator implements HealthIndicator {

    static final String SATURATED = "SATURATED";

    private final AdmissionQueue queue;

    public QueueHealthIndicator(AdmissionQueue queue) {
        this.queue = queue;
    }

    @Override
    public Health health() {
        QueueStats stats = queue.getStats();
        boolean saturated = stats.activeRequests() >= stats.maxConcurrent() && stats.queuedRequests() > 0;

        Health.Builder builder = saturated ? Health.status(SATURATED) : Health.up();
        return builder
                .withDetail("activeRequests", stats.activeRequests())
                .withDetail("queuedRequests", stats.queuedRequests())
                .withDetail("maxConcurrent", stats.maxConcurrent())
                .withDetail("totalProcessed", stats.totalProcessed())
                .withDetail("averageWaitTimeMs", stats.averageWaitTimeMs())
                .build();
    }
}
