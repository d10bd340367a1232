package com.phillippitts.geminibridge.config;

import com.phillippitts.geminibridge.domain.QueueStats;
import com.phillippitts.geminibridge.service.queue.AdmissionQueue;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Exposes admission queue statistics via Micrometer.
 *
 * <p>Gauges:
 * <ul>
 *   <li>bridge.queue.active - Executions currently holding a slot</li>
 *   <li>bridge.queue.queued - Requests waiting for admission</li>
 *   <li>bridge.queue.processed - Cumulative completed executions</li>
 *   <li>bridge.queue.wait.average - Average admission wait in milliseconds</li>
 *   <li>bridge.queue.capacity - Current admission capacity</li>
 * </ul>
 *
 * <p>These metrics are available via:
 * <ul>
 *   <li>HTTP: {@code GET /actuator/metrics/bridge.queue.active}</li>
 *   <li>Prometheus: {@code bridge_queue_active}</li>
 * </ul>
 *
 * <p>Additionally logs a queue summary every 5 minutes for operational visibility.
 */
@Configuration
public class QueueMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(QueueMetricsConfig.class);

    private final ObjectProvider<AdmissionQueue> queueProvider;

    public QueueMetricsConfig(ObjectProvider<AdmissionQueue> queueProvider) {
        this.queueProvider = queueProvider;
    }

    @Bean
    public MeterBinder admissionQueueMetrics() {
        return registry -> {
            AdmissionQueue queue = queueProvider.getObject();

            Gauge.builder("bridge.queue.active", queue, q -> q.getStats().activeRequests())
                    .description("Gemini CLI executions currently running")
                    .register(registry);

            Gauge.builder("bridge.queue.queued", queue, q -> q.getStats().queuedRequests())
                    .description("Requests waiting for an admission slot")
                    .register(registry);

            Gauge.builder("bridge.queue.processed", queue, q -> q.getStats().totalProcessed())
                    .description("Cumulative count of completed executions")
                    .register(registry);

            Gauge.builder("bridge.queue.wait.average", queue, q -> q.getStats().averageWaitTimeMs())
                    .description("Average admission wait in milliseconds")
                    .baseUnit("milliseconds")
                    .register(registry);

            Gauge.builder("bridge.queue.capacity", queue, q -> q.getStats().maxConcurrent())
                    .description("Configured admission capacity")
                    .register(registry);

            LOG.info("Admission queue metrics registered: bridge.queue.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logQueueHealth() {
        QueueStats stats = queueProvider.getObject().getStats();
        LOG.info("Admission Queue Health: active={}/{}, queued={}, processed={}, avgWaitMs={}",
                stats.activeRequests(),
                stats.maxConcurrent(),
                stats.queuedRequests(),
                stats.totalProcessed(),
                stats.averageWaitTimeMs()
        );
    }
}
