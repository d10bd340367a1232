package com.phillippitts.geminibridge.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for Gemini CLI executions.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>End-to-end completion latency per model (queue wait and retries included)</li>
 *   <li>Success/failure rates per model, failures tagged with a reason</li>
 *   <li>Container conflict retries and queue rejections</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class CliMetrics {

    private static final String METRIC_PREFIX = "bridge.cli";

    private final MeterRegistry registry;

    public CliMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param model resolved Gemini model
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(String model, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to produce a chat completion")
                .tag("model", model)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(String model) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of successful CLI executions")
                .tag("model", model)
                .register(registry)
                .increment();
    }

    /**
     * @param model resolved Gemini model
     * @param reason failure reason (timeout, tool_failure, conflict_exhausted, internal, queue_timeout)
     */
    public void incrementFailure(String model, String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed CLI executions")
                .tag("model", model)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param exhausted whether the conflict ended the retry loop
     */
    public void incrementConflict(boolean exhausted) {
        Counter.builder(METRIC_PREFIX + ".conflict")
                .description("Number of sandbox container name conflicts")
                .tag("outcome", exhausted ? "exhausted" : "retried")
                .register(registry)
                .increment();
    }

    public void incrementQueueRejection() {
        Counter.builder("bridge.queue.rejected")
                .description("Number of requests rejected after the admission timeout")
                .register(registry)
                .increment();
    }
}
