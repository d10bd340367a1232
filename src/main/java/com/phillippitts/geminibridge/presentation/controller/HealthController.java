package com.phillippitts.geminibridge.presentation.controller;

import com.phillippitts.geminibridge.domain.QueueStats;
import com.phillippitts.geminibridge.service.queue.AdmissionQueue;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unauthenticated liveness endpoint with queue statistics, in the shape existing GeminiBridge
 * clients poll.
 */
@RestController
class HealthController {

    static final String SERVICE = "GeminiBridge";
    static final String VERSION = "2.0.0";

    private final AdmissionQueue queue;

    HealthController(AdmissionQueue queue) {
        this.queue = queue;
    }

    @GetMapping("/health")
    ResponseEntity<Map<String, Object>> health() {
        QueueStats stats = queue.getStats();
        Map<String, Object> queueDetails = new LinkedHashMap<>();
        queueDetails.put("active_requests", stats.activeRequests());
        queueDetails.put("queued_requests", stats.queuedRequests());
        queueDetails.put("total_processed", stats.totalProcessed());
        queueDetails.put("average_wait_time_ms", stats.averageWaitTimeMs());
        queueDetails.put("max_concurrent", stats.maxConcurrent());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("service", SERVICE);
        body.put("version", VERSION);
        body.put("queue", queueDetails);
        return ResponseEntity.ok(body);
    }
}
