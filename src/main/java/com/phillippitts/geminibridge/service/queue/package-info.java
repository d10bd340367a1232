/**
 * Admission control for Gemini CLI executions.
 *
 * <p>{@link com.phillippitts.geminibridge.service.queue.AdmissionQueue} bounds concurrency with a
 * fair semaphore, spaces process starts by a minimum gap and keeps wait statistics for the
 * health endpoint and metrics.
 */
package com.phillippitts.geminibridge.service.queue;
