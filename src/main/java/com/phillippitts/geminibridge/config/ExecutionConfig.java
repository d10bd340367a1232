package com.phillippitts.geminibridge.config;

import com.phillippitts.geminibridge.config.cli.GeminiCliConfig;
import com.phillippitts.geminibridge.config.cli.RetryProperties;
import com.phillippitts.geminibridge.config.properties.QueueProperties;
import com.phillippitts.geminibridge.service.cli.BackoffPolicy;
import com.phillippitts.geminibridge.service.cli.CliExecutor;
import com.phillippitts.geminibridge.service.cli.GeminiCommandBuilder;
import com.phillippitts.geminibridge.service.cli.GeminiProcessExecutor;
import com.phillippitts.geminibridge.service.cli.RandomizedBackoffPolicy;
import com.phillippitts.geminibridge.service.cli.RetryingCliExecutor;
import com.phillippitts.geminibridge.service.cli.conflict.ConflictRecoveryStrategy;
import com.phillippitts.geminibridge.service.cli.conflict.ContainerRuntime;
import com.phillippitts.geminibridge.service.cli.conflict.DockerContainerRuntime;
import com.phillippitts.geminibridge.service.cli.process.DefaultProcessFactory;
import com.phillippitts.geminibridge.service.cli.process.ProcessRunner;
import com.phillippitts.geminibridge.service.queue.AdmissionQueue;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Duration;

/**
 * Wires the execution pipeline explicitly: admission queue, retry controller, conflict recovery
 * and the single-attempt process executor.
 */
@Configuration
public class ExecutionConfig {

    private static final Logger LOG = LogManager.getLogger(ExecutionConfig.class);

    private final GeminiCliConfig cliConfig;
    private final RetryProperties retryProperties;
    private final QueueProperties queueProperties;
    private final ApplicationEventPublisher publisher;

    public ExecutionConfig(GeminiCliConfig cliConfig,
                           RetryProperties retryProperties,
                           QueueProperties queueProperties,
                           ApplicationEventPublisher publisher) {
        this.cliConfig = cliConfig;
        this.retryProperties = retryProperties;
        this.queueProperties = queueProperties;
        this.publisher = publisher;
    }

    @Bean
    public ProcessRunner processRunner() {
        return new ProcessRunner(new DefaultProcessFactory());
    }

    @Bean
    public GeminiProcessExecutor geminiProcessExecutor(ProcessRunner processRunner,
                                                       @Value("${bridge.debug:false}") boolean debug) {
        GeminiCommandBuilder builder = new GeminiCommandBuilder();
        LOG.info("Gemini CLI: binary={}, timeout={}s, sandbox={}, shell={}",
                cliConfig.binaryPath(), cliConfig.timeoutSeconds(), cliConfig.sandbox(), builder.requiresShell());
        return new GeminiProcessExecutor(processRunner, builder, cliConfig, debug);
    }

    @Bean
    public ContainerRuntime containerRuntime(ProcessRunner processRunner) {
        return new DockerContainerRuntime(processRunner, retryProperties.getDockerBinary());
    }

    @Bean
    public ConflictRecoveryStrategy conflictRecoveryStrategy(ContainerRuntime containerRuntime) {
        return new ConflictRecoveryStrategy(containerRuntime, retryProperties.getContainerPrefix());
    }

    @Bean
    public BackoffPolicy backoffPolicy() {
        return new RandomizedBackoffPolicy(retryProperties.getSettleDelayMs());
    }

    /**
     * The executor callers use: single attempts wrapped in conflict retries.
     */
    @Bean
    @Primary
    public CliExecutor retryingCliExecutor(GeminiProcessExecutor geminiProcessExecutor,
                                           ConflictRecoveryStrategy conflictRecoveryStrategy,
                                           BackoffPolicy backoffPolicy) {
        int cleanupTimeout = retryProperties.effectiveCleanupTimeoutSeconds(cliConfig.timeoutSeconds());
        LOG.info("Conflict retries: maxRetries={}, cleanupTimeout={}s, proactiveCleanup={}",
                retryProperties.getMaxRetries(), cleanupTimeout, retryProperties.isProactiveCleanup());
        return new RetryingCliExecutor(
                geminiProcessExecutor,
                conflictRecoveryStrategy,
                backoffPolicy,
                retryProperties.getMaxRetries(),
                cleanupTimeout,
                retryProperties.isProactiveCleanup(),
                publisher);
    }

    @Bean
    public AdmissionQueue admissionQueue() {
        LOG.info("Admission queue: maxConcurrent={}, queueTimeout={}s, minGap={}ms",
                queueProperties.getMaxConcurrent(), queueProperties.getQueueTimeoutSeconds(),
                queueProperties.getMinRequestGapMs());
        return new AdmissionQueue(
                queueProperties.getMaxConcurrent(),
                Duration.ofSeconds(queueProperties.getQueueTimeoutSeconds()),
                Duration.ofMillis(queueProperties.getMinRequestGapMs()),
                queueProperties.getJitterMinMs(),
                queueProperties.getJitterMaxMs(),
                publisher);
    }
}
