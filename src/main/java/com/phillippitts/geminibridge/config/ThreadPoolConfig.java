package com.phillippitts.geminibridge.config;

import com.phillippitts.geminibridge.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the worker pool that runs chat completions off the servlet threads.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the pool that hosts admission waits and Gemini CLI processes.
     *
     * <p>Pool sizing strategy configured via {@code threadpool.cli.*} properties:
     * <ul>
     *   <li>Core pool: default 8 - covers the admission capacity plus a few waiters</li>
     *   <li>Max pool: default 64 - one thread per request waiting for an admission slot</li>
     *   <li>Queue: default 0 - direct hand-off, so every accepted request gets a thread at once
     *       and waits inside the admission queue, where its timeout and stats apply</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}
     * When every thread is busy the submission fails and the request is rejected. Admission waits
     * never run on servlet threads.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext (MDC) from the submitting thread to
     * the worker thread so requestId stays on every CLI log line.
     *
     * @return Configured executor for chat completion work
     */
    @Bean(name = "cliExecutor")
    public ThreadPoolTaskExecutor cliExecutor() {
        ThreadPoolProperties.CliPoolProperties cliProps = threadPoolProperties.getCli();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(cliProps.getCorePoolSize());
        executor.setMaxPoolSize(cliProps.getMaxPoolSize());
        executor.setQueueCapacity(cliProps.getQueueCapacity());
        executor.setThreadNamePrefix(cliProps.getThreadNamePrefix());
        executor.setKeepAliveSeconds(cliProps.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
