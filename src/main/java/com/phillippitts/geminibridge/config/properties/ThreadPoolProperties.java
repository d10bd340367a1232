package com.phillippitts.geminibridge.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for thread pools.
 *
 * <p>The CLI pool hosts the blocking part of every chat completion: waiting for an admission
 * slot and running the Gemini CLI process. Keep the queue capacity at 0 so work is handed straight
 * to a thread; a task parked in the pool's own queue would wait outside the admission queue.
 * {@code max-pool-size} bounds running plus waiting requests.
 */
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private CliPoolProperties cli = new CliPoolProperties();

    public CliPoolProperties getCli() {
        return cli;
    }

    public void setCli(CliPoolProperties cli) {
        this.cli = cli;
    }

    /**
     * CLI executor pool configuration.
     */
    public static class CliPoolProperties {
        private int corePoolSize = 8;
        private int maxPoolSize = 64;
        private int queueCapacity = 0;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "cli-pool-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
