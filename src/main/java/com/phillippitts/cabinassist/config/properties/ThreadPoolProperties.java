package com.phillippitts.cabinassist.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for thread pools.
 *
 * <p>The worker pool runs component start-up, health probes and restarts in parallel;
 * the event pool offloads vehicle event dispatch from the vehicle link's callback thread;
 * the scheduler drives the orchestrator tick.
 */
@Validated
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    @Valid
    private PoolProperties worker = new PoolProperties(4, 8, 50, "worker-pool-");
    @Valid
    private PoolProperties event = new PoolProperties(2, 4, 20, "event-pool-");
    private String schedulerThreadNamePrefix = "assistant-tick-";

    public PoolProperties getWorker() {
        return worker;
    }

    public void setWorker(PoolProperties worker) {
        this.worker = worker;
    }

    public PoolProperties getEvent() {
        return event;
    }

    public void setEvent(PoolProperties event) {
        this.event = event;
    }

    public String getSchedulerThreadNamePrefix() {
        return schedulerThreadNamePrefix;
    }

    public void setSchedulerThreadNamePrefix(String schedulerThreadNamePrefix) {
        this.schedulerThreadNamePrefix = schedulerThreadNamePrefix;
    }

    /**
     * Sizing for one {@code ThreadPoolTaskExecutor}.
     */
    public static class PoolProperties {
        @Positive
        private int corePoolSize;
        @Positive
        private int maxPoolSize;
        @Positive
        private int queueCapacity;
        @Positive
        private int keepAliveSeconds = 60;
        private String threadNamePrefix;

        public PoolProperties() {
        }

        PoolProperties(int corePoolSize, int maxPoolSize, int queueCapacity, String threadNamePrefix) {
            this.corePoolSize = corePoolSize;
            this.maxPoolSize = maxPoolSize;
            this.queueCapacity = queueCapacity;
            this.threadNamePrefix = threadNamePrefix;
        }

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
