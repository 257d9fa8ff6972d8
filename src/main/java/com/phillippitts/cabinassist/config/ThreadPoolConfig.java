package com.phillippitts.cabinassist.config;

import com.phillippitts.cabinassist.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools used by the orchestrator.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on hardware and workload.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Pool for provider calls, component start-up, health probes and restarts.
     *
     * <p>Pool sizing strategy configured via {@code threadpool.worker.*} properties:
     * <ul>
     *   <li>Core pool: default 4 - one probe per component in the common case</li>
     *   <li>Max pool: default 8 - covers a full health pass while a turn is in flight</li>
     *   <li>Queue: default 50 tasks - prevents unbounded memory growth</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}
     * When the pool and queue are full, the caller thread executes the task,
     * providing backpressure instead of failing fast.
     *
     * <p>MDC propagation: copies the Log4j2 ThreadContext from the submitting thread so the
     * conversation's {@code sessionId} follows provider calls into the pool.
     */
    @Bean(name = "workerExecutor")
    public ThreadPoolTaskExecutor workerExecutor() {
        return pool(threadPoolProperties.getWorker());
    }

    /**
     * Pool that takes vehicle events off the vehicle link's callback thread.
     */
    @Bean(name = "eventExecutor")
    public ThreadPoolTaskExecutor eventExecutor() {
        return pool(threadPoolProperties.getEvent());
    }

    /**
     * Single thread running the conversation consumer loop. Turns are processed strictly
     * one at a time on it.
     */
    @Bean(name = "conversationExecutor")
    public ThreadPoolTaskExecutor conversationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1);
        executor.setThreadNamePrefix("conversation-");
        executor.setTaskDecorator(mdcPropagation());
        executor.initialize();
        return executor;
    }

    /**
     * Scheduler driving the orchestrator tick (wake-word polling, vehicle state refresh,
     * periodic health checks).
     */
    @Bean(name = "assistantScheduler")
    public ThreadPoolTaskScheduler assistantScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix(threadPoolProperties.getSchedulerThreadNamePrefix());
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private static ThreadPoolTaskExecutor pool(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setTaskDecorator(mdcPropagation());
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagation() {
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
