package com.phillippitts.cabinassist.config;

import com.phillippitts.cabinassist.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    private final ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());
    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
        if (executor != null) {
            executor.shutdown();
        }
    }

    @Test
    void workerPoolUsesPropertyDefaults() {
        executor = config.workerExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(4);
        assertThat(executor.getMaxPoolSize()).isEqualTo(8);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("worker-pool-");
        assertThat(executor.getThreadPoolExecutor().getRejectedExecutionHandler())
                .isInstanceOf(ThreadPoolExecutor.CallerRunsPolicy.class);
    }

    @Test
    void conversationPoolHasSingleThread() {
        executor = config.conversationExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(1);
        assertThat(executor.getMaxPoolSize()).isEqualTo(1);
    }

    @Test
    void eventPoolHandlesConcurrentTasks() throws InterruptedException {
        executor = config.eventExecutor();
        int taskCount = 10;
        CountDownLatch latch = new CountDownLatch(taskCount);
        AtomicInteger completed = new AtomicInteger();

        for (int i = 0; i < taskCount; i++) {
            executor.execute(() -> {
                completed.incrementAndGet();
                latch.countDown();
            });
        }

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(completed.get()).isEqualTo(taskCount);
    }

    @Test
    void propagatesThreadContextIntoPool() throws InterruptedException {
        executor = config.workerExecutor();
        AtomicReference<String> seen = new AtomicReference<>();
        CountDownLatch latch = new CountDownLatch(1);

        ThreadContext.put("sessionId", "session-42");
        executor.execute(() -> {
            seen.set(ThreadContext.get("sessionId"));
            latch.countDown();
        });

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("session-42");
    }

    @Test
    void decoratorRestoresCallerContextWhenRunInline() {
        ThreadContext.put("requestId", "outer");
        Runnable decorated = ThreadPoolConfig.mdcPropagation().decorate(() -> ThreadContext.put("requestId", "inner"));

        decorated.run();

        assertThat(ThreadContext.get("requestId")).isEqualTo("outer");
    }
}
