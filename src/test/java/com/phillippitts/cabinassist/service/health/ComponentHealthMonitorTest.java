package com.phillippitts.cabinassist.service.health;

import com.phillippitts.cabinassist.config.properties.HealthProperties;
import com.phillippitts.cabinassist.service.lifecycle.ComponentRegistry;
import com.phillippitts.cabinassist.testutil.FakeComponent;
import com.phillippitts.cabinassist.testutil.SyncExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class ComponentHealthMonitorTest {

    private final FakeComponent nlu = new FakeComponent("nlu");
    private final FakeComponent tts = new FakeComponent("tts");
    private final FakeComponent telemetry = new FakeComponent("telemetry");
    private final ComponentRegistry registry = new ComponentRegistry()
            .register(nlu)
            .register(tts)
            .register(telemetry, false);
    private final HealthProperties properties = new HealthProperties();
    private ExecutorService pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    @Test
    void reportsOnlyMonitoredComponents() {
        ComponentHealthMonitor monitor = new ComponentHealthMonitor(registry, new SyncExecutor(), properties,
                Clock.systemUTC());

        HealthReport report = monitor.checkAll();

        assertThat(report.components()).containsOnlyKeys("nlu", "tts");
        assertThat(report.isHealthy()).isTrue();
        assertThat(monitor.isSystemHealthy()).isTrue();
    }

    @Test
    void unhealthyComponentFlipsSystemHealth() {
        ComponentHealthMonitor monitor = new ComponentHealthMonitor(registry, new SyncExecutor(), properties,
                Clock.systemUTC());
        monitor.checkAll();

        tts.healthy = false;
        HealthReport report = monitor.checkAll();

        assertThat(report.unhealthyComponents()).containsExactly("tts");
        assertThat(report.components().get("tts").status()).isEqualTo(ComponentStatus.FAILED);
        assertThat(monitor.isSystemHealthy()).isFalse();

        tts.healthy = true;
        monitor.checkAll();
        assertThat(monitor.isSystemHealthy()).isTrue();
    }

    @Test
    void slowProbeIsFailedAtDeadline() {
        pool = Executors.newFixedThreadPool(2);
        properties.setProbeTimeout(Duration.ofMillis(100));
        nlu.probeDelayMillis = 2_000;
        ComponentHealthMonitor monitor = new ComponentHealthMonitor(registry, pool, properties, Clock.systemUTC());

        long start = System.nanoTime();
        HealthReport report = monitor.checkAll();
        long elapsedMillis = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertThat(elapsedMillis).isLessThan(1_500);
        assertThat(report.components().get("nlu").detail()).contains("timed out");
        assertThat(report.components().get("tts").isHealthy()).isTrue();
    }

    @Test
    void throwingProbeIsFailed() {
        ComponentHealthMonitor monitor = new ComponentHealthMonitor(registry, new SyncExecutor(), properties,
                Clock.systemUTC());
        FakeComponent broken = new FakeComponent("dialogue_manager") {
            @Override
            public boolean healthCheck() {
                throw new IllegalStateException("probe exploded");
            }
        };

        ComponentHealth health = monitor.probe(broken);

        assertThat(health.isHealthy()).isFalse();
        assertThat(health.detail()).contains("probe exploded");
    }
}
