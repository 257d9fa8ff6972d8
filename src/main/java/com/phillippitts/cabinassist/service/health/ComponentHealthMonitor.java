package com.phillippitts.cabinassist.service.health;

import com.phillippitts.cabinassist.config.properties.HealthProperties;
import com.phillippitts.cabinassist.service.lifecycle.ComponentRegistry;
import com.phillippitts.cabinassist.service.lifecycle.ManagedComponent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Probes the liveness of managed components.
 *
 * <p>All probes of a cycle run concurrently on the worker executor and share one deadline of
 * {@code health.probe-timeout}, so a cycle never takes much longer than the slowest probe's
 * bound. A probe that returns false, throws or misses the deadline is recorded as FAILED;
 * the late probe is cancelled.
 *
 * <p>The monitor only proposes reports. The orchestrator decides which report is committed.
 */
public class ComponentHealthMonitor {

    private static final Logger LOG = LogManager.getLogger(ComponentHealthMonitor.class);

    private final ComponentRegistry registry;
    private final Executor executor;
    private final Duration probeTimeout;
    private final Clock clock;

    private volatile HealthReport lastReport;

    public ComponentHealthMonitor(ComponentRegistry registry,
                                  Executor executor,
                                  HealthProperties properties,
                                  Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.probeTimeout = Objects.requireNonNull(properties, "properties").getProbeTimeout();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.lastReport = HealthReport.empty(clock.instant());
    }

    /**
     * Probes every health-monitored component.
     */
    public HealthReport checkAll() {
        HealthReport report = check(registry.monitored());
        lastReport = report;
        if (!report.isHealthy()) {
            LOG.warn("Health check found unhealthy components: {}", report.unhealthyComponents());
        } else {
            LOG.debug("Health check passed for {} components", report.components().size());
        }
        return report;
    }

    /**
     * Probes a single component with the same timeout rules as {@link #checkAll()}.
     */
    public ComponentHealth probe(ManagedComponent component) {
        return check(List.of(component)).components().get(component.name());
    }

    /**
     * True iff every component in the last report produced by {@link #checkAll()} is HEALTHY.
     */
    public boolean isSystemHealthy() {
        return lastReport.isHealthy();
    }

    public HealthReport lastReport() {
        return lastReport;
    }

    private HealthReport check(Collection<ManagedComponent> components) {
        Map<String, CompletableFuture<Boolean>> probes = new LinkedHashMap<>();
        for (ManagedComponent component : components) {
            probes.put(component.name(), CompletableFuture.supplyAsync(component::healthCheck, executor));
        }

        long deadline = System.nanoTime() + probeTimeout.toNanos();
        List<ComponentHealth> results = new ArrayList<>(probes.size());
        for (Map.Entry<String, CompletableFuture<Boolean>> entry : probes.entrySet()) {
            results.add(await(entry.getKey(), entry.getValue(), deadline));
        }

        Map<String, ComponentHealth> byName = new LinkedHashMap<>();
        results.forEach(h -> byName.put(h.name(), h));
        return new HealthReport(byName, clock.instant());
    }

    private ComponentHealth await(String name, CompletableFuture<Boolean> probe, long deadlineNanos) {
        long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
        try {
            boolean ok = Boolean.TRUE.equals(probe.get(remaining, TimeUnit.NANOSECONDS));
            return ok
                    ? ComponentHealth.healthy(name, clock.instant())
                    : ComponentHealth.failed(name, clock.instant(), "health check returned false");
        } catch (TimeoutException te) {
            probe.cancel(true);
            LOG.warn("Health probe for {} timed out after {}ms", name, probeTimeout.toMillis());
            return ComponentHealth.failed(name, clock.instant(),
                    "probe timed out after " + probeTimeout.toMillis() + "ms");
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            probe.cancel(true);
            return ComponentHealth.failed(name, clock.instant(), "interrupted");
        } catch (ExecutionException ee) {
            LOG.warn("Health probe for {} threw: {}", name, String.valueOf(ee.getCause()));
            return ComponentHealth.failed(name, clock.instant(), "probe error: " + ee.getCause());
        }
    }
}
