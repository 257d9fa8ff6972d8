package com.phillippitts.cabinassist.service.recovery;

import com.phillippitts.cabinassist.config.properties.RecoveryProperties;
import com.phillippitts.cabinassist.service.health.ComponentHealth;
import com.phillippitts.cabinassist.service.health.ComponentHealthMonitor;
import com.phillippitts.cabinassist.service.lifecycle.ComponentRegistry;
import com.phillippitts.cabinassist.service.lifecycle.ManagedComponent;
import com.phillippitts.cabinassist.service.metrics.AssistantMetricsPublisher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

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
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded restart of failed components.
 *
 * <p>Recovery runs in rounds. Each round restarts every still-failed component concurrently on
 * the worker executor, all bounded by one {@code recovery.restart-timeout} deadline, then
 * re-probes the components whose restart returned in time. A restart only counts when the
 * probe reports healthy afterwards. After {@code recovery.max-restart-attempts} rounds the
 * remaining components are terminally failed for this cycle.
 *
 * <p>A restart that misses its deadline keeps its worker thread until the component returns;
 * the component is still reported as failed.
 *
 * <p>Recovery cycles are serialized: a cycle requested while another is running waits for it.
 */
public class RecoveryManager {

    private static final Logger LOG = LogManager.getLogger(RecoveryManager.class);

    private final ComponentRegistry registry;
    private final ComponentHealthMonitor healthMonitor;
    private final Executor executor;
    private final int maxAttempts;
    private final Duration restartTimeout;
    private final ApplicationEventPublisher publisher;
    private final AssistantMetricsPublisher metrics;
    private final Clock clock;
    private final ReentrantLock cycleLock = new ReentrantLock();

    public RecoveryManager(ComponentRegistry registry,
                           ComponentHealthMonitor healthMonitor,
                           Executor executor,
                           RecoveryProperties properties,
                           ApplicationEventPublisher publisher,
                           AssistantMetricsPublisher metrics,
                           Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.healthMonitor = Objects.requireNonNull(healthMonitor, "healthMonitor");
        this.executor = Objects.requireNonNull(executor, "executor");
        Objects.requireNonNull(properties, "properties");
        this.maxAttempts = properties.getMaxRestartAttempts();
        this.restartTimeout = properties.getRestartTimeout();
        this.publisher = publisher;
        this.metrics = metrics == null ? AssistantMetricsPublisher.NOOP : metrics;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Attempts to bring every named component back to HEALTHY.
     *
     * @param failedComponents component names; unknown names are reported as failed
     * @return per-component outcome; {@link RecoveryResult#fullyRecovered()} is false when any
     *         component is still unhealthy
     */
    public RecoveryResult recover(Collection<String> failedComponents) {
        cycleLock.lock();
        try {
            return runCycle(failedComponents);
        } finally {
            cycleLock.unlock();
        }
    }

    private RecoveryResult runCycle(Collection<String> failedComponents) {
        Map<String, ComponentHealth> outcomes = new LinkedHashMap<>();
        List<ManagedComponent> known = new ArrayList<>();
        for (String name : failedComponents) {
            registry.find(name).ifPresentOrElse(component -> {
                known.add(component);
                outcomes.put(name, ComponentHealth.failed(name, clock.instant(), "not restarted"));
            }, () -> outcomes.put(name, ComponentHealth.failed(name, clock.instant(), "unknown component")));
        }
        List<ManagedComponent> pending = known;
        LOG.warn("Starting recovery for {} (max attempts={}, timeout={}ms)",
                failedComponents, maxAttempts, restartTimeout.toMillis());

        for (int attempt = 1; attempt <= maxAttempts && !pending.isEmpty(); attempt++) {
            List<ManagedComponent> stillFailed = new ArrayList<>();
            for (Map.Entry<ManagedComponent, String> restart : restartAll(pending).entrySet()) {
                ManagedComponent component = restart.getKey();
                ComponentHealth health = restart.getValue() == null
                        ? healthMonitor.probe(component)
                        : ComponentHealth.failed(component.name(), clock.instant(), restart.getValue());
                outcomes.put(component.name(), health);
                if (health.isHealthy()) {
                    onRecovered(component.name(), attempt);
                } else {
                    LOG.warn("Restart attempt {}/{} of {} did not restore health: {}",
                            attempt, maxAttempts, component.name(), health.detail());
                    stillFailed.add(component);
                }
            }
            pending = stillFailed;
        }

        for (ManagedComponent component : pending) {
            onExhausted(component.name(), outcomes.get(component.name()));
        }
        for (Map.Entry<String, ComponentHealth> entry : outcomes.entrySet()) {
            if (registry.find(entry.getKey()).isEmpty()) {
                onExhausted(entry.getKey(), entry.getValue());
            }
        }

        RecoveryResult result = new RecoveryResult(outcomes);
        if (result.fullyRecovered()) {
            LOG.info("Recovery complete: {}", result.recoveredComponents());
        } else {
            LOG.error("Recovery failed for {}", result.failedComponents());
        }
        return result;
    }

    /**
     * Restarts components concurrently.
     *
     * @return component to {@code null} on a timely restart, or the failure detail otherwise
     */
    private Map<ManagedComponent, String> restartAll(List<ManagedComponent> components) {
        Map<ManagedComponent, CompletableFuture<Void>> restarts = new LinkedHashMap<>();
        for (ManagedComponent component : components) {
            LOG.warn("Restarting component {}", component.name());
            restarts.put(component, CompletableFuture.runAsync(component::restart, executor));
        }

        long deadline = System.nanoTime() + restartTimeout.toNanos();
        Map<ManagedComponent, String> results = new LinkedHashMap<>();
        for (Map.Entry<ManagedComponent, CompletableFuture<Void>> entry : restarts.entrySet()) {
            ManagedComponent component = entry.getKey();
            CompletableFuture<Void> future = entry.getValue();
            long remaining = Math.max(0L, deadline - System.nanoTime());
            try {
                future.get(remaining, TimeUnit.NANOSECONDS);
                results.put(component, null);
            } catch (TimeoutException te) {
                future.cancel(true);
                results.put(component, "restart timed out after " + restartTimeout.toMillis() + "ms");
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                results.put(component, "interrupted");
            } catch (ExecutionException ee) {
                LOG.error("Component {} failed to restart: {}", component.name(), String.valueOf(ee.getCause()));
                results.put(component, "restart failed: " + ee.getCause());
            }
        }
        return results;
    }

    private void onRecovered(String component, int attempts) {
        LOG.info("Component {} recovered after {} attempt(s)", component, attempts);
        metrics.recordRecovery(component, true);
        if (publisher != null) {
            publisher.publishEvent(new ComponentRecoveredEvent(component, clock.instant(), attempts));
        }
    }

    private void onExhausted(String component, ComponentHealth health) {
        String detail = health == null ? "not recovered" : health.detail();
        LOG.error("Component {} could not be recovered: {}", component, detail);
        metrics.recordRecovery(component, false);
        if (publisher != null) {
            publisher.publishEvent(ComponentFailureEvent.recoveryExhausted(component, clock.instant(),
                    "recovery exhausted: " + detail));
        }
    }
}
