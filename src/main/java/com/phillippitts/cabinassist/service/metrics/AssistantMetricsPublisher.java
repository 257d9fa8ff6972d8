package com.phillippitts.cabinassist.service.metrics;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Null-safe facade over {@link AssistantMetrics} used by the orchestration classes.
 *
 * <p><b>Null Safety:</b> every method is a no-op when constructed without metrics, so
 * orchestration components run unchanged in unit tests that have no meter registry.
 */
public final class AssistantMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(AssistantMetricsPublisher.class);

    /**
     * Shared no-op instance for tests and defaults.
     */
    public static final AssistantMetricsPublisher NOOP = new AssistantMetricsPublisher(null);

    private final AssistantMetrics metrics;

    /**
     * @param metrics metrics service (nullable for test mode)
     */
    public AssistantMetricsPublisher(AssistantMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("AssistantMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordTurn(long durationNanos, String outcome) {
        if (metrics != null) {
            metrics.recordTurnLatency(durationNanos, outcome);
        }
    }

    public void recordTransition(String from, String to) {
        if (metrics != null) {
            metrics.incrementTransition(from, to);
        }
    }

    public void recordLowConfidence() {
        if (metrics != null) {
            metrics.incrementLowConfidence();
        }
    }

    public void recordCommand(String commandType, boolean success) {
        if (metrics != null) {
            metrics.incrementCommand(commandType, success);
        }
    }

    public void recordRecovery(String component, boolean success) {
        if (metrics != null) {
            metrics.incrementRecovery(component, success);
        }
    }

    public void recordProactive(String eventType, boolean deferred) {
        if (metrics != null) {
            metrics.incrementProactive(eventType, deferred);
        }
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
