package com.phillippitts.cabinassist.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the assistant's orchestration engine.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Turn latency, from accepted transcription to delivered response</li>
 *   <li>Conversation state transitions</li>
 *   <li>Low-confidence clarification prompts</li>
 *   <li>Vehicle command outcomes per command type</li>
 *   <li>Component recovery outcomes</li>
 *   <li>Proactive notifications, delivered or deferred</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class AssistantMetrics {

    private static final String METRIC_PREFIX = "cabinassist";

    private final MeterRegistry registry;

    public AssistantMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param durationNanos turn duration in nanoseconds
     * @param outcome       {@code ok}, {@code error} or {@code low_confidence}
     */
    public void recordTurnLatency(long durationNanos, String outcome) {
        Timer.builder(METRIC_PREFIX + ".turn.latency")
                .description("Time from accepted utterance to delivered response")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementTransition(String from, String to) {
        Counter.builder(METRIC_PREFIX + ".conversation.transitions")
                .description("Conversation state transitions")
                .tag("from", from)
                .tag("to", to)
                .register(registry)
                .increment();
    }

    public void incrementLowConfidence() {
        Counter.builder(METRIC_PREFIX + ".conversation.low_confidence")
                .description("Transcriptions answered with a clarification prompt")
                .register(registry)
                .increment();
    }

    public void incrementCommand(String commandType, boolean success) {
        Counter.builder(METRIC_PREFIX + ".commands")
                .description("Executed vehicle commands")
                .tag("type", commandType)
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public void incrementRecovery(String component, boolean success) {
        Counter.builder(METRIC_PREFIX + ".recovery")
                .description("Component recovery outcomes")
                .tag("component", component)
                .tag("result", success ? "recovered" : "failed")
                .register(registry)
                .increment();
    }

    public void incrementProactive(String eventType, boolean deferred) {
        Counter.builder(METRIC_PREFIX + ".proactive")
                .description("Proactive notifications triggered by vehicle events")
                .tag("event", eventType)
                .tag("delivery", deferred ? "deferred" : "immediate")
                .register(registry)
                .increment();
    }
}
