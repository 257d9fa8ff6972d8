package com.phillippitts.cabinassist.service.telemetry;

import com.phillippitts.cabinassist.domain.DialogueResponse;
import com.phillippitts.cabinassist.domain.NluResult;
import com.phillippitts.cabinassist.service.lifecycle.ComponentNames;
import com.phillippitts.cabinassist.util.LogSanitizer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.Objects;

/**
 * Telemetry backed by Micrometer counters plus a structured log line per event.
 *
 * <p>Events count under {@code cabinassist.telemetry.events} tagged by name; interactions count
 * under {@code cabinassist.telemetry.interactions} tagged by intent, with NLU confidence recorded
 * as a distribution. Utterance text is only ever logged as a sanitized preview.
 */
public class MeterRegistryTelemetry implements Telemetry {

    private static final Logger LOG = LogManager.getLogger(MeterRegistryTelemetry.class);
    private static final String METRIC_PREFIX = "cabinassist.telemetry";

    private final MeterRegistry registry;
    private volatile boolean running;

    public MeterRegistryTelemetry(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public void logEvent(String name, Map<String, Object> payload) {
        if (!running) {
            return;
        }
        Counter.builder(METRIC_PREFIX + ".events")
                .description("Telemetry events by name")
                .tag("event", name)
                .register(registry)
                .increment();
        LOG.info("telemetry event={} keys={}", name, payload == null ? "[]" : payload.keySet());
    }

    @Override
    public void logInteraction(String input, NluResult nluResult, DialogueResponse response) {
        if (!running) {
            return;
        }
        String intent = nluResult == null ? NluResult.UNKNOWN_INTENT : nluResult.intent();
        Counter.builder(METRIC_PREFIX + ".interactions")
                .description("Completed user interactions by intent")
                .tag("intent", intent)
                .register(registry)
                .increment();
        if (nluResult != null) {
            DistributionSummary.builder(METRIC_PREFIX + ".nlu.confidence")
                    .description("NLU confidence of completed interactions")
                    .register(registry)
                    .record(nluResult.confidence());
        }
        LOG.info("telemetry interaction intent={} input=\"{}\" commands={}",
                intent, LogSanitizer.preview(input), response == null ? 0 : response.commands().size());
    }

    @Override
    public String name() {
        return ComponentNames.TELEMETRY;
    }

    @Override
    public void start() {
        running = true;
    }

    @Override
    public void stop() {
        running = false;
    }

    @Override
    public boolean healthCheck() {
        return running;
    }
}
