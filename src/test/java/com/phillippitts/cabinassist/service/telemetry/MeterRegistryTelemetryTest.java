package com.phillippitts.cabinassist.service.telemetry;

import com.phillippitts.cabinassist.domain.DialogueResponse;
import com.phillippitts.cabinassist.domain.NluResult;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MeterRegistryTelemetryTest {

    private SimpleMeterRegistry registry;
    private MeterRegistryTelemetry telemetry;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        telemetry = new MeterRegistryTelemetry(registry);
    }

    @Test
    void countsEventsByName() {
        telemetry.start();

        telemetry.logEvent("conversation_started", Map.of("session_id", "s-1"));
        telemetry.logEvent("conversation_started", Map.of());

        assertThat(registry.find("cabinassist.telemetry.events").tag("event", "conversation_started")
                .counter().count()).isEqualTo(2.0);
    }

    @Test
    void recordsInteractionIntentAndConfidence() {
        telemetry.start();

        telemetry.logInteraction("play music", new NluResult("media_control", Map.of(), 0.95),
                DialogueResponse.speech("OK, play.", false));

        assertThat(registry.find("cabinassist.telemetry.interactions").tag("intent", "media_control")
                .counter().count()).isEqualTo(1.0);
        DistributionSummary confidence = registry.find("cabinassist.telemetry.nlu.confidence").summary();
        assertThat(confidence).isNotNull();
        assertThat(confidence.totalAmount()).isEqualTo(0.95);
    }

    @Test
    void silentWhileStopped() {
        telemetry.logEvent("conversation_started", Map.of());

        assertThat(registry.getMeters()).isEmpty();
        assertThat(telemetry.healthCheck()).isFalse();
    }
}
