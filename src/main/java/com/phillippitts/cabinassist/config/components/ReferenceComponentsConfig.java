package com.phillippitts.cabinassist.config.components;

import com.phillippitts.cabinassist.config.properties.ContextProperties;
import com.phillippitts.cabinassist.config.properties.IntegrityProperties;
import com.phillippitts.cabinassist.service.context.ContextStore;
import com.phillippitts.cabinassist.service.context.InMemoryContextStore;
import com.phillippitts.cabinassist.service.dialogue.DialogueEngine;
import com.phillippitts.cabinassist.service.dialogue.TemplateDialogueEngine;
import com.phillippitts.cabinassist.service.nlu.KeywordLanguageUnderstanding;
import com.phillippitts.cabinassist.service.nlu.LanguageUnderstanding;
import com.phillippitts.cabinassist.service.security.DigestIntegrityVerifier;
import com.phillippitts.cabinassist.service.security.IntegrityVerifier;
import com.phillippitts.cabinassist.service.speech.LoggingSpeechOutput;
import com.phillippitts.cabinassist.service.speech.QueuedSpeechInput;
import com.phillippitts.cabinassist.service.speech.SpeechInput;
import com.phillippitts.cabinassist.service.speech.SpeechOutput;
import com.phillippitts.cabinassist.service.telemetry.MeterRegistryTelemetry;
import com.phillippitts.cabinassist.service.telemetry.Telemetry;
import com.phillippitts.cabinassist.service.vehicle.SimulatedVehicleLink;
import com.phillippitts.cabinassist.service.vehicle.VehicleLink;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Default collaborator implementations.
 *
 * <p>Each bean backs off when the application defines its own implementation of the same
 * contract, so a real speech stack or vehicle bus replaces the in-process one bean by bean.
 */
@Configuration
public class ReferenceComponentsConfig {

    @Bean
    @ConditionalOnMissingBean(SpeechInput.class)
    public QueuedSpeechInput speechInput() {
        return new QueuedSpeechInput();
    }

    @Bean
    @ConditionalOnMissingBean
    public LanguageUnderstanding languageUnderstanding() {
        return new KeywordLanguageUnderstanding();
    }

    @Bean
    @ConditionalOnMissingBean
    public DialogueEngine dialogueEngine() {
        return new TemplateDialogueEngine();
    }

    @Bean
    @ConditionalOnMissingBean
    public SpeechOutput speechOutput() {
        return new LoggingSpeechOutput();
    }

    @Bean
    @ConditionalOnMissingBean(VehicleLink.class)
    public SimulatedVehicleLink vehicleLink() {
        return new SimulatedVehicleLink();
    }

    @Bean
    @ConditionalOnMissingBean
    public ContextStore contextStore(ContextProperties properties, Clock clock) {
        return new InMemoryContextStore(properties, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public Telemetry telemetry(MeterRegistry registry) {
        return new MeterRegistryTelemetry(registry);
    }

    @Bean
    @ConditionalOnMissingBean
    public IntegrityVerifier integrityVerifier(IntegrityProperties properties) {
        return new DigestIntegrityVerifier(properties);
    }
}
