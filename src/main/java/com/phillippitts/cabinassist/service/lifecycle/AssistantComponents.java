package com.phillippitts.cabinassist.service.lifecycle;

import com.phillippitts.cabinassist.service.context.ContextStore;
import com.phillippitts.cabinassist.service.dialogue.DialogueEngine;
import com.phillippitts.cabinassist.service.nlu.LanguageUnderstanding;
import com.phillippitts.cabinassist.service.speech.SpeechInput;
import com.phillippitts.cabinassist.service.speech.SpeechOutput;
import com.phillippitts.cabinassist.service.telemetry.Telemetry;
import com.phillippitts.cabinassist.service.vehicle.VehicleLink;

import java.util.Objects;

/**
 * The collaborators the orchestrator coordinates, bundled for constructor injection.
 */
public record AssistantComponents(
        SpeechInput speechInput,
        LanguageUnderstanding understanding,
        DialogueEngine dialogue,
        SpeechOutput speechOutput,
        VehicleLink vehicle,
        ContextStore contextStore,
        Telemetry telemetry
) {
    public AssistantComponents {
        Objects.requireNonNull(speechInput, "speechInput");
        Objects.requireNonNull(understanding, "understanding");
        Objects.requireNonNull(dialogue, "dialogue");
        Objects.requireNonNull(speechOutput, "speechOutput");
        Objects.requireNonNull(vehicle, "vehicle");
        Objects.requireNonNull(contextStore, "contextStore");
        Objects.requireNonNull(telemetry, "telemetry");
    }

    /**
     * Builds the registry in start order. Telemetry is started and stopped but not health-gated.
     */
    public ComponentRegistry toRegistry() {
        return new ComponentRegistry()
                .register(speechInput)
                .register(understanding)
                .register(dialogue)
                .register(speechOutput)
                .register(vehicle)
                .register(contextStore)
                .register(telemetry, false);
    }
}
