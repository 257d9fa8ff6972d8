package com.phillippitts.cabinassist.service.lifecycle;

/**
 * Canonical component names, shared by health reports, recovery, metrics and logs.
 */
public final class ComponentNames {

    public static final String SPEECH_RECOGNITION = "speech_recognition";
    public static final String NLU = "nlu";
    public static final String DIALOGUE_MANAGER = "dialogue_manager";
    public static final String TTS = "tts";
    public static final String VEHICLE_INTEGRATION = "vehicle_integration";
    public static final String CONTEXT_FUSION = "context_fusion";
    public static final String TELEMETRY = "telemetry";

    private ComponentNames() {
    }
}
