package com.phillippitts.cabinassist.service.speech;

import com.phillippitts.cabinassist.service.lifecycle.ManagedComponent;

/**
 * Speech capture and recognition collaborator.
 *
 * <p>Wake-word detection is polled by the orchestrator loop while idle; transcriptions are
 * pushed to the registered {@link TranscriptionListener}, typically from an I/O thread.
 */
public interface SpeechInput extends ManagedComponent {

    /**
     * Returns true once per detected wake word (detection is consumed by the call).
     */
    boolean isWakeWordDetected();

    /**
     * Registers the single listener that receives transcriptions. Replaces any previous one.
     */
    void setTranscriptionListener(TranscriptionListener listener);
}
