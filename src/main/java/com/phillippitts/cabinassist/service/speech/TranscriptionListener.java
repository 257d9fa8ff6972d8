package com.phillippitts.cabinassist.service.speech;

/**
 * Receives transcriptions produced by the speech input collaborator.
 */
@FunctionalInterface
public interface TranscriptionListener {

    /**
     * @param transcription recognized text
     * @param confidence    recognizer confidence in [0.0, 1.0]
     */
    void onTranscription(String transcription, double confidence);
}
