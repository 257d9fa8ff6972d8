package com.phillippitts.cabinassist.service.speech;

import com.phillippitts.cabinassist.service.lifecycle.ManagedComponent;

/**
 * Speech synthesis collaborator.
 */
public interface SpeechOutput extends ManagedComponent {

    /**
     * Speaks {@code text}; returns once the utterance has been delivered.
     *
     * @param text      text to speak
     * @param interrupt whether to cut off anything currently being spoken
     */
    void speak(String text, boolean interrupt);
}
