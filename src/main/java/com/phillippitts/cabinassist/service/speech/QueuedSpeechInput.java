package com.phillippitts.cabinassist.service.speech;

import com.phillippitts.cabinassist.service.lifecycle.ComponentNames;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Speech input fed programmatically, e.g. from the REST API or tests.
 *
 * <p>{@link #triggerWakeWord()} latches a detection consumed by the next
 * {@link #isWakeWordDetected()} poll; {@link #inject(String, double)} pushes a transcription
 * straight to the listener on the caller's thread.
 */
public class QueuedSpeechInput implements SpeechInput {

    private static final Logger LOG = LogManager.getLogger(QueuedSpeechInput.class);

    private final AtomicBoolean wakeWord = new AtomicBoolean();
    private volatile TranscriptionListener listener;
    private volatile boolean running;

    public void triggerWakeWord() {
        wakeWord.set(true);
    }

    /**
     * @return false when no listener is registered or the input is stopped
     */
    public boolean inject(String text, double confidence) {
        TranscriptionListener current = listener;
        if (!running || current == null) {
            LOG.warn("Dropping transcription: input {}", running ? "has no listener" : "is stopped");
            return false;
        }
        current.onTranscription(text, confidence);
        return true;
    }

    @Override
    public boolean isWakeWordDetected() {
        return running && wakeWord.getAndSet(false);
    }

    @Override
    public void setTranscriptionListener(TranscriptionListener listener) {
        this.listener = listener;
    }

    @Override
    public String name() {
        return ComponentNames.SPEECH_RECOGNITION;
    }

    @Override
    public void start() {
        running = true;
    }

    @Override
    public void stop() {
        running = false;
        wakeWord.set(false);
    }

    @Override
    public boolean healthCheck() {
        return running;
    }
}
