package com.phillippitts.cabinassist.service.speech;

import com.phillippitts.cabinassist.service.lifecycle.ComponentNames;
import com.phillippitts.cabinassist.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Speech output that writes utterances to the log instead of a synthesizer.
 */
public class LoggingSpeechOutput implements SpeechOutput {

    private static final Logger LOG = LogManager.getLogger(LoggingSpeechOutput.class);

    private final AtomicReference<String> lastUtterance = new AtomicReference<>();
    private volatile boolean running;

    @Override
    public void speak(String text, boolean interrupt) {
        lastUtterance.set(text);
        LOG.info("Speaking (interrupt={}): {}", interrupt, LogSanitizer.preview(text));
    }

    public String getLastUtterance() {
        return lastUtterance.get();
    }

    @Override
    public String name() {
        return ComponentNames.TTS;
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
