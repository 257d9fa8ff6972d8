package com.phillippitts.cabinassist.service.speech;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class QueuedSpeechInputTest {

    private final QueuedSpeechInput input = new QueuedSpeechInput();

    @Test
    void wakeWordIsConsumedOnce() {
        input.start();
        input.triggerWakeWord();

        assertThat(input.isWakeWordDetected()).isTrue();
        assertThat(input.isWakeWordDetected()).isFalse();
    }

    @Test
    void stoppedInputReportsNoWakeWord() {
        input.triggerWakeWord();

        assertThat(input.isWakeWordDetected()).isFalse();
    }

    @Test
    void transcriptionsReachListener() {
        List<String> heard = new ArrayList<>();
        input.setTranscriptionListener((text, confidence) -> heard.add(text + "@" + confidence));

        assertThat(input.inject("hello", 0.9)).isFalse();
        input.start();
        assertThat(input.inject("hello", 0.9)).isTrue();

        assertThat(heard).containsExactly("hello@0.9");
    }

    @Test
    void speechOutputRemembersLastUtterance() {
        LoggingSpeechOutput output = new LoggingSpeechOutput();
        output.start();

        output.speak("Setting the temperature to 21 degrees.", false);

        assertThat(output.getLastUtterance()).isEqualTo("Setting the temperature to 21 degrees.");
        assertThat(output.healthCheck()).isTrue();
    }
}
