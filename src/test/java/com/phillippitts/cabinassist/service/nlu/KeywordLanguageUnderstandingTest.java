package com.phillippitts.cabinassist.service.nlu;

import com.phillippitts.cabinassist.domain.NluResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordLanguageUnderstandingTest {

    private final KeywordLanguageUnderstanding nlu = new KeywordLanguageUnderstanding();

    @ParameterizedTest
    @CsvSource({
            "'Hello there', greeting",
            "'goodbye', farewell",
            "'what can you do', help",
            "'navigate to the airport', navigation",
            "'pause', media_control",
            "'how much fuel is left', vehicle_status",
            "'turn on the lights', settings",
            "'what is the meaning of life', unknown"
    })
    void classifiesIntents(String text, String intent) {
        assertThat(nlu.process(text).intent()).isEqualTo(intent);
    }

    @Test
    void confidenceGrowsWithKeywordMatches() {
        assertThat(nlu.process("set temperature to 21").confidence()).isEqualTo(0.8);
        assertThat(nlu.process("play some music").confidence()).isEqualTo(0.95);
        assertThat(nlu.process("tell me a joke").confidence()).isEqualTo(0.4);
    }

    @Test
    void tieGoesToEarlierIntent() {
        assertThat(nlu.process("hello and goodbye").intent()).isEqualTo(KeywordLanguageUnderstanding.FAREWELL);
    }

    @Test
    void extractsWholeAndDecimalTemperatures() {
        assertThat(nlu.process("set temperature to 21").entities()).containsEntry("temperature", 21);
        assertThat(nlu.process("make it 21.5 degrees").entities()).containsEntry("temperature", 21.5);
    }

    @Test
    void extractsDestinationVolumeFanAndAction() {
        assertThat(nlu.process("Navigate to the Central Station.").entities())
                .containsEntry("destination", "central station");
        assertThat(nlu.process("volume to 15").entities()).containsEntry("volume", 15);
        assertThat(nlu.process("set the fan to 3").entities()).containsEntry("fan_speed", 3);
        assertThat(nlu.process("skip this song").entities()).containsEntry("action", "skip");
    }

    @Test
    void emptyInputIsUnknown() {
        NluResult result = nlu.process("");
        assertThat(result.intent()).isEqualTo(NluResult.UNKNOWN_INTENT);
        assertThat(result.entities()).isEqualTo(Map.of());
    }

    @Test
    void healthFollowsLifecycle() {
        assertThat(nlu.healthCheck()).isFalse();
        nlu.start();
        assertThat(nlu.healthCheck()).isTrue();
        nlu.stop();
        assertThat(nlu.healthCheck()).isFalse();
    }
}
