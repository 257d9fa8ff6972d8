package com.phillippitts.cabinassist.service.lifecycle;

import com.phillippitts.cabinassist.testutil.FakeComponent;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ComponentRegistryTest {

    @Test
    void stopOrderIsReverseOfStartOrder() {
        ComponentRegistry registry = new ComponentRegistry()
                .register(new FakeComponent("speech_recognition"))
                .register(new FakeComponent("nlu"))
                .register(new FakeComponent("telemetry"), false);

        assertThat(registry.inStartOrder()).extracting(ManagedComponent::name)
                .containsExactly("speech_recognition", "nlu", "telemetry");
        assertThat(registry.inStopOrder()).extracting(ManagedComponent::name)
                .containsExactly("telemetry", "nlu", "speech_recognition");
        assertThat(registry.monitored()).extracting(ManagedComponent::name)
                .containsExactly("speech_recognition", "nlu");
    }

    @Test
    void duplicateNamesAreRejected() {
        ComponentRegistry registry = new ComponentRegistry().register(new FakeComponent("nlu"));

        assertThatThrownBy(() -> registry.register(new FakeComponent("nlu")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nlu");
    }

    @Test
    void findsByName() {
        FakeComponent tts = new FakeComponent("tts");
        ComponentRegistry registry = new ComponentRegistry().register(tts);

        assertThat(registry.find("tts")).containsSame(tts);
        assertThat(registry.find("radar")).isEmpty();
    }
}
