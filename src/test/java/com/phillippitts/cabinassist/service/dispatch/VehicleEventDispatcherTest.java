package com.phillippitts.cabinassist.service.dispatch;

import com.phillippitts.cabinassist.domain.ConversationContext;
import com.phillippitts.cabinassist.domain.ProactiveNotification;
import com.phillippitts.cabinassist.exception.IntegrityCheckException;
import com.phillippitts.cabinassist.service.conversation.ConversationState;
import com.phillippitts.cabinassist.service.dialogue.TemplateDialogueEngine;
import com.phillippitts.cabinassist.service.lifecycle.ManagedComponent;
import com.phillippitts.cabinassist.service.vehicle.UiState;
import com.phillippitts.cabinassist.testutil.TestAssistant;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VehicleEventDispatcherTest {

    private TestAssistant assistant;

    private void build() {
        assistant.build();
        assistant.components.toRegistry().inStartOrder().forEach(ManagedComponent::start);
    }

    @Test
    void lowFuelWhileIdleIsSpokenImmediately() {
        assistant = new TestAssistant();
        build();

        assistant.dispatcher.onVehicleEvent("low_fuel", Map.of("fuel_level", 10));
        assistant.coordinator.processPending();

        assertThat(assistant.recordingSpeechOutput().spoken).containsExactly(
                "Your fuel is running low at 10 percent. Would you like me to find a gas station?");
        assertThat(assistant.vehicle.uiStates).containsExactly(UiState.SPEAKING, UiState.IDLE);
        assertThat(assistant.coordinator.getState()).isEqualTo(ConversationState.IDLE);
        assertThat(assistant.recordingTelemetry().events)
                .containsExactly("vehicle_event", "proactive_notification");
    }

    @Test
    @SuppressWarnings("unchecked")
    void everyEventIsRecordedEvenWithoutNotification() {
        assistant = new TestAssistant();
        build();

        assistant.dispatcher.onVehicleEvent("door_open", Map.of("door", "rear_left", "speed", 0));

        assertThat(assistant.coordinator.processPending()).isZero();
        Map<String, Object> vehicle = assistant.contextStore.read().vehicleState();
        Map<String, Object> events = (Map<String, Object>) vehicle.get("events");
        assertThat(events).containsKey("door_open");
    }

    @Test
    void notificationDuringConversationIsDeferred() {
        assistant = new TestAssistant();
        build();
        assistant.coordinator.onWakeWord();
        assistant.coordinator.processPending();

        assistant.dispatcher.onVehicleEvent("low_battery", Map.of("battery_level", 12));
        assistant.coordinator.processPending();

        assertThat(assistant.coordinator.deferredCount()).isEqualTo(1);
        assertThat(assistant.coordinator.getState()).isEqualTo(ConversationState.LISTENING);
    }

    @Test
    void dialogueFailureIsContained() {
        assistant = new TestAssistant();
        assistant.dialogue = new TemplateDialogueEngine() {
            @Override
            public Optional<ProactiveNotification> checkProactiveTrigger(String eventType,
                                                                         Map<String, Object> eventData,
                                                                         ConversationContext context) {
                throw new IllegalStateException("engine offline");
            }
        };
        build();

        assistant.dispatcher.onVehicleEvent("low_fuel", Map.of("fuel_level", 5));

        assertThat(assistant.coordinator.processPending()).isZero();
        assertThat(assistant.contextStore.read().vehicleState()).containsKey("events");
    }

    @Test
    void fatalErrorsPropagate() {
        assistant = new TestAssistant();
        assistant.dialogue = new TemplateDialogueEngine() {
            @Override
            public Optional<ProactiveNotification> checkProactiveTrigger(String eventType,
                                                                         Map<String, Object> eventData,
                                                                         ConversationContext context) {
                throw new IntegrityCheckException("model file changed");
            }
        };
        build();

        assertThatThrownBy(() -> assistant.dispatcher.onVehicleEvent("low_fuel", Map.of("fuel_level", 5)))
                .isInstanceOf(IntegrityCheckException.class);
    }
}
