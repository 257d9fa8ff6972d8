package com.phillippitts.cabinassist.service.dispatch;

import com.phillippitts.cabinassist.domain.ProactiveNotification;
import com.phillippitts.cabinassist.service.context.ContextStore;
import com.phillippitts.cabinassist.service.conversation.ConversationCoordinator;
import com.phillippitts.cabinassist.service.dialogue.DialogueEngine;
import com.phillippitts.cabinassist.service.lifecycle.ComponentNames;
import com.phillippitts.cabinassist.service.lifecycle.ProviderCallGuard;
import com.phillippitts.cabinassist.service.orchestration.ErrorPolicy;
import com.phillippitts.cabinassist.service.orchestration.ErrorSeverity;
import com.phillippitts.cabinassist.service.telemetry.Telemetry;
import com.phillippitts.cabinassist.service.vehicle.VehicleEventListener;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Routes vehicle events into the context and, when warranted, into proactive notifications.
 *
 * <p>The vehicle link calls {@link #onVehicleEvent(String, Map)} on its own thread; the work is
 * offloaded to the event executor so the link is never blocked by dialogue calls.
 *
 * <p>For each event:
 * <ol>
 *   <li>the event is recorded in the context store (always)</li>
 *   <li>the dialogue collaborator decides whether it warrants a notification</li>
 *   <li>a notification is handed to the conversation coordinator, which speaks it at once when
 *       no conversation is in progress and otherwise defers it until the conversation returns to idle</li>
 * </ol>
 */
public class VehicleEventDispatcher implements VehicleEventListener {

    private static final Logger LOG = LogManager.getLogger(VehicleEventDispatcher.class);

    private final ContextStore context;
    private final DialogueEngine dialogue;
    private final ConversationCoordinator coordinator;
    private final Telemetry telemetry;
    private final ProviderCallGuard guard;
    private final Executor eventExecutor;

    public VehicleEventDispatcher(ContextStore context,
                                  DialogueEngine dialogue,
                                  ConversationCoordinator coordinator,
                                  Telemetry telemetry,
                                  ProviderCallGuard guard,
                                  Executor eventExecutor) {
        this.context = Objects.requireNonNull(context, "context");
        this.dialogue = Objects.requireNonNull(dialogue, "dialogue");
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.telemetry = Objects.requireNonNull(telemetry, "telemetry");
        this.guard = Objects.requireNonNull(guard, "guard");
        this.eventExecutor = Objects.requireNonNull(eventExecutor, "eventExecutor");
    }

    @Override
    public void onVehicleEvent(String eventType, Map<String, Object> payload) {
        Objects.requireNonNull(eventType, "eventType");
        Map<String, Object> data = payload == null ? Map.of() : payload;
        eventExecutor.execute(() -> dispatch(eventType, data));
    }

    /**
     * Handles one event on the calling thread.
     */
    void dispatch(String eventType, Map<String, Object> payload) {
        LOG.debug("Vehicle event type={} keys={}", eventType, payload.keySet());
        try {
            context.recordVehicleEvent(eventType, payload);
            logEvent(eventType);

            Optional<ProactiveNotification> notification = guard.call(ComponentNames.DIALOGUE_MANAGER,
                    () -> dialogue.checkProactiveTrigger(eventType, payload, context.read()));
            notification.ifPresent(n -> {
                coordinator.offerProactive(n);
                LOG.info("Proactive notification for event={} queued", eventType);
            });
        } catch (RuntimeException e) {
            ErrorSeverity severity = ErrorPolicy.classify(e);
            if (severity == ErrorSeverity.FATAL) {
                throw e;
            }
            LOG.error("Error handling vehicle event type={} ({}): {}", eventType, severity, e.getMessage());
        }
    }

    private void logEvent(String eventType) {
        try {
            telemetry.logEvent("vehicle_event", Map.of("event_type", eventType));
        } catch (RuntimeException e) {
            LOG.warn("Telemetry event dropped: {}", e.getMessage());
        }
    }
}
