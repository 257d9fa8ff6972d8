package com.phillippitts.cabinassist.presentation.controller;

import com.phillippitts.cabinassist.service.context.ContextStore;
import com.phillippitts.cabinassist.service.context.ContextSummary;
import com.phillippitts.cabinassist.service.conversation.ConversationCoordinator;
import com.phillippitts.cabinassist.service.dispatch.VehicleEventDispatcher;
import com.phillippitts.cabinassist.service.health.ComponentHealth;
import com.phillippitts.cabinassist.service.orchestration.AssistantOrchestrator;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Control API for driving the assistant without a microphone or vehicle bus.
 *
 * <p>Inputs are queued and processed asynchronously, so POST endpoints answer 202 Accepted.
 * They answer 409 Conflict while the orchestrator is not active.
 */
@RestController
@RequestMapping("/api/assistant")
class AssistantController {

    private static final Logger LOG = LogManager.getLogger(AssistantController.class);

    private final AssistantOrchestrator orchestrator;
    private final ConversationCoordinator coordinator;
    private final VehicleEventDispatcher dispatcher;
    private final ContextStore contextStore;

    AssistantController(AssistantOrchestrator orchestrator,
                        ConversationCoordinator coordinator,
                        VehicleEventDispatcher dispatcher,
                        ContextStore contextStore) {
        this.orchestrator = orchestrator;
        this.coordinator = coordinator;
        this.dispatcher = dispatcher;
        this.contextStore = contextStore;
    }

    @PostMapping("/wake")
    ResponseEntity<Map<String, Object>> wake() {
        requireActive();
        coordinator.onWakeWord();
        return accepted();
    }

    @PostMapping("/utterances")
    ResponseEntity<Map<String, Object>> utterance(@Valid @RequestBody UtteranceRequest request) {
        requireActive();
        coordinator.onTranscription(request.text(), request.confidence());
        return accepted();
    }

    @PostMapping("/vehicle-events")
    ResponseEntity<Map<String, Object>> vehicleEvent(@Valid @RequestBody VehicleEventRequest request) {
        requireActive();
        LOG.debug("Vehicle event via API: type={}", request.type());
        dispatcher.onVehicleEvent(request.type(), request.payload() == null ? Map.of() : request.payload());
        return accepted();
    }

    @GetMapping("/status")
    ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> components = new LinkedHashMap<>();
        for (ComponentHealth health : orchestrator.getCommittedHealth().components().values()) {
            components.put(health.name(), health.status().name());
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", orchestrator.getStatus().name());
        body.put("conversation", orchestrator.getConversationState().name());
        body.put("deferredNotifications", coordinator.deferredCount());
        body.put("components", components);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/context")
    ResponseEntity<ContextSummary> context() {
        return ResponseEntity.ok(contextStore.summarize());
    }

    private void requireActive() {
        if (!orchestrator.isActive()) {
            throw new IllegalStateException("Assistant is " + orchestrator.getStatus().name().toLowerCase());
        }
    }

    private ResponseEntity<Map<String, Object>> accepted() {
        return ResponseEntity.accepted().body(Map.of(
                "accepted", true,
                "conversation", coordinator.getState().name()));
    }

    record UtteranceRequest(
            @NotBlank String text,
            @DecimalMin("0.0") @DecimalMax("1.0") double confidence
    ) {}

    record VehicleEventRequest(
            @NotBlank String type,
            Map<String, Object> payload
    ) {}
}
