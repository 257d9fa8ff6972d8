package com.phillippitts.cabinassist.presentation.controller;

import com.phillippitts.cabinassist.service.orchestration.AssistantOrchestrator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Liveness probe for the control API. Answers even while the assistant is down, and logs
 * through the MDC filter so the requestId can be checked in the log pattern.
 */
@RestController
class PingController {

    private static final Logger log = LogManager.getLogger(PingController.class);

    private final AssistantOrchestrator orchestrator;

    PingController(AssistantOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping("/ping")
    ResponseEntity<Map<String, Object>> ping() {
        String assistant = orchestrator.getStatus().name();
        log.info("Ping received (assistant {})", assistant);
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "assistant", assistant
        ));
    }
}
