package com.phillippitts.cabinassist.service.orchestration;

/**
 * Lifecycle of the {@link AssistantOrchestrator}.
 */
public enum OrchestratorStatus {
    /** Constructed, not started. */
    CREATED,
    /** Integrity check, component start-up and initial health check in progress. */
    STARTING,
    /** Steady-state loop and conversation consumer running. */
    ACTIVE,
    /** Shutdown in progress. */
    STOPPING,
    /** Orderly shutdown completed. */
    STOPPED,
    /** Startup aborted or emergency shutdown completed. */
    FAILED
}
