package com.phillippitts.cabinassist.service.orchestration;

/**
 * How an error is routed by the conversation loop and the orchestrator.
 */
public enum ErrorSeverity {
    /** Collaborator hiccup: log, apologize, keep running; health and recovery take over. */
    TRANSIENT,
    /** Bad input or payload: log and reject the operation, state untouched. */
    VALIDATION,
    /** Cannot continue safely: emergency shutdown, never retried. */
    FATAL
}
