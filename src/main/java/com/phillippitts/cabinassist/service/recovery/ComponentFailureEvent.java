package com.phillippitts.cabinassist.service.recovery;

import java.time.Instant;
import java.util.Map;

/**
 * Published when a component fails: a provider call times out or throws, a health probe
 * fails, or a restart attempt is exhausted.
 *
 * <p>PII note: Do not include utterance text in context. Restrict to technical diagnostics.
 */
public record ComponentFailureEvent(
        String component,
        Instant at,
        String message,
        Throwable cause,
        Map<String, String> context
) {
    public ComponentFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }

    /** Context key naming where the failure was detected. */
    public static final String PHASE = "phase";

    /** {@link #PHASE} value for failures reported by recovery once a restart budget is spent. */
    public static final String PHASE_RECOVERY = "recovery";

    /**
     * Failure reported by recovery itself. Listeners must not start another recovery for it.
     */
    public static ComponentFailureEvent recoveryExhausted(String component, Instant at, String message) {
        return new ComponentFailureEvent(component, at, message, null, Map.of(PHASE, PHASE_RECOVERY));
    }

    public boolean fromRecovery() {
        return PHASE_RECOVERY.equals(context.get(PHASE));
    }
}
