package com.phillippitts.cabinassist.service.recovery;

import java.time.Instant;

/**
 * Published when a component reports healthy again after a restart.
 */
public record ComponentRecoveredEvent(
        String component,
        Instant at,
        int attempts
) {
    public ComponentRecoveredEvent {
        if (at == null) at = Instant.now();
    }
}
