package com.phillippitts.cabinassist.service.health;

import java.time.Instant;
import java.util.Objects;

/**
 * Result of one health evaluation of a component.
 *
 * @param name        component name
 * @param status      evaluated status
 * @param lastChecked when the status was determined
 * @param detail      short human-readable reason (never null)
 */
public record ComponentHealth(String name, ComponentStatus status, Instant lastChecked, String detail) {

    public ComponentHealth {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(lastChecked, "lastChecked");
        detail = detail == null ? "" : detail;
    }

    public static ComponentHealth healthy(String name, Instant at) {
        return new ComponentHealth(name, ComponentStatus.HEALTHY, at, "ok");
    }

    public static ComponentHealth failed(String name, Instant at, String detail) {
        return new ComponentHealth(name, ComponentStatus.FAILED, at, detail);
    }

    public boolean isHealthy() {
        return status == ComponentStatus.HEALTHY;
    }
}
