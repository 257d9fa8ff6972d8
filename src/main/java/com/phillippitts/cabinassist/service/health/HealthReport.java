package com.phillippitts.cabinassist.service.health;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregated component health, keyed by component name in registration order.
 *
 * @param components per-component health
 * @param checkedAt  when the report was produced or last amended
 */
public record HealthReport(Map<String, ComponentHealth> components, Instant checkedAt) {

    public HealthReport {
        Objects.requireNonNull(checkedAt, "checkedAt");
        components = components == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(components));
    }

    public static HealthReport empty(Instant at) {
        return new HealthReport(Map.of(), at);
    }

    /**
     * True iff the report is non-empty and every component is HEALTHY.
     */
    public boolean isHealthy() {
        return !components.isEmpty() && components.values().stream().allMatch(ComponentHealth::isHealthy);
    }

    /**
     * Names of components that are not HEALTHY, in registration order.
     */
    public List<String> unhealthyComponents() {
        return components.values().stream()
                .filter(h -> !h.isHealthy())
                .map(ComponentHealth::name)
                .toList();
    }

    /**
     * Returns a copy with {@code health} replacing the entry for its component.
     */
    public HealthReport with(ComponentHealth health) {
        Map<String, ComponentHealth> copy = new LinkedHashMap<>(components);
        copy.put(health.name(), health);
        return new HealthReport(copy, health.lastChecked());
    }

    /**
     * Returns a copy with every entry of {@code other} replacing the matching entry here.
     */
    public HealthReport merge(HealthReport other) {
        Map<String, ComponentHealth> copy = new LinkedHashMap<>(components);
        copy.putAll(other.components());
        return new HealthReport(copy, other.checkedAt());
    }
}
