package com.phillippitts.cabinassist.service.recovery;

import com.phillippitts.cabinassist.service.health.ComponentHealth;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one recovery cycle.
 *
 * @param outcomes final health per component that was asked to recover, in request order
 */
public record RecoveryResult(Map<String, ComponentHealth> outcomes) {

    public RecoveryResult {
        outcomes = outcomes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
    }

    /**
     * True iff every component that was asked to recover is healthy again.
     */
    public boolean fullyRecovered() {
        return outcomes.values().stream().allMatch(ComponentHealth::isHealthy);
    }

    public List<String> failedComponents() {
        return outcomes.values().stream()
                .filter(h -> !h.isHealthy())
                .map(ComponentHealth::name)
                .toList();
    }

    public List<String> recoveredComponents() {
        return outcomes.values().stream()
                .filter(ComponentHealth::isHealthy)
                .map(ComponentHealth::name)
                .toList();
    }
}
