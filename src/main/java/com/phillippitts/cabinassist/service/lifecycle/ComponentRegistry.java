package com.phillippitts.cabinassist.service.lifecycle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered set of managed components.
 *
 * <p>Registration order is start order; shutdown walks {@link #inStopOrder()}, the exact
 * reverse. Components registered as monitored take part in health checks and recovery;
 * the others (telemetry) are only started and stopped.
 */
public final class ComponentRegistry {

    private final Map<String, ManagedComponent> components = new LinkedHashMap<>();
    private final List<String> monitored = new ArrayList<>();

    /**
     * Registers a component that is started, stopped and health-monitored.
     *
     * @throws IllegalArgumentException if a component with the same name is already registered
     */
    public ComponentRegistry register(ManagedComponent component) {
        return register(component, true);
    }

    /**
     * Registers a component, optionally excluding it from health monitoring.
     */
    public ComponentRegistry register(ManagedComponent component, boolean healthMonitored) {
        Objects.requireNonNull(component, "component");
        String name = component.name();
        if (components.putIfAbsent(name, component) != null) {
            throw new IllegalArgumentException("Duplicate component name: " + name);
        }
        if (healthMonitored) {
            monitored.add(name);
        }
        return this;
    }

    public List<ManagedComponent> inStartOrder() {
        return List.copyOf(components.values());
    }

    public List<ManagedComponent> inStopOrder() {
        List<ManagedComponent> reversed = new ArrayList<>(components.values());
        Collections.reverse(reversed);
        return reversed;
    }

    public List<ManagedComponent> monitored() {
        return monitored.stream().map(components::get).toList();
    }

    public Optional<ManagedComponent> find(String name) {
        return Optional.ofNullable(components.get(name));
    }
}
