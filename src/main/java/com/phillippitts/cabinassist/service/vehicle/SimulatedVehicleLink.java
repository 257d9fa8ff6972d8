package com.phillippitts.cabinassist.service.vehicle;

import com.phillippitts.cabinassist.domain.ContextMaps;
import com.phillippitts.cabinassist.service.lifecycle.ComponentNames;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process vehicle used when no real vehicle bus is attached.
 *
 * <p>Commands mutate an in-memory state tree; {@link #emit(String, Map)} raises a vehicle event
 * to every subscriber on the caller's thread. All state access is synchronized on this instance.
 */
public class SimulatedVehicleLink implements VehicleLink {

    private static final Logger LOG = LogManager.getLogger(SimulatedVehicleLink.class);

    static final double MIN_TEMPERATURE = 16.0;
    static final double MAX_TEMPERATURE = 30.0;
    static final int MAX_FAN_SPEED = 5;

    private final List<VehicleEventListener> listeners = new CopyOnWriteArrayList<>();
    private Map<String, Map<String, Object>> state = defaultState();
    private UiState uiState = UiState.IDLE;
    private Map<String, Object> lastUiUpdate = Map.of();
    private volatile boolean running;

    @Override
    public synchronized Map<String, Object> getCurrentState() {
        return ContextMaps.mutableCopy(state);
    }

    @Override
    public synchronized void setUiState(UiState uiState) {
        if (this.uiState != uiState) {
            LOG.debug("UI state {} -> {}", this.uiState, uiState);
        }
        this.uiState = uiState;
    }

    public synchronized UiState getUiState() {
        return uiState;
    }

    @Override
    public synchronized void updateUi(Map<String, Object> update) {
        lastUiUpdate = ContextMaps.frozenCopy(update);
    }

    public synchronized Map<String, Object> getLastUiUpdate() {
        return lastUiUpdate;
    }

    @Override
    public void subscribeToEvents(VehicleEventListener listener) {
        listeners.add(listener);
    }

    /**
     * Raises a vehicle event. Also folds known levels into the simulated state so later reads agree.
     */
    public void emit(String eventType, Map<String, Object> payload) {
        synchronized (this) {
            Map<String, Object> vehicle = subsystem("vehicle");
            for (String key : List.of("fuel_level", "battery_level", "speed")) {
                if (payload.get(key) instanceof Number n) {
                    vehicle.put(key, n);
                }
            }
        }
        LOG.info("Vehicle event type={} subscribers={}", eventType, listeners.size());
        for (VehicleEventListener listener : listeners) {
            listener.onVehicleEvent(eventType, payload);
        }
    }

    @Override
    public synchronized boolean setClimate(Double temperature, Integer fanSpeed, String zone) {
        if (temperature != null && (temperature < MIN_TEMPERATURE || temperature > MAX_TEMPERATURE)) {
            LOG.warn("Temperature {} outside [{}, {}]", temperature, MIN_TEMPERATURE, MAX_TEMPERATURE);
            return false;
        }
        if (fanSpeed != null && (fanSpeed < 0 || fanSpeed > MAX_FAN_SPEED)) {
            LOG.warn("Fan speed {} outside [0, {}]", fanSpeed, MAX_FAN_SPEED);
            return false;
        }
        Map<String, Object> climate = subsystem("climate_control");
        if (temperature != null) {
            climate.put("temperature", temperature);
        }
        if (fanSpeed != null) {
            climate.put("fan_speed", fanSpeed);
        }
        if (zone != null) {
            climate.put("zone", zone);
        }
        return true;
    }

    @Override
    public synchronized boolean setNavigationDestination(String destination, Map<String, Object> routePreferences) {
        Map<String, Object> navigation = subsystem("navigation");
        navigation.put("active", true);
        navigation.put("destination", destination);
        navigation.put("route_preferences", ContextMaps.mutableCopy(routePreferences));
        return true;
    }

    @Override
    public synchronized boolean controlMedia(String action, String source, String content) {
        Map<String, Object> media = subsystem("media");
        switch (action) {
            case "play", "resume" -> media.put("playing", true);
            case "pause", "stop" -> media.put("playing", false);
            case "volume" -> {
                try {
                    media.put("volume", Integer.parseInt(content));
                } catch (NumberFormatException e) {
                    LOG.warn("Invalid volume '{}'", content);
                    return false;
                }
            }
            case "next", "skip" -> media.put("track", "next");
            default -> {
                LOG.warn("Unsupported media action '{}'", action);
                return false;
            }
        }
        if (source != null) {
            media.put("source", source);
        }
        if (content != null && !"volume".equals(action)) {
            media.put("content", content);
        }
        return true;
    }

    @Override
    public synchronized boolean updateSettings(Map<String, Object> settings) {
        subsystem("settings").putAll(ContextMaps.mutableCopy(settings));
        return true;
    }

    @Override
    public String name() {
        return ComponentNames.VEHICLE_INTEGRATION;
    }

    @Override
    public void start() {
        running = true;
        LOG.info("Simulated vehicle link started");
    }

    @Override
    public void stop() {
        running = false;
    }

    @Override
    public synchronized void restart() {
        stop();
        state = defaultState();
        start();
    }

    @Override
    public boolean healthCheck() {
        return running;
    }

    private Map<String, Object> subsystem(String key) {
        return state.computeIfAbsent(key, k -> new LinkedHashMap<>());
    }

    private static Map<String, Map<String, Object>> defaultState() {
        Map<String, Object> climate = new LinkedHashMap<>();
        climate.put("temperature", 22.0);
        climate.put("fan_speed", 2);
        climate.put("mode", "auto");
        climate.put("recirculation", false);

        Map<String, Object> media = new LinkedHashMap<>();
        media.put("source", "radio");
        media.put("volume", 10);
        media.put("playing", false);

        Map<String, Object> navigation = new LinkedHashMap<>();
        navigation.put("active", false);
        navigation.put("destination", null);

        Map<String, Object> phone = new LinkedHashMap<>();
        phone.put("connected", false);

        Map<String, Object> vehicle = new LinkedHashMap<>();
        vehicle.put("speed", 0);
        vehicle.put("fuel_level", 100);
        vehicle.put("battery_level", 100);
        vehicle.put("doors_locked", true);
        vehicle.put("lights", "auto");

        Map<String, Map<String, Object>> root = new LinkedHashMap<>();
        root.put("climate_control", climate);
        root.put("media", media);
        root.put("navigation", navigation);
        root.put("phone", phone);
        root.put("vehicle", vehicle);
        return root;
    }
}
