package com.phillippitts.cabinassist.service.vehicle;

import com.phillippitts.cabinassist.service.lifecycle.ManagedComponent;

import java.util.Map;

/**
 * Vehicle integration collaborator: state, head-unit UI, events and command executors.
 *
 * <p>Command methods return {@code false} when the vehicle refuses the command; they throw
 * only when the link itself is broken.
 */
public interface VehicleLink extends ManagedComponent {

    /**
     * Current vehicle state, keyed by subsystem ({@code climate_control}, {@code media},
     * {@code navigation}, {@code phone}, {@code vehicle}).
     */
    Map<String, Object> getCurrentState();

    void setUiState(UiState state);

    void updateUi(Map<String, Object> update);

    void subscribeToEvents(VehicleEventListener listener);

    boolean setClimate(Double temperature, Integer fanSpeed, String zone);

    boolean setNavigationDestination(String destination, Map<String, Object> routePreferences);

    boolean controlMedia(String action, String source, String content);

    boolean updateSettings(Map<String, Object> settings);
}
