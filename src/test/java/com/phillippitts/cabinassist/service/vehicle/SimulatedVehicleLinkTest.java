package com.phillippitts.cabinassist.service.vehicle;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SimulatedVehicleLinkTest {

    private final SimulatedVehicleLink vehicle = new SimulatedVehicleLink();

    @Test
    @SuppressWarnings("unchecked")
    void rejectsOutOfRangeClimate() {
        assertThat(vehicle.setClimate(15.0, null, null)).isFalse();
        assertThat(vehicle.setClimate(null, 6, null)).isFalse();
        assertThat(vehicle.setClimate(30.0, 5, "driver")).isTrue();

        Map<String, Object> climate = (Map<String, Object>) vehicle.getCurrentState().get("climate_control");
        assertThat(climate).containsEntry("temperature", 30.0).containsEntry("zone", "driver");
    }

    @Test
    @SuppressWarnings("unchecked")
    void emitFoldsLevelsAndNotifiesSubscribers() {
        List<String> seen = new ArrayList<>();
        vehicle.subscribeToEvents((type, payload) -> seen.add(type));

        vehicle.emit("low_fuel", Map.of("fuel_level", 9));

        assertThat(seen).containsExactly("low_fuel");
        Map<String, Object> status = (Map<String, Object>) vehicle.getCurrentState().get("vehicle");
        assertThat(status).containsEntry("fuel_level", 9);
    }

    @Test
    @SuppressWarnings("unchecked")
    void restartRestoresDefaults() {
        vehicle.start();
        vehicle.controlMedia("volume", null, "25");

        vehicle.restart();

        Map<String, Object> media = (Map<String, Object>) vehicle.getCurrentState().get("media");
        assertThat(media).containsEntry("volume", 10);
        assertThat(vehicle.healthCheck()).isTrue();
    }

    @Test
    void snapshotsAreDetachedFromState() {
        Map<String, Object> snapshot = vehicle.getCurrentState();
        snapshot.put("climate_control", Map.of());

        assertThat(vehicle.getCurrentState().get("climate_control")).isNotEqualTo(Map.of());
    }
}
