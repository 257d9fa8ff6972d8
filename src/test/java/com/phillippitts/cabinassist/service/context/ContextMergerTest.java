package com.phillippitts.cabinassist.service.context;

import com.phillippitts.cabinassist.exception.SchemaMismatchException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContextMergerTest {

    @Test
    void mergesNestedMapsRecursively() {
        Map<String, Object> target = new LinkedHashMap<>();
        target.put("media", new LinkedHashMap<>(Map.of("source", "radio", "volume", 10)));

        ContextMerger.mergeInto(target, Map.of("media", Map.of("volume", 5)), "vehicleState");

        assertThat(target.get("media")).isEqualTo(Map.of("source", "radio", "volume", 5));
    }

    @Test
    void nullValueReplacesExisting() {
        Map<String, Object> target = new LinkedHashMap<>(Map.of("destination", "home"));
        Map<String, Object> incoming = new HashMap<>();
        incoming.put("destination", null);

        ContextMerger.mergeInto(target, incoming, "navigation");

        assertThat(target).containsEntry("destination", null);
    }

    @Test
    void mapOverNullIsAccepted() {
        Map<String, Object> target = new LinkedHashMap<>();
        target.put("route", null);

        ContextMerger.mergeInto(target, Map.of("route", Map.of("avoid_tolls", true)), "navigation");

        assertThat(target.get("route")).isEqualTo(Map.of("avoid_tolls", true));
    }

    @Test
    void scalarOverMapIsRejectedWithPath() {
        Map<String, Object> target = new LinkedHashMap<>();
        target.put("climate_control", new LinkedHashMap<>(Map.of("temperature", 21.0)));

        assertThatThrownBy(() -> ContextMerger.mergeInto(target, Map.of("climate_control", "off"), "vehicleState"))
                .isInstanceOf(SchemaMismatchException.class)
                .hasMessageContaining("vehicleState.climate_control");
    }
}
