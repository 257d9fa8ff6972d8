package com.phillippitts.cabinassist.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContextMapsTest {

    @Test
    void keysAreStoredByTheirStringForm() {
        Map<Object, Object> zones = new LinkedHashMap<>();
        zones.put(1, "driver");
        zones.put(2, "passenger");

        Map<String, Object> copy = ContextMaps.mutableCopy(Map.of("zones", zones));

        assertThat(copy.get("zones")).isEqualTo(Map.of("1", "driver", "2", "passenger"));
    }

    @Test
    void mutableCopyIsDetachedAtEveryLevel() {
        Map<String, Object> climate = new HashMap<>();
        climate.put("temperature", 21.0);
        List<Object> presets = new ArrayList<>(List.of("eco"));
        Map<String, Object> source = new HashMap<>(Map.of("climate_control", climate, "presets", presets));

        Map<String, Object> copy = ContextMaps.mutableCopy(source);
        climate.put("temperature", 25.0);
        presets.add("sport");

        assertThat(copy.get("climate_control")).isEqualTo(Map.of("temperature", 21.0));
        assertThat(copy.get("presets")).isEqualTo(List.of("eco"));
        assertThat(copy.get("climate_control")).isInstanceOf(LinkedHashMap.class);
    }

    @Test
    void frozenCopyRejectsNestedWrites() {
        Map<String, Object> frozen = ContextMaps.frozenCopy(Map.of("media", Map.of("volume", 10)));

        Object media = frozen.get("media");
        assertThat(media).isInstanceOf(Map.class);
        assertThatThrownBy(() -> frozen.put("media", Map.of()))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> ((Map<?, ?>) media).clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void nullSourceBecomesEmpty() {
        assertThat(ContextMaps.frozenCopy(null)).isEmpty();
        assertThat(ContextMaps.mutableCopy(null)).isEmpty();
    }
}
