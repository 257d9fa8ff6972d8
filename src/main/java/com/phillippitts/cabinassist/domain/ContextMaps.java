package com.phillippitts.cabinassist.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deep-copy helpers for the loosely typed maps carried in context snapshots, NLU entities
 * and command parameters.
 *
 * <p>Copies preserve insertion order and tolerate {@code null} values (vehicle state uses
 * {@code null} for "not set", e.g. no navigation destination). Nested maps and lists are
 * copied recursively; the returned structures are unmodifiable at every level so a snapshot
 * handed to a caller can never alias store-owned state. Keys of any type are accepted and
 * stored by their string form.
 */
public final class ContextMaps {

    private ContextMaps() {
    }

    /**
     * Returns an unmodifiable deep copy of {@code source}; {@code null} becomes an empty map.
     */
    public static Map<String, Object> frozenCopy(Map<?, ?> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(String.valueOf(k), freeze(v)));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Returns a mutable deep copy of {@code source}; nested maps are mutable {@link LinkedHashMap}s.
     */
    public static Map<String, Object> mutableCopy(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((k, v) -> copy.put(String.valueOf(k), thaw(v)));
        }
        return copy;
    }

    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> m) {
            return frozenCopy(m);
        }
        if (value instanceof List<?> l) {
            List<Object> copy = new ArrayList<>(l.size());
            l.forEach(item -> copy.add(freeze(item)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    private static Object thaw(Object value) {
        if (value instanceof Map<?, ?> m) {
            return mutableCopy(m);
        }
        if (value instanceof List<?> l) {
            List<Object> copy = new ArrayList<>(l.size());
            l.forEach(item -> copy.add(thaw(item)));
            return copy;
        }
        return value;
    }
}
