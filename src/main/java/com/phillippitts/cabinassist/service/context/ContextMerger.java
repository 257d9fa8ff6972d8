package com.phillippitts.cabinassist.service.context;

import com.phillippitts.cabinassist.domain.ContextMaps;
import com.phillippitts.cabinassist.exception.SchemaMismatchException;

import java.util.Map;

/**
 * Deep merge of loosely typed context maps.
 *
 * <p>Rules, applied recursively per key:
 * <ul>
 *   <li>map into map: merged key by key</li>
 *   <li>{@code null} incoming value: replaces (clears) the existing value</li>
 *   <li>any value into an absent or {@code null} existing value: stored as-is</li>
 *   <li>map into non-null scalar, or non-null scalar into map: {@link SchemaMismatchException}</li>
 *   <li>scalar into scalar: replaced</li>
 * </ul>
 *
 * <p>The target is mutated in place and nested maps are replaced by merged copies; callers merge
 * into a working copy and commit only when no exception was thrown.
 */
final class ContextMerger {

    private ContextMerger() {
    }

    static void mergeInto(Map<String, Object> target, Map<?, ?> incoming, String path) {
        for (Map.Entry<?, ?> entry : incoming.entrySet()) {
            String key = String.valueOf(entry.getKey());
            String keyPath = path.isEmpty() ? key : path + "." + key;
            Object value = entry.getValue();
            Object existing = target.get(key);

            if (value == null || existing == null) {
                target.put(key, value instanceof Map<?, ?> m ? ContextMaps.mutableCopy(m) : value);
            } else if (existing instanceof Map<?, ?> existingMap) {
                if (!(value instanceof Map<?, ?> valueMap)) {
                    throw new SchemaMismatchException(keyPath,
                            "expected a mapping but got " + value.getClass().getSimpleName());
                }
                Map<String, Object> merged = ContextMaps.mutableCopy(existingMap);
                mergeInto(merged, valueMap, keyPath);
                target.put(key, merged);
            } else if (value instanceof Map<?, ?>) {
                throw new SchemaMismatchException(keyPath,
                        "expected a scalar " + existing.getClass().getSimpleName() + " but got a mapping");
            } else {
                target.put(key, value);
            }
        }
    }
}
