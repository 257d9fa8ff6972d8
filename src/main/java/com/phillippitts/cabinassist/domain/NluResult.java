package com.phillippitts.cabinassist.domain;

import java.util.Map;
import java.util.Objects;

/**
 * Output of the language-understanding collaborator.
 *
 * @param intent     intent label (e.g. {@code climate_control}); {@code unknown} when unsure
 * @param entities   extracted entities
 * @param confidence classifier confidence in [0.0, 1.0]
 */
public record NluResult(String intent, Map<String, Object> entities, double confidence) {

    public static final String UNKNOWN_INTENT = "unknown";

    public NluResult {
        Objects.requireNonNull(intent, "intent");
        entities = ContextMaps.frozenCopy(entities);
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }
}
