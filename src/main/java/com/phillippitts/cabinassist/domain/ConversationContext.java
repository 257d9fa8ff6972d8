package com.phillippitts.cabinassist.domain;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of the shared conversation context.
 *
 * <p>Instances are produced by the context store only; every nested collection is an
 * unmodifiable deep copy, so holding a snapshot never exposes a partially applied update.
 *
 * <p>The string constants name the fields accepted by partial updates.
 *
 * @param history         conversation turns, oldest first, bounded by the store's window
 * @param currentIntent   latest user intent, or {@code null}
 * @param entities        entities of the latest user turn
 * @param vehicleState    last known vehicle state (nested maps per subsystem)
 * @param userPreferences user preferences
 * @param systemStatus    system status (e.g. {@code status}, {@code errors})
 * @param lastUpdate      time of the last mutation
 */
public record ConversationContext(
        List<ConversationTurn> history,
        String currentIntent,
        Map<String, Object> entities,
        Map<String, Object> vehicleState,
        Map<String, Object> userPreferences,
        Map<String, Object> systemStatus,
        Instant lastUpdate
) {

    public static final String CURRENT_INTENT = "currentIntent";
    public static final String ENTITIES = "entities";
    public static final String VEHICLE_STATE = "vehicleState";
    public static final String USER_PREFERENCES = "userPreferences";
    public static final String SYSTEM_STATUS = "systemStatus";

    public ConversationContext {
        history = history == null ? List.of() : List.copyOf(history);
        entities = ContextMaps.frozenCopy(entities);
        vehicleState = ContextMaps.frozenCopy(vehicleState);
        userPreferences = ContextMaps.frozenCopy(userPreferences);
        systemStatus = ContextMaps.frozenCopy(systemStatus);
        Objects.requireNonNull(lastUpdate, "lastUpdate");
    }

    /**
     * Default context used at process start and after a TTL reset.
     */
    public static ConversationContext defaults(Instant now) {
        return new ConversationContext(List.of(), null, Map.of(), Map.of(), Map.of(),
                Map.of("status", "ready"), now);
    }
}
