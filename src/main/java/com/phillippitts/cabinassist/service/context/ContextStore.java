package com.phillippitts.cabinassist.service.context;

import com.phillippitts.cabinassist.domain.ConversationContext;
import com.phillippitts.cabinassist.domain.ConversationTurn;
import com.phillippitts.cabinassist.exception.SchemaMismatchException;
import com.phillippitts.cabinassist.service.lifecycle.ManagedComponent;

import java.util.List;
import java.util.Map;

/**
 * Concurrency-safe owner of the shared {@link ConversationContext}.
 *
 * <p>All operations are mutually exclusive. Reads return immutable snapshots, so a caller
 * holding a snapshot never observes a later or partially applied update. A context that has
 * not been modified for longer than the configured TTL is reset to defaults before the next
 * operation observes it.
 *
 * <p>The store takes part in the component lifecycle as {@code context_fusion}.
 */
public interface ContextStore extends ManagedComponent {

    /**
     * Returns a consistent snapshot, applying the TTL reset first when the context is stale.
     */
    ConversationContext read();

    /**
     * Applies a partial update: map fields are deep-merged, scalar fields replaced, and the
     * last-update timestamp refreshed.
     *
     * @param partial field name to value, using the {@link ConversationContext} field constants
     * @throws SchemaMismatchException if a value does not fit the field's shape; the stored
     *                                 context is left exactly as it was
     */
    void update(Map<String, Object> partial);

    /**
     * Appends a turn and truncates history to the configured window.
     */
    void appendTurn(ConversationTurn turn);

    /**
     * Resets the context to defaults.
     */
    void reset();

    /**
     * Returns at most {@code turns} of the most recent history entries, oldest first.
     */
    List<ConversationTurn> recentHistory(int turns);

    /**
     * Deep-merges {@code state} into the vehicle state.
     */
    void updateVehicleState(Map<String, Object> state);

    /**
     * Deep-merges {@code preferences} into the user preferences.
     */
    void updateUserPreferences(Map<String, Object> preferences);

    /**
     * Records the latest occurrence of a vehicle event under {@code vehicleState.events}.
     */
    void recordVehicleEvent(String eventType, Map<String, Object> payload);

    /**
     * Headline view of the context for status endpoints and logs.
     */
    ContextSummary summarize();
}
