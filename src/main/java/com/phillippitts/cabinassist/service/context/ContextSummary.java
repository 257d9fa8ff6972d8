package com.phillippitts.cabinassist.service.context;

import java.time.Instant;
import java.util.Map;

/**
 * Compact, log-friendly view of the conversation context.
 *
 * @param currentIntent   latest user intent (nullable)
 * @param entityCount     number of entities of the latest user turn
 * @param historySize     turns currently held in history
 * @param climate         climate subsystem state
 * @param media           media subsystem state
 * @param navigation      navigation subsystem state
 * @param preferenceCount number of stored user preferences
 * @param systemStatus    system status label
 * @param lastUpdate      time of the last mutation
 */
public record ContextSummary(
        String currentIntent,
        int entityCount,
        int historySize,
        Map<String, Object> climate,
        Map<String, Object> media,
        Map<String, Object> navigation,
        int preferenceCount,
        String systemStatus,
        Instant lastUpdate
) {
}
