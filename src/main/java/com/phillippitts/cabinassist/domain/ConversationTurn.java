package com.phillippitts.cabinassist.domain;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One exchange unit appended to conversation history. Immutable once created.
 *
 * @param timestamp when the turn was produced
 * @param speaker   who spoke
 * @param text      utterance text (may be empty, never null)
 * @param intent    detected intent, or {@code null} for assistant/system turns
 * @param entities  extracted entities (deep-copied, unmodifiable)
 */
public record ConversationTurn(
        Instant timestamp,
        Speaker speaker,
        String text,
        String intent,
        Map<String, Object> entities
) {
    public ConversationTurn {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(speaker, "speaker");
        text = text == null ? "" : text;
        entities = ContextMaps.frozenCopy(entities);
    }

    public static ConversationTurn user(Instant at, String text, String intent, Map<String, Object> entities) {
        return new ConversationTurn(at, Speaker.USER, text, intent, entities);
    }

    public static ConversationTurn assistant(Instant at, String text) {
        return new ConversationTurn(at, Speaker.ASSISTANT, text, null, Map.of());
    }
}
