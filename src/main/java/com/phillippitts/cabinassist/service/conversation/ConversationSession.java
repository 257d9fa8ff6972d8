package com.phillippitts.cabinassist.service.conversation;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Transient record of one conversation, discarded when the state machine returns to IDLE.
 *
 * @param id        session identifier, also used as the {@code sessionId} log context
 * @param state     state the session is in
 * @param startedAt when the session began
 * @param turnCount user turns accepted so far
 * @param active    true for a user conversation; false while a proactive notification is spoken
 */
public record ConversationSession(UUID id, ConversationState state, Instant startedAt, int turnCount, boolean active) {

    public ConversationSession {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(startedAt, "startedAt");
    }

    static ConversationSession conversation(Instant now) {
        return new ConversationSession(UUID.randomUUID(), ConversationState.LISTENING, now, 0, true);
    }

    static ConversationSession proactive(Instant now) {
        return new ConversationSession(UUID.randomUUID(), ConversationState.SPEAKING, now, 0, false);
    }

    ConversationSession withState(ConversationState next) {
        return new ConversationSession(id, next, startedAt, turnCount, active);
    }

    ConversationSession withNextTurn() {
        return new ConversationSession(id, state, startedAt, turnCount + 1, active);
    }
}
