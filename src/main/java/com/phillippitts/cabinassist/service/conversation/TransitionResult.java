package com.phillippitts.cabinassist.service.conversation;

/**
 * Outcome of evaluating one trigger.
 *
 * @param from     state before evaluation
 * @param to       state after evaluation
 * @param accepted false when the trigger was a no-op in the {@code from} state
 * @param session  session the trigger acted on; for a transition into IDLE this is the session
 *                 just discarded, for an ignored trigger the current session (may be {@code null})
 */
public record TransitionResult(ConversationState from, ConversationState to, boolean accepted,
                               ConversationSession session) {

    static TransitionResult ignored(ConversationState state, ConversationSession session) {
        return new TransitionResult(state, state, false, session);
    }

    public boolean changed() {
        return from != to;
    }
}
