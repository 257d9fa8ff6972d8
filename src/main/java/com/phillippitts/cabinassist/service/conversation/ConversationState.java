package com.phillippitts.cabinassist.service.conversation;

/**
 * Conversation states. IDLE is initial; there is no terminal state.
 */
public enum ConversationState {
    IDLE,
    LISTENING,
    PROCESSING,
    SPEAKING
}
