package com.phillippitts.cabinassist.domain;

/**
 * Who produced a conversation turn.
 */
public enum Speaker {
    USER,
    ASSISTANT,
    SYSTEM
}
