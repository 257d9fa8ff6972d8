package com.phillippitts.cabinassist.service.vehicle;

/**
 * Assistant indicator shown on the head unit.
 */
public enum UiState {
    IDLE,
    LISTENING,
    PROCESSING,
    SPEAKING
}
