package com.phillippitts.cabinassist.service.health;

/**
 * Health state of one managed component.
 */
public enum ComponentStatus {
    /** Probe passed. */
    HEALTHY,
    /** A runtime failure was reported; recovery pending. */
    DEGRADED,
    /** Probe failed, timed out or threw, or recovery was exhausted. */
    FAILED
}
