package com.bbthechange.recurring.model;

/**
 * Lifecycle state of one series version.
 */
public enum SeriesStatus {
    ACTIVE,
    PAUSED,
    NEEDS_ATTENTION, // template drifted from the record type, expansion halted
    ENDED
}
