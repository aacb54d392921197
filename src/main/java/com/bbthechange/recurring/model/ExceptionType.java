package com.bbthechange.recurring.model;

/**
 * How an occurrence deviates from its series template.
 */
public enum ExceptionType {
    NONE,
    MODIFIED,
    RESCHEDULED,
    CANCELLED,
    CONFLICT_SKIPPED
}
