package com.bbthechange.recurring.model;

/**
 * Filters for listing the instances of a group.
 */
public enum InstanceFilter {
    ALL,
    UPCOMING,
    PAST,
    EXCEPTIONS
}
