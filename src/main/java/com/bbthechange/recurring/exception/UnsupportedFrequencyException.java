package com.bbthechange.recurring.exception;

/**
 * Thrown for recurrence rules whose frequency is finer than hourly.
 */
public class UnsupportedFrequencyException extends RuntimeException {

    private final String frequency;

    public UnsupportedFrequencyException(String frequency) {
        super(String.format("Invalid RRULE: %s frequency is not allowed. Use HOURLY or less frequent.", frequency));
        this.frequency = frequency;
    }

    public String getFrequency() {
        return frequency;
    }
}
