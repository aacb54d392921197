package com.bbthechange.recurring.exception;

/**
 * Thrown when a required series creation parameter is absent.
 */
public class MissingFieldException extends RuntimeException {

    private final String field;

    public MissingFieldException(String field) {
        super("Missing required field: " + field);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
