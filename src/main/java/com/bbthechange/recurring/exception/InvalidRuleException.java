package com.bbthechange.recurring.exception;

/**
 * Exception thrown when a recurrence rule is malformed or has an unknown frequency.
 */
public class InvalidRuleException extends RuntimeException {

    public InvalidRuleException(String message) {
        super(message);
    }

    public InvalidRuleException(String message, Throwable cause) {
        super(message, cause);
    }
}
