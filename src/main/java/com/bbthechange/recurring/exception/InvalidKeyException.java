package com.bbthechange.recurring.exception;

/**
 * Exception thrown when DynamoDB key validation fails.
 * Used by RecurringKeyFactory to keep key patterns consistent.
 */
public class InvalidKeyException extends RuntimeException {

    public InvalidKeyException(String message) {
        super(message);
    }

    public InvalidKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
