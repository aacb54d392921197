package com.bbthechange.recurring.exception;

/**
 * Exception thrown for malformed request input that is not covered by a more specific type.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
