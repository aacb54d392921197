package com.bbthechange.recurring.exception;

/**
 * Exception thrown when no authenticated user is attached to the request.
 */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException(String message) {
        super(message);
    }

    public UnauthorizedException(String message, Throwable cause) {
        super(message, cause);
    }
}
