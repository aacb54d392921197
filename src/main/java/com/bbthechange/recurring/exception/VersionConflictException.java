package com.bbthechange.recurring.exception;

/**
 * Exception thrown when an optimistic locking version check fails.
 *
 * The item was modified by another request or by the expansion worker since it was read.
 * Services retry these internally; callers only see it once retries are exhausted.
 */
public class VersionConflictException extends RuntimeException {

    public VersionConflictException(String message) {
        super(message);
    }

    public VersionConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
