package com.bbthechange.recurring.exception;

/**
 * Exception thrown when a DynamoDB transaction is cancelled after all retries.
 * Multi-item changes either apply completely or not at all.
 */
public class TransactionFailedException extends RuntimeException {

    public TransactionFailedException(String message) {
        super(message);
    }

    public TransactionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
