package com.bbthechange.recurring.service.impl;

import com.bbthechange.recurring.exception.TransactionFailedException;
import com.bbthechange.recurring.exception.VersionConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

/**
 * Runs a read-modify-write operation and repeats it when a version condition fails.
 *
 * The operation must re-read everything it writes on each call, so a retry always
 * works against the latest stored versions.
 */
@Service
public class OptimisticRetryService {

    private static final Logger logger = LoggerFactory.getLogger(OptimisticRetryService.class);

    // Optimistic locking retry configuration
    private static final int MAX_RETRY_ATTEMPTS = 3;
    private static final long INITIAL_RETRY_DELAY_MS = 50;
    private static final double RETRY_BACKOFF_MULTIPLIER = 2.0;

    /**
     * @param operationName used in logs and the failure message
     * @param operation the read-modify-write to run
     * @throws TransactionFailedException when every attempt hit a version conflict
     */
    public <T> T executeWithRetry(String operationName, Supplier<T> operation) {
        int attempt = 0;
        long delayMs = INITIAL_RETRY_DELAY_MS;

        while (true) {
            try {
                return operation.get();
            } catch (VersionConflictException e) {
                attempt++;
                if (attempt >= MAX_RETRY_ATTEMPTS) {
                    logger.error("{} failed after {} attempts due to version conflicts", operationName, MAX_RETRY_ATTEMPTS);
                    throw new TransactionFailedException(
                        operationName + " failed: the data was modified concurrently, please retry", e);
                }

                logger.debug("Version conflict during {}, retrying (attempt {})", operationName, attempt);

                try {
                    Thread.sleep(delayMs);
                    delayMs = (long) (delayMs * RETRY_BACKOFF_MULTIPLIER);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new TransactionFailedException(operationName + " interrupted during retry backoff", ie);
                }
            }
        }
    }
}
