package com.bbthechange.recurring.util;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Times every DynamoDB call made by the repositories and the entity store.
 * Slow calls are logged at warn level; failures are tagged so dashboards can split them out.
 */
@Component
public class QueryPerformanceTracker {

    private static final Logger logger = LoggerFactory.getLogger(QueryPerformanceTracker.class);
    private static final long SLOW_QUERY_THRESHOLD_MS = 500L;

    private final MeterRegistry meterRegistry;

    @Autowired
    public QueryPerformanceTracker(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Run a DynamoDB operation and record its duration.
     *
     * @param operation logical operation name, used as a metric tag
     * @param table table or index name
     * @param queryOperation the call to run
     * @return whatever the call returns
     */
    public <T> T trackQuery(String operation, String table, Supplier<T> queryOperation) {
        long startNanos = System.nanoTime();
        String outcome = "success";
        try {
            return queryOperation.get();
        } catch (RuntimeException e) {
            outcome = "error";
            logger.error("DynamoDB operation failed: operation={}, table={}, error={}",
                operation, table, e.getMessage());
            throw e;
        } finally {
            long elapsedNanos = System.nanoTime() - startNanos;
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(elapsedNanos);
            if (elapsedMs > SLOW_QUERY_THRESHOLD_MS) {
                logger.warn("Slow DynamoDB operation: operation={}, table={}, duration={}ms", operation, table, elapsedMs);
            } else {
                logger.debug("DynamoDB operation completed: operation={}, table={}, duration={}ms", operation, table, elapsedMs);
            }
            Timer.builder("dynamodb.query.duration")
                .tag("operation", operation)
                .tag("table", table)
                .tag("outcome", outcome)
                .register(meterRegistry)
                .record(elapsedNanos, TimeUnit.NANOSECONDS);
        }
    }
}
