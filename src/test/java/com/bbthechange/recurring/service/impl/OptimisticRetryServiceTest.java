package com.bbthechange.recurring.service.impl;

import com.bbthechange.recurring.exception.RepositoryException;
import com.bbthechange.recurring.exception.TransactionFailedException;
import com.bbthechange.recurring.exception.VersionConflictException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class OptimisticRetryServiceTest {

    private final OptimisticRetryService retryService = new OptimisticRetryService();

    @Test
    void executeWithRetry_SucceedsFirstTime_RunsOnce() {
        // Given
        AtomicInteger calls = new AtomicInteger();

        // When
        String result = retryService.executeWithRetry("test", () -> {
            calls.incrementAndGet();
            return "done";
        });

        // Then
        assertThat(result).isEqualTo("done");
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void executeWithRetry_ConflictThenSuccess_Retries() {
        // Given
        AtomicInteger calls = new AtomicInteger();

        // When
        Integer result = retryService.executeWithRetry("test", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new VersionConflictException("conflict");
            }
            return calls.get();
        });

        // Then
        assertThat(result).isEqualTo(3);
    }

    @Test
    void executeWithRetry_ConflictEveryTime_ThrowsTransactionFailed() {
        // Given
        AtomicInteger calls = new AtomicInteger();

        // When / Then
        assertThatThrownBy(() -> retryService.executeWithRetry("updateTemplate", () -> {
            calls.incrementAndGet();
            throw new VersionConflictException("conflict");
        }))
            .isInstanceOf(TransactionFailedException.class)
            .hasMessageContaining("updateTemplate")
            .hasCauseInstanceOf(VersionConflictException.class);
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void executeWithRetry_OtherException_PropagatesWithoutRetry() {
        // Given
        AtomicInteger calls = new AtomicInteger();

        // When / Then
        assertThatThrownBy(() -> retryService.executeWithRetry("test", () -> {
            calls.incrementAndGet();
            throw new RepositoryException("down", new RuntimeException());
        })).isInstanceOf(RepositoryException.class);
        assertThat(calls.get()).isEqualTo(1);
    }
}
