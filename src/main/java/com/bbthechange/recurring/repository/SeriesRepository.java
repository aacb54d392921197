package com.bbthechange.recurring.repository;

import com.bbthechange.recurring.model.Series;
import com.bbthechange.recurring.model.SeriesStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for series versions.
 * There is deliberately no delete here: a series only disappears together with its instances,
 * through {@link SeriesTransactionRepository#deleteSeries}.
 */
public interface SeriesRepository {

    /**
     * Find a series by its id.
     */
    Optional<Series> findById(String seriesId);

    /**
     * All versions in a group, ordered by version number ascending.
     */
    List<Series> findByGroupId(String groupId);

    /**
     * Set the status of a series.
     */
    void updateStatus(String seriesId, SeriesStatus status);

    /**
     * Move the expansion high-water mark forward. A value at or behind the stored mark is ignored,
     * so concurrent workers can never move it back.
     *
     * @return true if the stored mark changed
     */
    boolean advanceExpandedUntil(String seriesId, Instant expandedUntil);
}
