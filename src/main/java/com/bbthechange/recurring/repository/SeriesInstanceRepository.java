package com.bbthechange.recurring.repository;

import com.bbthechange.recurring.model.SeriesInstance;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for series instances, the junction rows between occurrences and records.
 */
public interface SeriesInstanceRepository {

    Optional<SeriesInstance> findById(String instanceId);

    /**
     * All instances of one series, ordered by occurrence date.
     */
    List<SeriesInstance> findBySeriesId(String seriesId);

    /**
     * The instance currently linked to a record, if the record belongs to a series.
     */
    Optional<SeriesInstance> findByRecord(String recordType, String recordId);

    /**
     * Insert an instance unless one already exists under the same id.
     *
     * @return true if inserted, false if the occurrence was already tracked
     */
    boolean putIfAbsent(SeriesInstance instance);

    /**
     * Replace an instance, guarded by the version that was read. The stored version is incremented.
     *
     * @throws com.bbthechange.recurring.exception.VersionConflictException if the instance changed concurrently
     */
    SeriesInstance update(SeriesInstance instance);
}
