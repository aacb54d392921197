package com.bbthechange.recurring.repository;

import com.bbthechange.recurring.model.Series;
import com.bbthechange.recurring.model.SeriesGroup;
import com.bbthechange.recurring.model.SeriesInstance;
import com.bbthechange.recurring.model.TimeRange;

import java.util.List;
import java.util.Map;

/**
 * Repository for multi-item writes that must be applied atomically.
 * Items passed in carry the version that was read; each write is conditioned on it and increments it.
 *
 * @throws com.bbthechange.recurring.exception.VersionConflictException when a version condition fails
 * @throws com.bbthechange.recurring.exception.TransactionFailedException when the transaction is cancelled for another reason
 */
public interface SeriesTransactionRepository {

    /**
     * Create a group together with its first series.
     */
    void createSeries(SeriesGroup group, Series series);

    /**
     * Close the original series, open the next version and move future instances onto it.
     *
     * @param closedOriginal the original series, already carrying its effectiveUntil and rewritten rule
     * @param newGroup a group to create when the original was standalone, otherwise null
     * @param newSeries the version taking over from the split date
     * @param instancesToRepoint instances dated on or after the split date
     */
    void splitSeries(Series closedOriginal, SeriesGroup newGroup, Series newSeries, List<SeriesInstance> instancesToRepoint);

    /**
     * Move instances onto another version of their lineage. Finishes a split whose later chunks did not commit.
     */
    void repointInstances(String seriesId, List<SeriesInstance> instances);

    /**
     * Persist a series template and push the changed fields to the records of the given instances.
     */
    void updateTemplate(Series series, Map<String, Object> changedFields, List<SeriesInstance> instancesToUpdate);

    /**
     * Delete the given instances with their records, then save the series with its new schedule.
     */
    void replaceSchedule(Series series, List<SeriesInstance> instancesToDelete);

    /**
     * Delete the records of the given instances, the instances and the series.
     *
     * @param groupIdToDelete the owning group when this is its last series, otherwise null
     */
    void deleteSeries(Series series, List<SeriesInstance> instances, String groupIdToDelete);

    /**
     * Delete a group that no longer has any series.
     */
    void deleteGroup(String groupId);

    /**
     * Save a cancelled instance and delete the record it pointed to.
     */
    void cancelInstance(SeriesInstance cancelledInstance, String recordType, String recordId);

    /**
     * Save a rescheduled instance and move its record to the new range.
     */
    void rescheduleInstance(SeriesInstance rescheduledInstance, TimeRange newRange);
}
