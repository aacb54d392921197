package com.bbthechange.recurring.repository;

import com.bbthechange.recurring.model.SeriesGroup;

import java.util.Optional;

/**
 * Repository interface for series groups.
 * Groups are created and deleted through {@link SeriesTransactionRepository}; this interface covers reads
 * and in-place metadata updates.
 */
public interface SeriesGroupRepository {

    /**
     * Find a group by its id.
     *
     * @param groupId the group id
     * @return the group if it exists
     */
    Optional<SeriesGroup> findById(String groupId);

    /**
     * Write back a group's display metadata, guarded by its optimistic-lock version.
     *
     * @param group the group, carrying the version that was read
     * @return the saved group with its version incremented
     * @throws com.bbthechange.recurring.exception.VersionConflictException if the group changed since it was read
     */
    SeriesGroup update(SeriesGroup group);
}
