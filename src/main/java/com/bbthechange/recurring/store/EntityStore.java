package com.bbthechange.recurring.store;

import com.bbthechange.recurring.model.EntityRecord;
import com.bbthechange.recurring.model.TimeRange;

import java.util.Map;
import java.util.Optional;

/**
 * Generic store for the concrete records a series materializes, addressed by (recordType, recordId).
 * The engine only relies on the capabilities declared here; field names are checked against
 * record type metadata before they reach the store.
 */
public interface EntityStore {

    Optional<EntityRecord> find(String recordType, String recordId);

    /**
     * Create a record with a generated id.
     *
     * @param recordType target record type
     * @param fields field values, excluding the time field
     * @param timeField name of the time range field
     * @param timeRange the record's time range
     * @return the created record
     */
    EntityRecord create(String recordType, Map<String, Object> fields, String timeField, TimeRange timeRange);

    /**
     * Overwrite the given fields, leaving the others as they are.
     *
     * @throws com.bbthechange.recurring.exception.ResourceNotFoundException if the record does not exist
     */
    void setFields(String recordType, String recordId, Map<String, Object> fields);

    /**
     * Replace the record's time range.
     *
     * @throws com.bbthechange.recurring.exception.ResourceNotFoundException if the record does not exist
     */
    void setTimeRange(String recordType, String recordId, TimeRange timeRange);

    /**
     * Delete a record. Every registered {@link RecordDeletionListener} is told first.
     */
    void delete(String recordType, String recordId);

    /**
     * Find a record in the same scope whose time range overlaps {@code range}. Ranges are half-open,
     * so a record ending exactly when {@code range} starts is not returned.
     *
     * @return some overlapping record, or empty if none
     */
    Optional<EntityRecord> findOverlapping(String recordType, String scopeField, Object scopeValue,
                                           String timeField, TimeRange range);
}
