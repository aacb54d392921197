package com.bbthechange.recurring.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A concrete record held by the entity store, addressed by (recordType, recordId).
 * The time range lives beside the free-form fields so the store can index it.
 */
public class EntityRecord {

    private String recordType;
    private String recordId;
    private Map<String, Object> fields;
    private String timeField;
    private TimeRange timeRange;
    private Instant createdAt;
    private Instant updatedAt;

    public EntityRecord() {
        this.fields = new LinkedHashMap<>();
    }

    public EntityRecord(String recordType, String recordId, Map<String, Object> fields,
                        String timeField, TimeRange timeRange) {
        this.recordType = recordType;
        this.recordId = recordId;
        this.fields = fields == null ? new LinkedHashMap<>() : new LinkedHashMap<>(fields);
        this.timeField = timeField;
        this.timeRange = timeRange;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    /**
     * Value of a field, with the time field resolving to the indexed range.
     */
    public Object getField(String name) {
        if (name != null && name.equals(timeField)) {
            return timeRange;
        }
        return fields.get(name);
    }

    public String getRecordType() {
        return recordType;
    }

    public void setRecordType(String recordType) {
        this.recordType = recordType;
    }

    public String getRecordId() {
        return recordId;
    }

    public void setRecordId(String recordId) {
        this.recordId = recordId;
    }

    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    public void setFields(Map<String, Object> fields) {
        this.fields = fields == null ? new LinkedHashMap<>() : new LinkedHashMap<>(fields);
    }

    public String getTimeField() {
        return timeField;
    }

    public void setTimeField(String timeField) {
        this.timeField = timeField;
    }

    public TimeRange getTimeRange() {
        return timeRange;
    }

    public void setTimeRange(TimeRange timeRange) {
        this.timeRange = timeRange;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
