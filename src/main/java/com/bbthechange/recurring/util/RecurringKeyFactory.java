package com.bbthechange.recurring.util;

import com.bbthechange.recurring.exception.InvalidKeyException;

import java.time.Instant;
import java.time.LocalDate;
import java.util.regex.Pattern;

/**
 * Type-safe key factory for the single-table layout of the recurring schedule engine.
 *
 * <pre>
 * SeriesGroup  PK = GROUP#{groupId}            SK = METADATA
 * Series       PK = SERIES#{seriesId}          SK = METADATA   GSI1 = GROUP#{groupId} / VERSION#{nnnnnn}
 * Instance     PK = INSTANCE#{instanceId}      SK = METADATA   GSI1 = SERIES#{seriesId} / OCCURRENCE#{date}
 *                                                              GSI2 = RECORD#{type}#{recordId} / INSTANCE
 * Record       PK = RECORD#{type}#{recordId}   SK = METADATA   GSI1 = RECORDTYPE#{type} / {start millis}
 * </pre>
 */
public final class RecurringKeyFactory {
    private static final String DELIMITER = "#";
    private static final Pattern UUID_PATTERN = Pattern.compile(
        "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern RECORD_TYPE_PATTERN = Pattern.compile("[a-z][a-z0-9_]{0,62}");

    public static final String GROUP_PREFIX = "GROUP";
    public static final String SERIES_PREFIX = "SERIES";
    public static final String INSTANCE_PREFIX = "INSTANCE";
    public static final String RECORD_PREFIX = "RECORD";
    public static final String RECORD_TYPE_PREFIX = "RECORDTYPE";
    public static final String VERSION_PREFIX = "VERSION";
    public static final String OCCURRENCE_PREFIX = "OCCURRENCE";
    public static final String METADATA_SUFFIX = "METADATA";

    // Item type discriminators
    public static final String ITEM_TYPE_GROUP = "SERIES_GROUP";
    public static final String ITEM_TYPE_SERIES = "SERIES";
    public static final String ITEM_TYPE_INSTANCE = "SERIES_INSTANCE";
    public static final String ITEM_TYPE_RECORD = "RECORD";

    // Index names
    public static final String PARENT_INDEX = "ParentIndex";
    public static final String RECORD_INDEX = "RecordIndex";

    private RecurringKeyFactory() {
        throw new UnsupportedOperationException("Utility class");
    }

    private static void validateId(String id, String type) {
        if (id == null || id.trim().isEmpty()) {
            throw new InvalidKeyException(type + " ID cannot be null or empty");
        }
        if (!UUID_PATTERN.matcher(id).matches()) {
            throw new InvalidKeyException("Invalid " + type + " ID format: " + id);
        }
    }

    public static void validateRecordType(String recordType) {
        if (recordType == null || !RECORD_TYPE_PATTERN.matcher(recordType).matches()) {
            throw new InvalidKeyException("Invalid record type: " + recordType);
        }
    }

    public static String getGroupPk(String groupId) {
        validateId(groupId, "Group");
        return GROUP_PREFIX + DELIMITER + groupId;
    }

    public static String getSeriesPk(String seriesId) {
        validateId(seriesId, "Series");
        return SERIES_PREFIX + DELIMITER + seriesId;
    }

    public static String getInstancePk(String instanceId) {
        validateId(instanceId, "Instance");
        return INSTANCE_PREFIX + DELIMITER + instanceId;
    }

    public static String getRecordPk(String recordType, String recordId) {
        validateRecordType(recordType);
        validateId(recordId, "Record");
        return RECORD_PREFIX + DELIMITER + recordType + DELIMITER + recordId;
    }

    public static String getRecordTypeKey(String recordType) {
        validateRecordType(recordType);
        return RECORD_TYPE_PREFIX + DELIMITER + recordType;
    }

    public static String getMetadataSk() {
        return METADATA_SUFFIX;
    }

    public static String getVersionSk(int versionNumber) {
        return VERSION_PREFIX + DELIMITER + String.format("%06d", versionNumber);
    }

    public static String getOccurrenceSk(LocalDate occurrenceDate) {
        return OCCURRENCE_PREFIX + DELIMITER + occurrenceDate;
    }

    public static String getOccurrencePrefix() {
        return OCCURRENCE_PREFIX + DELIMITER;
    }

    public static String getVersionPrefix() {
        return VERSION_PREFIX + DELIMITER;
    }

    /**
     * Sort key for the record time index. Zero padded so that string order matches time order.
     */
    public static String getTimeSortKey(Instant instant) {
        return String.format("%015d", Math.max(0L, instant.toEpochMilli()));
    }

    public static String getInstanceRecordSk() {
        return INSTANCE_PREFIX;
    }

    public static boolean isValidId(String id) {
        return id != null && UUID_PATTERN.matcher(id).matches();
    }
}
