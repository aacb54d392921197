package com.bbthechange.recurring.model;

import com.bbthechange.recurring.util.InstantAsLongAttributeConverter;
import com.bbthechange.recurring.util.RecurringKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbIgnore;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Junction between one occurrence of a series and the concrete record that represents it.
 * A null recordId means the occurrence was cancelled or skipped; the row itself is kept for audit.
 *
 * Key Pattern: PK = INSTANCE#{instanceId}, SK = METADATA
 * ParentIndex: GSI1PK = SERIES#{seriesId}, GSI1SK = OCCURRENCE#{occurrenceDate}
 * RecordIndex: GSI2PK = RECORD#{recordType}#{recordId}, GSI2SK = INSTANCE (only while linked)
 */
@DynamoDbBean
public class SeriesInstance extends BaseItem {

    private String instanceId;
    private String seriesId;
    private LocalDate occurrenceDate;
    private String recordType;
    private String recordId;
    private Boolean exception;
    private ExceptionType exceptionType;
    private Instant originalStart;      // range before the most recent reschedule
    private Instant originalEnd;
    private String exceptionReason;
    private String exceptionBy;
    private Instant exceptionAt;
    private Long version;

    // Default constructor for DynamoDB
    public SeriesInstance() {
        super();
        setItemType(RecurringKeyFactory.ITEM_TYPE_INSTANCE);
        this.exception = false;
        this.exceptionType = ExceptionType.NONE;
        this.version = 1L;
    }

    /**
     * Create the instance for one occurrence date of a series that starts its own lineage.
     */
    public SeriesInstance(String seriesId, LocalDate occurrenceDate, String recordType) {
        this(seriesId, seriesId, occurrenceDate, recordType);
    }

    /**
     * Create the instance for one occurrence date. The id is derived from the lineage and date,
     * so materializing the same occurrence twice addresses the same item, whichever version of the series does it.
     */
    public SeriesInstance(String seriesId, String lineageKey, LocalDate occurrenceDate, String recordType) {
        this();
        this.instanceId = deriveInstanceId(lineageKey, occurrenceDate);
        this.seriesId = seriesId;
        this.occurrenceDate = occurrenceDate;
        this.recordType = recordType;
        setPk(RecurringKeyFactory.getInstancePk(instanceId));
        setSk(RecurringKeyFactory.getMetadataSk());
        setGsi1pk(RecurringKeyFactory.getSeriesPk(seriesId));
        setGsi1sk(RecurringKeyFactory.getOccurrenceSk(occurrenceDate));
    }

    public static SeriesInstance forOccurrence(Series series, LocalDate occurrenceDate) {
        return new SeriesInstance(series.getSeriesId(), series.lineageKey(), occurrenceDate, series.getRecordType());
    }

    public static String deriveInstanceId(String lineageKey, LocalDate occurrenceDate) {
        String name = lineageKey + "#" + occurrenceDate;
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8)).toString();
    }

    /**
     * Hand this occurrence over to another version of the same lineage.
     */
    public void moveToSeries(String seriesId) {
        this.seriesId = seriesId;
        setGsi1pk(RecurringKeyFactory.getSeriesPk(seriesId));
    }

    public void linkRecord(String recordId) {
        this.recordId = recordId;
        setGsi2pk(RecurringKeyFactory.getRecordPk(recordType, recordId));
        setGsi2sk(RecurringKeyFactory.getInstanceRecordSk());
    }

    public void unlinkRecord() {
        this.recordId = null;
        setGsi2pk(null);
        setGsi2sk(null);
    }

    public void markException(ExceptionType type, String reason, String actor) {
        this.exception = true;
        this.exceptionType = type;
        this.exceptionReason = reason;
        this.exceptionBy = actor;
        this.exceptionAt = Instant.now();
    }

    @DynamoDbIgnore
    public boolean hasRecord() {
        return recordId != null;
    }

    @DynamoDbIgnore
    public boolean isExceptionInstance() {
        return Boolean.TRUE.equals(exception);
    }

    @DynamoDbIgnore
    public TimeRange getOriginalTimeRange() {
        if (originalStart == null || originalEnd == null) {
            return null;
        }
        return new TimeRange(originalStart, originalEnd);
    }

    public void setOriginalTimeRange(TimeRange range) {
        this.originalStart = range == null ? null : range.getStart();
        this.originalEnd = range == null ? null : range.getEnd();
    }

    public String getInstanceId() {
        return instanceId;
    }

    public void setInstanceId(String instanceId) {
        this.instanceId = instanceId;
    }

    public String getSeriesId() {
        return seriesId;
    }

    public void setSeriesId(String seriesId) {
        this.seriesId = seriesId;
    }

    public LocalDate getOccurrenceDate() {
        return occurrenceDate;
    }

    public void setOccurrenceDate(LocalDate occurrenceDate) {
        this.occurrenceDate = occurrenceDate;
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

    public Boolean getException() {
        return exception;
    }

    public void setException(Boolean exception) {
        this.exception = exception;
    }

    public ExceptionType getExceptionType() {
        return exceptionType;
    }

    public void setExceptionType(ExceptionType exceptionType) {
        this.exceptionType = exceptionType;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getOriginalStart() {
        return originalStart;
    }

    public void setOriginalStart(Instant originalStart) {
        this.originalStart = originalStart;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getOriginalEnd() {
        return originalEnd;
    }

    public void setOriginalEnd(Instant originalEnd) {
        this.originalEnd = originalEnd;
    }

    public String getExceptionReason() {
        return exceptionReason;
    }

    public void setExceptionReason(String exceptionReason) {
        this.exceptionReason = exceptionReason;
    }

    public String getExceptionBy() {
        return exceptionBy;
    }

    public void setExceptionBy(String exceptionBy) {
        this.exceptionBy = exceptionBy;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getExceptionAt() {
        return exceptionAt;
    }

    public void setExceptionAt(Instant exceptionAt) {
        this.exceptionAt = exceptionAt;
    }

    public Long getVersion() {
        return version;
    }

    public void setVersion(Long version) {
        this.version = version;
    }
}
