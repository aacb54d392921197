package com.bbthechange.recurring.model;

import com.bbthechange.recurring.util.FieldMapAttributeConverter;
import com.bbthechange.recurring.util.InstantAsLongAttributeConverter;
import com.bbthechange.recurring.util.RecurringKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbIgnore;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One versioned recurrence definition plus the template stamped onto each generated record.
 * The version with a null effectiveUntil is the current one for its group; closed versions are never reopened.
 *
 * Key Pattern: PK = SERIES#{seriesId}, SK = METADATA
 * ParentIndex: GSI1PK = GROUP#{groupId}, GSI1SK = VERSION#{versionNumber}
 */
@DynamoDbBean
public class Series extends BaseItem {

    public static final String DEFAULT_TIME_FIELD = "time_slot";

    private String seriesId;
    private String groupId;             // null for legacy standalone series
    private String lineageId;           // shared by every version split from the same first series
    private Integer versionNumber;
    private LocalDate effectiveFrom;
    private LocalDate effectiveUntil;   // null = current version
    private String recordType;
    private Map<String, Object> template;
    private String rule;
    private Instant anchor;
    private Duration duration;
    private String timezone;
    private String timeField;
    private SeriesStatus status;
    private Instant expandedUntil;
    private String createdBy;
    private Instant templateUpdatedAt;
    private String templateUpdatedBy;
    private Long version;               // Optimistic locking

    // Default constructor for DynamoDB
    public Series() {
        super();
        setItemType(RecurringKeyFactory.ITEM_TYPE_SERIES);
        this.template = new LinkedHashMap<>();
        this.timeField = DEFAULT_TIME_FIELD;
        this.status = SeriesStatus.ACTIVE;
        this.version = 1L;
    }

    /**
     * Create a new series with a generated id. Pass a null groupId for a standalone series.
     */
    public Series(String groupId, Integer versionNumber) {
        this(UUID.randomUUID().toString(), groupId, versionNumber);
    }

    /**
     * Create a series under a known id. It starts a lineage of its own until {@link #continueLineage} is called.
     */
    public Series(String seriesId, String groupId, Integer versionNumber) {
        this();
        this.seriesId = seriesId;
        this.lineageId = seriesId;
        setPk(RecurringKeyFactory.getSeriesPk(seriesId));
        setSk(RecurringKeyFactory.getMetadataSk());
        if (groupId != null) {
            assignToGroup(groupId, versionNumber);
        } else {
            this.versionNumber = versionNumber;
        }
    }

    /**
     * Attach this series to a group at the given version and index it under that group.
     */
    public void assignToGroup(String groupId, Integer versionNumber) {
        this.groupId = groupId;
        this.versionNumber = versionNumber;
        setGsi1pk(RecurringKeyFactory.getGroupPk(groupId));
        setGsi1sk(RecurringKeyFactory.getVersionSk(versionNumber));
    }

    /**
     * Id of the version that takes over from the given series at a split date. Deterministic, so a split
     * that was interrupted can find the version it already created.
     */
    public static String deriveSuccessorId(String seriesId, LocalDate splitDate) {
        String name = seriesId + "#SPLIT#" + splitDate;
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8)).toString();
    }

    public void continueLineage(Series predecessor) {
        this.lineageId = predecessor.lineageKey();
    }

    /**
     * Key that instance ids are derived from. Series written before lineages existed use their own id.
     */
    public String lineageKey() {
        return lineageId != null ? lineageId : seriesId;
    }

    @DynamoDbIgnore
    public boolean isCurrent() {
        return effectiveUntil == null;
    }

    /**
     * Zone used for wall-clock fidelity. Unknown or missing ids resolve to UTC.
     */
    @DynamoDbIgnore
    public ZoneId zoneId() {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone);
        } catch (java.time.DateTimeException e) {
            return ZoneOffset.UTC;
        }
    }

    public String getSeriesId() {
        return seriesId;
    }

    public void setSeriesId(String seriesId) {
        this.seriesId = seriesId;
    }

    public String getGroupId() {
        return groupId;
    }

    public void setGroupId(String groupId) {
        this.groupId = groupId;
    }

    public String getLineageId() {
        return lineageId;
    }

    public void setLineageId(String lineageId) {
        this.lineageId = lineageId;
    }

    public Integer getVersionNumber() {
        return versionNumber;
    }

    public void setVersionNumber(Integer versionNumber) {
        this.versionNumber = versionNumber;
    }

    public LocalDate getEffectiveFrom() {
        return effectiveFrom;
    }

    public void setEffectiveFrom(LocalDate effectiveFrom) {
        this.effectiveFrom = effectiveFrom;
    }

    public LocalDate getEffectiveUntil() {
        return effectiveUntil;
    }

    public void setEffectiveUntil(LocalDate effectiveUntil) {
        this.effectiveUntil = effectiveUntil;
    }

    public String getRecordType() {
        return recordType;
    }

    public void setRecordType(String recordType) {
        this.recordType = recordType;
    }

    @DynamoDbConvertedBy(FieldMapAttributeConverter.class)
    public Map<String, Object> getTemplate() {
        return template;
    }

    public void setTemplate(Map<String, Object> template) {
        this.template = template;
    }

    public String getRule() {
        return rule;
    }

    public void setRule(String rule) {
        this.rule = rule;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getAnchor() {
        return anchor;
    }

    public void setAnchor(Instant anchor) {
        this.anchor = anchor;
    }

    public Duration getDuration() {
        return duration;
    }

    public void setDuration(Duration duration) {
        this.duration = duration;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public String getTimeField() {
        return timeField;
    }

    public void setTimeField(String timeField) {
        this.timeField = timeField;
    }

    public SeriesStatus getStatus() {
        return status;
    }

    public void setStatus(SeriesStatus status) {
        this.status = status;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getExpandedUntil() {
        return expandedUntil;
    }

    public void setExpandedUntil(Instant expandedUntil) {
        this.expandedUntil = expandedUntil;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(String createdBy) {
        this.createdBy = createdBy;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getTemplateUpdatedAt() {
        return templateUpdatedAt;
    }

    public void setTemplateUpdatedAt(Instant templateUpdatedAt) {
        this.templateUpdatedAt = templateUpdatedAt;
    }

    public String getTemplateUpdatedBy() {
        return templateUpdatedBy;
    }

    public void setTemplateUpdatedBy(String templateUpdatedBy) {
        this.templateUpdatedBy = templateUpdatedBy;
    }

    public Long getVersion() {
        return version;
    }

    public void setVersion(Long version) {
        this.version = version;
    }
}
