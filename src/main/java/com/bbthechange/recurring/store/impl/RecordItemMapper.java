package com.bbthechange.recurring.store.impl;

import com.bbthechange.recurring.model.EntityRecord;
import com.bbthechange.recurring.model.TimeRange;
import com.bbthechange.recurring.util.FieldValueMapper;
import com.bbthechange.recurring.util.RecurringKeyFactory;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.Delete;
import software.amazon.awssdk.services.dynamodb.model.Update;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Item layout of records in the shared table. Used by the entity store for single-item calls and by the
 * series transaction repository when record writes have to join a transaction.
 *
 * PK = RECORD#{type}#{id}, SK = METADATA, GSI1 = RECORDTYPE#{type} / zero-padded range start.
 */
public final class RecordItemMapper {

    public static final String ATTR_RECORD_TYPE = "recordType";
    public static final String ATTR_RECORD_ID = "recordId";
    public static final String ATTR_FIELDS = "fields";
    public static final String ATTR_TIME_FIELD = "timeField";
    public static final String ATTR_RANGE_START = "rangeStart";
    public static final String ATTR_RANGE_END = "rangeEnd";

    private RecordItemMapper() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static Map<String, AttributeValue> key(String recordType, String recordId) {
        return Map.of(
            "pk", AttributeValue.builder().s(RecurringKeyFactory.getRecordPk(recordType, recordId)).build(),
            "sk", AttributeValue.builder().s(RecurringKeyFactory.getMetadataSk()).build()
        );
    }

    public static Map<String, AttributeValue> toItem(EntityRecord record) {
        Map<String, AttributeValue> item = new HashMap<>(key(record.getRecordType(), record.getRecordId()));
        item.put("itemType", str(RecurringKeyFactory.ITEM_TYPE_RECORD));
        item.put(ATTR_RECORD_TYPE, str(record.getRecordType()));
        item.put(ATTR_RECORD_ID, str(record.getRecordId()));
        item.put(ATTR_FIELDS, AttributeValue.builder().m(FieldValueMapper.toAttributeMap(record.getFields())).build());
        if (record.getTimeField() != null) {
            item.put(ATTR_TIME_FIELD, str(record.getTimeField()));
        }
        TimeRange range = record.getTimeRange();
        if (range != null) {
            item.put(ATTR_RANGE_START, millis(range.getStart()));
            item.put(ATTR_RANGE_END, millis(range.getEnd()));
            item.put("gsi1pk", str(RecurringKeyFactory.getRecordTypeKey(record.getRecordType())));
            item.put("gsi1sk", str(RecurringKeyFactory.getTimeSortKey(range.getStart())));
        }
        Instant now = Instant.now();
        item.put("createdAt", millis(record.getCreatedAt() != null ? record.getCreatedAt() : now));
        item.put("updatedAt", millis(record.getUpdatedAt() != null ? record.getUpdatedAt() : now));
        return item;
    }

    public static EntityRecord fromItem(Map<String, AttributeValue> item) {
        EntityRecord record = new EntityRecord();
        record.setRecordType(item.get(ATTR_RECORD_TYPE).s());
        record.setRecordId(item.get(ATTR_RECORD_ID).s());
        AttributeValue fields = item.get(ATTR_FIELDS);
        record.setFields(fields != null && fields.hasM() ? FieldValueMapper.fromAttributeMap(fields.m()) : new LinkedHashMap<>());
        if (item.containsKey(ATTR_TIME_FIELD)) {
            record.setTimeField(item.get(ATTR_TIME_FIELD).s());
        }
        if (item.containsKey(ATTR_RANGE_START) && item.containsKey(ATTR_RANGE_END)) {
            record.setTimeRange(new TimeRange(instant(item.get(ATTR_RANGE_START)), instant(item.get(ATTR_RANGE_END))));
        }
        if (item.containsKey("createdAt")) {
            record.setCreatedAt(instant(item.get("createdAt")));
        }
        if (item.containsKey("updatedAt")) {
            record.setUpdatedAt(instant(item.get("updatedAt")));
        }
        return record;
    }

    /**
     * Update that overwrites individual entries of the fields map. Fails if the record is gone.
     */
    public static Update fieldsUpdate(String tableName, String recordType, String recordId, Map<String, Object> fields) {
        Map<String, String> names = new HashMap<>();
        Map<String, AttributeValue> values = new HashMap<>();
        StringBuilder expression = new StringBuilder("SET ");
        names.put("#fields", ATTR_FIELDS);
        int i = 0;
        for (Map.Entry<String, Object> entry : fields.entrySet()) {
            names.put("#f" + i, entry.getKey());
            values.put(":v" + i, FieldValueMapper.toAttributeValue(entry.getValue()));
            expression.append("#fields.#f").append(i).append(" = :v").append(i).append(", ");
            i++;
        }
        expression.append("updatedAt = :updated");
        values.put(":updated", millis(Instant.now()));

        return Update.builder()
            .tableName(tableName)
            .key(key(recordType, recordId))
            .updateExpression(expression.toString())
            .conditionExpression("attribute_exists(pk)")
            .expressionAttributeNames(names)
            .expressionAttributeValues(values)
            .build();
    }

    /**
     * Update that replaces the record's time range and keeps the time index in step.
     */
    public static Update timeRangeUpdate(String tableName, String recordType, String recordId, TimeRange range) {
        return Update.builder()
            .tableName(tableName)
            .key(key(recordType, recordId))
            .updateExpression("SET rangeStart = :start, rangeEnd = :end, gsi1pk = :typeKey, gsi1sk = :startKey, updatedAt = :updated")
            .conditionExpression("attribute_exists(pk)")
            .expressionAttributeValues(Map.of(
                ":start", millis(range.getStart()),
                ":end", millis(range.getEnd()),
                ":typeKey", str(RecurringKeyFactory.getRecordTypeKey(recordType)),
                ":startKey", str(RecurringKeyFactory.getTimeSortKey(range.getStart())),
                ":updated", millis(Instant.now())
            ))
            .build();
    }

    public static Delete delete(String tableName, String recordType, String recordId) {
        return Delete.builder()
            .tableName(tableName)
            .key(key(recordType, recordId))
            .build();
    }

    private static AttributeValue str(String value) {
        return AttributeValue.builder().s(value).build();
    }

    private static AttributeValue millis(Instant instant) {
        return AttributeValue.builder().n(String.valueOf(instant.toEpochMilli())).build();
    }

    private static Instant instant(AttributeValue value) {
        return Instant.ofEpochMilli(Long.parseLong(value.n()));
    }
}
