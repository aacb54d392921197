package com.bbthechange.recurring.store.impl;

import com.bbthechange.recurring.exception.RepositoryException;
import com.bbthechange.recurring.exception.ResourceNotFoundException;
import com.bbthechange.recurring.model.EntityRecord;
import com.bbthechange.recurring.model.TimeRange;
import com.bbthechange.recurring.store.EntityStore;
import com.bbthechange.recurring.store.RecordDeletionListener;
import com.bbthechange.recurring.util.FieldValueMapper;
import com.bbthechange.recurring.util.QueryPerformanceTracker;
import com.bbthechange.recurring.util.RecurringKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;
import software.amazon.awssdk.services.dynamodb.model.Update;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * EntityStore backed by the shared DynamoDB table.
 * Overlap queries walk the ParentIndex partition RECORDTYPE#{type}, newest start first, bounded by the
 * candidate's end; the remaining conditions run as a filter.
 */
@Repository
public class DynamoDbEntityStore implements EntityStore {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDbEntityStore.class);
    private static final String TABLE_NAME = "RecurringTable";

    private final DynamoDbClient dynamoDbClient;
    private final QueryPerformanceTracker performanceTracker;
    private final List<RecordDeletionListener> deletionListeners;

    @Autowired
    public DynamoDbEntityStore(DynamoDbClient dynamoDbClient,
                               QueryPerformanceTracker performanceTracker,
                               List<RecordDeletionListener> deletionListeners) {
        this.dynamoDbClient = dynamoDbClient;
        this.performanceTracker = performanceTracker;
        this.deletionListeners = List.copyOf(deletionListeners);
    }

    @Override
    public Optional<EntityRecord> find(String recordType, String recordId) {
        return performanceTracker.trackQuery("findRecord", TABLE_NAME, () -> {
            try {
                GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(RecordItemMapper.key(recordType, recordId))
                    .consistentRead(true)
                    .build());
                if (!response.hasItem() || response.item().isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(RecordItemMapper.fromItem(response.item()));
            } catch (DynamoDbException e) {
                logger.error("Failed to find record {}/{}", recordType, recordId, e);
                throw new RepositoryException("Failed to retrieve record", e);
            }
        });
    }

    @Override
    public EntityRecord create(String recordType, Map<String, Object> fields, String timeField, TimeRange timeRange) {
        EntityRecord record = new EntityRecord(recordType, UUID.randomUUID().toString(), fields, timeField, timeRange);
        return performanceTracker.trackQuery("createRecord", TABLE_NAME, () -> {
            try {
                dynamoDbClient.putItem(PutItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .item(RecordItemMapper.toItem(record))
                    .conditionExpression("attribute_not_exists(pk)")
                    .build());
                logger.debug("Created record {}/{}", recordType, record.getRecordId());
                return record;
            } catch (DynamoDbException e) {
                logger.error("Failed to create record of type {}", recordType, e);
                throw new RepositoryException("Failed to create record", e);
            }
        });
    }

    @Override
    public void setFields(String recordType, String recordId, Map<String, Object> fields) {
        if (fields.isEmpty()) {
            return;
        }
        applyUpdate("setRecordFields", recordType, recordId,
            RecordItemMapper.fieldsUpdate(TABLE_NAME, recordType, recordId, fields));
    }

    @Override
    public void setTimeRange(String recordType, String recordId, TimeRange timeRange) {
        applyUpdate("setRecordTimeRange", recordType, recordId,
            RecordItemMapper.timeRangeUpdate(TABLE_NAME, recordType, recordId, timeRange));
    }

    @Override
    public void delete(String recordType, String recordId) {
        for (RecordDeletionListener listener : deletionListeners) {
            listener.beforeRecordDelete(recordType, recordId);
        }
        performanceTracker.trackQuery("deleteRecord", TABLE_NAME, () -> {
            try {
                dynamoDbClient.deleteItem(DeleteItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(RecordItemMapper.key(recordType, recordId))
                    .build());
                logger.debug("Deleted record {}/{}", recordType, recordId);
                return null;
            } catch (DynamoDbException e) {
                logger.error("Failed to delete record {}/{}", recordType, recordId, e);
                throw new RepositoryException("Failed to delete record", e);
            }
        });
    }

    @Override
    public Optional<EntityRecord> findOverlapping(String recordType, String scopeField, Object scopeValue,
                                                  String timeField, TimeRange range) {
        return performanceTracker.trackQuery("findOverlappingRecord", RecurringKeyFactory.PARENT_INDEX, () -> {
            try {
                QueryRequest page = QueryRequest.builder()
                    .tableName(TABLE_NAME)
                    .indexName(RecurringKeyFactory.PARENT_INDEX)
                    .keyConditionExpression("gsi1pk = :typeKey AND gsi1sk < :endKey")
                    .filterExpression("rangeEnd > :start AND timeField = :timeField AND #fields.#scope = :scopeValue")
                    .expressionAttributeNames(Map.of("#fields", RecordItemMapper.ATTR_FIELDS, "#scope", scopeField))
                    .expressionAttributeValues(Map.of(
                        ":typeKey", AttributeValue.builder().s(RecurringKeyFactory.getRecordTypeKey(recordType)).build(),
                        ":endKey", AttributeValue.builder().s(RecurringKeyFactory.getTimeSortKey(range.getEnd())).build(),
                        ":start", AttributeValue.builder().n(String.valueOf(range.getStart().toEpochMilli())).build(),
                        ":timeField", AttributeValue.builder().s(timeField).build(),
                        ":scopeValue", FieldValueMapper.toAttributeValue(scopeValue)
                    ))
                    .scanIndexForward(false)
                    .build();

                while (true) {
                    QueryResponse response = dynamoDbClient.query(page);
                    if (response.hasItems() && !response.items().isEmpty()) {
                        return Optional.of(RecordItemMapper.fromItem(response.items().get(0)));
                    }
                    if (!response.hasLastEvaluatedKey() || response.lastEvaluatedKey().isEmpty()) {
                        return Optional.empty();
                    }
                    page = page.toBuilder().exclusiveStartKey(response.lastEvaluatedKey()).build();
                }
            } catch (DynamoDbException e) {
                logger.error("Failed overlap query for {} where {} = {}", recordType, scopeField, scopeValue, e);
                throw new RepositoryException("Failed to query overlapping records", e);
            }
        });
    }

    private void applyUpdate(String operation, String recordType, String recordId, Update update) {
        performanceTracker.trackQuery(operation, TABLE_NAME, () -> {
            try {
                UpdateItemRequest.Builder request = UpdateItemRequest.builder()
                    .tableName(update.tableName())
                    .key(update.key())
                    .updateExpression(update.updateExpression())
                    .conditionExpression(update.conditionExpression())
                    .expressionAttributeValues(update.expressionAttributeValues());
                if (update.hasExpressionAttributeNames()) {
                    request.expressionAttributeNames(update.expressionAttributeNames());
                }
                dynamoDbClient.updateItem(request.build());
                return null;
            } catch (ConditionalCheckFailedException e) {
                throw new ResourceNotFoundException("Record not found: " + recordType + "/" + recordId);
            } catch (DynamoDbException e) {
                logger.error("Failed {} on record {}/{}", operation, recordType, recordId, e);
                throw new RepositoryException("Failed to update record", e);
            }
        });
    }
}
