package com.bbthechange.recurring.repository.impl;

import com.bbthechange.recurring.exception.RepositoryException;
import com.bbthechange.recurring.exception.VersionConflictException;
import com.bbthechange.recurring.model.SeriesInstance;
import com.bbthechange.recurring.repository.SeriesInstanceRepository;
import com.bbthechange.recurring.util.QueryPages;
import com.bbthechange.recurring.util.QueryPerformanceTracker;
import com.bbthechange.recurring.util.RecurringKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * DynamoDB implementation of SeriesInstanceRepository.
 * Instances of a series are read through the ParentIndex; the instance linked to a record through the RecordIndex.
 */
@Repository
public class SeriesInstanceRepositoryImpl implements SeriesInstanceRepository {

    private static final Logger logger = LoggerFactory.getLogger(SeriesInstanceRepositoryImpl.class);
    private static final String TABLE_NAME = "RecurringTable";

    private final DynamoDbClient dynamoDbClient;
    private final QueryPerformanceTracker performanceTracker;
    private final TableSchema<SeriesInstance> instanceSchema;

    @Autowired
    public SeriesInstanceRepositoryImpl(DynamoDbClient dynamoDbClient, QueryPerformanceTracker performanceTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.performanceTracker = performanceTracker;
        this.instanceSchema = TableSchema.fromBean(SeriesInstance.class);
    }

    @Override
    public Optional<SeriesInstance> findById(String instanceId) {
        return performanceTracker.trackQuery("findInstanceById", TABLE_NAME, () -> {
            try {
                GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(Map.of(
                        "pk", AttributeValue.builder().s(RecurringKeyFactory.getInstancePk(instanceId)).build(),
                        "sk", AttributeValue.builder().s(RecurringKeyFactory.getMetadataSk()).build()
                    ))
                    .consistentRead(true)
                    .build());
                if (!response.hasItem() || response.item().isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(instanceSchema.mapToItem(response.item()));
            } catch (DynamoDbException e) {
                logger.error("Failed to find instance {}", instanceId, e);
                throw new RepositoryException("Failed to retrieve series instance", e);
            }
        });
    }

    @Override
    public List<SeriesInstance> findBySeriesId(String seriesId) {
        return performanceTracker.trackQuery("findInstancesBySeriesId", RecurringKeyFactory.PARENT_INDEX, () -> {
            try {
                QueryRequest request = QueryRequest.builder()
                    .tableName(TABLE_NAME)
                    .indexName(RecurringKeyFactory.PARENT_INDEX)
                    .keyConditionExpression("gsi1pk = :seriesKey AND begins_with(gsi1sk, :occurrencePrefix)")
                    .expressionAttributeValues(Map.of(
                        ":seriesKey", AttributeValue.builder().s(RecurringKeyFactory.getSeriesPk(seriesId)).build(),
                        ":occurrencePrefix", AttributeValue.builder().s(RecurringKeyFactory.getOccurrencePrefix()).build()
                    ))
                    .scanIndexForward(true)
                    .build();

                return QueryPages.queryAll(dynamoDbClient, request).stream()
                    .map(instanceSchema::mapToItem)
                    .sorted(Comparator.comparing(SeriesInstance::getOccurrenceDate))
                    .collect(Collectors.toList());
            } catch (DynamoDbException e) {
                logger.error("Failed to query instances for series {}", seriesId, e);
                throw new RepositoryException("Failed to query instances by series ID", e);
            }
        });
    }

    @Override
    public Optional<SeriesInstance> findByRecord(String recordType, String recordId) {
        return performanceTracker.trackQuery("findInstanceByRecord", RecurringKeyFactory.RECORD_INDEX, () -> {
            try {
                QueryRequest request = QueryRequest.builder()
                    .tableName(TABLE_NAME)
                    .indexName(RecurringKeyFactory.RECORD_INDEX)
                    .keyConditionExpression("gsi2pk = :recordKey")
                    .expressionAttributeValues(Map.of(
                        ":recordKey", AttributeValue.builder().s(RecurringKeyFactory.getRecordPk(recordType, recordId)).build()
                    ))
                    .limit(1)
                    .build();

                List<Map<String, AttributeValue>> items = dynamoDbClient.query(request).items();
                if (items == null || items.isEmpty()) {
                    return Optional.empty();
                }
                // The index is eventually consistent; re-read the base item for the current state
                SeriesInstance indexed = instanceSchema.mapToItem(items.get(0));
                return findById(indexed.getInstanceId())
                    .filter(instance -> recordId.equals(instance.getRecordId()));
            } catch (DynamoDbException e) {
                logger.error("Failed to find instance for record {}/{}", recordType, recordId, e);
                throw new RepositoryException("Failed to find instance by record", e);
            }
        });
    }

    @Override
    public boolean putIfAbsent(SeriesInstance instance) {
        return performanceTracker.trackQuery("putInstanceIfAbsent", TABLE_NAME, () -> {
            try {
                dynamoDbClient.putItem(PutItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .item(instanceSchema.itemToMap(instance, true))
                    .conditionExpression("attribute_not_exists(pk)")
                    .build());
                return true;
            } catch (ConditionalCheckFailedException e) {
                logger.debug("Instance for series {} on {} already exists",
                    instance.getSeriesId(), instance.getOccurrenceDate());
                return false;
            } catch (DynamoDbException e) {
                logger.error("Failed to insert instance for series {} on {}",
                    instance.getSeriesId(), instance.getOccurrenceDate(), e);
                throw new RepositoryException("Failed to insert series instance", e);
            }
        });
    }

    @Override
    public SeriesInstance update(SeriesInstance instance) {
        return performanceTracker.trackQuery("updateInstance", TABLE_NAME, () -> {
            Long expectedVersion = instance.getVersion();
            try {
                instance.setVersion(expectedVersion + 1);
                instance.touch();
                dynamoDbClient.putItem(PutItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .item(instanceSchema.itemToMap(instance, true))
                    .conditionExpression("#ver = :expectedVersion")
                    .expressionAttributeNames(Map.of("#ver", "version"))
                    .expressionAttributeValues(Map.of(
                        ":expectedVersion", AttributeValue.builder().n(String.valueOf(expectedVersion)).build()
                    ))
                    .build());
                return instance;
            } catch (ConditionalCheckFailedException e) {
                instance.setVersion(expectedVersion);
                throw new VersionConflictException("Instance " + instance.getInstanceId() + " was modified concurrently", e);
            } catch (DynamoDbException e) {
                instance.setVersion(expectedVersion);
                logger.error("Failed to update instance {}", instance.getInstanceId(), e);
                throw new RepositoryException("Failed to update series instance", e);
            }
        });
    }
}
