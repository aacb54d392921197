package com.bbthechange.recurring.repository.impl;

import com.bbthechange.recurring.exception.RepositoryException;
import com.bbthechange.recurring.exception.VersionConflictException;
import com.bbthechange.recurring.model.SeriesGroup;
import com.bbthechange.recurring.repository.SeriesGroupRepository;
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

import java.util.Map;
import java.util.Optional;

/**
 * DynamoDB implementation of SeriesGroupRepository.
 */
@Repository
public class SeriesGroupRepositoryImpl implements SeriesGroupRepository {

    private static final Logger logger = LoggerFactory.getLogger(SeriesGroupRepositoryImpl.class);
    private static final String TABLE_NAME = "RecurringTable";

    private final DynamoDbClient dynamoDbClient;
    private final QueryPerformanceTracker performanceTracker;
    private final TableSchema<SeriesGroup> groupSchema;

    @Autowired
    public SeriesGroupRepositoryImpl(DynamoDbClient dynamoDbClient, QueryPerformanceTracker performanceTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.performanceTracker = performanceTracker;
        this.groupSchema = TableSchema.fromBean(SeriesGroup.class);
    }

    @Override
    public Optional<SeriesGroup> findById(String groupId) {
        return performanceTracker.trackQuery("findSeriesGroupById", TABLE_NAME, () -> {
            try {
                GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(Map.of(
                        "pk", AttributeValue.builder().s(RecurringKeyFactory.getGroupPk(groupId)).build(),
                        "sk", AttributeValue.builder().s(RecurringKeyFactory.getMetadataSk()).build()
                    ))
                    .consistentRead(true)
                    .build());
                if (!response.hasItem() || response.item().isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(groupSchema.mapToItem(response.item()));
            } catch (DynamoDbException e) {
                logger.error("Failed to find series group {}", groupId, e);
                throw new RepositoryException("Failed to retrieve series group", e);
            }
        });
    }

    @Override
    public SeriesGroup update(SeriesGroup group) {
        return performanceTracker.trackQuery("updateSeriesGroup", TABLE_NAME, () -> {
            Long expectedVersion = group.getVersion();
            try {
                group.setVersion(expectedVersion + 1);
                group.touch();
                dynamoDbClient.putItem(PutItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .item(groupSchema.itemToMap(group, true))
                    .conditionExpression("#ver = :expectedVersion")
                    .expressionAttributeNames(Map.of("#ver", "version"))
                    .expressionAttributeValues(Map.of(
                        ":expectedVersion", AttributeValue.builder().n(String.valueOf(expectedVersion)).build()
                    ))
                    .build());
                logger.debug("Updated series group {} to version {}", group.getGroupId(), group.getVersion());
                return group;
            } catch (ConditionalCheckFailedException e) {
                group.setVersion(expectedVersion);
                throw new VersionConflictException("Series group " + group.getGroupId() + " was modified concurrently", e);
            } catch (DynamoDbException e) {
                group.setVersion(expectedVersion);
                logger.error("Failed to update series group {}", group.getGroupId(), e);
                throw new RepositoryException("Failed to update series group", e);
            }
        });
    }
}
