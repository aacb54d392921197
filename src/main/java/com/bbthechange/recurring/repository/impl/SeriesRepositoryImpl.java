package com.bbthechange.recurring.repository.impl;

import com.bbthechange.recurring.exception.RepositoryException;
import com.bbthechange.recurring.model.Series;
import com.bbthechange.recurring.model.SeriesStatus;
import com.bbthechange.recurring.repository.SeriesRepository;
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
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * DynamoDB implementation of SeriesRepository.
 * Series versions of a group are found through the ParentIndex under GROUP#{groupId}.
 */
@Repository
public class SeriesRepositoryImpl implements SeriesRepository {

    private static final Logger logger = LoggerFactory.getLogger(SeriesRepositoryImpl.class);
    private static final String TABLE_NAME = "RecurringTable";

    private final DynamoDbClient dynamoDbClient;
    private final QueryPerformanceTracker performanceTracker;
    private final TableSchema<Series> seriesSchema;

    @Autowired
    public SeriesRepositoryImpl(DynamoDbClient dynamoDbClient, QueryPerformanceTracker performanceTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.performanceTracker = performanceTracker;
        this.seriesSchema = TableSchema.fromBean(Series.class);
    }

    @Override
    public Optional<Series> findById(String seriesId) {
        return performanceTracker.trackQuery("findSeriesById", TABLE_NAME, () -> {
            try {
                GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(seriesKey(seriesId))
                    .consistentRead(true)
                    .build());
                if (!response.hasItem() || response.item().isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(seriesSchema.mapToItem(response.item()));
            } catch (DynamoDbException e) {
                logger.error("Failed to find series {}", seriesId, e);
                throw new RepositoryException("Failed to retrieve series", e);
            }
        });
    }

    @Override
    public List<Series> findByGroupId(String groupId) {
        return performanceTracker.trackQuery("findSeriesByGroupId", RecurringKeyFactory.PARENT_INDEX, () -> {
            try {
                QueryRequest request = QueryRequest.builder()
                    .tableName(TABLE_NAME)
                    .indexName(RecurringKeyFactory.PARENT_INDEX)
                    .keyConditionExpression("gsi1pk = :groupKey AND begins_with(gsi1sk, :versionPrefix)")
                    .expressionAttributeValues(Map.of(
                        ":groupKey", AttributeValue.builder().s(RecurringKeyFactory.getGroupPk(groupId)).build(),
                        ":versionPrefix", AttributeValue.builder().s(RecurringKeyFactory.getVersionPrefix()).build()
                    ))
                    .scanIndexForward(true)
                    .build();

                return QueryPages.queryAll(dynamoDbClient, request).stream()
                    .map(seriesSchema::mapToItem)
                    .sorted(Comparator.comparing(Series::getVersionNumber, Comparator.nullsFirst(Comparator.naturalOrder())))
                    .collect(Collectors.toList());
            } catch (DynamoDbException e) {
                logger.error("Failed to query series for group {}", groupId, e);
                throw new RepositoryException("Failed to query series by group ID", e);
            }
        });
    }

    @Override
    public void updateStatus(String seriesId, SeriesStatus status) {
        performanceTracker.trackQuery("updateSeriesStatus", TABLE_NAME, () -> {
            try {
                dynamoDbClient.updateItem(UpdateItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(seriesKey(seriesId))
                    .updateExpression("SET #status = :status, updatedAt = :updated, #ver = #ver + :inc")
                    .conditionExpression("attribute_exists(pk)")
                    .expressionAttributeNames(Map.of("#status", "status", "#ver", "version"))
                    .expressionAttributeValues(Map.of(
                        ":status", AttributeValue.builder().s(status.name()).build(),
                        ":updated", AttributeValue.builder().n(String.valueOf(System.currentTimeMillis())).build(),
                        ":inc", AttributeValue.builder().n("1").build()
                    ))
                    .build());
                logger.info("Series {} status set to {}", seriesId, status);
                return null;
            } catch (ConditionalCheckFailedException e) {
                logger.warn("Series {} disappeared before its status could be set to {}", seriesId, status);
                return null;
            } catch (DynamoDbException e) {
                logger.error("Failed to update status of series {}", seriesId, e);
                throw new RepositoryException("Failed to update series status", e);
            }
        });
    }

    @Override
    public boolean advanceExpandedUntil(String seriesId, Instant expandedUntil) {
        return performanceTracker.trackQuery("advanceExpandedUntil", TABLE_NAME, () -> {
            try {
                dynamoDbClient.updateItem(UpdateItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(seriesKey(seriesId))
                    .updateExpression("SET expandedUntil = :until, updatedAt = :updated, #ver = #ver + :inc")
                    .conditionExpression("attribute_exists(pk) AND (attribute_not_exists(expandedUntil) "
                        + "OR attribute_type(expandedUntil, :nullType) OR expandedUntil < :until)")
                    .expressionAttributeNames(Map.of("#ver", "version"))
                    .expressionAttributeValues(Map.of(
                        ":until", AttributeValue.builder().n(String.valueOf(expandedUntil.toEpochMilli())).build(),
                        ":updated", AttributeValue.builder().n(String.valueOf(System.currentTimeMillis())).build(),
                        ":inc", AttributeValue.builder().n("1").build(),
                        ":nullType", AttributeValue.builder().s("NULL").build()
                    ))
                    .build());
                logger.debug("Series {} expanded until {}", seriesId, expandedUntil);
                return true;
            } catch (ConditionalCheckFailedException e) {
                // Mark is already at or beyond the requested point
                return false;
            } catch (DynamoDbException e) {
                logger.error("Failed to advance expandedUntil for series {}", seriesId, e);
                throw new RepositoryException("Failed to advance series expansion mark", e);
            }
        });
    }

    private static Map<String, AttributeValue> seriesKey(String seriesId) {
        return Map.of(
            "pk", AttributeValue.builder().s(RecurringKeyFactory.getSeriesPk(seriesId)).build(),
            "sk", AttributeValue.builder().s(RecurringKeyFactory.getMetadataSk()).build()
        );
    }
}
