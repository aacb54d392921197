package com.bbthechange.recurring.repository.impl;

import com.bbthechange.recurring.exception.RepositoryException;
import com.bbthechange.recurring.exception.TransactionFailedException;
import com.bbthechange.recurring.exception.VersionConflictException;
import com.bbthechange.recurring.model.Series;
import com.bbthechange.recurring.model.SeriesGroup;
import com.bbthechange.recurring.model.SeriesInstance;
import com.bbthechange.recurring.model.TimeRange;
import com.bbthechange.recurring.repository.SeriesTransactionRepository;
import com.bbthechange.recurring.store.impl.RecordItemMapper;
import com.bbthechange.recurring.util.QueryPerformanceTracker;
import com.bbthechange.recurring.util.RecurringKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.CancellationReason;
import software.amazon.awssdk.services.dynamodb.model.Delete;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.Put;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItem;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItemsRequest;
import software.amazon.awssdk.services.dynamodb.model.TransactionCanceledException;
import software.amazon.awssdk.services.dynamodb.model.Update;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Implementation of SeriesTransactionRepository on DynamoDB TransactWriteItems.
 *
 * A transaction holds at most {@value #MAX_TRANSACTION_ITEMS} actions. Larger operations are written as
 * ordered chunks, and the order is chosen so that repeating the operation completes a partially applied run:
 * <ul>
 *   <li>template updates, schedule replacements and deletes write the series item in the last chunk;</li>
 *   <li>a split writes both series in the first chunk, and the remaining moves are finished
 *       through {@link #repointInstances}.</li>
 * </ul>
 */
@Repository
public class SeriesTransactionRepositoryImpl implements SeriesTransactionRepository {

    private static final Logger logger = LoggerFactory.getLogger(SeriesTransactionRepositoryImpl.class);

    private static final String TABLE_NAME = "RecurringTable";
    static final int MAX_TRANSACTION_ITEMS = 100;

    private final DynamoDbClient dynamoDbClient;
    private final QueryPerformanceTracker performanceTracker;

    private final TableSchema<SeriesGroup> groupSchema;
    private final TableSchema<Series> seriesSchema;
    private final TableSchema<SeriesInstance> instanceSchema;

    @Autowired
    public SeriesTransactionRepositoryImpl(DynamoDbClient dynamoDbClient, QueryPerformanceTracker performanceTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.performanceTracker = performanceTracker;
        this.groupSchema = TableSchema.fromBean(SeriesGroup.class);
        this.seriesSchema = TableSchema.fromBean(Series.class);
        this.instanceSchema = TableSchema.fromBean(SeriesInstance.class);
    }

    @Override
    public void createSeries(SeriesGroup group, Series series) {
        List<TransactWriteItem> items = new ArrayList<>();
        items.add(newItem(groupSchema.itemToMap(group, true)));
        items.add(newItem(seriesSchema.itemToMap(series, true)));

        execute("createSeries", items);
        logger.info("Created series group {} with series {}", group.getGroupId(), series.getSeriesId());
    }

    @Override
    public void splitSeries(Series closedOriginal, SeriesGroup newGroup, Series newSeries,
                            List<SeriesInstance> instancesToRepoint) {
        List<TransactWriteItem> items = new ArrayList<>();
        if (newGroup != null) {
            items.add(newItem(groupSchema.itemToMap(newGroup, true)));
        }
        items.add(versionedSeriesPut(closedOriginal));
        items.add(newItem(seriesSchema.itemToMap(newSeries, true)));

        long now = System.currentTimeMillis();
        for (SeriesInstance instance : instancesToRepoint) {
            items.add(repoint(instance, newSeries.getSeriesId(), now));
        }

        execute("splitSeries", items);
        logger.info("Split series {} into {} at {}, re-pointed {} instances",
            closedOriginal.getSeriesId(), newSeries.getSeriesId(), newSeries.getEffectiveFrom(), instancesToRepoint.size());
    }

    @Override
    public void repointInstances(String seriesId, List<SeriesInstance> instances) {
        if (instances.isEmpty()) {
            return;
        }
        long now = System.currentTimeMillis();
        List<TransactWriteItem> items = new ArrayList<>();
        for (SeriesInstance instance : instances) {
            items.add(repoint(instance, seriesId, now));
        }

        execute("repointInstances", items);
        logger.info("Re-pointed {} instances onto series {}", instances.size(), seriesId);
    }

    @Override
    public void updateTemplate(Series series, Map<String, Object> changedFields, List<SeriesInstance> instancesToUpdate) {
        List<TransactWriteItem> items = new ArrayList<>();
        if (!changedFields.isEmpty()) {
            for (SeriesInstance instance : instancesToUpdate) {
                items.add(TransactWriteItem.builder()
                    .update(RecordItemMapper.fieldsUpdate(TABLE_NAME, instance.getRecordType(), instance.getRecordId(), changedFields))
                    .build());
            }
        }
        items.add(versionedSeriesPut(series));

        execute("updateTemplate", items);
        logger.info("Updated template of series {} ({} records updated)",
            series.getSeriesId(), changedFields.isEmpty() ? 0 : instancesToUpdate.size());
    }

    @Override
    public void replaceSchedule(Series series, List<SeriesInstance> instancesToDelete) {
        List<TransactWriteItem> items = new ArrayList<>();
        for (SeriesInstance instance : instancesToDelete) {
            if (instance.hasRecord()) {
                items.add(recordDelete(instance));
            }
            items.add(itemDelete(instance.getPk(), instance.getSk()));
        }
        // Series last: if an early chunk fails the schedule is still the old one and the operation can be repeated
        items.add(versionedSeriesPut(series));

        execute("replaceSchedule", items);
        logger.info("Replaced schedule of series {}, deleted {} instances", series.getSeriesId(), instancesToDelete.size());
    }

    @Override
    public void deleteSeries(Series series, List<SeriesInstance> instances, String groupIdToDelete) {
        List<TransactWriteItem> items = new ArrayList<>();
        for (SeriesInstance instance : instances) {
            if (instance.hasRecord()) {
                items.add(recordDelete(instance));
            }
            items.add(itemDelete(instance.getPk(), instance.getSk()));
        }
        items.add(itemDelete(series.getPk(), series.getSk()));
        if (groupIdToDelete != null) {
            items.add(itemDelete(RecurringKeyFactory.getGroupPk(groupIdToDelete), RecurringKeyFactory.getMetadataSk()));
        }

        execute("deleteSeries", items);
        logger.info("Deleted series {} with {} instances{}", series.getSeriesId(), instances.size(),
            groupIdToDelete != null ? " and group " + groupIdToDelete : "");
    }

    @Override
    public void deleteGroup(String groupId) {
        execute("deleteGroup", List.of(
            itemDelete(RecurringKeyFactory.getGroupPk(groupId), RecurringKeyFactory.getMetadataSk())));
        logger.info("Deleted series group {}", groupId);
    }

    @Override
    public void cancelInstance(SeriesInstance cancelledInstance, String recordType, String recordId) {
        List<TransactWriteItem> items = new ArrayList<>();
        items.add(versionedInstancePut(cancelledInstance));
        items.add(TransactWriteItem.builder()
            .delete(RecordItemMapper.delete(TABLE_NAME, recordType, recordId))
            .build());

        execute("cancelInstance", items);
        logger.info("Cancelled instance {} and deleted record {}/{}", cancelledInstance.getInstanceId(), recordType, recordId);
    }

    @Override
    public void rescheduleInstance(SeriesInstance rescheduledInstance, TimeRange newRange) {
        List<TransactWriteItem> items = new ArrayList<>();
        items.add(versionedInstancePut(rescheduledInstance));
        items.add(TransactWriteItem.builder()
            .update(RecordItemMapper.timeRangeUpdate(TABLE_NAME, rescheduledInstance.getRecordType(),
                rescheduledInstance.getRecordId(), newRange))
            .build());

        execute("rescheduleInstance", items);
        logger.info("Rescheduled instance {} to {}", rescheduledInstance.getInstanceId(), newRange);
    }

    private void execute(String operation, List<TransactWriteItem> items) {
        performanceTracker.trackQuery(operation, TABLE_NAME, () -> {
            int chunks = (items.size() + MAX_TRANSACTION_ITEMS - 1) / MAX_TRANSACTION_ITEMS;
            for (int chunk = 0; chunk < chunks; chunk++) {
                List<TransactWriteItem> slice = items.subList(
                    chunk * MAX_TRANSACTION_ITEMS, Math.min(items.size(), (chunk + 1) * MAX_TRANSACTION_ITEMS));
                try {
                    dynamoDbClient.transactWriteItems(TransactWriteItemsRequest.builder()
                        .transactItems(slice)
                        .build());
                } catch (TransactionCanceledException e) {
                    logger.warn("Transaction {} cancelled (chunk {}/{}): {}", operation, chunk + 1, chunks,
                        e.cancellationReasons());
                    if (hasConditionFailure(e)) {
                        throw new VersionConflictException("Concurrent modification during " + operation, e);
                    }
                    throw new TransactionFailedException("Transaction cancelled during " + operation, e);
                } catch (DynamoDbException e) {
                    logger.error("DynamoDB error during {}", operation, e);
                    throw new RepositoryException("Failed to complete " + operation + " due to DynamoDB error", e);
                }
            }
            if (chunks > 1) {
                logger.info("{} written as {} transactions ({} actions)", operation, chunks, items.size());
            }
            return null;
        });
    }

    private static boolean hasConditionFailure(TransactionCanceledException e) {
        if (!e.hasCancellationReasons()) {
            return false;
        }
        for (CancellationReason reason : e.cancellationReasons()) {
            if ("ConditionalCheckFailed".equals(reason.code())) {
                return true;
            }
        }
        return false;
    }

    private TransactWriteItem newItem(Map<String, AttributeValue> item) {
        return TransactWriteItem.builder()
            .put(Put.builder()
                .tableName(TABLE_NAME)
                .item(item)
                .conditionExpression("attribute_not_exists(pk)")
                .build())
            .build();
    }

    private TransactWriteItem versionedSeriesPut(Series series) {
        Long expectedVersion = series.getVersion();
        series.setVersion(expectedVersion + 1);
        series.touch();
        return versionedPut(seriesSchema.itemToMap(series, true), expectedVersion);
    }

    private TransactWriteItem versionedInstancePut(SeriesInstance instance) {
        Long expectedVersion = instance.getVersion();
        instance.setVersion(expectedVersion + 1);
        instance.touch();
        return versionedPut(instanceSchema.itemToMap(instance, true), expectedVersion);
    }

    private TransactWriteItem versionedPut(Map<String, AttributeValue> item, Long expectedVersion) {
        return TransactWriteItem.builder()
            .put(Put.builder()
                .tableName(TABLE_NAME)
                .item(item)
                .conditionExpression("#ver = :expectedVersion")
                .expressionAttributeNames(Map.of("#ver", "version"))
                .expressionAttributeValues(Map.of(
                    ":expectedVersion", AttributeValue.builder().n(String.valueOf(expectedVersion)).build()))
                .build())
            .build();
    }

    private TransactWriteItem repoint(SeriesInstance instance, String newSeriesId, long now) {
        return TransactWriteItem.builder()
            .update(Update.builder()
                .tableName(TABLE_NAME)
                .key(key(instance.getPk(), instance.getSk()))
                .updateExpression("SET seriesId = :sid, gsi1pk = :parent, updatedAt = :updated, #ver = #ver + :inc")
                .conditionExpression("#ver = :expectedVersion")
                .expressionAttributeNames(Map.of("#ver", "version"))
                .expressionAttributeValues(Map.of(
                    ":sid", AttributeValue.builder().s(newSeriesId).build(),
                    ":parent", AttributeValue.builder().s(RecurringKeyFactory.getSeriesPk(newSeriesId)).build(),
                    ":updated", AttributeValue.builder().n(String.valueOf(now)).build(),
                    ":inc", AttributeValue.builder().n("1").build(),
                    ":expectedVersion", AttributeValue.builder().n(String.valueOf(instance.getVersion())).build()
                ))
                .build())
            .build();
    }

    private TransactWriteItem recordDelete(SeriesInstance instance) {
        return TransactWriteItem.builder()
            .delete(RecordItemMapper.delete(TABLE_NAME, instance.getRecordType(), instance.getRecordId()))
            .build();
    }

    private TransactWriteItem itemDelete(String pk, String sk) {
        return TransactWriteItem.builder()
            .delete(Delete.builder()
                .tableName(TABLE_NAME)
                .key(key(pk, sk))
                .build())
            .build();
    }

    private static Map<String, AttributeValue> key(String pk, String sk) {
        return Map.of(
            "pk", AttributeValue.builder().s(pk).build(),
            "sk", AttributeValue.builder().s(sk).build()
        );
    }
}
