package com.bbthechange.recurring.repository.impl;

import com.bbthechange.recurring.exception.RepositoryException;
import com.bbthechange.recurring.exception.TransactionFailedException;
import com.bbthechange.recurring.exception.VersionConflictException;
import com.bbthechange.recurring.model.ExceptionType;
import com.bbthechange.recurring.model.Series;
import com.bbthechange.recurring.model.SeriesGroup;
import com.bbthechange.recurring.model.SeriesInstance;
import com.bbthechange.recurring.model.TimeRange;
import com.bbthechange.recurring.util.QueryPerformanceTracker;
import com.bbthechange.recurring.util.RecurringKeyFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.CancellationReason;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItem;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItemsRequest;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItemsResponse;
import software.amazon.awssdk.services.dynamodb.model.TransactionCanceledException;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

import static com.bbthechange.recurring.testutil.SeriesInstanceTestBuilder.anInstance;
import static com.bbthechange.recurring.testutil.SeriesTestBuilder.aSeries;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SeriesTransactionRepositoryImplTest {

    @Mock
    private DynamoDbClient dynamoDbClient;

    @Mock
    private QueryPerformanceTracker performanceTracker;

    private SeriesTransactionRepositoryImpl repository;

    @BeforeEach
    void setUp() {
        lenient().when(performanceTracker.trackQuery(anyString(), anyString(), any()))
            .thenAnswer(invocation -> ((Supplier<?>) invocation.getArgument(2)).get());
        repository = new SeriesTransactionRepositoryImpl(dynamoDbClient, performanceTracker);
    }

    @Test
    void createSeries_WritesGroupAndSeriesWithNotExistsConditions() {
        // Given
        SeriesGroup group = new SeriesGroup("Standup", null, null, "user-1");
        Series series = aSeries().inGroup(group.getGroupId()).build();
        when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
            .thenReturn(TransactWriteItemsResponse.builder().build());

        // When
        repository.createSeries(group, series);

        // Then
        List<TransactWriteItem> items = captureSingleRequest().transactItems();
        assertThat(items).hasSize(2);
        assertThat(items).allSatisfy(item ->
            assertThat(item.put().conditionExpression()).isEqualTo("attribute_not_exists(pk)"));
        assertThat(items.get(0).put().item().get("pk").s()).isEqualTo(RecurringKeyFactory.getGroupPk(group.getGroupId()));
        assertThat(items.get(1).put().item().get("pk").s()).isEqualTo(RecurringKeyFactory.getSeriesPk(series.getSeriesId()));
    }

    @Test
    void splitSeries_ClosesOriginalCreatesNewAndRepointsInstances() {
        // Given
        String groupId = UUID.randomUUID().toString();
        Series original = aSeries().inGroup(groupId).build();
        original.setEffectiveUntil(LocalDate.of(2025, 3, 30));
        Series newSeries = aSeries().inGroup(groupId).withVersionNumber(2)
            .withEffectiveFrom(LocalDate.of(2025, 3, 31)).build();
        List<SeriesInstance> toRepoint = List.of(
            anInstance().forSeries(original.getSeriesId()).on(LocalDate.of(2025, 3, 31)).build(),
            anInstance().forSeries(original.getSeriesId()).on(LocalDate.of(2025, 4, 2)).build());
        when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
            .thenReturn(TransactWriteItemsResponse.builder().build());

        // When
        repository.splitSeries(original, null, newSeries, toRepoint);

        // Then
        List<TransactWriteItem> items = captureSingleRequest().transactItems();
        assertThat(items).hasSize(4);
        assertThat(items.get(0).put().conditionExpression()).isEqualTo("#ver = :expectedVersion");
        assertThat(items.get(1).put().conditionExpression()).isEqualTo("attribute_not_exists(pk)");
        assertThat(items.get(2).update().updateExpression()).startsWith("SET seriesId = :sid, gsi1pk = :parent");
        assertThat(items.get(2).update().expressionAttributeValues().get(":parent").s())
            .isEqualTo(RecurringKeyFactory.getSeriesPk(newSeries.getSeriesId()));
        assertThat(items.get(3).update().key().get("pk").s()).isEqualTo(toRepoint.get(1).getPk());
    }

    @Test
    void splitSeries_WhenLaterChunkFails_KeepsBothSeriesInFirstChunkAndThrowsConflict() {
        // Given
        String groupId = UUID.randomUUID().toString();
        Series original = aSeries().inGroup(groupId).build();
        original.setEffectiveUntil(LocalDate.of(2025, 3, 9));
        Series newSeries = aSeries().inGroup(groupId).withVersionNumber(2)
            .withEffectiveFrom(LocalDate.of(2025, 3, 10)).build();
        List<SeriesInstance> toRepoint = new ArrayList<>();
        LocalDate date = LocalDate.of(2025, 3, 10);
        for (int i = 0; i < 150; i++) {
            toRepoint.add(anInstance().forSeries(original.getSeriesId()).on(date.plusDays(i)).build());
        }
        when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
            .thenReturn(TransactWriteItemsResponse.builder().build())
            .thenThrow(cancelled("None", "ConditionalCheckFailed"));

        // When / Then
        assertThatThrownBy(() -> repository.splitSeries(original, null, newSeries, toRepoint))
            .isInstanceOf(VersionConflictException.class);

        ArgumentCaptor<TransactWriteItemsRequest> captor = ArgumentCaptor.forClass(TransactWriteItemsRequest.class);
        verify(dynamoDbClient, times(2)).transactWriteItems(captor.capture());
        List<TransactWriteItem> first = captor.getAllValues().get(0).transactItems();
        assertThat(first.get(0).put().item().get("pk").s()).isEqualTo(original.getPk());
        assertThat(first.get(1).put().item().get("pk").s()).isEqualTo(newSeries.getPk());
    }

    @Test
    void repointInstances_MovesEachInstanceUnderItsVersion() {
        // Given
        String seriesId = UUID.randomUUID().toString();
        SeriesInstance stranded = anInstance().on(LocalDate.of(2025, 3, 12)).build();
        stranded.setVersion(2L);
        when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
            .thenReturn(TransactWriteItemsResponse.builder().build());

        // When
        repository.repointInstances(seriesId, List.of(stranded));

        // Then
        List<TransactWriteItem> items = captureSingleRequest().transactItems();
        assertThat(items).hasSize(1);
        assertThat(items.get(0).update().key().get("pk").s()).isEqualTo(stranded.getPk());
        assertThat(items.get(0).update().expressionAttributeValues().get(":sid").s()).isEqualTo(seriesId);
        assertThat(items.get(0).update().expressionAttributeValues().get(":expectedVersion").n()).isEqualTo("2");
    }

    @Test
    void repointInstances_WithNothingToMove_WritesNothing() {
        // When
        repository.repointInstances(UUID.randomUUID().toString(), List.of());

        // Then
        verifyNoInteractions(dynamoDbClient);
    }

    @Test
    void updateTemplate_IncrementsVersionAndConditionsOnPreviousOne() {
        // Given
        Series series = aSeries().build();
        series.setVersion(3L);
        SeriesInstance linked = anInstance().forSeries(series.getSeriesId()).build();
        when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
            .thenReturn(TransactWriteItemsResponse.builder().build());

        // When
        repository.updateTemplate(series, Map.of("title", "Retro"), List.of(linked));

        // Then
        assertThat(series.getVersion()).isEqualTo(4L);
        List<TransactWriteItem> items = captureSingleRequest().transactItems();
        assertThat(items).hasSize(2);
        assertThat(items.get(0).update().key().get("pk").s())
            .isEqualTo(RecurringKeyFactory.getRecordPk("booking", linked.getRecordId()));
        assertThat(items.get(1).put().expressionAttributeValues().get(":expectedVersion").n()).isEqualTo("3");
        assertThat(items.get(1).put().item().get("version").n()).isEqualTo("4");
    }

    @Test
    void updateTemplate_WithNoChangedFields_OnlyWritesSeries() {
        // Given
        Series series = aSeries().build();
        SeriesInstance linked = anInstance().forSeries(series.getSeriesId()).build();
        when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
            .thenReturn(TransactWriteItemsResponse.builder().build());

        // When
        repository.updateTemplate(series, Map.of(), List.of(linked));

        // Then
        assertThat(captureSingleRequest().transactItems()).hasSize(1);
    }

    @Test
    void replaceSchedule_PutsSeriesLast() {
        // Given
        Series series = aSeries().build();
        List<SeriesInstance> toDelete = List.of(
            anInstance().forSeries(series.getSeriesId()).build(),
            anInstance().forSeries(series.getSeriesId()).on(LocalDate.of(2025, 3, 5)).withoutRecord().build());
        when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
            .thenReturn(TransactWriteItemsResponse.builder().build());

        // When
        repository.replaceSchedule(series, toDelete);

        // Then
        List<TransactWriteItem> items = captureSingleRequest().transactItems();
        assertThat(items).hasSize(4);
        assertThat(items.subList(0, 3)).allSatisfy(item -> assertThat(item.delete()).isNotNull());
        assertThat(items.get(3).put().item().get("pk").s()).isEqualTo(series.getPk());
    }

    @Test
    void deleteSeries_WithMoreThanHundredActions_WritesOrderedChunks() {
        // Given
        String groupId = UUID.randomUUID().toString();
        Series series = aSeries().inGroup(groupId).build();
        List<SeriesInstance> instances = new ArrayList<>();
        LocalDate date = LocalDate.of(2025, 3, 3);
        for (int i = 0; i < 60; i++) {
            instances.add(anInstance().forSeries(series.getSeriesId()).on(date.plusDays(i)).build());
        }
        when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
            .thenReturn(TransactWriteItemsResponse.builder().build());

        // When
        repository.deleteSeries(series, instances, groupId);

        // Then
        ArgumentCaptor<TransactWriteItemsRequest> captor = ArgumentCaptor.forClass(TransactWriteItemsRequest.class);
        verify(dynamoDbClient, times(2)).transactWriteItems(captor.capture());
        List<TransactWriteItemsRequest> requests = captor.getAllValues();
        assertThat(requests.get(0).transactItems()).hasSize(SeriesTransactionRepositoryImpl.MAX_TRANSACTION_ITEMS);
        List<TransactWriteItem> last = requests.get(1).transactItems();
        assertThat(last).hasSize(22);
        assertThat(last.get(20).delete().key().get("pk").s()).isEqualTo(series.getPk());
        assertThat(last.get(21).delete().key().get("pk").s()).isEqualTo(RecurringKeyFactory.getGroupPk(groupId));
    }

    @Test
    void deleteSeries_WhenFirstChunkFails_DoesNotWriteLaterChunks() {
        // Given
        Series series = aSeries().build();
        List<SeriesInstance> instances = new ArrayList<>();
        LocalDate date = LocalDate.of(2025, 3, 3);
        for (int i = 0; i < 60; i++) {
            instances.add(anInstance().forSeries(series.getSeriesId()).on(date.plusDays(i)).build());
        }
        when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
            .thenThrow(DynamoDbException.builder().message("throttled").build());

        // When / Then
        assertThatThrownBy(() -> repository.deleteSeries(series, instances, null))
            .isInstanceOf(RepositoryException.class);
        verify(dynamoDbClient, times(1)).transactWriteItems(any(TransactWriteItemsRequest.class));
    }

    @Test
    void cancelInstance_ConditionalCheckFailure_ThrowsVersionConflict() {
        // Given
        SeriesInstance instance = anInstance().build();
        String recordId = instance.getRecordId();
        instance.unlinkRecord();
        instance.markException(ExceptionType.CANCELLED, null, "user-1");
        when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
            .thenThrow(cancelled("ConditionalCheckFailed", "None"));

        // When / Then
        assertThatThrownBy(() -> repository.cancelInstance(instance, "booking", recordId))
            .isInstanceOf(VersionConflictException.class);
    }

    @Test
    void rescheduleInstance_OtherCancellationReason_ThrowsTransactionFailed() {
        // Given
        SeriesInstance instance = anInstance().build();
        TimeRange newRange = new TimeRange(Instant.parse("2025-03-03T16:00:00Z"), Instant.parse("2025-03-03T16:30:00Z"));
        when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
            .thenThrow(cancelled("TransactionConflict", "None"));

        // When / Then
        assertThatThrownBy(() -> repository.rescheduleInstance(instance, newRange))
            .isInstanceOf(TransactionFailedException.class);
    }

    @Test
    void rescheduleInstance_WritesInstanceAndRecordRange() {
        // Given
        SeriesInstance instance = anInstance().build();
        TimeRange newRange = new TimeRange(Instant.parse("2025-03-03T16:00:00Z"), Instant.parse("2025-03-03T16:30:00Z"));
        when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
            .thenReturn(TransactWriteItemsResponse.builder().build());

        // When
        repository.rescheduleInstance(instance, newRange);

        // Then
        List<TransactWriteItem> items = captureSingleRequest().transactItems();
        assertThat(items).hasSize(2);
        assertThat(items.get(0).put().item().get("pk").s()).isEqualTo(instance.getPk());
        assertThat(items.get(1).update().key().get("pk").s())
            .isEqualTo(RecurringKeyFactory.getRecordPk("booking", instance.getRecordId()));
        assertThat(instance.getVersion()).isEqualTo(2L);
    }

    private TransactWriteItemsRequest captureSingleRequest() {
        ArgumentCaptor<TransactWriteItemsRequest> captor = ArgumentCaptor.forClass(TransactWriteItemsRequest.class);
        verify(dynamoDbClient).transactWriteItems(captor.capture());
        return captor.getValue();
    }

    private static TransactionCanceledException cancelled(String... codes) {
        List<CancellationReason> reasons = new ArrayList<>();
        for (String code : codes) {
            reasons.add(CancellationReason.builder().code(code).build());
        }
        return TransactionCanceledException.builder()
            .message("Transaction cancelled")
            .cancellationReasons(reasons)
            .build();
    }
}
