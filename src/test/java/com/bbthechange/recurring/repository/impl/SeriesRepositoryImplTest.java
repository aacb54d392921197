package com.bbthechange.recurring.repository.impl;

import com.bbthechange.recurring.exception.RepositoryException;
import com.bbthechange.recurring.model.Series;
import com.bbthechange.recurring.model.SeriesStatus;
import com.bbthechange.recurring.util.QueryPerformanceTracker;
import com.bbthechange.recurring.util.RecurringKeyFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemResponse;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

import static com.bbthechange.recurring.testutil.SeriesTestBuilder.aSeries;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SeriesRepositoryImplTest {

    @Mock
    private DynamoDbClient dynamoDbClient;

    @Mock
    private QueryPerformanceTracker performanceTracker;

    private SeriesRepositoryImpl repository;

    private final TableSchema<Series> schema = TableSchema.fromBean(Series.class);

    @BeforeEach
    void setUp() {
        when(performanceTracker.trackQuery(anyString(), anyString(), any()))
            .thenAnswer(invocation -> ((Supplier<?>) invocation.getArgument(2)).get());
        repository = new SeriesRepositoryImpl(dynamoDbClient, performanceTracker);
    }

    @Test
    void findById_MapsStoredSeries() {
        // Given
        Series stored = aSeries().build();
        when(dynamoDbClient.getItem(any(GetItemRequest.class)))
            .thenReturn(GetItemResponse.builder().item(schema.itemToMap(stored, true)).build());

        // When
        Optional<Series> result = repository.findById(stored.getSeriesId());

        // Then
        assertThat(result).isPresent();
        assertThat(result.get().getRule()).isEqualTo(stored.getRule());
        assertThat(result.get().getTemplate()).containsEntry("title", "Standup");
        assertThat(result.get().getDuration()).isEqualTo(stored.getDuration());
    }

    @Test
    void findByGroupId_QueriesVersionsOfGroup() {
        // Given
        String groupId = UUID.randomUUID().toString();
        Series first = aSeries().inGroup(groupId).build();
        when(dynamoDbClient.query(any(QueryRequest.class)))
            .thenReturn(QueryResponse.builder().items(List.of(schema.itemToMap(first, true))).build());

        // When
        List<Series> versions = repository.findByGroupId(groupId);

        // Then
        assertThat(versions).extracting(Series::getSeriesId).containsExactly(first.getSeriesId());
        ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
        verify(dynamoDbClient).query(captor.capture());
        assertThat(captor.getValue().expressionAttributeValues().get(":groupKey").s())
            .isEqualTo(RecurringKeyFactory.getGroupPk(groupId));
    }

    @Test
    void advanceExpandedUntil_WhenMarkAlreadyAhead_ReturnsFalse() {
        // Given
        when(dynamoDbClient.updateItem(any(UpdateItemRequest.class)))
            .thenThrow(ConditionalCheckFailedException.builder().message("behind").build());

        // When
        boolean advanced = repository.advanceExpandedUntil(UUID.randomUUID().toString(), Instant.parse("2025-06-01T00:00:00Z"));

        // Then
        assertThat(advanced).isFalse();
    }

    @Test
    void advanceExpandedUntil_OnlyMovesForward() {
        // Given
        when(dynamoDbClient.updateItem(any(UpdateItemRequest.class))).thenReturn(UpdateItemResponse.builder().build());

        // When
        boolean advanced = repository.advanceExpandedUntil(UUID.randomUUID().toString(), Instant.parse("2025-06-01T00:00:00Z"));

        // Then
        assertThat(advanced).isTrue();
        ArgumentCaptor<UpdateItemRequest> captor = ArgumentCaptor.forClass(UpdateItemRequest.class);
        verify(dynamoDbClient).updateItem(captor.capture());
        assertThat(captor.getValue().conditionExpression()).contains("expandedUntil < :until");
    }

    @Test
    void updateStatus_OnDynamoDbError_ThrowsRepositoryException() {
        // Given
        when(dynamoDbClient.updateItem(any(UpdateItemRequest.class)))
            .thenThrow(DynamoDbException.builder().message("down").build());

        // When / Then
        assertThatThrownBy(() -> repository.updateStatus(UUID.randomUUID().toString(), SeriesStatus.NEEDS_ATTENTION))
            .isInstanceOf(RepositoryException.class);
    }
}
