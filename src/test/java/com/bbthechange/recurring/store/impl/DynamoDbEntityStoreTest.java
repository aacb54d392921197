package com.bbthechange.recurring.store.impl;

import com.bbthechange.recurring.exception.RepositoryException;
import com.bbthechange.recurring.exception.ResourceNotFoundException;
import com.bbthechange.recurring.model.EntityRecord;
import com.bbthechange.recurring.model.TimeRange;
import com.bbthechange.recurring.store.RecordDeletionListener;
import com.bbthechange.recurring.util.QueryPerformanceTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.PutItemResponse;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DynamoDbEntityStoreTest {

    @Mock
    private DynamoDbClient dynamoDbClient;

    @Mock
    private QueryPerformanceTracker performanceTracker;

    @Mock
    private RecordDeletionListener deletionListener;

    private DynamoDbEntityStore entityStore;

    private final String recordId = UUID.randomUUID().toString();
    private final TimeRange range = new TimeRange(
        Instant.parse("2025-03-03T14:00:00Z"), Instant.parse("2025-03-03T14:30:00Z"));

    @BeforeEach
    void setUp() {
        lenient().when(performanceTracker.trackQuery(anyString(), anyString(), any()))
            .thenAnswer(invocation -> ((Supplier<?>) invocation.getArgument(2)).get());
        entityStore = new DynamoDbEntityStore(dynamoDbClient, performanceTracker, List.of(deletionListener));
    }

    @Test
    void find_WhenItemMissing_ReturnsEmpty() {
        // Given
        when(dynamoDbClient.getItem(any(GetItemRequest.class))).thenReturn(GetItemResponse.builder().build());

        // When
        Optional<EntityRecord> result = entityStore.find("booking", recordId);

        // Then
        assertThat(result).isEmpty();
    }

    @Test
    void find_WhenItemExists_MapsFieldsAndRange() {
        // Given
        EntityRecord stored = new EntityRecord("booking", recordId, Map.of("title", "Standup"), "time_slot", range);
        when(dynamoDbClient.getItem(any(GetItemRequest.class)))
            .thenReturn(GetItemResponse.builder().item(RecordItemMapper.toItem(stored)).build());

        // When
        Optional<EntityRecord> result = entityStore.find("booking", recordId);

        // Then
        assertThat(result).isPresent();
        assertThat(result.get().getField("title")).isEqualTo("Standup");
        assertThat(result.get().getTimeRange()).isEqualTo(range);
    }

    @Test
    void create_PutsItemWithNotExistsCondition() {
        // Given
        when(dynamoDbClient.putItem(any(PutItemRequest.class))).thenReturn(PutItemResponse.builder().build());

        // When
        EntityRecord created = entityStore.create("booking", Map.of("title", "Standup"), "time_slot", range);

        // Then
        ArgumentCaptor<PutItemRequest> captor = ArgumentCaptor.forClass(PutItemRequest.class);
        verify(dynamoDbClient).putItem(captor.capture());
        assertThat(captor.getValue().conditionExpression()).isEqualTo("attribute_not_exists(pk)");
        assertThat(captor.getValue().item().get("gsi1pk").s()).isEqualTo("RECORDTYPE#booking");
        assertThat(UUID.fromString(created.getRecordId())).isNotNull();
    }

    @Test
    void create_OnDynamoDbError_ThrowsRepositoryException() {
        // Given
        when(dynamoDbClient.putItem(any(PutItemRequest.class))).thenThrow(DynamoDbException.builder().message("down").build());

        // When / Then
        assertThatThrownBy(() -> entityStore.create("booking", Map.of(), "time_slot", range))
            .isInstanceOf(RepositoryException.class);
    }

    @Test
    void delete_NotifiesListenersBeforeDeleting() {
        // When
        entityStore.delete("booking", recordId);

        // Then
        InOrder inOrder = inOrder(deletionListener, dynamoDbClient);
        inOrder.verify(deletionListener).beforeRecordDelete("booking", recordId);
        inOrder.verify(dynamoDbClient).deleteItem(any(DeleteItemRequest.class));
    }

    @Test
    void setFields_WithNoFields_DoesNothing() {
        // When
        entityStore.setFields("booking", recordId, Map.of());

        // Then
        verifyNoInteractions(dynamoDbClient);
    }

    @Test
    void setTimeRange_WhenRecordGone_ThrowsNotFound() {
        // Given
        when(dynamoDbClient.updateItem(any(UpdateItemRequest.class)))
            .thenThrow(ConditionalCheckFailedException.builder().message("gone").build());

        // When / Then
        assertThatThrownBy(() -> entityStore.setTimeRange("booking", recordId, range))
            .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void findOverlapping_FollowsPagesUntilMatch() {
        // Given
        EntityRecord existing = new EntityRecord("booking", recordId, Map.of("roomId", "room-1"), "time_slot", range);
        QueryResponse emptyPage = QueryResponse.builder()
            .items(List.of())
            .lastEvaluatedKey(Map.of("pk", AttributeValue.builder().s("next").build()))
            .build();
        QueryResponse matchPage = QueryResponse.builder()
            .items(List.of(RecordItemMapper.toItem(existing)))
            .build();
        when(dynamoDbClient.query(any(QueryRequest.class))).thenReturn(emptyPage, matchPage);

        // When
        Optional<EntityRecord> result = entityStore.findOverlapping("booking", "roomId", "room-1", "time_slot", range);

        // Then
        assertThat(result).map(EntityRecord::getRecordId).contains(recordId);
        ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
        verify(dynamoDbClient, times(2)).query(captor.capture());
        assertThat(captor.getAllValues().get(1).exclusiveStartKey()).containsKey("pk");
        assertThat(captor.getAllValues().get(0).scanIndexForward()).isFalse();
    }
}
