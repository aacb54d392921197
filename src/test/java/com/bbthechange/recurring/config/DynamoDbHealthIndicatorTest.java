package com.bbthechange.recurring.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableResponse;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.TableDescription;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DynamoDbHealthIndicatorTest {

    @Mock
    private DynamoDbClient dynamoDbClient;

    @InjectMocks
    private DynamoDbHealthIndicator healthIndicator;

    @Test
    void health_WithActiveTable_ReportsUp() {
        // Given
        when(dynamoDbClient.describeTable(any(DescribeTableRequest.class))).thenReturn(describe(TableStatus.ACTIVE));

        // When
        Health health = healthIndicator.health();

        // Then
        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("recurringTable", "ACTIVE");
    }

    @Test
    void health_WithTableStillCreating_ReportsDownWithReason() {
        // Given
        when(dynamoDbClient.describeTable(any(DescribeTableRequest.class))).thenReturn(describe(TableStatus.CREATING));

        // When
        Health health = healthIndicator.health();

        // Then
        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails())
            .containsEntry("recurringTable", "CREATING")
            .containsEntry("reason", "RecurringTable not active");
    }

    @Test
    void health_WhenDynamoDbUnreachable_ReportsDown() {
        // Given
        when(dynamoDbClient.describeTable(any(DescribeTableRequest.class)))
            .thenThrow(DynamoDbException.builder().message("connection refused").build());

        // When
        Health health = healthIndicator.health();

        // Then
        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("error", "DynamoDB connection failed").containsKey("message");
    }

    private static DescribeTableResponse describe(TableStatus status) {
        return DescribeTableResponse.builder()
            .table(TableDescription.builder().tableName("RecurringTable").tableStatus(status).build())
            .build();
    }
}
