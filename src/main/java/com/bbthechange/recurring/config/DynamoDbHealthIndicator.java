package com.bbthechange.recurring.config;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableResponse;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;

/**
 * Health indicator for the recurring schedule table.
 */
@Component
public class DynamoDbHealthIndicator implements HealthIndicator {

    private final DynamoDbClient dynamoDbClient;

    @Autowired
    public DynamoDbHealthIndicator(DynamoDbClient dynamoDbClient) {
        this.dynamoDbClient = dynamoDbClient;
    }

    @Override
    public Health health() {
        try {
            DescribeTableResponse response = dynamoDbClient.describeTable(
                DescribeTableRequest.builder().tableName(DynamoDBTableInitializer.TABLE_NAME).build()
            );
            TableStatus status = response.table().tableStatus();

            if (status == TableStatus.ACTIVE) {
                return Health.up()
                    .withDetail("recurringTable", "ACTIVE")
                    .withDetail("gsiCount", response.table().globalSecondaryIndexes().size())
                    .build();
            }
            return Health.down()
                .withDetail("recurringTable", status.toString())
                .withDetail("reason", "RecurringTable not active")
                .build();

        } catch (DynamoDbException e) {
            return Health.down()
                .withDetail("error", "DynamoDB connection failed")
                .withDetail("message", e.getMessage())
                .build();
        }
    }
}
