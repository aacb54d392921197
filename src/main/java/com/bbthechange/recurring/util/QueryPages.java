package com.bbthechange.recurring.util;

import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Follows LastEvaluatedKey so callers see every page of a query.
 */
public final class QueryPages {

    private QueryPages() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static List<Map<String, AttributeValue>> queryAll(DynamoDbClient dynamoDbClient, QueryRequest request) {
        List<Map<String, AttributeValue>> items = new ArrayList<>();
        QueryRequest page = request;
        while (true) {
            QueryResponse response = dynamoDbClient.query(page);
            if (response.hasItems()) {
                items.addAll(response.items());
            }
            if (!response.hasLastEvaluatedKey() || response.lastEvaluatedKey().isEmpty()) {
                return items;
            }
            page = page.toBuilder().exclusiveStartKey(response.lastEvaluatedKey()).build();
        }
    }
}
