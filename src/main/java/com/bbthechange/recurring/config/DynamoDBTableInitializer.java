package com.bbthechange.recurring.config;

import com.bbthechange.recurring.model.SeriesInstance;
import com.bbthechange.recurring.util.RecurringKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.CreateTableEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.EnhancedGlobalSecondaryIndex;
import software.amazon.awssdk.services.dynamodb.model.Projection;
import software.amazon.awssdk.services.dynamodb.model.ProjectionType;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughput;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

/**
 * Creates the recurring schedule table on startup when it does not exist yet.
 * The schema is taken from SeriesInstance, the only item type that populates both indexes.
 */
@Component
@ConditionalOnProperty(name = "dynamodb.table.init.enabled", havingValue = "true", matchIfMissing = true)
public class DynamoDBTableInitializer implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDBTableInitializer.class);

    static final String TABLE_NAME = "RecurringTable";

    @Autowired
    private DynamoDbEnhancedClient dynamoDbEnhancedClient;

    @Override
    public void run(ApplicationArguments args) throws Exception {
        DynamoDbTable<SeriesInstance> table = dynamoDbEnhancedClient.table(TABLE_NAME, TableSchema.fromBean(SeriesInstance.class));
        try {
            table.describeTable();
            logger.info("Table {} already exists", TABLE_NAME);
        } catch (ResourceNotFoundException e) {
            logger.info("Creating table: {}", TABLE_NAME);
            table.createTable(CreateTableEnhancedRequest.builder()
                .provisionedThroughput(throughput())
                .globalSecondaryIndices(
                    createGSI(RecurringKeyFactory.PARENT_INDEX),
                    createGSI(RecurringKeyFactory.RECORD_INDEX))
                .build());
            logger.info("Table {} created successfully with GSIs", TABLE_NAME);
        }
    }

    private EnhancedGlobalSecondaryIndex createGSI(String indexName) {
        return EnhancedGlobalSecondaryIndex.builder()
            .indexName(indexName)
            .provisionedThroughput(throughput())
            .projection(Projection.builder()
                .projectionType(ProjectionType.ALL)
                .build())
            .build();
    }

    private static ProvisionedThroughput throughput() {
        return ProvisionedThroughput.builder()
            .readCapacityUnits(5L)
            .writeCapacityUnits(5L)
            .build();
    }
}
