package com.bbthechange.podfeed.config;

import com.bbthechange.podfeed.model.Feed;
import com.bbthechange.podfeed.model.Pledge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.CreateTableEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.EnhancedGlobalSecondaryIndex;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTimeToLiveRequest;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.Projection;
import software.amazon.awssdk.services.dynamodb.model.ProjectionType;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughput;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.TimeToLiveSpecification;
import software.amazon.awssdk.services.dynamodb.model.TimeToLiveStatus;
import software.amazon.awssdk.services.dynamodb.model.UpdateTimeToLiveRequest;
import software.amazon.awssdk.services.dynamodb.waiters.DynamoDbWaiter;

import java.util.List;

/**
 * One-time, idempotent schema bootstrap: creates the Feeds and Pledges tables with the user
 * index, waits for them to become active and turns on TTL.
 */
@Component
@ConditionalOnProperty(name = "dynamodb.table.init.enabled", havingValue = "true", matchIfMissing = true)
public class DynamoDBTableInitializer implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDBTableInitializer.class);

    private static final ProvisionedThroughput THROUGHPUT = ProvisionedThroughput.builder()
            .readCapacityUnits(5L)
            .writeCapacityUnits(5L)
            .build();

    private final DynamoDbEnhancedClient dynamoDbEnhancedClient;
    private final DynamoDbClient dynamoDbClient;
    private final StorageProperties storageProperties;

    public DynamoDBTableInitializer(DynamoDbEnhancedClient dynamoDbEnhancedClient,
                                    DynamoDbClient dynamoDbClient,
                                    StorageProperties storageProperties) {
        this.dynamoDbEnhancedClient = dynamoDbEnhancedClient;
        this.dynamoDbClient = dynamoDbClient;
        this.storageProperties = storageProperties;
    }

    @Override
    public void run(ApplicationArguments args) {
        String feedsTable = storageProperties.getFeedsTable();
        String pledgesTable = storageProperties.getPledgesTable();

        createTableIfNotExists(feedsTable, Feed.class, List.of(keysOnlyIndex(Feed.USER_INDEX)));
        createTableIfNotExists(pledgesTable, Pledge.class, List.of());

        waitUntilActive(feedsTable);
        waitUntilActive(pledgesTable);

        configureTTL(feedsTable, Feed.TTL_ATTRIBUTE);
        configureTTL(pledgesTable, Pledge.TTL_ATTRIBUTE);
    }

    <T> void createTableIfNotExists(String tableName, Class<T> entityClass,
                                    List<EnhancedGlobalSecondaryIndex> indices) {
        DynamoDbTable<T> table = dynamoDbEnhancedClient.table(tableName, TableSchema.fromBean(entityClass));
        try {
            table.describeTable();
            logger.info("Table {} already exists", tableName);
        } catch (ResourceNotFoundException e) {
            logger.info("Creating table: {}", tableName);

            CreateTableEnhancedRequest.Builder request = CreateTableEnhancedRequest.builder()
                    .provisionedThroughput(THROUGHPUT);
            if (!indices.isEmpty()) {
                request.globalSecondaryIndices(indices);
            }
            table.createTable(request.build());

            logger.info("Table {} created with {} GSIs", tableName, indices.size());
        }
    }

    private EnhancedGlobalSecondaryIndex keysOnlyIndex(String indexName) {
        return EnhancedGlobalSecondaryIndex.builder()
                .indexName(indexName)
                .provisionedThroughput(THROUGHPUT)
                .projection(Projection.builder()
                        .projectionType(ProjectionType.KEYS_ONLY)
                        .build())
                .build();
    }

    private void waitUntilActive(String tableName) {
        try (DynamoDbWaiter waiter = dynamoDbClient.waiter()) {
            waiter.waitUntilTableExists(DescribeTableRequest.builder().tableName(tableName).build());
        }
    }

    void configureTTL(String tableName, String ttlAttributeName) {
        try {
            TimeToLiveStatus status = dynamoDbClient.describeTimeToLive(DescribeTimeToLiveRequest.builder()
                            .tableName(tableName)
                            .build())
                    .timeToLiveDescription()
                    .timeToLiveStatus();

            if (status == TimeToLiveStatus.ENABLED || status == TimeToLiveStatus.ENABLING) {
                logger.info("TTL already {} for table {}", status, tableName);
                return;
            }

            logger.info("Enabling TTL for table {} on attribute {}", tableName, ttlAttributeName);
            dynamoDbClient.updateTimeToLive(UpdateTimeToLiveRequest.builder()
                    .tableName(tableName)
                    .timeToLiveSpecification(TimeToLiveSpecification.builder()
                            .attributeName(ttlAttributeName)
                            .enabled(true)
                            .build())
                    .build());
        } catch (DynamoDbException e) {
            // Expired records then simply stay until TTL is switched on by hand
            logger.warn("Could not configure TTL for table {} on attribute {}: {}",
                    tableName, ttlAttributeName, e.getMessage());
        }
    }
}
