package com.bbthechange.podfeed.config;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;

/**
 * Reports DOWN unless both the Feeds and Pledges tables are ACTIVE.
 */
@Component
public class DynamoDbHealthIndicator implements HealthIndicator {

    private final DynamoDbClient dynamoDbClient;
    private final StorageProperties storageProperties;

    public DynamoDbHealthIndicator(DynamoDbClient dynamoDbClient, StorageProperties storageProperties) {
        this.dynamoDbClient = dynamoDbClient;
        this.storageProperties = storageProperties;
    }

    @Override
    public Health health() {
        try {
            TableStatus feeds = tableStatus(storageProperties.getFeedsTable());
            TableStatus pledges = tableStatus(storageProperties.getPledgesTable());

            Health.Builder builder = (feeds == TableStatus.ACTIVE && pledges == TableStatus.ACTIVE)
                    ? Health.up()
                    : Health.down();

            return builder
                    .withDetail("feedsTable", String.valueOf(feeds))
                    .withDetail("pledgesTable", String.valueOf(pledges))
                    .build();

        } catch (DynamoDbException e) {
            return Health.down()
                    .withDetail("error", "DynamoDB connection failed")
                    .withDetail("message", e.getMessage())
                    .build();
        }
    }

    private TableStatus tableStatus(String tableName) {
        return dynamoDbClient.describeTable(DescribeTableRequest.builder().tableName(tableName).build())
                .table()
                .tableStatus();
    }
}
