package com.bbthechange.podfeed.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;

import java.net.URI;

/**
 * DynamoDB clients for the feed and pledge store.
 * Setting aws.dynamodb.endpoint points the service at DynamoDB Local or LocalStack.
 */
@Configuration
public class DynamoDBConfig {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDBConfig.class);

    private final String region;
    private final String endpoint;

    public DynamoDBConfig(@Value("${aws.region:us-east-1}") String region,
                          @Value("${aws.dynamodb.endpoint:}") String endpoint) {
        this.region = region;
        this.endpoint = endpoint;
    }

    @Bean
    public DynamoDbClient dynamoDbClient() {
        DynamoDbClientBuilder builder = DynamoDbClient.builder()
                .region(Region.of(region))
                .credentialsProvider(credentialsProvider());

        if (isLocalEndpoint()) {
            logger.info("Using local DynamoDB endpoint {}", endpoint);
            builder.endpointOverride(URI.create(endpoint));
        }

        return builder.build();
    }

    @Bean
    public DynamoDbEnhancedClient dynamoDbEnhancedClient(DynamoDbClient dynamoDbClient) {
        return DynamoDbEnhancedClient.builder()
                .dynamoDbClient(dynamoDbClient)
                .build();
    }

    private AwsCredentialsProvider credentialsProvider() {
        if (isLocalEndpoint()) {
            // Local endpoints accept any credentials
            return StaticCredentialsProvider.create(AwsBasicCredentials.create("dummykey", "dummysecret"));
        }
        return DefaultCredentialsProvider.create();
    }

    private boolean isLocalEndpoint() {
        return StringUtils.hasText(endpoint);
    }
}
