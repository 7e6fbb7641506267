package com.bbthechange.podfeed.config;

import com.bbthechange.podfeed.model.Feed;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.CreateTableEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.EnhancedGlobalSecondaryIndex;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.DescribeTimeToLiveRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTimeToLiveResponse;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.Projection;
import software.amazon.awssdk.services.dynamodb.model.ProjectionType;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.TimeToLiveDescription;
import software.amazon.awssdk.services.dynamodb.model.TimeToLiveStatus;
import software.amazon.awssdk.services.dynamodb.model.UpdateTimeToLiveRequest;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DynamoDBTableInitializerTest {

    @Mock
    private DynamoDbEnhancedClient dynamoDbEnhancedClient;

    @Mock
    private DynamoDbClient dynamoDbClient;

    @Mock
    private DynamoDbTable<Feed> feedTable;

    private DynamoDBTableInitializer initializer;

    @BeforeEach
    void setUp() {
        initializer = new DynamoDBTableInitializer(dynamoDbEnhancedClient, dynamoDbClient, new StorageProperties());
    }

    private void ttlStatus(TimeToLiveStatus status) {
        when(dynamoDbClient.describeTimeToLive(any(DescribeTimeToLiveRequest.class)))
                .thenReturn(DescribeTimeToLiveResponse.builder()
                        .timeToLiveDescription(TimeToLiveDescription.builder()
                                .timeToLiveStatus(status)
                                .build())
                        .build());
    }

    @Test
    void createTableIfNotExists_Missing_CreatesWithKeysOnlyIndex() {
        when(dynamoDbEnhancedClient.table(eq("Feeds"), any(TableSchema.class))).thenReturn(feedTable);
        when(feedTable.describeTable()).thenThrow(ResourceNotFoundException.builder().message("no table").build());
        EnhancedGlobalSecondaryIndex index = EnhancedGlobalSecondaryIndex.builder()
                .indexName(Feed.USER_INDEX)
                .projection(Projection.builder().projectionType(ProjectionType.KEYS_ONLY).build())
                .build();

        initializer.createTableIfNotExists("Feeds", Feed.class, List.of(index));

        ArgumentCaptor<CreateTableEnhancedRequest> captor = ArgumentCaptor.forClass(CreateTableEnhancedRequest.class);
        verify(feedTable).createTable(captor.capture());
        assertThat(captor.getValue().globalSecondaryIndices())
                .singleElement()
                .satisfies(gsi -> {
                    assertThat(gsi.indexName()).isEqualTo("UserCreatedAtIndex");
                    assertThat(gsi.projection().projectionType()).isEqualTo(ProjectionType.KEYS_ONLY);
                });
    }

    @Test
    void createTableIfNotExists_Existing_DoesNotCreate() {
        when(dynamoDbEnhancedClient.table(eq("Feeds"), any(TableSchema.class))).thenReturn(feedTable);

        initializer.createTableIfNotExists("Feeds", Feed.class, List.of());

        verify(feedTable).describeTable();
        verify(feedTable, never()).createTable(any(CreateTableEnhancedRequest.class));
    }

    @Test
    void configureTTL_AlreadyEnabled_SkipsUpdate() {
        ttlStatus(TimeToLiveStatus.ENABLED);

        initializer.configureTTL("Feeds", Feed.TTL_ATTRIBUTE);

        verify(dynamoDbClient, never()).updateTimeToLive(any(UpdateTimeToLiveRequest.class));
    }

    @Test
    void configureTTL_Disabled_EnablesOnAttribute() {
        ttlStatus(TimeToLiveStatus.DISABLED);

        initializer.configureTTL("Feeds", Feed.TTL_ATTRIBUTE);

        ArgumentCaptor<UpdateTimeToLiveRequest> captor = ArgumentCaptor.forClass(UpdateTimeToLiveRequest.class);
        verify(dynamoDbClient).updateTimeToLive(captor.capture());
        assertThat(captor.getValue().tableName()).isEqualTo("Feeds");
        assertThat(captor.getValue().timeToLiveSpecification().attributeName()).isEqualTo("expirationTime");
        assertThat(captor.getValue().timeToLiveSpecification().enabled()).isTrue();
    }

    @Test
    void configureTTL_DynamoFailure_DoesNotPropagate() {
        when(dynamoDbClient.describeTimeToLive(any(DescribeTimeToLiveRequest.class)))
                .thenThrow(DynamoDbException.builder().message("throttled").build());

        initializer.configureTTL("Pledges", "expiresAt");

        verify(dynamoDbClient, never()).updateTimeToLive(any(UpdateTimeToLiveRequest.class));
    }
}
