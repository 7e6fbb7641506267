package com.bbthechange.podfeed.repository.impl;

import com.bbthechange.podfeed.config.StorageProperties;
import com.bbthechange.podfeed.model.Feed;
import com.bbthechange.podfeed.repository.FeedRepository;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbIndex;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryEnhancedRequest;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Repository
public class FeedRepositoryImpl implements FeedRepository {

    private final DynamoDbTable<Feed> feedTable;
    private final DynamoDbIndex<Feed> userIndex;

    public FeedRepositoryImpl(DynamoDbEnhancedClient enhancedClient, StorageProperties storageProperties) {
        this.feedTable = enhancedClient.table(storageProperties.getFeedsTable(),
                TableSchema.fromBean(Feed.class));
        this.userIndex = feedTable.index(Feed.USER_INDEX);
    }

    @Override
    public Feed save(Feed feed) {
        feedTable.putItem(feed);
        return feed;
    }

    @Override
    public Optional<Feed> findById(String feedId) {
        return Optional.ofNullable(feedTable.getItem(key(feedId)));
    }

    @Override
    public void deleteById(String feedId) {
        feedTable.deleteItem(key(feedId));
    }

    @Override
    public List<String> findFeedIdsByUserId(String userId) {
        QueryConditional queryConditional = QueryConditional
                .keyEqualTo(Key.builder()
                        .partitionValue(userId)
                        .build());

        // Index is KEYS_ONLY: items carry id, userId and createdAt
        return userIndex.query(QueryEnhancedRequest.builder()
                        .queryConditional(queryConditional)
                        .scanIndexForward(true)
                        .build())
                .stream()
                .flatMap(page -> page.items().stream())
                .map(Feed::getId)
                .collect(Collectors.toList());
    }

    private static Key key(String feedId) {
        return Key.builder()
                .partitionValue(feedId)
                .build();
    }
}
