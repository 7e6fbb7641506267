package com.bbthechange.podfeed.model;

import com.bbthechange.podfeed.util.InstantAsLongAttributeConverter;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondaryPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondarySortKey;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Podcast-shaped representation of a Vimeo channel, group or user.
 *
 * Stored in the Feeds table. The UserCreatedAtIndex (userId hash, createdAt range, keys only)
 * lets the downgrade sweep find every feed a user owns without a scan. expirationTime is the
 * table's TTL attribute.
 */
@Data
@NoArgsConstructor
@DynamoDbBean
public class Feed {

    public static final String USER_INDEX = "UserCreatedAtIndex";
    public static final String PRIMARY_KEY = "id";
    public static final String TTL_ATTRIBUTE = "expirationTime";

    private String id;
    private String userId;
    private Long createdAt;         // epoch seconds, range key of UserCreatedAtIndex
    private Long expirationTime;    // epoch seconds, TTL

    // What the feed was built from; kept so the feed can be re-assembled
    private String url;
    private Integer pageSize;
    private Quality quality;

    private String itemId;
    private SourceType sourceType;
    private String title;
    private String itemUrl;
    private String description;
    private String coverArt;
    private String author;
    private Instant pubDate;
    private Instant updatedAt;
    private List<Item> episodes = new ArrayList<>();

    @DynamoDbPartitionKey
    public String getId() {
        return id;
    }

    @DynamoDbSecondaryPartitionKey(indexNames = USER_INDEX)
    public String getUserId() {
        return userId;
    }

    @DynamoDbSecondarySortKey(indexNames = USER_INDEX)
    public Long getCreatedAt() {
        return createdAt;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getPubDate() {
        return pubDate;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void addEpisode(Item item) {
        if (episodes == null) {
            episodes = new ArrayList<>();
        }
        episodes.add(item);
    }
}
