package com.bbthechange.podfeed.model;

import com.bbthechange.podfeed.util.InstantAsLongAttributeConverter;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;

import java.time.Instant;

/**
 * A single episode of a feed, stored nested inside its Feed record.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class Item {

    private String id;
    private String title;
    private String description;
    private Long duration;  // seconds
    private Long size;      // approximate bytes
    private Instant pubDate;
    private String thumbnail;
    private String videoUrl;

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getPubDate() {
        return pubDate;
    }
}
