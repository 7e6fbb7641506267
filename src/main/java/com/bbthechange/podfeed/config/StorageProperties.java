package com.bbthechange.podfeed.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

@Component
@ConfigurationProperties(prefix = "podfeed.storage")
public class StorageProperties {

    private String feedsTable = "Feeds";

    private String pledgesTable = "Pledges";

    /**
     * How long a feed lives after its last assembly before DynamoDB expires it.
     */
    @DurationUnit(ChronoUnit.DAYS)
    private Duration feedTtl = Duration.ofDays(90);

    public String getFeedsTable() {
        return feedsTable;
    }

    public void setFeedsTable(String feedsTable) {
        this.feedsTable = feedsTable;
    }

    public String getPledgesTable() {
        return pledgesTable;
    }

    public void setPledgesTable(String pledgesTable) {
        this.pledgesTable = pledgesTable;
    }

    public Duration getFeedTtl() {
        return feedTtl;
    }

    public void setFeedTtl(Duration feedTtl) {
        this.feedTtl = feedTtl;
    }
}
