package com.bbthechange.podfeed.model;

import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

import java.time.Instant;
import java.util.Objects;

/**
 * Time-bounded entitlement that grants a user HIGH quality feeds.
 * Written by the payment lifecycle; expiresAt doubles as the Pledges table TTL.
 */
@DynamoDbBean
public class Pledge {

    public static final String PRIMARY_KEY = "id";
    public static final String TTL_ATTRIBUTE = "expiresAt";

    private Long id;
    private String userId;
    private Long createdAt;
    private Long expiresAt;
    private String tier;

    public Pledge() {
    }

    public Pledge(Long id, String userId, Long expiresAt, String tier) {
        this.id = id;
        this.userId = userId;
        this.createdAt = Instant.now().getEpochSecond();
        this.expiresAt = expiresAt;
        this.tier = tier;
    }

    @DynamoDbPartitionKey
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public Long getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Long createdAt) {
        this.createdAt = createdAt;
    }

    public Long getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Long expiresAt) {
        this.expiresAt = expiresAt;
    }

    public String getTier() {
        return tier;
    }

    public void setTier(String tier) {
        this.tier = tier;
    }

    public boolean isExpired() {
        return expiresAt == null || Instant.now().getEpochSecond() > expiresAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Pledge pledge = (Pledge) o;
        return Objects.equals(id, pledge.id) &&
                Objects.equals(userId, pledge.userId) &&
                Objects.equals(createdAt, pledge.createdAt) &&
                Objects.equals(expiresAt, pledge.expiresAt) &&
                Objects.equals(tier, pledge.tier);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, userId, createdAt, expiresAt, tier);
    }

    @Override
    public String toString() {
        return "Pledge{" +
                "id=" + id +
                ", userId='" + userId + '\'' +
                ", expiresAt=" + expiresAt +
                ", tier='" + tier + '\'' +
                '}';
    }
}
