package com.bbthechange.podfeed.util;

import software.amazon.awssdk.enhanced.dynamodb.AttributeConverter;
import software.amazon.awssdk.enhanced.dynamodb.AttributeValueType;
import software.amazon.awssdk.enhanced.dynamodb.EnhancedType;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.time.Instant;

/**
 * Stores feed and episode timestamps as DynamoDB numbers holding epoch milliseconds.
 */
public class InstantAsLongAttributeConverter implements AttributeConverter<Instant> {

    private static final AttributeValue NULL_VALUE = AttributeValue.builder().nul(true).build();

    @Override
    public AttributeValue transformFrom(Instant instant) {
        if (instant == null) {
            return NULL_VALUE;
        }
        return AttributeValue.builder().n(Long.toString(instant.toEpochMilli())).build();
    }

    @Override
    public Instant transformTo(AttributeValue attributeValue) {
        if (attributeValue == null || Boolean.TRUE.equals(attributeValue.nul()) || attributeValue.n() == null) {
            return null;
        }
        return Instant.ofEpochMilli(Long.parseLong(attributeValue.n()));
    }

    @Override
    public EnhancedType<Instant> type() {
        return EnhancedType.of(Instant.class);
    }

    @Override
    public AttributeValueType attributeValueType() {
        return AttributeValueType.N;
    }
}
