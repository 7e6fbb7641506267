package com.bbthechange.podfeed.model;

/**
 * Feed quality tier. LOW is the free tier, HIGH requires an active pledge.
 */
public enum Quality {
    LOW,
    HIGH
}
