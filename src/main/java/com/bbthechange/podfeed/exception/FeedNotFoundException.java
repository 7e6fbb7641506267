package com.bbthechange.podfeed.exception;

/**
 * No stored feed has the requested id, or it has already expired.
 */
public class FeedNotFoundException extends RuntimeException {

    private final String feedId;

    public FeedNotFoundException(String feedId) {
        super("Feed not found: " + feedId);
        this.feedId = feedId;
    }

    public String getFeedId() {
        return feedId;
    }
}
