package com.bbthechange.podfeed.service;

import com.bbthechange.podfeed.dto.FeedConfig;
import com.bbthechange.podfeed.model.Feed;

import java.util.List;

/**
 * Lifecycle of stored feeds: creation, re-assembly, lookup and removal.
 */
public interface FeedService {

    /**
     * Assemble a feed for the user and store it under a fresh id.
     */
    Feed createFeed(String userId, FeedConfig config);

    /**
     * Re-assemble a stored feed from its stored link and settings and overwrite it.
     * Id, owner and creation time are kept; everything else is replaced.
     */
    Feed refreshFeed(String feedId);

    Feed getFeed(String feedId);

    /**
     * Ids of the user's feeds, oldest first.
     */
    List<String> getFeedIdsForUser(String userId);

    void deleteFeed(String feedId);
}
