package com.bbthechange.podfeed.service;

import com.bbthechange.podfeed.dto.FeedConfig;
import com.bbthechange.podfeed.exception.FeedBuildException;
import com.bbthechange.podfeed.model.Feed;

/**
 * Assembles a feed from a video platform.
 */
public interface FeedBuilder {

    /**
     * Build a complete feed for the configured link.
     *
     * Process:
     * 1. Classify the link (no network call if it is unsupported)
     * 2. Fetch the source's metadata
     * 3. Page through its videos until pageSize episodes are collected or the listing ends;
     *    a page is always consumed in full before the count is checked
     *
     * The returned feed has no id, owner or timestamps for storage yet.
     *
     * @throws FeedBuildException on any failure; a partial feed is never returned
     */
    Feed build(FeedConfig config);
}
