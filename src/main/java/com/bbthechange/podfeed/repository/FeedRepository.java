package com.bbthechange.podfeed.repository;

import com.bbthechange.podfeed.model.Feed;

import java.util.List;
import java.util.Optional;

/**
 * Point access to stored feeds plus the per-user listing the downgrade sweep relies on.
 * Writes replace the whole record; concurrent writes to one id are last-write-wins.
 */
public interface FeedRepository {

    Feed save(Feed feed);

    Optional<Feed> findById(String feedId);

    void deleteById(String feedId);

    /**
     * Ids of the user's feeds, oldest first. Served by the user index, which is eventually
     * consistent: a feed saved moments ago may be missing.
     */
    List<String> findFeedIdsByUserId(String userId);
}
