package com.bbthechange.podfeed.service;

/**
 * Lowers a user's feeds to the free tier once their pledge has lapsed.
 * Invoked by the maintenance process that watches the payment lifecycle.
 */
public interface FeedDowngradeService {

    /**
     * Downgrade the user's feeds if the pledge is missing or expired.
     *
     * @param userId owner of the feeds
     * @param pledgeId pledge the user was entitled through; null means no pledge
     * @return number of feeds changed, 0 if the pledge is still active
     */
    int downgradeIfLapsed(String userId, Long pledgeId);

    /**
     * Unconditionally set every feed of the user to LOW quality and the free page size.
     *
     * @return number of feeds changed
     */
    int downgradeUser(String userId);
}
