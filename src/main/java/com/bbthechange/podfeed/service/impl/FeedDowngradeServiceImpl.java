package com.bbthechange.podfeed.service.impl;

import com.bbthechange.podfeed.model.Feed;
import com.bbthechange.podfeed.model.Pledge;
import com.bbthechange.podfeed.model.Quality;
import com.bbthechange.podfeed.repository.FeedRepository;
import com.bbthechange.podfeed.repository.PledgeRepository;
import com.bbthechange.podfeed.service.FeedDowngradeService;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class FeedDowngradeServiceImpl implements FeedDowngradeService {

    private static final Logger logger = LoggerFactory.getLogger(FeedDowngradeServiceImpl.class);

    private final FeedRepository feedRepository;
    private final PledgeRepository pledgeRepository;
    private final MeterRegistry meterRegistry;
    private final int freePageSize;

    public FeedDowngradeServiceImpl(FeedRepository feedRepository,
                                    PledgeRepository pledgeRepository,
                                    MeterRegistry meterRegistry,
                                    @Value("${podfeed.downgrade.page-size:50}") int freePageSize) {
        this.feedRepository = feedRepository;
        this.pledgeRepository = pledgeRepository;
        this.meterRegistry = meterRegistry;
        this.freePageSize = freePageSize;
    }

    @Override
    public int downgradeIfLapsed(String userId, Long pledgeId) {
        // Another user's pledge does not entitle this one
        Optional<Pledge> pledge = pledgeId == null
                ? Optional.empty()
                : pledgeRepository.findById(pledgeId).filter(p -> userId.equals(p.getUserId()));

        if (pledge.isPresent() && !pledge.get().isExpired()) {
            logger.debug("Pledge {} of user {} is active, nothing to downgrade", pledgeId, userId);
            return 0;
        }

        logger.info("Pledge {} of user {} lapsed, downgrading feeds", pledgeId, userId);
        return downgradeUser(userId);
    }

    @Override
    public int downgradeUser(String userId) {
        int changed = 0;

        for (String feedId : feedRepository.findFeedIdsByUserId(userId)) {
            // The index only holds keys; the feed may also have expired in the meantime
            Optional<Feed> stored = feedRepository.findById(feedId);
            if (stored.isEmpty()) {
                continue;
            }

            Feed feed = stored.get();
            boolean needsDowngrade = feed.getQuality() != Quality.LOW
                    || feed.getPageSize() == null
                    || feed.getPageSize() > freePageSize;
            if (!needsDowngrade) {
                continue;
            }

            feed.setQuality(Quality.LOW);
            feed.setPageSize(feed.getPageSize() == null ? freePageSize : Math.min(feed.getPageSize(), freePageSize));
            feedRepository.save(feed);
            changed++;
        }

        meterRegistry.counter("feed_downgrades").increment(changed);
        logger.info("Downgraded {} feeds of user {}", changed, userId);
        return changed;
    }
}
