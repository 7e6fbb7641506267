package com.bbthechange.podfeed.service.impl;

import com.bbthechange.podfeed.config.StorageProperties;
import com.bbthechange.podfeed.dto.FeedConfig;
import com.bbthechange.podfeed.exception.FeedBuildException;
import com.bbthechange.podfeed.exception.FeedNotFoundException;
import com.bbthechange.podfeed.model.Feed;
import com.bbthechange.podfeed.repository.FeedRepository;
import com.bbthechange.podfeed.service.FeedBuilder;
import com.bbthechange.podfeed.service.FeedService;
import com.bbthechange.podfeed.util.FeedIdGenerator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Service
public class FeedServiceImpl implements FeedService {

    private static final Logger logger = LoggerFactory.getLogger(FeedServiceImpl.class);

    private final FeedBuilder feedBuilder;
    private final FeedRepository feedRepository;
    private final MeterRegistry meterRegistry;
    private final Duration feedTtl;

    public FeedServiceImpl(FeedBuilder feedBuilder,
                           FeedRepository feedRepository,
                           MeterRegistry meterRegistry,
                           StorageProperties storageProperties) {
        this.feedBuilder = feedBuilder;
        this.feedRepository = feedRepository;
        this.meterRegistry = meterRegistry;
        this.feedTtl = storageProperties.getFeedTtl();
    }

    @Override
    public Feed createFeed(String userId, FeedConfig config) {
        Feed feed = timedBuild(config);

        Instant now = Instant.now();
        feed.setId(FeedIdGenerator.generateUnique(id -> feedRepository.findById(id).isPresent()));
        feed.setUserId(userId);
        feed.setCreatedAt(now.getEpochSecond());
        feed.setExpirationTime(now.plus(feedTtl).getEpochSecond());

        feedRepository.save(feed);
        logger.info("Created feed {} for user {} from {}", feed.getId(), userId, config.getUrl());
        return feed;
    }

    @Override
    public Feed refreshFeed(String feedId) {
        Feed existing = getFeed(feedId);

        FeedConfig config = new FeedConfig(existing.getUrl(), existing.getQuality(), existing.getPageSize());
        Feed rebuilt = timedBuild(config);

        rebuilt.setId(existing.getId());
        rebuilt.setUserId(existing.getUserId());
        rebuilt.setCreatedAt(existing.getCreatedAt());
        rebuilt.setExpirationTime(Instant.now().plus(feedTtl).getEpochSecond());

        feedRepository.save(rebuilt);
        logger.info("Refreshed feed {} ({} episodes)", feedId, rebuilt.getEpisodes().size());
        return rebuilt;
    }

    @Override
    public Feed getFeed(String feedId) {
        return feedRepository.findById(feedId)
                .orElseThrow(() -> new FeedNotFoundException(feedId));
    }

    @Override
    public List<String> getFeedIdsForUser(String userId) {
        return feedRepository.findFeedIdsByUserId(userId);
    }

    @Override
    public void deleteFeed(String feedId) {
        feedRepository.deleteById(feedId);
        logger.info("Deleted feed {}", feedId);
    }

    private Feed timedBuild(FeedConfig config) {
        Timer.Sample timer = Timer.start(meterRegistry);
        String outcome = "success";
        try {
            return feedBuilder.build(config);
        } catch (FeedBuildException e) {
            outcome = e.getErrorType().name().toLowerCase();
            throw e;
        } catch (RuntimeException e) {
            outcome = "error";
            throw e;
        } finally {
            timer.stop(Timer.builder("feed_build_duration")
                    .tag("outcome", outcome)
                    .register(meterRegistry));
        }
    }
}
