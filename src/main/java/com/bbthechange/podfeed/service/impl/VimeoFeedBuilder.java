package com.bbthechange.podfeed.service.impl;

import com.bbthechange.podfeed.client.VideoPlatformClient;
import com.bbthechange.podfeed.config.VimeoProperties;
import com.bbthechange.podfeed.dto.FeedConfig;
import com.bbthechange.podfeed.dto.PlatformVideo;
import com.bbthechange.podfeed.dto.SourceHeader;
import com.bbthechange.podfeed.dto.SourceLink;
import com.bbthechange.podfeed.dto.VideoPage;
import com.bbthechange.podfeed.exception.FeedBuildException;
import com.bbthechange.podfeed.exception.VimeoException;
import com.bbthechange.podfeed.model.Feed;
import com.bbthechange.podfeed.model.Item;
import com.bbthechange.podfeed.model.SourceType;
import com.bbthechange.podfeed.service.FeedBuilder;
import com.bbthechange.podfeed.util.CoverArtSelector;
import com.bbthechange.podfeed.util.VideoSizeEstimator;
import com.bbthechange.podfeed.util.VimeoLinkParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Builds feeds from Vimeo channels, groups and users.
 * Stateless; platform calls within one build are strictly sequential.
 */
@Service
public class VimeoFeedBuilder implements FeedBuilder {

    private static final Logger logger = LoggerFactory.getLogger(VimeoFeedBuilder.class);

    private final VideoPlatformClient platformClient;
    private final VimeoLinkParser linkParser;
    private final int platformPageSize;

    @Autowired
    public VimeoFeedBuilder(VideoPlatformClient platformClient, VimeoLinkParser linkParser,
                            VimeoProperties vimeoProperties) {
        this(platformClient, linkParser, vimeoProperties.getPageSize());
    }

    /**
     * Package-private constructor for testing.
     */
    VimeoFeedBuilder(VideoPlatformClient platformClient, VimeoLinkParser linkParser, int platformPageSize) {
        this.platformClient = platformClient;
        this.linkParser = linkParser;
        this.platformPageSize = platformPageSize;
    }

    @Override
    public Feed build(FeedConfig config) {
        SourceLink link = linkParser.parse(config.getUrl());
        logger.info("Building feed for {} {} (quality {}, page size {})",
                link.getSourceType(), link.getItemId(), config.getQuality(), config.getPageSize());

        Feed feed = new Feed();
        feed.setUrl(config.getUrl());
        feed.setQuality(config.getQuality());
        feed.setPageSize(config.getPageSize());
        feed.setSourceType(link.getSourceType());
        feed.setItemId(link.getItemId());

        queryHeader(feed);
        queryVideos(feed);

        logger.info("Built feed for {} {} with {} episodes",
                link.getSourceType(), link.getItemId(), feed.getEpisodes().size());
        return feed;
    }

    private void queryHeader(Feed feed) {
        SourceType sourceType = feed.getSourceType();
        String itemId = feed.getItemId();

        SourceHeader header;
        try {
            header = platformClient.getSourceHeader(sourceType, itemId);
        } catch (VimeoException e) {
            if (e.isNotFound()) {
                throw FeedBuildException.sourceNotFound(sourceType, itemId, e);
            }
            throw FeedBuildException.transientFailure(sourceType, itemId,
                    "failed to query " + sourceType.name().toLowerCase() + " with id \"" + itemId + "\"", e);
        }

        feed.setTitle(header.getTitle());
        feed.setItemUrl(header.getLink());
        feed.setDescription(header.getDescription());
        feed.setCoverArt(CoverArtSelector.select(header.getPictures(), feed.getQuality()));
        feed.setAuthor(header.getAuthor());
        feed.setPubDate(header.getCreatedTime());
        feed.setUpdatedAt(Instant.now());
    }

    /**
     * Pages are consumed whole; the pageSize limit is only checked between pages,
     * so a feed can hold up to one platform page more than asked for.
     */
    private void queryVideos(Feed feed) {
        SourceType sourceType = feed.getSourceType();
        String itemId = feed.getItemId();
        int page = 1;
        int added = 0;

        while (true) {
            VideoPage videos;
            try {
                videos = platformClient.listVideos(sourceType, itemId, page, platformPageSize);
            } catch (VimeoException e) {
                // A 404 mid-listing is unexpected and treated like any other failure
                String status = e.getStatusCode() != null ? " (error " + e.getStatusCode() + ")" : "";
                throw FeedBuildException.transientFailure(sourceType, itemId,
                        "failed to query videos" + status, e);
            }

            for (PlatformVideo video : videos.getVideos()) {
                feed.addEpisode(toItem(video, feed));
                added++;
            }

            if (added >= feed.getPageSize() || !videos.hasNextPage()) {
                return;
            }

            page++;
        }
    }

    private Item toItem(PlatformVideo video, Feed feed) {
        return Item.builder()
                .id(video.getId())
                .title(video.getTitle())
                .description(video.getDescription())
                .duration((long) video.getDuration())
                .size(VideoSizeEstimator.estimate(video.getDuration(), video.getWidth(), video.getHeight()))
                .pubDate(video.getCreatedTime())
                .thumbnail(CoverArtSelector.select(video.getPictures(), feed.getQuality()))
                .videoUrl(video.getLink())
                .build();
    }
}
