package com.bbthechange.podfeed.client;

import com.bbthechange.podfeed.dto.SourceHeader;
import com.bbthechange.podfeed.dto.VideoPage;
import com.bbthechange.podfeed.exception.VimeoException;
import com.bbthechange.podfeed.model.SourceType;

/**
 * Read access to a video platform. Implementations must be safe to share between threads.
 */
public interface VideoPlatformClient {

    /**
     * Fetch feed-level metadata of a channel, group or user.
     *
     * @throws VimeoException NOT_FOUND when the source does not exist, TRANSIENT otherwise
     */
    SourceHeader getSourceHeader(SourceType sourceType, String id);

    /**
     * Fetch one page (1-based) of the source's videos.
     *
     * @throws VimeoException on any failure
     */
    VideoPage listVideos(SourceType sourceType, String id, int page, int pageSize);
}
