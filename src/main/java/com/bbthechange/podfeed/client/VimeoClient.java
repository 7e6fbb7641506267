package com.bbthechange.podfeed.client;

import com.bbthechange.podfeed.config.VimeoProperties;
import com.bbthechange.podfeed.dto.PictureSize;
import com.bbthechange.podfeed.dto.PlatformVideo;
import com.bbthechange.podfeed.dto.SourceHeader;
import com.bbthechange.podfeed.dto.VideoPage;
import com.bbthechange.podfeed.dto.vimeo.VimeoPictures;
import com.bbthechange.podfeed.dto.vimeo.VimeoSourceResponse;
import com.bbthechange.podfeed.dto.vimeo.VimeoVideoListResponse;
import com.bbthechange.podfeed.dto.vimeo.VimeoVideoResponse;
import com.bbthechange.podfeed.exception.VimeoException;
import com.bbthechange.podfeed.model.SourceType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Client for the Vimeo REST API.
 * Channels, groups and users share one code path, parameterised by {@link SourceType}.
 * No retries: every failure is classified and surfaced to the caller.
 */
@Component
public class VimeoClient implements VideoPlatformClient {

    private static final Logger logger = LoggerFactory.getLogger(VimeoClient.class);

    private static final String USER_AGENT = "Podfeed/1.0";
    private static final String ACCEPT = "application/vnd.vimeo.*+json;version=3.4";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String accessToken;
    private final Duration requestTimeout;

    @Autowired
    public VimeoClient(ObjectMapper objectMapper, VimeoProperties properties) {
        this(HttpClient.newBuilder()
                        .connectTimeout(properties.getConnectionTimeout())
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build(),
                objectMapper,
                properties.getBaseUrl(),
                properties.getAccessToken(),
                properties.getRequestTimeout());
    }

    /**
     * Constructor for testing with custom HttpClient.
     */
    VimeoClient(HttpClient httpClient, ObjectMapper objectMapper, String baseUrl,
                String accessToken, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.accessToken = accessToken;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public SourceHeader getSourceHeader(SourceType sourceType, String id) {
        String path = "/" + sourceType.getPathSegment() + "/" + encode(id);

        VimeoSourceResponse source = fetch(path, VimeoSourceResponse.class);
        return toHeader(sourceType, source);
    }

    @Override
    public VideoPage listVideos(SourceType sourceType, String id, int page, int pageSize) {
        String path = "/" + sourceType.getPathSegment() + "/" + encode(id)
                + "/videos?page=" + page + "&per_page=" + pageSize;

        VimeoVideoListResponse response = fetch(path, VimeoVideoListResponse.class);

        List<PlatformVideo> videos = response.getData() == null
                ? new ArrayList<>()
                : response.getData().stream().map(this::toVideo).collect(Collectors.toList());
        String next = response.getPaging() != null ? response.getPaging().getNext() : null;

        logger.debug("Fetched {} videos for {} {} page {}, next page: {}",
                videos.size(), sourceType, id, page, next);
        return new VideoPage(videos, next);
    }

    /**
     * Make HTTP request to the Vimeo API and decode the body.
     * Messages only name the request; callers add what they were trying to do.
     */
    private <T> T fetch(String path, Class<T> type) {
        String url = baseUrl + path;
        String what = "Vimeo request GET " + path;

        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("User-Agent", USER_AGENT)
                .header("Accept", ACCEPT)
                .timeout(requestTimeout)
                .GET();
        if (accessToken != null && !accessToken.isBlank()) {
            request.header("Authorization", "bearer " + accessToken);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw VimeoException.classify(null, what + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw VimeoException.classify(null, what + " was interrupted", e);
        }

        int statusCode = response.statusCode();
        logger.debug("Vimeo API response status: {} for URL: {}", statusCode, url);

        if (statusCode < 200 || statusCode >= 300) {
            throw VimeoException.classify(statusCode, what + " failed", null);
        }

        T body;
        try {
            body = objectMapper.readValue(response.body(), type);
        } catch (JsonProcessingException e) {
            throw VimeoException.classify(statusCode, what + " returned an unreadable response", e);
        }

        // A literal JSON null decodes without error
        if (body == null) {
            throw VimeoException.classify(statusCode, what + " returned an empty response", null);
        }
        return body;
    }

    private SourceHeader toHeader(SourceType sourceType, VimeoSourceResponse source) {
        SourceHeader.SourceHeaderBuilder header = SourceHeader.builder()
                .title(source.getName())
                .link(source.getLink())
                .createdTime(parseTimestamp(source.getCreatedTime()))
                .pictures(sizes(source.getPictures()));

        if (sourceType == SourceType.USER) {
            header.description(source.getBio()).author(source.getName());
        } else {
            String owner = source.getUser() != null ? source.getUser().getName() : null;
            header.description(source.getDescription()).author(owner);
        }

        return header.build();
    }

    private PlatformVideo toVideo(VimeoVideoResponse video) {
        return PlatformVideo.builder()
                .id(video.getVideoId())
                .title(video.getName())
                .description(video.getDescription())
                .link(video.getLink())
                .duration(orZero(video.getDuration()))
                .width(orZero(video.getWidth()))
                .height(orZero(video.getHeight()))
                .createdTime(parseTimestamp(video.getCreatedTime()))
                .pictures(sizes(video.getPictures()))
                .build();
    }

    private static List<PictureSize> sizes(VimeoPictures pictures) {
        if (pictures == null || pictures.getSizes() == null) {
            return new ArrayList<>();
        }
        return pictures.getSizes();
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }

    private static String encode(String id) {
        return URLEncoder.encode(id, StandardCharsets.UTF_8);
    }

    /**
     * Convert a Vimeo timestamp (ISO 8601 with offset) to an Instant.
     *
     * @return the instant, or null if the timestamp is missing or malformed
     */
    static Instant parseTimestamp(String timestamp) {
        if (timestamp == null || timestamp.isEmpty()) {
            return null;
        }

        try {
            return OffsetDateTime.parse(timestamp).toInstant();
        } catch (DateTimeParseException e) {
            logger.warn("Failed to parse Vimeo timestamp: {}", timestamp);
            return null;
        }
    }
}
