package com.bbthechange.podfeed.util;

import com.bbthechange.podfeed.dto.SourceLink;
import com.bbthechange.podfeed.exception.FeedBuildException;
import com.bbthechange.podfeed.model.SourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Classifies a Vimeo page URL as a channel, group or user.
 *
 * Accepted forms (scheme and "www." optional):
 * vimeo.com/channels/{id}, vimeo.com/groups/{id}, vimeo.com/{user}
 */
@Component
public class VimeoLinkParser {

    private static final Logger logger = LoggerFactory.getLogger(VimeoLinkParser.class);

    private static final String HOST = "vimeo.com";

    // Top-level Vimeo sections that are not user pages
    private static final Set<String> RESERVED_PATHS = Set.of(
            "album", "blog", "categories", "channels", "groups", "ondemand",
            "search", "showcase", "watch", "upload", "settings", "features");

    /**
     * @throws FeedBuildException UNSUPPORTED_SOURCE if the URL is not a channel, group or user page
     */
    public SourceLink parse(String url) {
        List<String> segments = pathSegments(url);

        if (segments.isEmpty()) {
            throw rejected(url);
        }

        String first = segments.get(0).toLowerCase(Locale.ROOT);
        if (first.equals("channels") || first.equals("groups")) {
            if (segments.size() < 2) {
                throw rejected(url);
            }
            SourceType type = first.equals("channels") ? SourceType.CHANNEL : SourceType.GROUP;
            return new SourceLink(type, segments.get(1));
        }

        // Bare numbers are single videos
        if (RESERVED_PATHS.contains(first) || first.chars().allMatch(Character::isDigit)) {
            throw rejected(url);
        }

        return new SourceLink(SourceType.USER, segments.get(0));
    }

    private List<String> pathSegments(String url) {
        if (url == null || url.isBlank()) {
            throw rejected(url);
        }

        String candidate = url.trim();
        if (!candidate.contains("://")) {
            candidate = "https://" + candidate;
        }

        URI uri;
        try {
            uri = new URI(candidate);
        } catch (URISyntaxException e) {
            throw rejected(url);
        }

        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
        if (host.startsWith("www.")) {
            host = host.substring(4);
        }

        if (!(scheme.equals("http") || scheme.equals("https")) || !host.equals(HOST)) {
            throw rejected(url);
        }

        String path = uri.getPath() == null ? "" : uri.getPath();
        return Arrays.stream(path.split("/"))
                .filter(segment -> !segment.isEmpty())
                .collect(Collectors.toList());
    }

    private static FeedBuildException rejected(String url) {
        logger.warn("Rejected feed link: {}", url);
        return FeedBuildException.unsupportedLink(url);
    }
}
