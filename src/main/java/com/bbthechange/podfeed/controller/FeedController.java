package com.bbthechange.podfeed.controller;

import com.bbthechange.podfeed.dto.FeedConfig;
import com.bbthechange.podfeed.model.Feed;
import com.bbthechange.podfeed.service.FeedDowngradeService;
import com.bbthechange.podfeed.service.FeedService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST API for building and managing podcast feeds.
 */
@RestController
@Tag(name = "Feeds", description = "Podcast feeds built from Vimeo channels, groups and users")
public class FeedController {

    private final FeedService feedService;
    private final FeedDowngradeService feedDowngradeService;

    public FeedController(FeedService feedService, FeedDowngradeService feedDowngradeService) {
        this.feedService = feedService;
        this.feedDowngradeService = feedDowngradeService;
    }

    @PostMapping("/users/{userId}/feeds")
    @Operation(summary = "Create a feed",
              description = "Assembles a feed from a Vimeo link and stores it for the user.")
    public ResponseEntity<Feed> createFeed(
            @PathVariable String userId,
            @Valid @RequestBody FeedConfig config) {
        Feed feed = feedService.createFeed(userId, config);
        return ResponseEntity.status(HttpStatus.CREATED).body(feed);
    }

    @GetMapping("/users/{userId}/feeds")
    @Operation(summary = "List a user's feed ids", description = "Oldest feed first.")
    public ResponseEntity<List<String>> listFeeds(@PathVariable String userId) {
        return ResponseEntity.ok(feedService.getFeedIdsForUser(userId));
    }

    @GetMapping("/feeds/{feedId}")
    @Operation(summary = "Get a stored feed")
    public ResponseEntity<Feed> getFeed(@PathVariable String feedId) {
        return ResponseEntity.ok(feedService.getFeed(feedId));
    }

    @PostMapping("/feeds/{feedId}/refresh")
    @Operation(summary = "Re-assemble a feed",
              description = "Rebuilds the feed from Vimeo and replaces the stored copy.")
    public ResponseEntity<Feed> refreshFeed(@PathVariable String feedId) {
        return ResponseEntity.ok(feedService.refreshFeed(feedId));
    }

    @DeleteMapping("/feeds/{feedId}")
    @Operation(summary = "Delete a feed")
    public ResponseEntity<Void> deleteFeed(@PathVariable String feedId) {
        feedService.deleteFeed(feedId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/users/{userId}/downgrade")
    @Operation(summary = "Downgrade feeds of a lapsed pledge",
              description = "Lowers the user's feeds to the free tier unless the pledge is still active.")
    public ResponseEntity<Map<String, Integer>> downgrade(
            @PathVariable String userId,
            @Parameter(description = "Pledge the user was entitled through")
            @RequestParam(required = false) Long pledgeId) {
        int downgraded = feedDowngradeService.downgradeIfLapsed(userId, pledgeId);
        return ResponseEntity.ok(Map.of("downgraded", downgraded));
    }
}
