package com.bbthechange.podfeed.dto.vimeo;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of GET /channels/{id}, /groups/{id} and /users/{id}.
 * Channels and groups fill description and user; users fill bio instead.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class VimeoSourceResponse {

    private String name;

    private String link;

    private String description;

    private String bio;

    private VimeoPictures pictures;

    /**
     * Owner of a channel or group.
     */
    private VimeoOwner user;

    /**
     * ISO 8601 timestamp, e.g. "2014-01-10T16:09:45+00:00".
     */
    @JsonProperty("created_time")
    private String createdTime;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class VimeoOwner {
        private String name;
    }
}
