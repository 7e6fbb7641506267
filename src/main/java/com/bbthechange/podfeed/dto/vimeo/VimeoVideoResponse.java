package com.bbthechange.podfeed.dto.vimeo;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of the data array returned by the /videos listings.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class VimeoVideoResponse {

    /**
     * Resource path, e.g. "/videos/76979871".
     */
    private String uri;

    private String name;

    private String description;

    private String link;

    /**
     * Length in seconds.
     */
    private Integer duration;

    private Integer width;

    private Integer height;

    @JsonProperty("created_time")
    private String createdTime;

    private VimeoPictures pictures;

    /**
     * Numeric video id taken from the last segment of the uri.
     */
    public String getVideoId() {
        if (uri == null) {
            return null;
        }
        int slash = uri.lastIndexOf('/');
        return slash >= 0 ? uri.substring(slash + 1) : uri;
    }
}
