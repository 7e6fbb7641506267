package com.bbthechange.podfeed.dto;

import com.bbthechange.podfeed.model.Quality;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to build a feed: which Vimeo page, at what quality, and roughly how many episodes.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FeedConfig {

    @NotBlank(message = "Feed URL is required")
    private String url;

    @NotNull(message = "Quality is required")
    private Quality quality;

    @NotNull(message = "Page size is required")
    @Positive(message = "Page size must be greater than zero")
    private Integer pageSize;
}
