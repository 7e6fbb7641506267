package com.bbthechange.podfeed.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Feed-level metadata of a channel, group or user, independent of which kind it is.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceHeader {
    private String title;
    private String link;
    private String description;
    private String author;
    private Instant createdTime;
    @Builder.Default
    private List<PictureSize> pictures = new ArrayList<>();
}
