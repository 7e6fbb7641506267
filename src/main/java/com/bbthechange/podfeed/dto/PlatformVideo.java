package com.bbthechange.podfeed.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlatformVideo {
    private String id;
    private String title;
    private String description;
    private String link;
    private int duration;   // seconds
    private int width;
    private int height;
    private Instant createdTime;
    @Builder.Default
    private List<PictureSize> pictures = new ArrayList<>();
}
