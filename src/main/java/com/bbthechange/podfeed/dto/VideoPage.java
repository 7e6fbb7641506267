package com.bbthechange.podfeed.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One page of a video listing. nextPage is empty on the last page.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class VideoPage {
    private List<PlatformVideo> videos = new ArrayList<>();
    private String nextPage;

    public boolean hasNextPage() {
        return nextPage != null && !nextPage.isEmpty();
    }
}
