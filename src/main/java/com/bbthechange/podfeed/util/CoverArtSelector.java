package com.bbthechange.podfeed.util;

import com.bbthechange.podfeed.dto.PictureSize;
import com.bbthechange.podfeed.model.Quality;

import java.util.List;

/**
 * Picks an image out of the size ladder Vimeo returns for a picture.
 * Vimeo orders sizes from the smallest to the largest rendition.
 */
public final class CoverArtSelector {

    private CoverArtSelector() {
    }

    /**
     * @return the smallest rendition for LOW quality, the largest otherwise,
     *         or an empty string when there are no renditions
     */
    public static String select(List<PictureSize> sizes, Quality quality) {
        if (sizes == null || sizes.isEmpty()) {
            return "";
        }

        if (quality == Quality.LOW) {
            return sizes.get(0).getLink();
        }

        return sizes.get(sizes.size() - 1).getLink();
    }
}
