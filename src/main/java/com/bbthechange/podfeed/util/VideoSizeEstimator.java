package com.bbthechange.podfeed.util;

/**
 * Approximates the download size of a Vimeo video. Vimeo does not report file sizes in
 * listings, but podcast enclosures need one.
 */
public final class VideoSizeEstimator {

    static final double BYTES_PER_PIXEL_SECOND = 0.38848958333;

    private VideoSizeEstimator() {
    }

    /**
     * Size grows linearly with duration: the per-second rate is truncated first so that
     * twice the duration gives exactly twice the size.
     *
     * @param durationSeconds video length in seconds
     * @param width frame width in pixels
     * @param height frame height in pixels
     * @return approximate size in bytes, never negative
     */
    public static long estimate(long durationSeconds, int width, int height) {
        if (durationSeconds <= 0 || width <= 0 || height <= 0) {
            return 0L;
        }
        long bytesPerSecond = (long) ((long) width * height * BYTES_PER_PIXEL_SECOND);
        return durationSeconds * bytesPerSecond;
    }
}
