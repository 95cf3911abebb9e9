package io.hearthwarrio.remoteui.device;

import io.hearthwarrio.remoteui.core.ActionArgumentException;

/**
 * Gesture margins: either in pixels or as a percentage of the element size, never both.
 */
final class Margins {

    static final Margins NONE = new Margins(null, null);

    private final Integer pixels;
    private final Integer percent;

    private Margins(Integer pixels, Integer percent) {
        this.pixels = pixels;
        this.percent = percent;
    }

    /**
     * @throws ActionArgumentException if both values are given
     */
    static Margins of(String operation, Integer pixels, Integer percent) {
        if (pixels != null && percent != null) {
            throw new ActionArgumentException(operation,
                    "pixel-based and percentage-based margin cannot be mixed, got margin=" + pixels
                            + ", percent=" + percent);
        }
        return new Margins(pixels, percent);
    }

    Integer pixels() {
        return pixels;
    }

    Integer percent() {
        return percent;
    }
}
