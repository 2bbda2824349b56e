package com.project.coin.measurement.model;

import java.util.Arrays;

/**
 * Row-major foreground/background classification of the normalized image.
 * {@code true} marks object (foreground) pixels.
 */
public final class BinaryMask {

    private final int width;
    private final int height;
    private final boolean[] pixels;

    public BinaryMask(int width, int height, boolean[] pixels) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Mask dimensions must be positive: " + width + "x" + height);
        }
        if (pixels == null || pixels.length != width * height) {
            throw new IllegalArgumentException("Mask data does not match " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.pixels = Arrays.copyOf(pixels, pixels.length);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public boolean isForeground(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height && pixels[y * width + x];
    }

    /** Copy of the underlying row-major data. */
    public boolean[] toArray() {
        return Arrays.copyOf(pixels, pixels.length);
    }
}
