package com.project.coin.measurement.model;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Result handed to presentation: the normalized image and its read-only object list.
 *
 * @param scale physical units per normalized pixel used for this image, or {@code null}
 */
public record MeasuredImage(String name, BufferedImage image, List<DetectedObject> objects, Double scale) {

    public MeasuredImage {
        objects = List.copyOf(objects);
    }

    public int width() {
        return image.getWidth();
    }

    public int height() {
        return image.getHeight();
    }
}
