package com.project.coin.measurement.model;

/**
 * A point in the pixel space of the normalized working image. Coordinates keep the
 * sub-pixel precision of whatever produced them.
 */
public record ImagePoint(double x, double y) {

    public ImagePoint {
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new IllegalArgumentException("Point coordinates must be finite: (" + x + ", " + y + ")");
        }
    }

    /**
     * Euclidean distance. Overlap resolution and object lookup both measure with this.
     */
    public double distanceTo(ImagePoint other) {
        return Math.hypot(x - other.x, y - other.y);
    }

    public ImagePoint scale(double factor) {
        return new ImagePoint(x * factor, y * factor);
    }
}
