package com.project.coin.measurement.model;

import java.util.Locale;
import java.util.Optional;

/**
 * One measured object: the minimal enclosing circle of a segmented region.
 *
 * @param id               positive, unique within one image's result set, assigned in discovery
 *                         order and kept as-is when duplicates are removed
 * @param center           circle center in normalized-image pixels
 * @param diameterPx       circle diameter in normalized-image pixels
 * @param diameterPhysical {@code diameterPx * scale}, or {@code null} when no scale is configured
 */
public record DetectedObject(int id, ImagePoint center, double diameterPx, Double diameterPhysical) {

    public DetectedObject {
        if (id <= 0) {
            throw new IllegalArgumentException("Object id must be positive: " + id);
        }
        if (center == null) {
            throw new IllegalArgumentException("Object center is required");
        }
        if (!(diameterPx > 0) || Double.isInfinite(diameterPx)) {
            throw new IllegalArgumentException("Object diameter must be positive and finite: " + diameterPx);
        }
    }

    public static DetectedObject of(int id, ImagePoint center, double diameterPx, Double scale) {
        return new DetectedObject(id, center, diameterPx, scale == null ? null : diameterPx * scale);
    }

    public double radiusPx() {
        return diameterPx / 2;
    }

    public Optional<Double> physicalDiameter() {
        return Optional.ofNullable(diameterPhysical);
    }

    /**
     * Human-readable size, e.g. {@code Object 3: 81.4 px, 24.42 mm}.
     */
    public String describe() {
        String msg = String.format(Locale.ROOT, "Object %d: %.1f px", id, diameterPx);
        if (diameterPhysical != null) {
            msg += String.format(Locale.ROOT, ", %.2f mm", diameterPhysical);
        }
        return msg;
    }
}
