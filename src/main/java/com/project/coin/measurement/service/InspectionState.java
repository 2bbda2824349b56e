package com.project.coin.measurement.service;

import com.project.coin.measurement.model.DetectedObject;
import com.project.coin.measurement.model.ImagePoint;
import com.project.coin.measurement.model.MeasuredImage;

import java.util.Optional;

/**
 * What the user is looking at: the current image with its objects and, optionally, the object
 * last picked with the pointer. Immutable; every interaction returns the next state.
 */
public record InspectionState(MeasuredImage image, DetectedObject selected) {

    public InspectionState {
        if (image == null) {
            throw new IllegalArgumentException("Inspection needs an image");
        }
    }

    public static InspectionState of(MeasuredImage image) {
        return new InspectionState(image, null);
    }

    /**
     * Pointer handler. A point that hits no object returns this same instance; a hit always
     * returns a new state.
     */
    public InspectionState select(ImagePoint point, ObjectLookup lookup) {
        return lookup.find(image.objects(), point)
                .map(o -> new InspectionState(image, o))
                .orElse(this);
    }

    public Optional<DetectedObject> selection() {
        return Optional.ofNullable(selected);
    }
}
