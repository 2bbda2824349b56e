package com.project.coin.measurement.service;

import com.project.coin.measurement.model.DetectedObject;
import com.project.coin.measurement.model.ImagePoint;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Finds the object under a pointer position: the nearest center wins, but only if the
 * point falls inside that object's circle.
 */
@Component
public class ObjectLookup {

    public Optional<DetectedObject> find(List<DetectedObject> objects, ImagePoint query) {
        DetectedObject nearest = null;
        double best = Double.POSITIVE_INFINITY;
        for (DetectedObject o : objects) {
            double d = query.distanceTo(o.center());
            if (d < best) {
                best = d;
                nearest = o;
            }
        }
        if (nearest == null || best > nearest.radiusPx()) {
            return Optional.empty();
        }
        return Optional.of(nearest);
    }
}
