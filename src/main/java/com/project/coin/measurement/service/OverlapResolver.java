package com.project.coin.measurement.service;

import com.project.coin.measurement.model.DetectedObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Collapses candidates that describe the same physical object.
 * <p>
 * Candidates are visited largest first (ties: lower id first). A candidate is dropped when its
 * center lies strictly closer than {@code tol * k.diameterPx} to an already kept object
 * {@code k}; otherwise it is kept. Kept objects keep their original ids and are returned in
 * visiting order.
 */
@Component
public class OverlapResolver {
    private static final Logger log = LoggerFactory.getLogger(OverlapResolver.class);

    static final Comparator<DetectedObject> LARGEST_FIRST =
            Comparator.comparingDouble(DetectedObject::diameterPx).reversed()
                    .thenComparingInt(DetectedObject::id);

    public List<DetectedObject> resolve(List<DetectedObject> candidates, double tol) {
        if (Double.isNaN(tol) || tol < 0) {
            throw new IllegalArgumentException("Tolerance must be a non-negative number: " + tol);
        }

        List<DetectedObject> sorted = new ArrayList<>(candidates);
        sorted.sort(LARGEST_FIRST);

        List<DetectedObject> kept = new ArrayList<>();
        for (DetectedObject o : sorted) {
            DetectedObject absorbedBy = firstWithinTolerance(o, kept, tol);
            if (absorbedBy != null) {
                log.debug("Dropping object {} ({} px), duplicate of object {}",
                        o.id(), o.diameterPx(), absorbedBy.id());
                continue;
            }
            kept.add(o);
        }
        return kept;
    }

    private static DetectedObject firstWithinTolerance(DetectedObject o, List<DetectedObject> kept, double tol) {
        for (DetectedObject k : kept) {
            if (o.center().distanceTo(k.center()) < tol * k.diameterPx()) {
                return k;
            }
        }
        return null;
    }
}
