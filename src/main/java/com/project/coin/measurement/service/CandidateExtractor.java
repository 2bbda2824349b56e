package com.project.coin.measurement.service;

import com.project.coin.measurement.model.BinaryMask;
import com.project.coin.measurement.model.DetectedObject;
import com.project.coin.measurement.model.ImagePoint;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns the foreground regions of a mask into circle candidates.
 * <p>
 * Every 8-connected region contributes its outer contour, including regions sitting inside another
 * region's hole. Contours enclosing less than the minimum area are dropped; the minimal enclosing
 * circle of each remaining contour becomes a candidate. Candidates are numbered from 1 in raster
 * order of their topmost-leftmost pixel.
 */
public class CandidateExtractor {
    private static final Logger log = LoggerFactory.getLogger(CandidateExtractor.class);

    private static final Comparator<Point> RASTER_ORDER =
            Comparator.<Point>comparingDouble(p -> p.y).thenComparingDouble(p -> p.x);

    private final double minArea;

    public CandidateExtractor(double minArea) {
        if (Double.isNaN(minArea) || minArea < 0) {
            throw new IllegalArgumentException("Minimum area must be non-negative: " + minArea);
        }
        this.minArea = minArea;
    }

    /**
     * @param scale physical units per pixel, or {@code null} to leave physical sizes absent
     */
    public List<DetectedObject> extract(BinaryMask mask, Double scale) {
        OpenCvSupport.requireNatives();

        List<MatOfPoint> outer = outerContours(mask);
        outer.sort(Comparator.comparing(CandidateExtractor::firstPixel, RASTER_ORDER));

        List<DetectedObject> candidates = new ArrayList<>();
        int nextId = 1;
        int rejected = 0;

        for (MatOfPoint contour : outer) {
            double area = Imgproc.contourArea(contour);
            if (area < minArea) {
                rejected++;
                continue;
            }

            Point center = new Point();
            float[] radius = new float[1];
            Imgproc.minEnclosingCircle(new MatOfPoint2f(contour.toArray()), center, radius);
            double diameter = 2.0 * radius[0];
            if (!(diameter > 0)) {
                rejected++;
                continue;
            }
            candidates.add(DetectedObject.of(nextId++, new ImagePoint(center.x, center.y), diameter, scale));
        }

        log.debug("Extracted {} candidates from {}x{} mask ({} regions below {} px²)",
                candidates.size(), mask.width(), mask.height(), rejected, minArea);
        return candidates;
    }

    // Two-level hierarchy: top-level entries are outer boundaries, their children are holes.
    private static List<MatOfPoint> outerContours(BinaryMask mask) {
        Mat padded = new Mat();
        Core.copyMakeBorder(OpenCvSupport.toMat(mask), padded, 1, 1, 1, 1, Core.BORDER_CONSTANT, new Scalar(0));

        List<MatOfPoint> contours = new ArrayList<>();
        Mat hierarchy = new Mat();
        Imgproc.findContours(padded, contours, hierarchy, Imgproc.RETR_CCOMP,
                Imgproc.CHAIN_APPROX_SIMPLE, new Point(-1, -1));

        List<MatOfPoint> outer = new ArrayList<>();
        for (int i = 0; i < contours.size(); i++) {
            if (hierarchy.get(0, i)[3] < 0) {
                outer.add(contours.get(i));
            }
        }
        return outer;
    }

    private static Point firstPixel(MatOfPoint contour) {
        Point first = null;
        for (Point p : contour.toArray()) {
            if (first == null || RASTER_ORDER.compare(p, first) < 0) {
                first = p;
            }
        }
        return first;
    }
}
