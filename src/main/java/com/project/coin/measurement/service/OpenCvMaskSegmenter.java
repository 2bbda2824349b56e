package com.project.coin.measurement.service;

import com.project.coin.measurement.exceptions.MeasurementException;
import com.project.coin.measurement.model.BinaryMask;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;

/**
 * OpenCV segmentation: gray, Gaussian 5x5, inverted Otsu threshold, elliptical close x2 / open x1.
 */
public class OpenCvMaskSegmenter implements MaskSegmenter {
    private static final Logger log = LoggerFactory.getLogger(OpenCvMaskSegmenter.class);

    @Override
    public BinaryMask segment(BufferedImage input) {
        if (input == null) {
            throw new MeasurementException("No image to segment");
        }
        if (!OpenCvSupport.isAvailable()) {
            throw new MeasurementException("OpenCV native library is not available; set measure.segmenter=java");
        }
        try {
            Mat image = OpenCvSupport.toBgrMat(input);
            Mat gray = new Mat();
            Mat blurred = new Mat();
            Mat mask = new Mat();

            Imgproc.cvtColor(image, gray, Imgproc.COLOR_BGR2GRAY);
            Imgproc.GaussianBlur(gray, blurred, new Size(5, 5), 0);
            double thr = Imgproc.threshold(blurred, mask, 0, 255, Imgproc.THRESH_BINARY_INV + Imgproc.THRESH_OTSU);
            log.debug("Otsu threshold: {}", thr);

            Mat kernel = Imgproc.getStructuringElement(Imgproc.MORPH_ELLIPSE, new Size(5, 5));
            Mat clean = new Mat();
            Imgproc.morphologyEx(mask, clean, Imgproc.MORPH_CLOSE, kernel, new Point(-1, -1), 2);
            Imgproc.morphologyEx(clean, clean, Imgproc.MORPH_OPEN, kernel, new Point(-1, -1), 1);

            return OpenCvSupport.toMask(clean);
        } catch (Exception e) {
            log.error("OpenCV segmentation failed", e);
            throw new MeasurementException("OpenCV segmentation failed: " + e.getMessage(), e);
        }
    }
}
