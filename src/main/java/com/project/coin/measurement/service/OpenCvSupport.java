package com.project.coin.measurement.service;

import com.project.coin.measurement.exceptions.MeasurementException;
import com.project.coin.measurement.model.BinaryMask;
import nu.pattern.OpenCV;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;

/**
 * Loads the OpenCV natives once per JVM and converts between Java images, masks and {@link Mat}s.
 */
public final class OpenCvSupport {
    private static final Logger log = LoggerFactory.getLogger(OpenCvSupport.class);

    private static final boolean LOADED = loadNatives();

    private OpenCvSupport() {
    }

    private static boolean loadNatives() {
        try {
            OpenCV.loadLocally();
            log.info("OpenCV loaded successfully");
            return true;
        } catch (Throwable e) {
            log.error("Failed to load OpenCV", e);
            return false;
        }
    }

    public static boolean isAvailable() {
        return LOADED;
    }

    static void requireNatives() {
        if (!LOADED) {
            throw new MeasurementException("OpenCV native library is not available");
        }
    }

    /** 8-bit, 3-channel BGR copy of {@code image}. */
    static Mat toBgrMat(BufferedImage image) {
        final int w = image.getWidth(), h = image.getHeight();
        int[] rgb = image.getRGB(0, 0, w, h, null, 0, w);
        byte[] bgr = new byte[rgb.length * 3];
        for (int i = 0, j = 0; i < rgb.length; i++) {
            bgr[j++] = (byte) rgb[i];
            bgr[j++] = (byte) (rgb[i] >> 8);
            bgr[j++] = (byte) (rgb[i] >> 16);
        }
        Mat mat = new Mat(h, w, CvType.CV_8UC3);
        mat.put(0, 0, bgr);
        return mat;
    }

    /** Foreground pixels become 255, background 0. */
    static Mat toMat(BinaryMask mask) {
        boolean[] fg = mask.toArray();
        byte[] data = new byte[fg.length];
        for (int i = 0; i < fg.length; i++) {
            if (fg[i]) data[i] = (byte) 255;
        }
        Mat mat = new Mat(mask.height(), mask.width(), CvType.CV_8UC1);
        mat.put(0, 0, data);
        return mat;
    }

    /** Any non-zero pixel of a single-channel 8-bit {@code mat} is foreground. */
    static BinaryMask toMask(Mat mat) {
        byte[] data = new byte[mat.rows() * mat.cols()];
        mat.get(0, 0, data);
        boolean[] fg = new boolean[data.length];
        for (int i = 0; i < data.length; i++) {
            fg[i] = data[i] != 0;
        }
        return new BinaryMask(mat.cols(), mat.rows(), fg);
    }
}
