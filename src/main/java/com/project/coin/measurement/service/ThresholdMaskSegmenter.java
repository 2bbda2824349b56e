package com.project.coin.measurement.service;

import com.project.coin.measurement.exceptions.MeasurementException;
import com.project.coin.measurement.model.BinaryMask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Pure Java segmentation for dark objects on a light background: grayscale, 5x5 Gaussian blur,
 * inverted Otsu threshold, then closing (2 iterations) and opening (1 iteration) with a 5x5
 * elliptical element. Needs no native libraries.
 */
public class ThresholdMaskSegmenter implements MaskSegmenter {
    private static final Logger log = LoggerFactory.getLogger(ThresholdMaskSegmenter.class);

    private static final double[] GAUSS_5 = {1 / 16.0, 4 / 16.0, 6 / 16.0, 4 / 16.0, 1 / 16.0};

    // 5x5 ellipse: full middle three rows, single centre pixel on the outer rows.
    private static final int[][] ELLIPSE_5 = buildEllipse5();

    @Override
    public BinaryMask segment(BufferedImage input) {
        if (input == null) {
            throw new MeasurementException("No image to segment");
        }
        final int w = input.getWidth(), h = input.getHeight();

        int[] gray = toGray(input);
        int[] blurred = gaussianBlur5(gray, w, h);
        int[] histogram = new int[256];
        for (int v : blurred) histogram[v]++;
        int thr = otsuThreshold(histogram);
        log.debug("Otsu threshold: {}", thr);

        boolean[] fg = new boolean[w * h];
        for (int i = 0; i < fg.length; i++) {
            fg[i] = blurred[i] <= thr;
        }

        fg = morphClose(fg, w, h, 2);
        fg = morphOpen(fg, w, h, 1);
        return new BinaryMask(w, h, fg);
    }

    static int[] toGray(BufferedImage input) {
        final int w = input.getWidth(), h = input.getHeight();
        int[] argb = new int[w * h];
        input.getRGB(0, 0, w, h, argb, 0, w);

        int[] gray = new int[w * h];
        for (int i = 0; i < argb.length; i++) {
            int p = argb[i];
            int r = (p >> 16) & 0xFF, g = (p >> 8) & 0xFF, b = p & 0xFF;
            gray[i] = (int) Math.round(0.299 * r + 0.587 * g + 0.114 * b);
        }
        return gray;
    }

    static int[] gaussianBlur5(int[] src, int w, int h) {
        double[] tmp = new double[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                double acc = 0;
                for (int k = -2; k <= 2; k++) {
                    acc += GAUSS_5[k + 2] * src[y * w + reflect(x + k, w)];
                }
                tmp[y * w + x] = acc;
            }
        }

        int[] dst = new int[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                double acc = 0;
                for (int k = -2; k <= 2; k++) {
                    acc += GAUSS_5[k + 2] * tmp[reflect(y + k, h) * w + x];
                }
                dst[y * w + x] = Math.min(255, (int) Math.round(acc));
            }
        }
        return dst;
    }

    // reflect-101 border: -1 -> 1, n -> n - 2
    private static int reflect(int i, int n) {
        if (n == 1) return 0;
        while (i < 0 || i >= n) {
            if (i < 0) i = -i;
            if (i >= n) i = 2 * n - 2 - i;
        }
        return i;
    }

    /**
     * Otsu's method on a 256-bin histogram: the first level maximizing the between-class variance,
     * with levels {@code <= t} forming one class.
     */
    static int otsuThreshold(int[] histogram) {
        long count = 0, total = 0;
        for (int v = 0; v < histogram.length; v++) {
            count += histogram[v];
            total += (long) v * histogram[v];
        }

        long lowCount = 0, lowTotal = 0;
        double best = -1.0;
        int threshold = 0;
        for (int t = 0; t < histogram.length; t++) {
            lowCount += histogram[t];
            lowTotal += (long) t * histogram[t];
            long highCount = count - lowCount;
            if (lowCount == 0 || highCount == 0) continue;

            // count^2 times the between-class variance
            double spread = (double) lowTotal * highCount - (double) (total - lowTotal) * lowCount;
            double score = spread * spread / ((double) lowCount * highCount);
            if (score > best) {
                best = score;
                threshold = t;
            }
        }
        return threshold;
    }

    static boolean[] erode(boolean[] src, int w, int h) {
        boolean[] dst = new boolean[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int idx = y * w + x;
                if (!src[idx]) continue;

                boolean keep = true;
                for (int[] o : ELLIPSE_5) {
                    int xx = x + o[0], yy = y + o[1];
                    if (xx >= 0 && xx < w && yy >= 0 && yy < h && !src[yy * w + xx]) {
                        keep = false;
                        break;
                    }
                }
                dst[idx] = keep;
            }
        }
        return dst;
    }

    static boolean[] dilate(boolean[] src, int w, int h) {
        boolean[] dst = new boolean[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int idx = y * w + x;
                boolean hit = src[idx];
                for (int i = 0; i < ELLIPSE_5.length && !hit; i++) {
                    int xx = x + ELLIPSE_5[i][0], yy = y + ELLIPSE_5[i][1];
                    if (xx >= 0 && xx < w && yy >= 0 && yy < h && src[yy * w + xx]) {
                        hit = true;
                    }
                }
                dst[idx] = hit;
            }
        }
        return dst;
    }

    // iterations apply all dilations first, then all erosions
    static boolean[] morphClose(boolean[] src, int w, int h, int iters) {
        boolean[] out = Arrays.copyOf(src, src.length);
        for (int i = 0; i < iters; i++) out = dilate(out, w, h);
        for (int i = 0; i < iters; i++) out = erode(out, w, h);
        return out;
    }

    static boolean[] morphOpen(boolean[] src, int w, int h, int iters) {
        boolean[] out = Arrays.copyOf(src, src.length);
        for (int i = 0; i < iters; i++) out = erode(out, w, h);
        for (int i = 0; i < iters; i++) out = dilate(out, w, h);
        return out;
    }

    private static int[][] buildEllipse5() {
        int[][] offsets = new int[17][];
        int n = 0;
        for (int dy = -2; dy <= 2; dy++) {
            for (int dx = -2; dx <= 2; dx++) {
                if (Math.abs(dy) == 2 && dx != 0) continue;
                offsets[n++] = new int[]{dx, dy};
            }
        }
        return offsets;
    }
}
