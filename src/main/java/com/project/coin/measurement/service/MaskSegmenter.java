package com.project.coin.measurement.service;

import com.project.coin.measurement.model.BinaryMask;

import java.awt.image.BufferedImage;

/**
 * Separates objects from background. The mask has the dimensions of the given (already
 * normalized) image and marks objects as filled foreground blobs; holes inside objects may or
 * may not be filled.
 */
public interface MaskSegmenter {

    BinaryMask segment(BufferedImage normalized);
}
