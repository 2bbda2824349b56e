package com.project.coin.measurement.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Decodes images and brings them to the working resolution: at most {@code maxWidth} pixels
 * wide, aspect ratio preserved. All measurements are taken at this resolution.
 */
public class ImageNormalizer {
    private static final Logger log = LoggerFactory.getLogger(ImageNormalizer.class);

    private final int maxWidth;

    public ImageNormalizer(int maxWidth) {
        if (maxWidth <= 0) {
            throw new IllegalArgumentException("Maximum width must be positive: " + maxWidth);
        }
        this.maxWidth = maxWidth;
    }

    /**
     * @return the decoded image, or empty when the file is missing or not a decodable image
     */
    public Optional<BufferedImage> read(Path file) {
        if (!Files.isRegularFile(file)) {
            log.warn("Not a readable file: {}", file);
            return Optional.empty();
        }
        try (InputStream in = Files.newInputStream(file)) {
            Optional<BufferedImage> image = read(in);
            if (image.isEmpty()) {
                log.warn("Could not decode image {}", file);
            }
            return image;
        } catch (IOException e) {
            log.warn("Could not read image {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<BufferedImage> read(InputStream in) throws IOException {
        return Optional.ofNullable(ImageIO.read(in));
    }

    public BufferedImage normalize(BufferedImage input) {
        int w = input.getWidth(), h = input.getHeight();
        int targetW = w, targetH = h;
        if (w > maxWidth) {
            double f = maxWidth / (double) w;
            targetW = maxWidth;
            targetH = Math.max(1, (int) Math.round(h * f));
            log.debug("Resizing {}x{} to {}x{}", w, h, targetW, targetH);
        }

        BufferedImage out = new BufferedImage(targetW, targetH, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = out.createGraphics();
        g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
        g.drawImage(input, 0, 0, targetW, targetH, null);
        g.dispose();
        return out;
    }
}
