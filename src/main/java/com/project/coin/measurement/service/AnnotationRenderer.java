package com.project.coin.measurement.service;

import com.project.coin.measurement.exceptions.MeasurementException;
import com.project.coin.measurement.model.DetectedObject;
import com.project.coin.measurement.model.MeasuredImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;

/**
 * Draws the detected circles and their ids over the normalized image. Drawing is aliased so
 * outlines keep their exact colors.
 */
@Component
public class AnnotationRenderer {
    private static final Logger log = LoggerFactory.getLogger(AnnotationRenderer.class);

    static final Color OBJECT_COLOR   = new Color(0, 255, 0);
    static final Color LABEL_COLOR    = new Color(0, 0, 255);
    static final Color SELECTED_COLOR = new Color(255, 0, 0);

    private static final Font LABEL_FONT = new Font(Font.SANS_SERIF, Font.PLAIN, 12);

    private volatile boolean labelsEnabled = true;

    /**
     * @param selected object to highlight, may be {@code null}
     */
    public BufferedImage render(MeasuredImage measured, DetectedObject selected) {
        BufferedImage src = measured.image();
        BufferedImage out = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = out.createGraphics();
        try {
            g.drawImage(src, 0, 0, null);

            for (DetectedObject o : measured.objects()) {
                drawCircle(g, o, OBJECT_COLOR, 1f);
                drawLabel(g, o);
            }
            if (selected != null) {
                drawCircle(g, selected, SELECTED_COLOR, 2f);
            }
        } finally {
            g.dispose();
        }
        return out;
    }

    public byte[] renderPng(MeasuredImage measured, DetectedObject selected) {
        return toPng(render(measured, selected));
    }

    private void drawLabel(Graphics2D g, DetectedObject o) {
        if (!labelsEnabled) return;
        try {
            g.setFont(LABEL_FONT);
            g.setColor(LABEL_COLOR);
            g.drawString(String.valueOf(o.id()),
                    (int) Math.round(o.center().x()) + 5, (int) Math.round(o.center().y()) + 5);
        } catch (RuntimeException | Error e) {
            // headless hosts without fonts: keep drawing circles
            labelsEnabled = false;
            log.warn("Cannot draw object labels, continuing without them: {}", e.toString());
        }
    }

    private static void drawCircle(Graphics2D g, DetectedObject o, Color color, float width) {
        int cx = (int) Math.round(o.center().x());
        int cy = (int) Math.round(o.center().y());
        int r = (int) o.radiusPx();
        g.setColor(color);
        g.setStroke(new BasicStroke(width));
        g.drawOval(cx - r, cy - r, 2 * r, 2 * r);
    }

    private static byte[] toPng(BufferedImage img) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            ImageIO.write(img, "png", baos);
            return baos.toByteArray();
        } catch (Exception e) {
            throw new MeasurementException("Failed to encode image", e);
        }
    }
}
