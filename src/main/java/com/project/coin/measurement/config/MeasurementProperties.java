package com.project.coin.measurement.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.Locale;
import java.util.Optional;

/**
 * Measurement settings. {@code input-dir} and {@code scale} can also be given on the command line
 * as {@code --input-dir=...} and {@code --scale=...}.
 */
@Validated
@ConfigurationProperties(prefix = "measure")
public class MeasurementProperties {

    public static final double DEFAULT_TOLERANCE = 0.3;
    public static final double DEFAULT_MIN_AREA = 500;
    public static final int DEFAULT_MAX_WIDTH = 800;

    @NotBlank
    private String inputDir = "test_IMG";

    private Double scale;

    @DecimalMin("0.0")
    private double tolerance = DEFAULT_TOLERANCE;

    @PositiveOrZero
    private double minArea = DEFAULT_MIN_AREA;

    @Positive
    private int maxWidth = DEFAULT_MAX_WIDTH;

    @Pattern(regexp = "opencv|java")
    private String segmenter = "opencv";

    public String getInputDir() {
        return inputDir;
    }

    public void setInputDir(String inputDir) {
        this.inputDir = inputDir;
    }

    /** Physical units per normalized pixel; empty when sizes are reported in pixels only. */
    public Optional<Double> getScaleFactor() {
        return Optional.ofNullable(scale);
    }

    public String getScale() {
        return scale == null ? "none" : String.valueOf(scale);
    }

    public void setScale(String scale) {
        this.scale = parseScale(scale);
    }

    public double getTolerance() {
        return tolerance;
    }

    public void setTolerance(double tolerance) {
        this.tolerance = tolerance;
    }

    public double getMinArea() {
        return minArea;
    }

    public void setMinArea(double minArea) {
        this.minArea = minArea;
    }

    public int getMaxWidth() {
        return maxWidth;
    }

    public void setMaxWidth(int maxWidth) {
        this.maxWidth = maxWidth;
    }

    public String getSegmenter() {
        return segmenter;
    }

    public void setSegmenter(String segmenter) {
        this.segmenter = segmenter;
    }

    /**
     * Accepts a positive number, or {@code none} / blank for "no scale".
     */
    public static Double parseScale(String raw) {
        if (raw == null || raw.isBlank() || raw.trim().toLowerCase(Locale.ROOT).equals("none")) {
            return null;
        }
        double value;
        try {
            value = Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Scale must be a positive number or 'none' (received: " + raw + ")", e);
        }
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Scale must be a positive number or 'none' (received: " + raw + ")");
        }
        return value;
    }
}
