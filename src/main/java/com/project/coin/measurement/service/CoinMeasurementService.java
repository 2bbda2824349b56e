package com.project.coin.measurement.service;

import com.project.coin.measurement.config.MeasurementProperties;
import com.project.coin.measurement.exceptions.MeasurementException;
import com.project.coin.measurement.model.BinaryMask;
import com.project.coin.measurement.model.DetectedObject;
import com.project.coin.measurement.model.MeasuredImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Runs one image through the pipeline: normalize, segment, extract candidates, remove duplicates.
 */
@Service
public class CoinMeasurementService {
    private static final Logger log = LoggerFactory.getLogger(CoinMeasurementService.class);

    private final ImageNormalizer normalizer;
    private final MaskSegmenter segmenter;
    private final CandidateExtractor extractor;
    private final OverlapResolver resolver;
    private final MeasurementProperties properties;

    public CoinMeasurementService(ImageNormalizer normalizer, MaskSegmenter segmenter, CandidateExtractor extractor,
                                  OverlapResolver resolver, MeasurementProperties properties) {
        this.normalizer = normalizer;
        this.segmenter = segmenter;
        this.extractor = extractor;
        this.resolver = resolver;
        this.properties = properties;
    }

    /**
     * Measures a file with the configured scale.
     *
     * @return empty when the file cannot be decoded; callers skip it and carry on
     */
    public Optional<MeasuredImage> measure(Path file) {
        Optional<BufferedImage> decoded = normalizer.read(file);
        if (decoded.isEmpty()) {
            return Optional.empty();
        }
        Double scale = properties.getScaleFactor().orElse(null);
        return Optional.of(measure(file.getFileName().toString(), decoded.get(), scale));
    }

    /**
     * @param scale physical units per normalized pixel, or {@code null}
     */
    public MeasuredImage measure(String name, BufferedImage decoded, Double scale) {
        if (decoded == null) {
            throw new MeasurementException("No image to measure");
        }
        if (scale != null && (!(scale > 0) || scale.isInfinite())) {
            throw new IllegalArgumentException("Scale must be positive: " + scale);
        }

        BufferedImage normalized = normalizer.normalize(decoded);
        BinaryMask mask = segmenter.segment(normalized);
        List<DetectedObject> candidates = extractor.extract(mask, scale);
        List<DetectedObject> objects = resolver.resolve(candidates, properties.getTolerance());

        log.debug("{}: {} candidates, {} after overlap filtering", name, candidates.size(), objects.size());
        log.info("{}: detected {} objects", name, objects.size());
        return new MeasuredImage(name, normalized, objects, scale);
    }
}
