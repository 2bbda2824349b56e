package com.project.coin.measurement.config;

import com.project.coin.measurement.service.CandidateExtractor;
import com.project.coin.measurement.service.ImageNormalizer;
import com.project.coin.measurement.service.MaskSegmenter;
import com.project.coin.measurement.service.OpenCvMaskSegmenter;
import com.project.coin.measurement.service.ThresholdMaskSegmenter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(MeasurementProperties.class)
public class MeasurementConfig {
    private static final Logger log = LoggerFactory.getLogger(MeasurementConfig.class);

    @Bean
    public MaskSegmenter maskSegmenter(MeasurementProperties properties) {
        if ("java".equals(properties.getSegmenter())) {
            log.info("Using pure Java segmentation");
            return new ThresholdMaskSegmenter();
        }
        log.info("Using OpenCV segmentation");
        return new OpenCvMaskSegmenter();
    }

    @Bean
    public CandidateExtractor candidateExtractor(MeasurementProperties properties) {
        return new CandidateExtractor(properties.getMinArea());
    }

    @Bean
    public ImageNormalizer imageNormalizer(MeasurementProperties properties) {
        return new ImageNormalizer(properties.getMaxWidth());
    }
}
