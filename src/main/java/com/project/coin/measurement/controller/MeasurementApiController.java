package com.project.coin.measurement.controller;

import com.project.coin.measurement.DTOs.MeasurementResponse;
import com.project.coin.measurement.exceptions.ImageSourceException;
import com.project.coin.measurement.model.MeasuredImage;
import com.project.coin.measurement.service.CoinMeasurementService;
import com.project.coin.measurement.service.ImageDirectoryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.nio.file.Path;
import java.util.List;

import static org.springframework.http.HttpStatus.NOT_FOUND;
import static org.springframework.http.HttpStatus.UNPROCESSABLE_ENTITY;

@RestController
@RequestMapping("/api")
public class MeasurementApiController {
    private static final Logger log = LoggerFactory.getLogger(MeasurementApiController.class);

    private final ImageDirectoryService directory;
    private final CoinMeasurementService measurementService;

    public MeasurementApiController(ImageDirectoryService directory, CoinMeasurementService measurementService) {
        this.directory = directory;
        this.measurementService = measurementService;
    }

    @GetMapping("/images")
    public List<String> images() {
        return directory.listImages();
    }

    @GetMapping("/images/{name}/objects")
    public MeasurementResponse objects(@PathVariable String name) {
        Path file;
        try {
            file = directory.resolve(name);
        } catch (ImageSourceException ex) {
            throw new ResponseStatusException(NOT_FOUND, ex.getMessage(), ex);
        }
        MeasuredImage measured = measurementService.measure(file)
                .orElseThrow(() -> new ResponseStatusException(UNPROCESSABLE_ENTITY, "Could not decode image " + name));
        log.debug("API measurement of {} returned {} objects", name, measured.objects().size());
        return MeasurementResponse.from(measured);
    }
}
