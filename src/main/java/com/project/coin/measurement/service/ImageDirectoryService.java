package com.project.coin.measurement.service;

import com.project.coin.measurement.config.MeasurementProperties;
import com.project.coin.measurement.exceptions.ImageSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The folder of input images, walked in file-name order.
 */
@Service
public class ImageDirectoryService {
    private static final Logger log = LoggerFactory.getLogger(ImageDirectoryService.class);

    private final Path rootDir;

    @Autowired
    public ImageDirectoryService(MeasurementProperties properties) {
        this(properties.getInputDir());
    }

    public ImageDirectoryService(String root) {
        this.rootDir = Paths.get(root).toAbsolutePath().normalize();
        log.info("Using input directory: {}", this.rootDir);
    }

    public Path getRootDir() {
        return rootDir;
    }

    /** Regular files in the directory, sorted by name. Not filtered by type: decoding decides. */
    public List<String> listImages() {
        if (!Files.isDirectory(rootDir)) {
            log.warn("Input directory does not exist: {}", rootDir);
            return List.of();
        }
        try (Stream<Path> files = Files.list(rootDir)) {
            return files.filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ImageSourceException("Cannot list input directory: " + rootDir, e);
        }
    }

    public Path resolve(String name) {
        if (name == null || name.isBlank()) {
            throw new ImageSourceException("Image name is required");
        }
        Path target = rootDir.resolve(name).normalize();
        if (!rootDir.equals(target.getParent())) {
            throw new ImageSourceException("Image name is outside the input directory: " + name);
        }
        if (!Files.isRegularFile(target)) {
            throw new ImageSourceException("No such image: " + name);
        }
        return target;
    }

    /** The image after {@code name} in listing order; empty at the end or for unknown names. */
    public Optional<String> next(String name) {
        List<String> images = listImages();
        int idx = images.indexOf(name);
        if (idx < 0 || idx + 1 >= images.size()) {
            return Optional.empty();
        }
        return Optional.of(images.get(idx + 1));
    }
}
