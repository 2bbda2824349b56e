package com.project.coin.measurement.controller;

import com.project.coin.measurement.DTOs.ObjectView;
import com.project.coin.measurement.config.MeasurementProperties;
import com.project.coin.measurement.exceptions.MeasurementException;
import com.project.coin.measurement.model.DetectedObject;
import com.project.coin.measurement.model.ImagePoint;
import com.project.coin.measurement.model.MeasuredImage;
import com.project.coin.measurement.service.AnnotationRenderer;
import com.project.coin.measurement.service.CoinMeasurementService;
import com.project.coin.measurement.service.ImageDirectoryService;
import com.project.coin.measurement.service.ImageNormalizer;
import com.project.coin.measurement.service.InspectionSession;
import com.project.coin.measurement.service.InspectionState;
import com.project.coin.measurement.service.ObjectLookup;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.mvc.support.RedirectAttributes;
import org.springframework.web.util.UriUtils;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Interactive inspection: show a measured image, pick objects by clicking on it, move on to the
 * next image of the directory.
 */
@Controller
@Validated
@RequestMapping("/inspect")
public class InspectionController {
    private static final Logger log = LoggerFactory.getLogger(InspectionController.class);

    private static final List<String> SUPPORTED_FORMATS = Arrays.asList(
            "image/jpeg", "image/jpg", "image/png", "image/gif", "image/bmp"
    );
    private static final long MAX_UPLOAD_BYTES = 10 * 1024 * 1024; // 10MB

    private final CoinMeasurementService measurementService;
    private final ImageDirectoryService directory;
    private final ImageNormalizer normalizer;
    private final AnnotationRenderer renderer;
    private final ObjectLookup lookup;
    private final InspectionSession session;
    private final MeasurementProperties properties;

    public InspectionController(CoinMeasurementService measurementService, ImageDirectoryService directory,
                                ImageNormalizer normalizer, AnnotationRenderer renderer, ObjectLookup lookup,
                                InspectionSession session, MeasurementProperties properties) {
        this.measurementService = measurementService;
        this.directory = directory;
        this.normalizer = normalizer;
        this.renderer = renderer;
        this.lookup = lookup;
        this.session = session;
        this.properties = properties;
    }

    @GetMapping("/{name}")
    public String inspect(@PathVariable String name, Model model, RedirectAttributes redirect) {
        Path file = directory.resolve(name);
        Optional<MeasuredImage> measured = measurementService.measure(file);
        if (measured.isEmpty()) {
            redirect.addFlashAttribute("error", "Could not read image " + name + "; it was skipped.");
            return "redirect:/";
        }
        InspectionState state = session.show(measured.get());
        populateModel(model, state, null);
        return "inspect";
    }

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public String upload(@RequestParam("file") @NotNull MultipartFile file,
                         @RequestParam(name = "scale", required = false) String scale,
                         Model model) throws IOException {
        validateUploadedFile(file);
        Double scaleFactor = (scale == null || scale.isBlank())
                ? properties.getScaleFactor().orElse(null)
                : MeasurementProperties.parseScale(scale);

        log.info("Processing upload: {} ({}KB), scale: {}",
                file.getOriginalFilename(), file.getSize() / 1024, scaleFactor);

        BufferedImage decoded;
        try (InputStream in = file.getInputStream()) {
            decoded = normalizer.read(in)
                    .orElseThrow(() -> new MeasurementException("The file is not a valid image or is corrupted."));
        }

        String name = file.getOriginalFilename() == null ? "upload" : file.getOriginalFilename();
        InspectionState state = session.show(measurementService.measure(name, decoded, scaleFactor));
        populateModel(model, state, null);
        return "inspect";
    }

    /**
     * Pointer handler. Parameter names are those an {@code <input type="image" name="click">}
     * submits.
     */
    @GetMapping("/select")
    public String select(@RequestParam("click.x") @Min(0) int x,
                         @RequestParam("click.y") @Min(0) int y,
                         Model model) {
        Optional<InspectionState> current = session.current();
        if (current.isEmpty()) {
            return "redirect:/";
        }
        InspectionState next = current.get().select(new ImagePoint(x, y), lookup);
        session.update(next);

        String message;
        // a miss hands back the very same state
        if (next == current.get()) {
            message = "No object at (" + x + ", " + y + ")";
        } else {
            message = next.selected().describe();
            log.info("{}: {}", next.image().name(), message);
        }
        populateModel(model, next, message);
        return "inspect";
    }

    @GetMapping(value = "/image.png", produces = MediaType.IMAGE_PNG_VALUE)
    public ResponseEntity<byte[]> annotatedImage() {
        return session.current()
                .map(state -> ResponseEntity.ok()
                        .cacheControl(CacheControl.noStore())
                        .contentType(MediaType.IMAGE_PNG)
                        .body(renderer.renderPng(state.image(), state.selected())))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/next")
    public String next() {
        Optional<String> following = session.current()
                .flatMap(state -> directory.next(state.image().name()));
        if (following.isEmpty()) {
            session.clear();
            return "redirect:/";
        }
        return "redirect:/inspect/" + UriUtils.encodePathSegment(following.get(), StandardCharsets.UTF_8);
    }

    private void validateUploadedFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Please choose a file to upload");
        }

        String contentType = file.getContentType();
        if (contentType == null || !SUPPORTED_FORMATS.contains(contentType.toLowerCase())) {
            throw new IllegalArgumentException(
                    "Unsupported file type: " + contentType +
                            ". Supported types: " + String.join(", ", SUPPORTED_FORMATS)
            );
        }

        if (file.getSize() > MAX_UPLOAD_BYTES) {
            throw new IllegalArgumentException("File is too large. Maximum size: 10MB");
        }
    }

    private void populateModel(Model model, InspectionState state, String message) {
        MeasuredImage image = state.image();
        DetectedObject selected = state.selected();
        List<ObjectView> objects = image.objects().stream().map(ObjectView::from).toList();

        model.addAttribute("name", image.name());
        model.addAttribute("width", image.width());
        model.addAttribute("height", image.height());
        model.addAttribute("scale", image.scale());
        model.addAttribute("objects", objects);
        model.addAttribute("objectCount", objects.size());
        model.addAttribute("selectedId", selected == null ? null : selected.id());
        model.addAttribute("message", message);
        model.addAttribute("hasNext", directory.next(image.name()).isPresent());
        model.addAttribute("imageVersion", System.identityHashCode(state));
    }
}
