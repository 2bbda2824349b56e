package com.project.coin.measurement.controller;

import com.project.coin.measurement.config.MeasurementProperties;
import com.project.coin.measurement.service.ImageDirectoryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;

/**
 * Serves the home page: the images available for inspection plus the upload form.
 */
@Controller
public class HomeController {
    private static final Logger log = LoggerFactory.getLogger(HomeController.class);

    private final ImageDirectoryService directory;
    private final MeasurementProperties properties;

    public HomeController(ImageDirectoryService directory, MeasurementProperties properties) {
        this.directory = directory;
        this.properties = properties;
    }

    @GetMapping("/")
    public String index(Model model) {
        log.debug("Serving home page");
        model.addAttribute("images", directory.listImages());
        model.addAttribute("inputDir", directory.getRootDir().toString());
        model.addAttribute("scale", properties.getScale());
        return "index"; // templates/index.html
    }
}
