package com.project.coin.measurement.exceptions;

import com.project.coin.measurement.controller.HomeController;
import com.project.coin.measurement.controller.InspectionController;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.servlet.mvc.support.RedirectAttributes;

import java.io.IOException;

/**
 * Turns failures of the HTML pages into an error message on the home page. The JSON API answers
 * with HTTP status codes instead and is not covered here.
 */
@ControllerAdvice(assignableTypes = {HomeController.class, InspectionController.class})
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String HOME = "redirect:/";

    @ExceptionHandler({ImageSourceException.class, MeasurementException.class})
    public String handleDomainExceptions(RuntimeException ex, RedirectAttributes redirect) {
        log.warn("Domain error: {}", ex.getMessage());
        redirect.addFlashAttribute("error", ex.getMessage());
        return HOME;
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public String handleMaxUploadSizeExceeded(MaxUploadSizeExceededException ex, RedirectAttributes redirect) {
        log.warn("File upload size exceeded: {}", ex.getMessage());
        redirect.addFlashAttribute("error", "File is too large. Maximum size: 10MB");
        return HOME;
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public String handleValidationErrors(ConstraintViolationException ex, RedirectAttributes redirect) {
        log.warn("Validation error: {}", ex.getMessage());
        redirect.addFlashAttribute("error", "Invalid parameters. Please check the values you entered.");
        return HOME;
    }

    @ExceptionHandler(IOException.class)
    public String handleIOException(IOException ex, RedirectAttributes redirect) {
        log.error("IO error occurred", ex);
        redirect.addFlashAttribute("error", "Could not process the file. Please try another image.");
        return HOME;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public String handleIllegalArgument(IllegalArgumentException ex, RedirectAttributes redirect) {
        log.warn("Invalid argument: {}", ex.getMessage());
        redirect.addFlashAttribute("error", "Invalid parameters: " + ex.getMessage());
        return HOME;
    }

    @ExceptionHandler(Exception.class)
    public String handleUnknownException(Exception ex, RedirectAttributes redirect) {
        log.error("Unhandled error occurred", ex);
        redirect.addFlashAttribute("error", "An unexpected error occurred. Please try again.");
        return HOME;
    }
}
