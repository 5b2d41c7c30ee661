package com.project.image.editdetection.exceptions;

import com.project.image.editdetection.config.DetectionProperties;
import com.project.image.editdetection.controller.ComparisonController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import jakarta.validation.ConstraintViolationException;
import java.io.IOException;

/** Renders errors from the browser pages back onto the comparison form. */
@ControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final DetectionProperties properties;

    public GlobalExceptionHandler(DetectionProperties properties) {
        this.properties = properties;
    }

    @ExceptionHandler(DetectionTimeoutException.class)
    public String handleTimeout(DetectionTimeoutException ex, Model model) {
        log.warn("Detection timed out: {}", ex.getMessage());
        return formWithError(model, "The perceptual comparison took too long. Try the block or pixel method, or smaller images.");
    }

    @ExceptionHandler(TaskRejectedException.class)
    public String handleRejected(TaskRejectedException ex, Model model) {
        log.warn("Perceptual pool is saturated: {}", ex.getMessage());
        return formWithError(model, "Too many perceptual comparisons are running. Please retry shortly.");
    }

    @ExceptionHandler(EditDetectionException.class)
    public String handleDomainExceptions(EditDetectionException ex, Model model) {
        log.warn("Domain error: {}", ex.getMessage());
        return formWithError(model, ex.getMessage());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public String handleMaxUploadSizeExceeded(MaxUploadSizeExceededException ex, Model model) {
        log.warn("File upload size exceeded: {}", ex.getMessage());
        return formWithError(model, "The file is too large. Maximum size: 10MB");
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public String handleValidationErrors(ConstraintViolationException ex, Model model) {
        log.warn("Validation error: {}", ex.getMessage());
        return formWithError(model, "Invalid parameters. Please check the values you entered.");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public String handleTypeMismatch(MethodArgumentTypeMismatchException ex, Model model) {
        log.warn("Bad request parameter '{}': {}", ex.getName(), ex.getValue());
        return formWithError(model, "Invalid value for '" + ex.getName() + "': " + ex.getValue());
    }

    @ExceptionHandler(IOException.class)
    public String handleIOException(IOException ex, Model model) {
        log.error("IO error occurred", ex);
        return formWithError(model, "Could not read the uploaded file. Please try a different image.");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public String handleIllegalArgument(IllegalArgumentException ex, Model model) {
        log.warn("Invalid argument: {}", ex.getMessage());
        return formWithError(model, "Invalid parameters: " + ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public String handleUnknownException(Exception ex, Model model) {
        log.error("Unhandled error occurred", ex);
        model.addAttribute("error", "An unexpected error occurred. Please try again.");
        return "index";
    }

    private String formWithError(Model model, String message) {
        ComparisonController.populateFormModel(model, properties);
        model.addAttribute("error", message);
        return "compare";
    }
}
