package com.project.image.editdetection.controller;

import com.project.image.editdetection.DTOs.Comparison;
import com.project.image.editdetection.DTOs.ComparisonRequest;
import com.project.image.editdetection.DTOs.ComparisonResponse;
import com.project.image.editdetection.DTOs.RasterImage;
import com.project.image.editdetection.service.EditDetectionService;
import com.project.image.editdetection.service.ImageDecoder;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** JSON variant of the comparison form. */
@RestController
@RequestMapping("/api")
public class ComparisonApiController {
    private static final Logger log = LoggerFactory.getLogger(ComparisonApiController.class);

    private final EditDetectionService detectionService;

    public ComparisonApiController(EditDetectionService detectionService) {
        this.detectionService = detectionService;
    }

    @PostMapping(value = "/compare", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ComparisonResponse compare(@Valid @RequestBody ComparisonRequest request) {
        RasterImage original = ImageDecoder.requireWithinLimits(
                ImageDecoder.fromDataUrl(request.originalImage()), "original");
        RasterImage edited = ImageDecoder.requireWithinLimits(
                ImageDecoder.fromDataUrl(request.editedImage()), "edited");
        log.info("API comparison {}x{} vs {}x{}, method: {}",
                original.width(), original.height(), edited.width(), edited.height(), request.method());

        Comparison comparison = detectionService.compare(original, edited, request.parameters());
        return ComparisonResponse.from(comparison);
    }
}
