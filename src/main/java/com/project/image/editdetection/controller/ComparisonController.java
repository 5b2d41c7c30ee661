package com.project.image.editdetection.controller;

import com.project.image.editdetection.DTOs.Comparison;
import com.project.image.editdetection.DTOs.ComparisonParameters;
import com.project.image.editdetection.DTOs.DetectionMethod;
import com.project.image.editdetection.DTOs.DetectionResult;
import com.project.image.editdetection.DTOs.EditRegion;
import com.project.image.editdetection.DTOs.PolygonRegion;
import com.project.image.editdetection.DTOs.RasterImage;
import com.project.image.editdetection.DTOs.RectRegion;
import com.project.image.editdetection.config.DetectionProperties;
import com.project.image.editdetection.service.EditDetectionService;
import com.project.image.editdetection.service.ImageDecoder;
import com.project.image.editdetection.service.RegionOverlayRenderer;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

@Controller
@Validated
public class ComparisonController {
    private static final Logger log = LoggerFactory.getLogger(ComparisonController.class);

    static final List<String> SUPPORTED_FORMATS = Arrays.asList(
            "image/jpeg", "image/jpg", "image/png", "image/gif", "image/bmp", "image/webp"
    );
    static final long MAX_FILE_SIZE = 10 * 1024 * 1024; // 10MB

    private final EditDetectionService detectionService;
    private final RegionOverlayRenderer overlayRenderer;
    private final DetectionProperties properties;

    public ComparisonController(EditDetectionService detectionService, RegionOverlayRenderer overlayRenderer,
                                DetectionProperties properties) {
        this.detectionService = detectionService;
        this.overlayRenderer = overlayRenderer;
        this.properties = properties;
    }

    @GetMapping("/compare")
    public String showForm(Model model) {
        populateFormModel(model);
        return "compare";
    }

    @PostMapping(value = "/compare", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public String handleUpload(
            @RequestParam("original") @NotNull MultipartFile original,
            @RequestParam("edited") @NotNull MultipartFile edited,
            @RequestParam(name = "method", required = false) DetectionMethod method,
            @RequestParam(name = "colorThreshold", required = false)
            @DecimalMin(value = "0.0", message = "Color threshold must be at least 0")
            @DecimalMax(value = "100.0", message = "Color threshold cannot exceed 100")
            Double colorThreshold,
            @RequestParam(name = "minRegionSize", required = false)
            @Min(value = 1, message = "Minimum region size must be at least 1 pixel")
            @Max(value = 1_000_000, message = "Minimum region size cannot exceed 1000000 pixels")
            Integer minRegionSize,
            @RequestParam(name = "perceptualThreshold", required = false)
            @DecimalMin(value = "0.0", message = "Perceptual threshold must be at least 0")
            @DecimalMax(value = "1.0", message = "Perceptual threshold cannot exceed 1")
            Double perceptualThreshold,
            @RequestParam(name = "minArea", required = false)
            @Min(value = 0, message = "Minimum area cannot be negative")
            @Max(value = 1_000_000, message = "Minimum area cannot exceed 1000000 pixels")
            Integer minArea,
            Model model
    ) throws IOException {

        validateUploadedFile(original, "original");
        validateUploadedFile(edited, "edited");

        log.info("Comparing {} ({}KB) with {} ({}KB), method: {}",
                original.getOriginalFilename(), original.getSize() / 1024,
                edited.getOriginalFilename(), edited.getSize() / 1024, method);

        RasterImage originalImage = loadAndValidateImage(original, "original");
        RasterImage editedImage = loadAndValidateImage(edited, "edited");

        ComparisonParameters params = new ComparisonParameters(
                method, colorThreshold, minRegionSize, null, perceptualThreshold, minArea);
        Comparison comparison = detectionService.compare(originalImage, editedImage, params);

        populateResultModel(model, comparison, editedImage);
        return "result";
    }

    private void populateFormModel(Model model) {
        populateFormModel(model, properties);
    }

    /** Form choices and configured defaults; also used when an error re-renders the form. */
    public static void populateFormModel(Model model, DetectionProperties properties) {
        DetectionProperties.Deterministic d = properties.getDeterministic();
        DetectionProperties.Perceptual p = properties.getPerceptual();
        model.addAttribute("methods", DetectionMethod.values());
        model.addAttribute("defaultMethod", d.getStrategy());
        model.addAttribute("defaultColorThreshold", d.getColorThreshold());
        model.addAttribute("defaultMinRegionSize", d.getMinRegionSize());
        model.addAttribute("defaultPerceptualThreshold", p.getThreshold());
        model.addAttribute("defaultMinArea", p.getMinArea());
        model.addAttribute("supportedFormats", String.join(", ", SUPPORTED_FORMATS));
    }

    private void validateUploadedFile(MultipartFile file, String label) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Please choose the " + label + " image to upload");
        }

        String contentType = file.getContentType();
        if (contentType == null || !SUPPORTED_FORMATS.contains(contentType.toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException(
                    "Unsupported file format for the " + label + " image: " + contentType +
                            ". Supported formats: " + String.join(", ", SUPPORTED_FORMATS)
            );
        }

        if (file.getSize() > MAX_FILE_SIZE) {
            throw new IllegalArgumentException("The " + label + " image is too large. Maximum size: 10MB");
        }
    }

    private RasterImage loadAndValidateImage(MultipartFile file, String label) throws IOException {
        RasterImage image;
        try (var inputStream = file.getInputStream()) {
            image = ImageDecoder.fromStream(inputStream);
        }
        return ImageDecoder.requireWithinLimits(image, label);
    }

    private void populateResultModel(Model model, Comparison comparison, RasterImage edited) {
        DetectionResult<? extends EditRegion> result = comparison.result();

        model.addAttribute("method", result.method());
        model.addAttribute("width", result.imageWidth());
        model.addAttribute("height", result.imageHeight());
        model.addAttribute("changedMeasure", result.changedMeasure());
        model.addAttribute("percentChanged", String.format(Locale.ROOT, "%.1f", result.percentChanged()));
        model.addAttribute("regionCount", result.regions().size());
        model.addAttribute("report", comparison.report());
        model.addAttribute("overlayDataUrl", overlayRenderer.renderDataUrl(edited, result));
        model.addAttribute("regionDetails", createRegionDetails(result));
    }

    private List<RegionDetails> createRegionDetails(DetectionResult<? extends EditRegion> result) {
        List<RegionDetails> details = new ArrayList<>();
        int i = 1;
        for (EditRegion region : result.regions()) {
            String size;
            if (region instanceof RectRegion r) {
                size = r.pixelCount() + " px changed";
            } else {
                size = ((PolygonRegion) region).area() + " px area";
            }
            details.add(new RegionDetails(
                    i++,
                    region.bounds().x(), region.bounds().y(),
                    region.bounds().width(), region.bounds().height(),
                    region.center().x(), region.center().y(),
                    size,
                    String.format(Locale.ROOT, "%.1f", region.significanceScore())
            ));
        }
        return details;
    }

    // one row of the result table
    public record RegionDetails(int id, int x, int y, int width, int height, int centerX, int centerY,
                                String size, String significance) {}
}
