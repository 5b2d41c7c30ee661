package com.project.image.editdetection.DTOs;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/** JSON body of {@code POST /api/compare}. Images are data URLs or bare base64. */
public record ComparisonRequest(
        @NotBlank(message = "originalImage is required") String originalImage,
        @NotBlank(message = "editedImage is required") String editedImage,
        DetectionMethod method,
        @DecimalMin("0.0") @DecimalMax("100.0") Double colorThreshold,
        @Min(1) @Max(1_000_000) Integer minRegionSize,
        @Min(1) @Max(256) Integer blockSize,
        @DecimalMin("0.0") @DecimalMax("1.0") Double perceptualThreshold,
        @Min(0) @Max(1_000_000) Integer minArea
) {
    public ComparisonParameters parameters() {
        return new ComparisonParameters(method, colorThreshold, minRegionSize, blockSize, perceptualThreshold, minArea);
    }
}
