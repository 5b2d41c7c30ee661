package com.project.image.editdetection.DTOs;

/**
 * Per-request overrides of the configured detector defaults. {@code null} keeps the default.
 *
 * @param method              detector to run; {@code null} means the configured deterministic strategy
 * @param colorThreshold      Delta E threshold for the pixel and block detectors
 * @param minRegionSize       smallest deterministic region, in pixels
 * @param blockSize           grid cell edge for the block detector
 * @param perceptualThreshold heatmap threshold for the perceptual detector
 * @param minArea             smallest perceptual contour area, in pixels
 */
public record ComparisonParameters(
        DetectionMethod method,
        Double colorThreshold,
        Integer minRegionSize,
        Integer blockSize,
        Double perceptualThreshold,
        Integer minArea
) {
    public static ComparisonParameters of(DetectionMethod method) {
        return new ComparisonParameters(method, null, null, null, null, null);
    }
}
