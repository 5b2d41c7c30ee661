package com.project.image.editdetection.DTOs;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ranked output of one detection call.
 *
 * @param changedMeasure changed pixels (Delta E detectors) or summed region area (perceptual)
 * @param imageWidth     width of the original image
 * @param imageHeight    height of the original image
 */
public record DetectionResult<R extends EditRegion>(
        DetectionMethod method,
        List<R> regions,
        long changedMeasure,
        double percentChanged,
        int imageWidth,
        int imageHeight
) {

    public DetectionResult {
        regions = List.copyOf(regions);
    }

    /** Orders by significance, highest first; the sort is stable so ties keep discovery order. */
    public static <R extends EditRegion> List<R> rank(List<R> discovered) {
        List<R> sorted = new ArrayList<>(discovered);
        sorted.sort(Comparator.comparingDouble(EditRegion::significanceScore).reversed());
        return sorted;
    }

    public static <R extends EditRegion> DetectionResult<R> empty(DetectionMethod method, int width, int height) {
        return new DetectionResult<>(method, List.of(), 0, 0.0, width, height);
    }

    public boolean hasRegions() { return !regions.isEmpty(); }
}
