package com.project.image.editdetection.DTOs;

/**
 * Region found by the Delta E detector.
 *
 * @param pixelCount    changed pixels belonging to the region
 * @param avgDifference mean Delta E over those pixels, one decimal
 * @param maxDifference largest Delta E over those pixels, one decimal
 * @param significance  0-100
 */
public record RectRegion(
        BoundingBox bounds,
        PixelPoint center,
        int pixelCount,
        double avgDifference,
        double maxDifference,
        int significance
) implements EditRegion {

    @Override
    public double significanceScore() { return significance; }
}
