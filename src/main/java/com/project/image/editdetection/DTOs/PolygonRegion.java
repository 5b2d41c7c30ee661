package com.project.image.editdetection.DTOs;

import java.util.List;

/**
 * Region found by the perceptual detector: a simplified outer contour.
 *
 * @param polygon      simplified contour vertices
 * @param center       area-weighted centroid, or the bbox center for degenerate contours
 * @param area         enclosed contour area in pixels
 * @param significance 100 x mean heatmap value inside the contour, one decimal
 */
public record PolygonRegion(
        List<PixelPoint> polygon,
        BoundingBox bounds,
        PixelPoint center,
        int area,
        double significance
) implements EditRegion {

    public PolygonRegion {
        polygon = List.copyOf(polygon);
    }

    @Override
    public double significanceScore() { return significance; }
}
