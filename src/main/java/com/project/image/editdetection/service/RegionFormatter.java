package com.project.image.editdetection.service;

import com.project.image.editdetection.DTOs.BoundingBox;
import com.project.image.editdetection.DTOs.DetectionResult;
import com.project.image.editdetection.DTOs.EditRegion;
import com.project.image.editdetection.DTOs.PolygonRegion;
import com.project.image.editdetection.DTOs.RectRegion;

import java.util.Locale;

/**
 * Plain-text report of a detection result for human reviewers.
 * Output is byte-stable: {@link Locale#ROOT} decimals and {@code \n} line endings.
 */
public final class RegionFormatter {

    public static final String NO_CHANGES = "DETECTED EDIT LOCATIONS: No significant changes detected between images.";

    private RegionFormatter() {}

    public static String format(DetectionResult<? extends EditRegion> result) {
        if (!result.hasRegions()) {
            return NO_CHANGES;
        }
        boolean perceptual = result.regions().get(0) instanceof PolygonRegion;

        StringBuilder sb = new StringBuilder();
        sb.append(perceptual
                ? "DETECTED EDIT LOCATIONS (by perceptual difference, sorted by significance):"
                : "DETECTED EDIT LOCATIONS (sorted by significance):").append('\n');

        int i = 1;
        for (EditRegion region : result.regions()) {
            sb.append("  ").append(i++).append(". ");
            if (region instanceof PolygonRegion p) {
                appendPolygon(sb, p);
            } else if (region instanceof RectRegion r) {
                appendRect(sb, r);
            } else {
                throw new IllegalArgumentException("Unsupported region type: " + region.getClass().getName());
            }
            sb.append('\n');
        }

        sb.append('\n');
        if (perceptual) {
            sb.append("Total changed area: ").append(result.changedMeasure()).append("px (")
                    .append(oneDecimal(result.percentChanged())).append("% of image)\n");
        } else {
            sb.append("Total: ").append(result.changedMeasure()).append(" pixels changed (")
                    .append(oneDecimal(result.percentChanged())).append("% of image)\n");
        }
        sb.append("Image dimensions: ").append(result.imageWidth()).append('x').append(result.imageHeight());
        return sb.toString();
    }

    private static void appendRect(StringBuilder sb, RectRegion r) {
        BoundingBox b = r.bounds();
        sb.append("Region from (").append(b.x()).append(", ").append(b.y()).append(") to (")
                .append(b.right()).append(", ").append(b.bottom()).append("), center: (")
                .append(r.center().x()).append(", ").append(r.center().y()).append("), size: ")
                .append(b.width()).append('x').append(b.height()).append(", ")
                .append(r.pixelCount()).append(" pixels changed, intensity: avg=")
                .append(oneDecimal(r.avgDifference())).append(", max=").append(oneDecimal(r.maxDifference()))
                .append(", significance: ").append(r.significance()).append("/100");
    }

    private static void appendPolygon(StringBuilder sb, PolygonRegion p) {
        BoundingBox b = p.bounds();
        sb.append("Region centered at (").append(p.center().x()).append(", ").append(p.center().y())
                .append("), bounding box from (").append(b.x()).append(", ").append(b.y()).append(") to (")
                .append(b.right()).append(", ").append(b.bottom()).append("), size: ")
                .append(b.width()).append('x').append(b.height()).append(", area: ").append(p.area())
                .append("px, significance: ").append(oneDecimal(p.significance())).append("/100");
    }

    private static String oneDecimal(double v) {
        return String.format(Locale.ROOT, "%.1f", v);
    }
}
