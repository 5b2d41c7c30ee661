package com.project.image.editdetection.DTOs;

import java.util.List;

/** JSON body returned by {@code POST /api/compare}. */
public record ComparisonResponse(
        DetectionMethod method,
        int imageWidth,
        int imageHeight,
        long changedMeasure,
        double percentChanged,
        List<? extends EditRegion> regions,
        String report
) {
    public static ComparisonResponse from(Comparison comparison) {
        DetectionResult<? extends EditRegion> r = comparison.result();
        return new ComparisonResponse(r.method(), r.imageWidth(), r.imageHeight(), r.changedMeasure(),
                r.percentChanged(), r.regions(), comparison.report());
    }
}
