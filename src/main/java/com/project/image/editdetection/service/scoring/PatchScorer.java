package com.project.image.editdetection.service.scoring;

import com.project.image.editdetection.DTOs.RasterImage;

/**
 * Perceptual distance between two aligned, equal-size RGB patches.
 * 0 means identical; larger means more different. Implementations must be safe for concurrent use.
 */
@FunctionalInterface
public interface PatchScorer {

    double score(RasterImage patchA, RasterImage patchB);
}
