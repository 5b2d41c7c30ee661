package com.project.image.editdetection.DTOs;

public enum DetectionMethod {
    /** Every pixel above the Delta E threshold, 4-connected. */
    PIXEL,
    /** Grid cells by changed-pixel density, 4-connected. Robust against diffusion noise. */
    BLOCK,
    /** Patch-scored perceptual heatmap plus contours. */
    PERCEPTUAL;

    public boolean isPerceptual() { return this == PERCEPTUAL; }
}
