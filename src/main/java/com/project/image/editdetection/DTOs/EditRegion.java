package com.project.image.editdetection.DTOs;

/** Common view of a detected change, whichever detector produced it. */
public interface EditRegion {

    BoundingBox bounds();

    PixelPoint center();

    /** Significance in [0, 100]. */
    double significanceScore();
}
