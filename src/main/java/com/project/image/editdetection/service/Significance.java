package com.project.image.editdetection.service;

/**
 * Significance of a Delta E region, 0-100: weighted sum of bounding-box size,
 * mean color difference and pixel density inside the box.
 */
public final class Significance {

    public static final double AREA_WEIGHT = 0.4;
    public static final double INTENSITY_WEIGHT = 0.4;
    public static final double DENSITY_WEIGHT = 0.2;

    /** Box area treated as "full size" (about 100x100). */
    public static final double AREA_NORMALIZER = 10_000.0;
    /** Delta E treated as "full intensity". */
    public static final double INTENSITY_NORMALIZER = 100.0;

    private Significance() {}

    public static int score(int area, double avgDifference, int pixelCount) {
        double areaNorm = Math.min(area / AREA_NORMALIZER, 1.0);
        double intensityNorm = Math.min(avgDifference / INTENSITY_NORMALIZER, 1.0);
        double densityNorm = area > 0 ? (double) pixelCount / area : 0.0;

        double raw = 100.0 * (AREA_WEIGHT * areaNorm + INTENSITY_WEIGHT * intensityNorm + DENSITY_WEIGHT * densityNorm);
        return (int) Math.max(0, Math.min(100, Math.rint(raw)));
    }

    /** Rounds a reported difference to one decimal. */
    static double oneDecimal(double v) {
        return Math.round(v * 10.0) / 10.0;
    }
}
