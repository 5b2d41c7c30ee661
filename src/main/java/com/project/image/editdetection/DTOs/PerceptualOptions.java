package com.project.image.editdetection.DTOs;

/**
 * Options for the perceptual detector.
 *
 * @param threshold            patch score a pixel must exceed to be marked changed (scores are roughly 0-1)
 * @param minArea              smallest contour area kept, in pixels
 * @param patchSize            scoring window edge; raised to the scorer's floor when smaller
 * @param stride               step between scoring windows
 * @param morphologyKernelSize elliptical kernel used for opening and closing the mask
 */
public record PerceptualOptions(
        double threshold,
        int minArea,
        int patchSize,
        int stride,
        int morphologyKernelSize
) {
    public static final double DEFAULT_THRESHOLD = 0.1;
    public static final int DEFAULT_MIN_AREA = 100;
    public static final int DEFAULT_PATCH_SIZE = 64;
    public static final int DEFAULT_STRIDE = 32;
    public static final int DEFAULT_MORPHOLOGY_KERNEL_SIZE = 5;

    public PerceptualOptions {
        if (Double.isNaN(threshold) || threshold < 0) {
            throw new IllegalArgumentException("threshold must be >= 0, got " + threshold);
        }
        if (minArea < 0) {
            throw new IllegalArgumentException("minArea must be >= 0, got " + minArea);
        }
        if (patchSize < 1 || stride < 1) {
            throw new IllegalArgumentException("patchSize and stride must be >= 1, got " + patchSize + "/" + stride);
        }
        if (morphologyKernelSize < 1) {
            throw new IllegalArgumentException("morphologyKernelSize must be >= 1, got " + morphologyKernelSize);
        }
    }

    public static PerceptualOptions defaults() {
        return new PerceptualOptions(DEFAULT_THRESHOLD, DEFAULT_MIN_AREA, DEFAULT_PATCH_SIZE, DEFAULT_STRIDE,
                DEFAULT_MORPHOLOGY_KERNEL_SIZE);
    }

    public PerceptualOptions withThreshold(double t) {
        return new PerceptualOptions(t, minArea, patchSize, stride, morphologyKernelSize);
    }

    public PerceptualOptions withMinArea(int a) {
        return new PerceptualOptions(threshold, a, patchSize, stride, morphologyKernelSize);
    }

    public PerceptualOptions withSampling(int patch, int step) {
        return new PerceptualOptions(threshold, minArea, patch, step, morphologyKernelSize);
    }

    public PerceptualOptions withMorphologyKernelSize(int k) {
        return new PerceptualOptions(threshold, minArea, patchSize, stride, k);
    }
}
