package com.project.image.editdetection.DTOs;

/**
 * Options for the Delta E detectors.
 *
 * @param colorThreshold  Delta E a pixel must exceed to count as changed (roughly 0-100)
 * @param minRegionSize   pixel strategy: smallest component kept, in pixels
 * @param strategy        {@link DetectionMethod#BLOCK} or {@link DetectionMethod#PIXEL}
 * @param blockSize       block strategy: cell edge length in pixels
 * @param minBlockDensity block strategy: fraction of changed pixels that marks a cell as changed, 0-1
 * @param minBlockCount   block strategy: smallest cluster kept, in cells
 */
public record DetectionOptions(
        double colorThreshold,
        int minRegionSize,
        DetectionMethod strategy,
        int blockSize,
        double minBlockDensity,
        int minBlockCount
) {
    public static final double DEFAULT_COLOR_THRESHOLD = 12.0;
    public static final int DEFAULT_MIN_REGION_SIZE = 10;
    public static final int DEFAULT_BLOCK_SIZE = 8;
    public static final double DEFAULT_MIN_BLOCK_DENSITY = 0.25;
    public static final int DEFAULT_MIN_BLOCK_COUNT = 2;

    public DetectionOptions {
        if (strategy == null || strategy.isPerceptual()) {
            throw new IllegalArgumentException("strategy must be PIXEL or BLOCK, got " + strategy);
        }
        if (Double.isNaN(colorThreshold) || colorThreshold < 0) {
            throw new IllegalArgumentException("colorThreshold must be >= 0, got " + colorThreshold);
        }
        if (minRegionSize < 1) {
            throw new IllegalArgumentException("minRegionSize must be >= 1, got " + minRegionSize);
        }
        if (blockSize < 1) {
            throw new IllegalArgumentException("blockSize must be >= 1, got " + blockSize);
        }
        if (!(minBlockDensity >= 0 && minBlockDensity <= 1)) {
            throw new IllegalArgumentException("minBlockDensity must be within [0, 1], got " + minBlockDensity);
        }
        if (minBlockCount < 1) {
            throw new IllegalArgumentException("minBlockCount must be >= 1, got " + minBlockCount);
        }
    }

    public static DetectionOptions defaults() {
        return new DetectionOptions(DEFAULT_COLOR_THRESHOLD, DEFAULT_MIN_REGION_SIZE, DetectionMethod.BLOCK,
                DEFAULT_BLOCK_SIZE, DEFAULT_MIN_BLOCK_DENSITY, DEFAULT_MIN_BLOCK_COUNT);
    }

    public static DetectionOptions pixel(double colorThreshold, int minRegionSize) {
        return defaults().withStrategy(DetectionMethod.PIXEL)
                .withColorThreshold(colorThreshold)
                .withMinRegionSize(minRegionSize);
    }

    public DetectionOptions withStrategy(DetectionMethod s) {
        return new DetectionOptions(colorThreshold, minRegionSize, s, blockSize, minBlockDensity, minBlockCount);
    }

    public DetectionOptions withColorThreshold(double t) {
        return new DetectionOptions(t, minRegionSize, strategy, blockSize, minBlockDensity, minBlockCount);
    }

    public DetectionOptions withMinRegionSize(int n) {
        return new DetectionOptions(colorThreshold, n, strategy, blockSize, minBlockDensity, minBlockCount);
    }

    public DetectionOptions withBlockSize(int n) {
        return new DetectionOptions(colorThreshold, minRegionSize, strategy, n, minBlockDensity, minBlockCount);
    }

    public DetectionOptions withMinBlockDensity(double d) {
        return new DetectionOptions(colorThreshold, minRegionSize, strategy, blockSize, d, minBlockCount);
    }

    public DetectionOptions withMinBlockCount(int n) {
        return new DetectionOptions(colorThreshold, minRegionSize, strategy, blockSize, minBlockDensity, n);
    }
}
