package com.project.image.editdetection.config;

import com.project.image.editdetection.DTOs.DetectionMethod;
import com.project.image.editdetection.DTOs.DetectionOptions;
import com.project.image.editdetection.DTOs.PerceptualOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Defaults for the detectors and the perceptual worker pool, bound from {@code app.detection.*}.
 * Request parameters override the detector defaults per call.
 */
@ConfigurationProperties(prefix = "app.detection")
public class DetectionProperties {

    private Deterministic deterministic = new Deterministic();
    private Perceptual perceptual = new Perceptual();
    private Ssim ssim = new Ssim();
    private Executor executor = new Executor();
    private Overlay overlay = new Overlay();

    public Deterministic getDeterministic() { return deterministic; }
    public void setDeterministic(Deterministic deterministic) { this.deterministic = deterministic; }

    public Perceptual getPerceptual() { return perceptual; }
    public void setPerceptual(Perceptual perceptual) { this.perceptual = perceptual; }

    public Ssim getSsim() { return ssim; }
    public void setSsim(Ssim ssim) { this.ssim = ssim; }

    public Executor getExecutor() { return executor; }
    public void setExecutor(Executor executor) { this.executor = executor; }

    public Overlay getOverlay() { return overlay; }
    public void setOverlay(Overlay overlay) { this.overlay = overlay; }

    public static class Deterministic {
        private DetectionMethod strategy = DetectionMethod.BLOCK;
        private double colorThreshold = DetectionOptions.DEFAULT_COLOR_THRESHOLD;
        private int minRegionSize = DetectionOptions.DEFAULT_MIN_REGION_SIZE;
        private int blockSize = DetectionOptions.DEFAULT_BLOCK_SIZE;
        private double minBlockDensity = DetectionOptions.DEFAULT_MIN_BLOCK_DENSITY;
        private int minBlockCount = DetectionOptions.DEFAULT_MIN_BLOCK_COUNT;

        public DetectionOptions toOptions() {
            return new DetectionOptions(colorThreshold, minRegionSize, strategy, blockSize, minBlockDensity, minBlockCount);
        }

        public DetectionMethod getStrategy() { return strategy; }
        public void setStrategy(DetectionMethod strategy) { this.strategy = strategy; }

        public double getColorThreshold() { return colorThreshold; }
        public void setColorThreshold(double colorThreshold) { this.colorThreshold = colorThreshold; }

        public int getMinRegionSize() { return minRegionSize; }
        public void setMinRegionSize(int minRegionSize) { this.minRegionSize = minRegionSize; }

        public int getBlockSize() { return blockSize; }
        public void setBlockSize(int blockSize) { this.blockSize = blockSize; }

        public double getMinBlockDensity() { return minBlockDensity; }
        public void setMinBlockDensity(double minBlockDensity) { this.minBlockDensity = minBlockDensity; }

        public int getMinBlockCount() { return minBlockCount; }
        public void setMinBlockCount(int minBlockCount) { this.minBlockCount = minBlockCount; }
    }

    public static class Perceptual {
        private double threshold = PerceptualOptions.DEFAULT_THRESHOLD;
        private int minArea = PerceptualOptions.DEFAULT_MIN_AREA;
        private int patchSize = PerceptualOptions.DEFAULT_PATCH_SIZE;
        private int stride = PerceptualOptions.DEFAULT_STRIDE;
        private int morphologyKernelSize = PerceptualOptions.DEFAULT_MORPHOLOGY_KERNEL_SIZE;
        /** Upper bound on one perceptual detection, queueing included. */
        private Duration timeout = Duration.ofSeconds(60);

        public PerceptualOptions toOptions() {
            return new PerceptualOptions(threshold, minArea, patchSize, stride, morphologyKernelSize);
        }

        public double getThreshold() { return threshold; }
        public void setThreshold(double threshold) { this.threshold = threshold; }

        public int getMinArea() { return minArea; }
        public void setMinArea(int minArea) { this.minArea = minArea; }

        public int getPatchSize() { return patchSize; }
        public void setPatchSize(int patchSize) { this.patchSize = patchSize; }

        public int getStride() { return stride; }
        public void setStride(int stride) { this.stride = stride; }

        public int getMorphologyKernelSize() { return morphologyKernelSize; }
        public void setMorphologyKernelSize(int morphologyKernelSize) { this.morphologyKernelSize = morphologyKernelSize; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    /** Gaussian window of the default SSIM patch scorer. */
    public static class Ssim {
        private int windowSize = 11;
        private double sigma = 1.5;

        public int getWindowSize() { return windowSize; }
        public void setWindowSize(int windowSize) { this.windowSize = windowSize; }

        public double getSigma() { return sigma; }
        public void setSigma(double sigma) { this.sigma = sigma; }
    }

    public static class Executor {
        private int poolSize = 2;
        private int queueCapacity = 16;

        public int getPoolSize() { return poolSize; }
        public void setPoolSize(int poolSize) { this.poolSize = poolSize; }

        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
    }

    public static class Overlay {
        /** Number each region on the overlay; needs a working font stack on the host. */
        private boolean labels = true;

        public boolean isLabels() { return labels; }
        public void setLabels(boolean labels) { this.labels = labels; }
    }
}
