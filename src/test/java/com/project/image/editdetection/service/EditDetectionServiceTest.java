package com.project.image.editdetection.service;

import com.project.image.editdetection.DTOs.Comparison;
import com.project.image.editdetection.DTOs.ComparisonParameters;
import com.project.image.editdetection.DTOs.DetectionMethod;
import com.project.image.editdetection.DTOs.DetectionOptions;
import com.project.image.editdetection.DTOs.PerceptualOptions;
import com.project.image.editdetection.DTOs.RasterImage;
import com.project.image.editdetection.config.DetectionProperties;
import com.project.image.editdetection.exceptions.DetectionTimeoutException;
import com.project.image.editdetection.service.scoring.PatchScorerHandle;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.project.image.editdetection.TestImages.raster;
import static com.project.image.editdetection.TestImages.solid;
import static com.project.image.editdetection.TestImages.withRect;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EditDetectionServiceTest {

    private final DetectionProperties properties = new DetectionProperties();
    private final EditDetectionService service = new EditDetectionService(
            new DeterministicDetectionService(),
            new PerceptualDetectionService(PatchScorerHandle.of((a, b) -> 1.0)),
            properties);

    private final RasterImage original = raster(solid(128, 128, Color.GRAY));
    private final RasterImage edited = raster(withRect(solid(128, 128, Color.GRAY), 16, 16, 32, 32, Color.WHITE));

    @Test
    void compare_withoutMethod_usesConfiguredStrategy() {
        Comparison c = service.compare(original, edited, ComparisonParameters.of(null));

        assertThat(c.result().method()).isEqualTo(DetectionMethod.BLOCK);
        assertThat(c.result().regions()).hasSize(1);
        assertThat(c.report()).startsWith("DETECTED EDIT LOCATIONS (sorted by significance):");
    }

    @Test
    void compare_perceptual_returnsPolygonReport() {
        Comparison c = service.compare(original, edited, ComparisonParameters.of(DetectionMethod.PERCEPTUAL));

        assertThat(c.result().method()).isEqualTo(DetectionMethod.PERCEPTUAL);
        assertThat(c.report()).startsWith("DETECTED EDIT LOCATIONS (by perceptual difference");
    }

    @Test
    void options_overridesReplaceDefaults() {
        ComparisonParameters params = new ComparisonParameters(DetectionMethod.PIXEL, 30.0, 50, 16, 0.3, 500);

        DetectionOptions d = service.deterministicOptions(params, DetectionMethod.PIXEL);
        PerceptualOptions p = service.perceptualOptions(params);

        assertThat(d.strategy()).isEqualTo(DetectionMethod.PIXEL);
        assertThat(d.colorThreshold()).isEqualTo(30.0);
        assertThat(d.minRegionSize()).isEqualTo(50);
        assertThat(d.blockSize()).isEqualTo(16);
        assertThat(d.minBlockDensity()).isEqualTo(DetectionOptions.DEFAULT_MIN_BLOCK_DENSITY);
        assertThat(p.threshold()).isEqualTo(0.3);
        assertThat(p.minArea()).isEqualTo(500);
        assertThat(p.patchSize()).isEqualTo(PerceptualOptions.DEFAULT_PATCH_SIZE);
    }

    @Test
    void compare_highColorThreshold_findsNothing() {
        ComparisonParameters params = new ComparisonParameters(DetectionMethod.PIXEL, 99.0, null, null, null, null);

        Comparison c = service.compare(original, edited, params);

        assertThat(c.result().regions()).isEmpty();
        assertThat(c.report()).isEqualTo(RegionFormatter.NO_CHANGES);
    }

    @Test
    void compare_perceptualTimeout_raisesTimeoutException() {
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            DetectionProperties shortTimeout = new DetectionProperties();
            shortTimeout.getPerceptual().setTimeout(Duration.ofMillis(50));
            PatchScorerHandle blocking = PatchScorerHandle.of((a, b) -> {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return 0.0;
            });
            EditDetectionService slow = new EditDetectionService(new DeterministicDetectionService(),
                    new PerceptualDetectionService(blocking, pool), shortTimeout);

            assertThatThrownBy(() -> slow.compare(original, edited, ComparisonParameters.of(DetectionMethod.PERCEPTUAL)))
                    .isInstanceOf(DetectionTimeoutException.class);
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }
}
