package com.project.image.editdetection.service;

import com.project.image.editdetection.DTOs.ChangeField;
import com.project.image.editdetection.DTOs.DetectionResult;
import com.project.image.editdetection.DTOs.PerceptualOptions;
import com.project.image.editdetection.DTOs.PolygonRegion;
import com.project.image.editdetection.DTOs.RasterImage;
import com.project.image.editdetection.service.scoring.PatchScorerHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Perceptual edit detection: patch scores spread into a heatmap, then contoured into polygons.
 * Scoring is the slow part, so web callers go through {@link #detectAsync} on the dedicated pool.
 */
@Service
public class PerceptualDetectionService {
    private static final Logger log = LoggerFactory.getLogger(PerceptualDetectionService.class);

    private final PatchScorerHandle scorer;
    private final PerceptualHeatmapBuilder heatmapBuilder;
    private final PerceptualRegionExtractor extractor = new PerceptualRegionExtractor();
    private final Executor executor;

    @Autowired
    public PerceptualDetectionService(PatchScorerHandle scorer, @Qualifier("perceptualExecutor") Executor executor) {
        this.scorer = scorer;
        this.heatmapBuilder = new PerceptualHeatmapBuilder(scorer);
        this.executor = executor;
    }

    /** Runs asynchronous calls on the calling thread. */
    public PerceptualDetectionService(PatchScorerHandle scorer) {
        this(scorer, Runnable::run);
    }

    public DetectionResult<PolygonRegion> detect(RasterImage original, RasterImage edited) {
        return detect(original, edited, PerceptualOptions.defaults());
    }

    public DetectionResult<PolygonRegion> detect(RasterImage original, RasterImage edited, PerceptualOptions options) {
        long start = System.nanoTime();
        ChangeField heat = heatmap(original, edited, options);
        log.debug("Heatmap {}x{}: mean={}, max={}", heat.width(), heat.height(), heat.mean(), heat.max());

        DetectionResult<PolygonRegion> result = extractor.extract(heat, options);
        log.debug("Perceptual detection with '{}' took {} ms: {} regions, {}px changed",
                scorer.name(), (System.nanoTime() - start) / 1_000_000, result.regions().size(), result.changedMeasure());
        return result;
    }

    /** Dense perceptual difference map on the original's grid. */
    public ChangeField heatmap(RasterImage original, RasterImage edited, PerceptualOptions options) {
        RasterImage aligned = ImageResampler.alignTo(original, edited);
        return heatmapBuilder.build(original, aligned, options.patchSize(), options.stride());
    }

    public CompletableFuture<DetectionResult<PolygonRegion>> detectAsync(RasterImage original, RasterImage edited,
                                                                         PerceptualOptions options) {
        return CompletableFuture.supplyAsync(() -> detect(original, edited, options), executor);
    }
}
