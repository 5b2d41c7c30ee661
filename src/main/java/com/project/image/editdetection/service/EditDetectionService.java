package com.project.image.editdetection.service;

import com.project.image.editdetection.DTOs.Comparison;
import com.project.image.editdetection.DTOs.ComparisonParameters;
import com.project.image.editdetection.DTOs.DetectionMethod;
import com.project.image.editdetection.DTOs.DetectionOptions;
import com.project.image.editdetection.DTOs.DetectionResult;
import com.project.image.editdetection.DTOs.EditRegion;
import com.project.image.editdetection.DTOs.PerceptualOptions;
import com.project.image.editdetection.DTOs.PolygonRegion;
import com.project.image.editdetection.DTOs.RasterImage;
import com.project.image.editdetection.config.DetectionProperties;
import com.project.image.editdetection.exceptions.DetectionTimeoutException;
import com.project.image.editdetection.exceptions.EditDetectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point for the web layer: resolves per-request options against the configured defaults,
 * runs the chosen detector and formats the report.
 */
@Service
public class EditDetectionService {
    private static final Logger log = LoggerFactory.getLogger(EditDetectionService.class);

    private final DeterministicDetectionService deterministic;
    private final PerceptualDetectionService perceptual;
    private final DetectionProperties properties;

    public EditDetectionService(DeterministicDetectionService deterministic,
                                PerceptualDetectionService perceptual,
                                DetectionProperties properties) {
        this.deterministic = deterministic;
        this.perceptual = perceptual;
        this.properties = properties;
    }

    public Comparison compare(RasterImage original, RasterImage edited, ComparisonParameters params) {
        DetectionMethod method = params.method() != null
                ? params.method()
                : properties.getDeterministic().getStrategy();

        DetectionResult<? extends EditRegion> result = method.isPerceptual()
                ? awaitPerceptual(original, edited, perceptualOptions(params))
                : deterministic.detect(original, edited, deterministicOptions(params, method));

        log.info("{} comparison of {}x{} finished: {} regions, {}% changed", method,
                result.imageWidth(), result.imageHeight(), result.regions().size(),
                String.format("%.1f", result.percentChanged()));
        return new Comparison(result, RegionFormatter.format(result));
    }

    DetectionOptions deterministicOptions(ComparisonParameters params, DetectionMethod method) {
        DetectionOptions options = properties.getDeterministic().toOptions().withStrategy(method);
        if (params.colorThreshold() != null) options = options.withColorThreshold(params.colorThreshold());
        if (params.minRegionSize() != null) options = options.withMinRegionSize(params.minRegionSize());
        if (params.blockSize() != null) options = options.withBlockSize(params.blockSize());
        return options;
    }

    PerceptualOptions perceptualOptions(ComparisonParameters params) {
        PerceptualOptions options = properties.getPerceptual().toOptions();
        if (params.perceptualThreshold() != null) options = options.withThreshold(params.perceptualThreshold());
        if (params.minArea() != null) options = options.withMinArea(params.minArea());
        return options;
    }

    private DetectionResult<PolygonRegion> awaitPerceptual(RasterImage original, RasterImage edited,
                                                           PerceptualOptions options) {
        Duration timeout = properties.getPerceptual().getTimeout();
        CompletableFuture<DetectionResult<PolygonRegion>> future = perceptual.detectAsync(original, edited, options);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Perceptual detection exceeded {} ms", timeout.toMillis());
            throw new DetectionTimeoutException("Perceptual detection timed out after " + timeout.toSeconds() + "s", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            throw new EditDetectionException("Perceptual detection failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EditDetectionException("Interrupted while waiting for perceptual detection", e);
        }
    }
}
