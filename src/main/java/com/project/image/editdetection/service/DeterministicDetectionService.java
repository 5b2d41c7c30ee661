package com.project.image.editdetection.service;

import com.project.image.editdetection.DTOs.ChangeField;
import com.project.image.editdetection.DTOs.DetectionMethod;
import com.project.image.editdetection.DTOs.DetectionOptions;
import com.project.image.editdetection.DTOs.DetectionResult;
import com.project.image.editdetection.DTOs.RasterImage;
import com.project.image.editdetection.DTOs.RectRegion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;

/**
 * Delta E edit detection. The edited image is resampled onto the original's grid when the sizes differ,
 * and the result always reports the original's dimensions.
 */
@Service
public class DeterministicDetectionService {
    private static final Logger log = LoggerFactory.getLogger(DeterministicDetectionService.class);

    private final Map<DetectionMethod, RegionDetector> strategies = new EnumMap<>(DetectionMethod.class);

    public DeterministicDetectionService() {
        strategies.put(DetectionMethod.PIXEL, new PixelRegionDetector());
        strategies.put(DetectionMethod.BLOCK, new BlockRegionDetector());
    }

    public DetectionResult<RectRegion> detect(RasterImage original, RasterImage edited) {
        return detect(original, edited, DetectionOptions.defaults());
    }

    public DetectionResult<RectRegion> detect(RasterImage original, RasterImage edited, DetectionOptions options) {
        ChangeField deltaE = colorDifference(original, edited);
        DetectionResult<RectRegion> result = strategies.get(options.strategy()).detect(deltaE, options);

        log.debug("{} detection on {}x{}: {} regions, {} changed pixels ({}%)",
                options.strategy(), result.imageWidth(), result.imageHeight(), result.regions().size(),
                result.changedMeasure(), String.format("%.1f", result.percentChanged()));
        return result;
    }

    /** Delta E between the original and the edited image resampled onto the original's grid. */
    public ChangeField colorDifference(RasterImage original, RasterImage edited) {
        return ColorScience.deltaE(original, ImageResampler.alignTo(original, edited));
    }
}
