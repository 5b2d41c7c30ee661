package com.project.image.editdetection.service;

import com.project.image.editdetection.DTOs.BoundingBox;
import com.project.image.editdetection.DTOs.ChangeField;
import com.project.image.editdetection.DTOs.DetectionMethod;
import com.project.image.editdetection.DTOs.DetectionOptions;
import com.project.image.editdetection.DTOs.DetectionResult;
import com.project.image.editdetection.DTOs.PixelPoint;
import com.project.image.editdetection.DTOs.RectRegion;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-pixel strategy: every pixel above the color threshold, grouped 4-connected.
 * Most sensitive, also most exposed to noise.
 */
public class PixelRegionDetector implements RegionDetector {

    @Override
    public DetectionResult<RectRegion> detect(ChangeField deltaE, DetectionOptions options) {
        final int w = deltaE.width(), h = deltaE.height();
        final double threshold = options.colorThreshold();

        long totalChanged = RegionDetector.countChanged(deltaE, threshold);
        List<RectRegion> regions = new ArrayList<>();

        for (ConnectedComponents.Component c : ConnectedComponents.find(w, h, i -> deltaE.at(i) > threshold)) {
            if (c.size() < options.minRegionSize()) continue;
            regions.add(toRegion(c, deltaE));
        }

        return new DetectionResult<>(DetectionMethod.PIXEL, DetectionResult.rank(regions), totalChanged,
                RegionDetector.percentOf(totalChanged, w, h), w, h);
    }

    private static RectRegion toRegion(ConnectedComponents.Component c, ChangeField deltaE) {
        double total = 0, max = 0;
        for (int idx : c.cells()) {
            float d = deltaE.at(idx);
            total += d;
            max = Math.max(max, d);
        }
        int count = c.size();
        double avg = count > 0 ? total / count : 0;

        int width = c.maxCol() - c.minCol() + 1;
        int height = c.maxRow() - c.minRow() + 1;
        PixelPoint center = new PixelPoint(
                (int) Math.rint((c.minCol() + c.maxCol()) / 2.0),
                (int) Math.rint((c.minRow() + c.maxRow()) / 2.0));

        return new RectRegion(
                new BoundingBox(c.minCol(), c.minRow(), width, height),
                center,
                count,
                Significance.oneDecimal(avg),
                Significance.oneDecimal(max),
                Significance.score(width * height, avg, count));
    }
}
