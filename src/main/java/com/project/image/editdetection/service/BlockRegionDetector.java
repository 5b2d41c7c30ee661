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
 * Block strategy, in the spirit of video-codec macroblocks: a cell is changed when enough of its
 * pixels are, and clusters of adjacent changed cells become regions. Robust against diffusion noise.
 */
public class BlockRegionDetector implements RegionDetector {

    @Override
    public DetectionResult<RectRegion> detect(ChangeField deltaE, DetectionOptions options) {
        final int w = deltaE.width(), h = deltaE.height();
        final int bs = options.blockSize();
        final double threshold = options.colorThreshold();
        final int blocksX = (w + bs - 1) / bs;
        final int blocksY = (h + bs - 1) / bs;

        BlockStats stats = new BlockStats(blocksX * blocksY);
        long totalChanged = 0;

        for (int by = 0; by < blocksY; by++) {
            for (int bx = 0; bx < blocksX; bx++) {
                int b = by * blocksX + bx;
                int x0 = bx * bs, y0 = by * bs;
                int x1 = Math.min(x0 + bs, w), y1 = Math.min(y0 + bs, h);

                int changed = 0;
                double sum = 0, max = 0;
                for (int y = y0; y < y1; y++) {
                    for (int x = x0; x < x1; x++) {
                        float d = deltaE.get(x, y);
                        if (d > threshold) {
                            changed++;
                            sum += d;
                            max = Math.max(max, d);
                        }
                    }
                }
                int pixels = (x1 - x0) * (y1 - y0);
                stats.changedPixels[b] = changed;
                stats.totalDiff[b] = sum;
                stats.maxDiff[b] = max;
                stats.changed[b] = (double) changed / pixels >= options.minBlockDensity();
                totalChanged += changed;
            }
        }

        List<RectRegion> regions = new ArrayList<>();
        for (ConnectedComponents.Component c : ConnectedComponents.find(blocksX, blocksY, b -> stats.changed[b])) {
            if (c.size() < options.minBlockCount()) continue;
            regions.add(toRegion(c, stats, bs, w, h));
        }

        return new DetectionResult<>(DetectionMethod.BLOCK, DetectionResult.rank(regions), totalChanged,
                RegionDetector.percentOf(totalChanged, w, h), w, h);
    }

    private static RectRegion toRegion(ConnectedComponents.Component c, BlockStats stats,
                                       int blockSize, int imageWidth, int imageHeight) {
        double total = 0, max = 0;
        int changedPixels = 0;
        for (int b : c.cells()) {
            total += stats.totalDiff[b];
            changedPixels += stats.changedPixels[b];
            max = Math.max(max, stats.maxDiff[b]);
        }

        int x = c.minCol() * blockSize;
        int y = c.minRow() * blockSize;
        int width = Math.min((c.maxCol() + 1) * blockSize, imageWidth) - x;
        int height = Math.min((c.maxRow() + 1) * blockSize, imageHeight) - y;
        double avg = changedPixels > 0 ? total / changedPixels : 0;

        return new RectRegion(
                new BoundingBox(x, y, width, height),
                new PixelPoint((int) Math.rint(x + width / 2.0), (int) Math.rint(y + height / 2.0)),
                changedPixels,
                Significance.oneDecimal(avg),
                Significance.oneDecimal(max),
                Significance.score(width * height, avg, changedPixels));
    }

    /** Per-cell aggregates, indexed {@code by * blocksX + bx}. */
    private static final class BlockStats {
        final boolean[] changed;
        final int[] changedPixels;
        final double[] totalDiff;
        final double[] maxDiff;

        BlockStats(int blocks) {
            changed = new boolean[blocks];
            changedPixels = new int[blocks];
            totalDiff = new double[blocks];
            maxDiff = new double[blocks];
        }
    }
}
