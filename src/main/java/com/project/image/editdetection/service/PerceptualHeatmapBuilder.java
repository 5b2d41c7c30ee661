package com.project.image.editdetection.service;

import com.project.image.editdetection.DTOs.ChangeField;
import com.project.image.editdetection.DTOs.RasterImage;
import com.project.image.editdetection.service.scoring.PatchScorer;
import com.project.image.editdetection.service.scoring.PatchScorerHandle;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Samples a patch scorer on a regular grid of windows and spreads the sparse scores over every pixel.
 * <p>
 * Interpolation depends on how many windows fit: one score fills the whole map, two or three use the
 * nearest window center, four or more are interpolated bicubically between window centers. Pixels
 * outside the span of window centers stay 0, as do non-finite or negative interpolated values.
 */
public class PerceptualHeatmapBuilder {
    private static final Logger log = LoggerFactory.getLogger(PerceptualHeatmapBuilder.class);

    /** Smallest window the scorer accepts; images below this on either side produce an all-zero map. */
    public static final int MIN_PATCH_SIZE = 64;

    private final PatchScorerHandle scorer;

    public PerceptualHeatmapBuilder(PatchScorerHandle scorer) {
        this.scorer = scorer;
    }

    public ChangeField build(RasterImage original, RasterImage edited, int patchSize, int stride) {
        if (!original.sameSizeAs(edited)) {
            throw new IllegalArgumentException("Images must share dimensions: " + original.shape() + " vs " + edited.shape());
        }
        final int w = original.width(), h = original.height();

        if (patchSize < MIN_PATCH_SIZE) {
            patchSize = MIN_PATCH_SIZE;
            stride = Math.max(stride, patchSize / 2);
        }
        if (w < MIN_PATCH_SIZE || h < MIN_PATCH_SIZE) {
            log.warn("Image too small for perceptual scoring ({}x{}, need at least {}x{}). Returning zeros.",
                    w, h, MIN_PATCH_SIZE, MIN_PATCH_SIZE);
            return ChangeField.zeros(w, h);
        }

        SampleGrid grid = sample(original, edited, patchSize, stride);
        if (grid == null) {
            return ChangeField.zeros(w, h);
        }

        float[] heat;
        if (grid.count() == 1) {
            heat = new float[w * h];
            Arrays.fill(heat, grid.scores[0]);
        } else if (grid.count() < 4) {
            heat = nearest(grid, w, h);
        } else {
            heat = bicubic(grid, w, h);
        }
        sanitize(heat);
        return new ChangeField(w, h, heat);
    }

    private SampleGrid sample(RasterImage a, RasterImage b, int patchSize, int stride) {
        int nx = a.width() >= patchSize ? (a.width() - patchSize) / stride + 1 : 0;
        int ny = a.height() >= patchSize ? (a.height() - patchSize) / stride + 1 : 0;
        if (nx == 0 || ny == 0) return null;

        PatchScorer s = scorer.get();
        float[] scores = new float[nx * ny];
        for (int gy = 0; gy < ny; gy++) {
            for (int gx = 0; gx < nx; gx++) {
                int x = gx * stride, y = gy * stride;
                scores[gy * nx + gx] = (float) s.score(
                        a.crop(x, y, patchSize, patchSize),
                        b.crop(x, y, patchSize, patchSize));
            }
        }
        log.debug("Scored {} patches ({}x{} grid, patch {}, stride {})", scores.length, nx, ny, patchSize, stride);
        return new SampleGrid(nx, ny, patchSize / 2, patchSize / 2, stride, scores);
    }

    private static float[] nearest(SampleGrid grid, int w, int h) {
        float[] out = new float[w * h];
        for (int v = 0; v < h; v++) {
            for (int u = 0; u < w; u++) {
                long best = Long.MAX_VALUE;
                float value = 0f;
                for (int s = 0; s < grid.count(); s++) {
                    long dx = u - grid.centerX(s), dy = v - grid.centerY(s);
                    long d = dx * dx + dy * dy;
                    if (d < best) {
                        best = d;
                        value = grid.scores[s];
                    }
                }
                out[v * w + u] = value;
            }
        }
        return out;
    }

    private static float[] bicubic(SampleGrid grid, int w, int h) {
        OpenCvSupport.ensureLoaded();

        float[] mx = new float[w * h];
        float[] my = new float[w * h];
        for (int v = 0; v < h; v++) {
            for (int u = 0; u < w; u++) {
                mx[v * w + u] = (u - grid.x0) / (float) grid.stride;
                my[v * w + u] = (v - grid.y0) / (float) grid.stride;
            }
        }

        Mat src = new Mat(grid.ny, grid.nx, CvType.CV_32F);
        Mat mapX = new Mat(h, w, CvType.CV_32F);
        Mat mapY = new Mat(h, w, CvType.CV_32F);
        Mat dst = new Mat();
        try {
            src.put(0, 0, grid.scores);
            mapX.put(0, 0, mx);
            mapY.put(0, 0, my);
            Imgproc.remap(src, dst, mapX, mapY, Imgproc.INTER_CUBIC, Core.BORDER_REPLICATE);
            float[] out = OpenCvSupport.floats(dst);

            int xLast = grid.x0 + (grid.nx - 1) * grid.stride;
            int yLast = grid.y0 + (grid.ny - 1) * grid.stride;
            for (int v = 0; v < h; v++) {
                boolean outsideY = grid.ny > 1 && (v < grid.y0 || v > yLast);
                for (int u = 0; u < w; u++) {
                    boolean outsideX = grid.nx > 1 && (u < grid.x0 || u > xLast);
                    if (outsideX || outsideY) out[v * w + u] = 0f;
                }
            }
            return out;
        } finally {
            src.release();
            mapX.release();
            mapY.release();
            dst.release();
        }
    }

    private static void sanitize(float[] heat) {
        for (int i = 0; i < heat.length; i++) {
            if (!Float.isFinite(heat[i]) || heat[i] < 0f) heat[i] = 0f;
        }
    }

    /** Scores at window centers {@code (x0 + gx * stride, y0 + gy * stride)}, row-major. */
    private record SampleGrid(int nx, int ny, int x0, int y0, int stride, float[] scores) {
        int count() { return scores.length; }
        int centerX(int s) { return x0 + (s % nx) * stride; }
        int centerY(int s) { return y0 + (s / nx) * stride; }
    }
}
