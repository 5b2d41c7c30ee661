package com.project.image.editdetection.service;

import com.project.image.editdetection.DTOs.ChangeField;
import com.project.image.editdetection.DTOs.RasterImage;
import com.project.image.editdetection.service.scoring.PatchScorer;
import com.project.image.editdetection.service.scoring.PatchScorerHandle;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.util.concurrent.atomic.AtomicInteger;

import static com.project.image.editdetection.TestImages.raster;
import static com.project.image.editdetection.TestImages.solid;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PerceptualHeatmapBuilderTest {

    private static RasterImage gray(int w, int h) {
        return raster(solid(w, h, Color.GRAY));
    }

    private static PerceptualHeatmapBuilder builder(PatchScorer scorer) {
        return new PerceptualHeatmapBuilder(PatchScorerHandle.of(scorer));
    }

    @Test
    void build_belowPatchFloor_isAllZeros_andNeverBuildsScorer() {
        AtomicInteger built = new AtomicInteger();
        PatchScorerHandle handle = new PatchScorerHandle("lazy", () -> {
            built.incrementAndGet();
            return (a, b) -> 1.0;
        });

        ChangeField heat = new PerceptualHeatmapBuilder(handle).build(gray(32, 100), gray(32, 100), 64, 32);

        assertThat(heat.width()).isEqualTo(32);
        assertThat(heat.height()).isEqualTo(100);
        assertThat(heat.max()).isZero();
        assertThat(handle.isInitialized()).isFalse();
        assertThat(built.get()).isZero();
    }

    @Test
    void build_singleSample_fillsUniformly() {
        ChangeField heat = builder((a, b) -> 0.7).build(gray(64, 64), gray(64, 64), 64, 32);

        assertThat((double) heat.get(0, 0)).isCloseTo(0.7, within(1e-6));
        assertThat((double) heat.get(63, 63)).isCloseTo(0.7, within(1e-6));
    }

    @Test
    void build_twoOrThreeSamples_usesNearestWindowCenter() {
        AtomicInteger calls = new AtomicInteger();
        // windows at x = 0, 32, 64 are scored in order: 0.1, 0.2, 0.3; centers at x = 32, 64, 96
        PatchScorer scorer = (a, b) -> 0.1 * calls.incrementAndGet();

        ChangeField heat = builder(scorer).build(gray(128, 64), gray(128, 64), 64, 32);

        assertThat(calls.get()).isEqualTo(3);
        assertThat((double) heat.get(0, 0)).isCloseTo(0.1, within(1e-6));
        assertThat((double) heat.get(64, 10)).isCloseTo(0.2, within(1e-6));
        assertThat((double) heat.get(127, 63)).isCloseTo(0.3, within(1e-6));
        // equidistant from the first two centers: the earlier window wins
        assertThat((double) heat.get(48, 0)).isCloseTo(0.1, within(1e-6));
    }

    @Test
    void build_fourOrMoreSamples_interpolatesInsideSpanAndZeroesOutside() {
        ChangeField heat = builder((a, b) -> 0.5).build(gray(128, 128), gray(128, 128), 64, 32);

        // centers span [32, 96] on both axes
        assertThat((double) heat.get(32, 32)).isCloseTo(0.5, within(1e-3));
        assertThat((double) heat.get(64, 70)).isCloseTo(0.5, within(1e-3));
        assertThat((double) heat.get(96, 96)).isCloseTo(0.5, within(1e-3));
        assertThat(heat.get(10, 10)).isZero();
        assertThat(heat.get(97, 64)).isZero();
        assertThat(heat.get(64, 127)).isZero();
    }

    @Test
    void build_smallPatch_isRaisedToFloor() {
        AtomicInteger calls = new AtomicInteger();

        builder((a, b) -> {
            calls.incrementAndGet();
            assertThat(a.width()).isEqualTo(PerceptualHeatmapBuilder.MIN_PATCH_SIZE);
            return 0.0;
        }).build(gray(128, 128), gray(128, 128), 16, 8);

        // patch 64 at stride 32 over 128 px: 3 x 3 windows
        assertThat(calls.get()).isEqualTo(9);
    }

    @Test
    void build_nonFiniteScores_becomeZero() {
        ChangeField single = builder((a, b) -> Double.NaN).build(gray(64, 64), gray(64, 64), 64, 32);
        ChangeField grid = builder((a, b) -> Double.POSITIVE_INFINITY).build(gray(128, 128), gray(128, 128), 64, 32);

        assertThat(single.max()).isZero();
        for (int i = 0; i < 128 * 128; i++) {
            assertThat(Float.isFinite(grid.at(i))).isTrue();
        }
    }
}
