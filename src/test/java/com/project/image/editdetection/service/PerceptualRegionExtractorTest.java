package com.project.image.editdetection.service;

import com.project.image.editdetection.DTOs.BoundingBox;
import com.project.image.editdetection.DTOs.ChangeField;
import com.project.image.editdetection.DTOs.DetectionMethod;
import com.project.image.editdetection.DTOs.DetectionResult;
import com.project.image.editdetection.DTOs.PerceptualOptions;
import com.project.image.editdetection.DTOs.PolygonRegion;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PerceptualRegionExtractorTest {

    private final PerceptualRegionExtractor extractor = new PerceptualRegionExtractor();

    private static ChangeField field(int w, int h, float[]... blocks) {
        float[] v = new float[w * h];
        for (float[] b : blocks) {
            int x0 = (int) b[0], y0 = (int) b[1], bw = (int) b[2], bh = (int) b[3];
            for (int y = y0; y < y0 + bh; y++) {
                for (int x = x0; x < x0 + bw; x++) {
                    v[y * w + x] = b[4];
                }
            }
        }
        return new ChangeField(w, h, v);
    }

    @Test
    void extract_squareBlob_yieldsOneSimplifiedPolygon() {
        ChangeField heat = field(100, 100, new float[]{20, 20, 40, 40, 0.8f});

        DetectionResult<PolygonRegion> res = extractor.extract(heat, PerceptualOptions.defaults());

        assertThat(res.method()).isEqualTo(DetectionMethod.PERCEPTUAL);
        assertThat(res.regions()).hasSize(1);
        PolygonRegion p = res.regions().get(0);
        BoundingBox b = p.bounds();
        assertThat(b.x()).isBetween(20, 21);
        assertThat(b.right()).isBetween(58, 59);
        assertThat(p.area()).isBetween(1400, 1600);
        assertThat(p.polygon().size()).isBetween(4, 8);
        assertThat(p.center().x()).isBetween(38, 40);
        assertThat(p.center().y()).isBetween(38, 40);
        assertThat(p.significance()).isCloseTo(80.0, within(0.1));
        assertThat(res.changedMeasure()).isEqualTo(p.area());
        assertThat(res.percentChanged()).isCloseTo(p.area() / 100.0, within(1e-9));
    }

    @Test
    void extract_dropsContoursBelowMinArea_andRanksBySignificance() {
        ChangeField heat = field(200, 200,
                new float[]{10, 10, 60, 60, 0.4f},
                new float[]{120, 120, 30, 30, 0.9f},
                new float[]{180, 10, 8, 8, 1.0f});

        DetectionResult<PolygonRegion> res = extractor.extract(heat, PerceptualOptions.defaults());

        assertThat(res.regions()).hasSize(2);
        assertThat(res.regions().get(0).significance()).isCloseTo(90.0, within(0.1));
        assertThat(res.regions().get(1).significance()).isCloseTo(40.0, within(0.1));
        assertThat(res.changedMeasure())
                .isEqualTo((long) res.regions().get(0).area() + res.regions().get(1).area());
    }

    @Test
    void extract_ranksOnUnroundedMean_whenReportedValuesTie() {
        // both report 50.0; the stronger blob must come first wherever it sits
        ChangeField strongLeft = field(200, 100,
                new float[]{10, 20, 40, 40, 0.5004f},
                new float[]{120, 20, 40, 40, 0.5001f});
        ChangeField strongRight = field(200, 100,
                new float[]{10, 20, 40, 40, 0.5001f},
                new float[]{120, 20, 40, 40, 0.5004f});

        DetectionResult<PolygonRegion> left = extractor.extract(strongLeft, PerceptualOptions.defaults());
        DetectionResult<PolygonRegion> right = extractor.extract(strongRight, PerceptualOptions.defaults());

        assertThat(left.regions()).hasSize(2);
        assertThat(right.regions()).hasSize(2);
        assertThat(left.regions().get(0).significance()).isEqualTo(left.regions().get(1).significance());
        assertThat(left.regions().get(0).bounds().x()).isLessThan(100);
        assertThat(right.regions().get(0).bounds().x()).isGreaterThan(100);
    }

    @Test
    void extract_belowThreshold_isEmpty() {
        ChangeField heat = field(100, 100, new float[]{20, 20, 40, 40, 0.05f});

        DetectionResult<PolygonRegion> res = extractor.extract(heat, PerceptualOptions.defaults());

        assertThat(res.hasRegions()).isFalse();
        assertThat(res.changedMeasure()).isZero();
        assertThat(res.percentChanged()).isZero();
        assertThat(res.imageWidth()).isEqualTo(100);
    }

    @Test
    void extract_openingRemovesThinLines() {
        ChangeField heat = field(100, 100, new float[]{0, 50, 100, 2, 1.0f});

        DetectionResult<PolygonRegion> res = extractor.extract(heat, PerceptualOptions.defaults().withMinArea(0));

        assertThat(res.regions()).isEmpty();
    }
}
