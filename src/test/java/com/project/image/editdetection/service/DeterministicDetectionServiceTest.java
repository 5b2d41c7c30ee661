package com.project.image.editdetection.service;

import com.project.image.editdetection.DTOs.BoundingBox;
import com.project.image.editdetection.DTOs.DetectionMethod;
import com.project.image.editdetection.DTOs.DetectionOptions;
import com.project.image.editdetection.DTOs.DetectionResult;
import com.project.image.editdetection.DTOs.RasterImage;
import com.project.image.editdetection.DTOs.RectRegion;
import com.project.image.editdetection.exceptions.ImageShapeException;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.image.BufferedImage;

import static com.project.image.editdetection.TestImages.raster;
import static com.project.image.editdetection.TestImages.solid;
import static com.project.image.editdetection.TestImages.withRect;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeterministicDetectionServiceTest {
    private static final Color GRAY = new Color(128, 128, 128);

    private final DeterministicDetectionService service = new DeterministicDetectionService();
    private final DetectionOptions pixel = DetectionOptions.pixel(12.0, 10);

    @Test
    void detect_singleSquare_pixelMode_reportsExactBounds() {
        BufferedImage base = solid(200, 200, GRAY);
        BufferedImage edited = withRect(base, 20, 20, 30, 30, Color.WHITE);

        DetectionResult<RectRegion> res = service.detect(raster(base), raster(edited), pixel);

        assertThat(res.method()).isEqualTo(DetectionMethod.PIXEL);
        assertThat(res.regions()).hasSize(1);
        RectRegion r = res.regions().get(0);
        assertThat(r.bounds()).isEqualTo(new BoundingBox(20, 20, 30, 30));
        assertThat(r.bounds().right()).isEqualTo(49);
        assertThat(r.bounds().bottom()).isEqualTo(49);
        assertThat(r.pixelCount()).isEqualTo(900);
        // (20 + 49) / 2 = 34.5 rounds half to even
        assertThat(r.center().x()).isEqualTo(34);
        assertThat(r.center().y()).isEqualTo(34);
        assertThat(r.avgDifference()).isEqualTo(r.maxDifference());
        assertThat(res.changedMeasure()).isEqualTo(900);
        assertThat(res.percentChanged()).isEqualTo(100.0 * 900 / (200 * 200));
    }

    @Test
    void detect_twoDisjointSquares_findsTwoRegionsSortedBySignificance() {
        BufferedImage base = solid(200, 200, GRAY);
        BufferedImage edited = withRect(withRect(base, 10, 10, 20, 20, Color.WHITE), 100, 100, 60, 60, Color.BLACK);

        DetectionResult<RectRegion> res = service.detect(raster(base), raster(edited), pixel);

        assertThat(res.regions()).hasSize(2);
        assertThat(res.regions().get(0).significance())
                .isGreaterThanOrEqualTo(res.regions().get(1).significance());
        assertThat(res.regions().get(0).bounds()).isEqualTo(new BoundingBox(100, 100, 60, 60));
        assertThat(res.regions()).allSatisfy(r -> assertThat(r.significance()).isBetween(0, 100));
    }

    @Test
    void detect_lShape_isOneRegion() {
        BufferedImage base = solid(100, 100, GRAY);
        BufferedImage edited = withRect(withRect(base, 10, 10, 40, 8, Color.WHITE), 10, 10, 8, 40, Color.WHITE);

        DetectionResult<RectRegion> res = service.detect(raster(base), raster(edited), pixel);

        assertThat(res.regions()).hasSize(1);
        assertThat(res.regions().get(0).bounds()).isEqualTo(new BoundingBox(10, 10, 40, 40));
        assertThat(res.regions().get(0).pixelCount()).isEqualTo(40 * 8 * 2 - 8 * 8);
    }

    @Test
    void detect_identicalImages_findsNothing() {
        RasterImage img = raster(solid(64, 48, GRAY));

        for (DetectionMethod m : new DetectionMethod[]{DetectionMethod.PIXEL, DetectionMethod.BLOCK}) {
            DetectionResult<RectRegion> res = service.detect(img, img, DetectionOptions.defaults().withStrategy(m));
            assertThat(res.regions()).isEmpty();
            assertThat(res.changedMeasure()).isZero();
            assertThat(res.percentChanged()).isZero();
        }
    }

    @Test
    void detect_blockMode_coversSquareAndCountsEveryChangedPixel() {
        BufferedImage base = solid(200, 200, GRAY);
        BufferedImage edited = withRect(base, 20, 20, 30, 30, Color.WHITE);

        DetectionResult<RectRegion> res = service.detect(raster(base), raster(edited));

        assertThat(res.method()).isEqualTo(DetectionMethod.BLOCK);
        assertThat(res.regions()).hasSize(1);
        BoundingBox b = res.regions().get(0).bounds();
        assertThat(b.x()).isLessThanOrEqualTo(20);
        assertThat(b.y()).isLessThanOrEqualTo(20);
        assertThat(b.right()).isGreaterThanOrEqualTo(49);
        assertThat(b.bottom()).isGreaterThanOrEqualTo(49);
        assertThat(b.x() % 8).isZero();
        assertThat(res.changedMeasure()).isEqualTo(900);
    }

    @Test
    void detect_scatteredNoise_isFilteredByBothStrategies() {
        BufferedImage base = solid(128, 128, GRAY);
        BufferedImage edited = solid(128, 128, GRAY);
        for (int y = 3; y < 128; y += 16) {
            for (int x = 5; x < 128; x += 16) {
                edited.setRGB(x, y, 0xFFFFFF);
            }
        }

        assertThat(service.detect(raster(base), raster(edited)).regions()).isEmpty();
        assertThat(service.detect(raster(base), raster(edited), pixel).regions()).isEmpty();
    }

    @Test
    void detect_blockMode_clampsBoundsToImage() {
        BufferedImage base = solid(60, 60, GRAY);
        BufferedImage edited = withRect(base, 40, 40, 20, 20, Color.WHITE);

        DetectionResult<RectRegion> res = service.detect(raster(base), raster(edited));

        assertThat(res.regions()).hasSize(1);
        BoundingBox b = res.regions().get(0).bounds();
        assertThat(b.right()).isLessThan(60);
        assertThat(b.bottom()).isLessThan(60);
    }

    @Test
    void detect_blockMode_edgeColumnNarrowerThanBlock_keepsCenterInsideBounds() {
        BufferedImage base = solid(65, 64, GRAY);
        BufferedImage edited = withRect(base, 64, 0, 1, 16, Color.WHITE);

        DetectionResult<RectRegion> res = service.detect(raster(base), raster(edited));

        assertThat(res.regions()).isNotEmpty();
        RectRegion r = res.regions().get(0);
        assertThat(r.bounds()).isEqualTo(new BoundingBox(64, 0, 1, 16));
        assertThat(r.center().x()).isEqualTo(64);
        assertThat(res.regions()).allSatisfy(region -> {
            BoundingBox b = region.bounds();
            assertThat(region.center().x()).isBetween(b.x(), b.right()).isLessThan(65);
            assertThat(region.center().y()).isBetween(b.y(), b.bottom()).isLessThan(64);
        });
    }

    @Test
    void detect_blockMode_singlePixelImage_centersOnThatPixel() {
        DetectionResult<RectRegion> res = service.detect(
                raster(solid(1, 1, Color.BLACK)), raster(solid(1, 1, Color.WHITE)));

        assertThat(res.regions()).hasSize(1);
        assertThat(res.regions().get(0).bounds()).isEqualTo(new BoundingBox(0, 0, 1, 1));
        assertThat(res.regions().get(0).center().x()).isZero();
        assertThat(res.regions().get(0).center().y()).isZero();
    }

    @Test
    void detect_editedOfDifferentSize_reportsOriginalDimensions() {
        RasterImage original = raster(solid(200, 150, GRAY));
        RasterImage edited = raster(withRect(solid(100, 75, GRAY), 10, 10, 30, 30, Color.WHITE));

        DetectionResult<RectRegion> res = service.detect(original, edited, pixel);

        assertThat(res.imageWidth()).isEqualTo(200);
        assertThat(res.imageHeight()).isEqualTo(150);
        assertThat(res.regions()).isNotEmpty();
        assertThat(res.regions()).allSatisfy(r -> {
            assertThat(r.bounds().x()).isGreaterThanOrEqualTo(0);
            assertThat(r.bounds().right()).isLessThan(200);
            assertThat(r.bounds().bottom()).isLessThan(150);
        });
    }

    @Test
    void detect_rgbaInput_ignoresAlpha() {
        int w = 20, h = 20;
        byte[] rgba = new byte[w * h * 4];
        byte[] rgbaEdited = new byte[w * h * 4];
        for (int i = 0; i < w * h; i++) {
            for (int c = 0; c < 3; c++) {
                rgba[i * 4 + c] = (byte) 128;
                rgbaEdited[i * 4 + c] = (byte) 128;
            }
            rgba[i * 4 + 3] = (byte) 255;
            rgbaEdited[i * 4 + 3] = 0;
        }
        for (int y = 5; y < 10; y++) {
            for (int x = 5; x < 10; x++) {
                rgbaEdited[(y * w + x) * 4] = (byte) 255;
            }
        }

        DetectionResult<RectRegion> res = service.detect(
                RasterImage.of(rgba, h, w, 4), RasterImage.of(rgbaEdited, h, w, 4), pixel);

        assertThat(res.regions()).hasSize(1);
        assertThat(res.regions().get(0).pixelCount()).isEqualTo(25);
    }

    @Test
    void detect_minRegionSize_dropsSmallRegions() {
        BufferedImage base = solid(100, 100, GRAY);
        BufferedImage edited = withRect(base, 10, 10, 10, 10, Color.WHITE);

        assertThat(service.detect(raster(base), raster(edited), DetectionOptions.pixel(12.0, 100)).regions()).hasSize(1);
        assertThat(service.detect(raster(base), raster(edited), DetectionOptions.pixel(12.0, 101)).regions()).isEmpty();
    }

    @Test
    void invalidShape_isRejectedBeforeDetection() {
        assertThatThrownBy(() -> service.detect(
                RasterImage.of(new byte[100 * 100], 100, 100), raster(solid(100, 100, GRAY))))
                .isInstanceOf(ImageShapeException.class)
                .hasMessageContaining("(100, 100)");
    }
}
