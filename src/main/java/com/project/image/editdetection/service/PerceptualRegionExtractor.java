package com.project.image.editdetection.service;

import com.project.image.editdetection.DTOs.BoundingBox;
import com.project.image.editdetection.DTOs.ChangeField;
import com.project.image.editdetection.DTOs.DetectionMethod;
import com.project.image.editdetection.DTOs.DetectionResult;
import com.project.image.editdetection.DTOs.PerceptualOptions;
import com.project.image.editdetection.DTOs.PixelPoint;
import com.project.image.editdetection.DTOs.PolygonRegion;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Point;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.opencv.imgproc.Moments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns a perceptual heatmap into polygon regions: threshold, open then close with an elliptical kernel,
 * trace outer contours, drop small ones, simplify the rest.
 */
public class PerceptualRegionExtractor {
    private static final Logger log = LoggerFactory.getLogger(PerceptualRegionExtractor.class);

    /** Douglas-Peucker tolerance as a fraction of the closed contour perimeter. */
    public static final double SIMPLIFY_EPSILON_FRACTION = 0.02;

    public DetectionResult<PolygonRegion> extract(ChangeField heatmap, PerceptualOptions options) {
        OpenCvSupport.ensureLoaded();
        final int w = heatmap.width(), h = heatmap.height();

        Mat heat = OpenCvSupport.toFloatMat(heatmap);
        Mat binary = new Mat();
        Mat kernel = Imgproc.getStructuringElement(Imgproc.MORPH_ELLIPSE,
                new Size(options.morphologyKernelSize(), options.morphologyKernelSize()));
        Mat hierarchy = new Mat();
        List<MatOfPoint> contours = new ArrayList<>();
        try {
            Mat thresholded = new Mat();
            Imgproc.threshold(heat, thresholded, options.threshold(), 255, Imgproc.THRESH_BINARY);
            thresholded.convertTo(binary, CvType.CV_8U);
            thresholded.release();

            // opening drops specks, closing fills pinholes
            Imgproc.morphologyEx(binary, binary, Imgproc.MORPH_OPEN, kernel);
            Imgproc.morphologyEx(binary, binary, Imgproc.MORPH_CLOSE, kernel);

            Imgproc.findContours(binary, contours, hierarchy, Imgproc.RETR_EXTERNAL, Imgproc.CHAIN_APPROX_SIMPLE);
            log.debug("Found {} raw contours", contours.size());

            List<ScoredRegion> scored = new ArrayList<>();
            for (MatOfPoint contour : contours) {
                double area = Imgproc.contourArea(contour);
                if (area < options.minArea()) continue;
                scored.add(toRegion(contour, area, heat));
            }
            // rank on the unrounded mean; regions whose reported values tie keep that order
            scored.sort(Comparator.comparingDouble(ScoredRegion::rawSignificance).reversed());
            List<PolygonRegion> regions = new ArrayList<>(scored.size());
            for (ScoredRegion s : scored) regions.add(s.region());

            long totalArea = 0;
            for (PolygonRegion r : regions) totalArea += r.area();
            double percent = RegionDetector.percentOf(totalArea, w, h);

            return new DetectionResult<>(DetectionMethod.PERCEPTUAL, regions, totalArea, percent, w, h);
        } finally {
            contours.forEach(Mat::release);
            heat.release();
            binary.release();
            kernel.release();
            hierarchy.release();
        }
    }

    private static ScoredRegion toRegion(MatOfPoint contour, double area, Mat heat) {
        MatOfPoint2f curve = new MatOfPoint2f(contour.toArray());
        MatOfPoint2f approx = new MatOfPoint2f();
        Mat mask = Mat.zeros(heat.size(), CvType.CV_8U);
        try {
            double epsilon = SIMPLIFY_EPSILON_FRACTION * Imgproc.arcLength(curve, true);
            Imgproc.approxPolyDP(curve, approx, epsilon, true);

            List<PixelPoint> polygon = new ArrayList<>();
            for (Point p : approx.toArray()) {
                polygon.add(new PixelPoint((int) p.x, (int) p.y));
            }

            Rect r = Imgproc.boundingRect(contour);
            BoundingBox bounds = new BoundingBox(r.x, r.y, r.width, r.height);

            Moments m = Imgproc.moments(contour);
            PixelPoint center = m.m00 > 0
                    ? new PixelPoint((int) (m.m10 / m.m00), (int) (m.m01 / m.m00))
                    : new PixelPoint(r.x + r.width / 2, r.y + r.height / 2);

            Imgproc.drawContours(mask, List.of(contour), -1, new Scalar(1), -1);
            double raw = 0.0;
            if (Core.countNonZero(mask) > 0) {
                raw = Core.mean(heat, mask).val[0] * 100.0;
            }
            double significance = Math.max(0.0, Math.min(100.0, Significance.oneDecimal(raw)));

            return new ScoredRegion(new PolygonRegion(polygon, bounds, center, (int) area, significance), raw);
        } finally {
            curve.release();
            approx.release();
            mask.release();
        }
    }

    private record ScoredRegion(PolygonRegion region, double rawSignificance) {}
}
