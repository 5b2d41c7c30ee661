package com.project.image.editdetection.service.scoring;

import com.project.image.editdetection.DTOs.RasterImage;
import com.project.image.editdetection.service.OpenCvSupport;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural dissimilarity: {@code 1 - mean SSIM} over the three color channels, clamped to [0, 1].
 * Local statistics use a Gaussian window. Scores behave like a learned patch distance: 0 for identical
 * patches, near 0 for faint brightness shifts, towards 1 for unrelated content.
 */
public class SsimPatchScorer implements PatchScorer {

    private static final double C1 = Math.pow(0.01 * 255, 2);
    private static final double C2 = Math.pow(0.03 * 255, 2);

    private final int windowSize;
    private final double sigma;

    public SsimPatchScorer() {
        this(11, 1.5);
    }

    public SsimPatchScorer(int windowSize, double sigma) {
        if (windowSize < 1 || windowSize % 2 == 0) {
            throw new IllegalArgumentException("windowSize must be odd and positive, got " + windowSize);
        }
        this.windowSize = windowSize;
        this.sigma = sigma;
    }

    @Override
    public double score(RasterImage patchA, RasterImage patchB) {
        if (!patchA.sameSizeAs(patchB)) {
            throw new IllegalArgumentException("Patch sizes differ: " + patchA.shape() + " vs " + patchB.shape());
        }
        OpenCvSupport.ensureLoaded();

        List<Mat> release = new ArrayList<>();
        try {
            Mat a = track(release, toDouble(patchA));
            Mat b = track(release, toDouble(patchB));
            Mat ssim = track(release, ssimMap(a, b, release));
            Scalar mean = Core.mean(ssim);
            double avg = (mean.val[0] + mean.val[1] + mean.val[2]) / 3.0;
            return Math.max(0.0, Math.min(1.0, 1.0 - avg));
        } finally {
            release.forEach(Mat::release);
        }
    }

    private Mat ssimMap(Mat x, Mat y, List<Mat> release) {
        Size window = new Size(windowSize, windowSize);

        Mat muX = track(release, blur(x, window));
        Mat muY = track(release, blur(y, window));
        Mat muX2 = track(release, muX.mul(muX));
        Mat muY2 = track(release, muY.mul(muY));
        Mat muXY = track(release, muX.mul(muY));

        Mat sigX2 = track(release, blur(track(release, x.mul(x)), window));
        Core.subtract(sigX2, muX2, sigX2);
        Mat sigY2 = track(release, blur(track(release, y.mul(y)), window));
        Core.subtract(sigY2, muY2, sigY2);
        Mat sigXY = track(release, blur(track(release, x.mul(y)), window));
        Core.subtract(sigXY, muXY, sigXY);

        // ((2 muX muY + C1)(2 sigXY + C2)) / ((muX^2 + muY^2 + C1)(sigX^2 + sigY^2 + C2))
        Mat t1 = track(release, new Mat());
        Core.multiply(muXY, Scalar.all(2), t1);
        Core.add(t1, Scalar.all(C1), t1);
        Mat t2 = track(release, new Mat());
        Core.multiply(sigXY, Scalar.all(2), t2);
        Core.add(t2, Scalar.all(C2), t2);
        Mat numerator = track(release, t1.mul(t2));

        Mat d1 = track(release, new Mat());
        Core.add(muX2, muY2, d1);
        Core.add(d1, Scalar.all(C1), d1);
        Mat d2 = track(release, new Mat());
        Core.add(sigX2, sigY2, d2);
        Core.add(d2, Scalar.all(C2), d2);
        Mat denominator = track(release, d1.mul(d2));

        Mat out = new Mat();
        Core.divide(numerator, denominator, out);
        return out;
    }

    private Mat blur(Mat src, Size window) {
        Mat dst = new Mat();
        Imgproc.GaussianBlur(src, dst, window, sigma);
        return dst;
    }

    private static Mat toDouble(RasterImage patch) {
        Mat rgb = new Mat(patch.height(), patch.width(), CvType.CV_8UC3);
        rgb.put(0, 0, patch.rgbBytes());
        Mat out = new Mat();
        rgb.convertTo(out, CvType.CV_64FC3);
        rgb.release();
        return out;
    }

    private static Mat track(List<Mat> release, Mat mat) {
        release.add(mat);
        return mat;
    }
}
