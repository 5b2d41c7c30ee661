package com.project.image.editdetection.service;

import com.project.image.editdetection.DTOs.RasterImage;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Puts the edited image on the original's pixel grid before any comparison. */
public final class ImageResampler {
    private static final Logger log = LoggerFactory.getLogger(ImageResampler.class);

    private ImageResampler() {}

    /**
     * Returns {@code edited} unchanged when it already matches {@code original}, otherwise a
     * Lanczos-resampled RGB copy at the original's width and height.
     */
    public static RasterImage alignTo(RasterImage original, RasterImage edited) {
        if (original.sameSizeAs(edited)) return edited;
        return resize(edited, original.width(), original.height());
    }

    /** Lanczos-resampled RGB copy of {@code image} at the given size. */
    public static RasterImage resize(RasterImage image, int width, int height) {
        log.debug("Resampling image {}x{} to {}x{}", image.width(), image.height(), width, height);
        OpenCvSupport.ensureLoaded();

        Mat src = OpenCvSupport.toRgbMat(image);
        Mat dst = new Mat();
        try {
            Imgproc.resize(src, dst, new Size(width, height), 0, 0, Imgproc.INTER_LANCZOS4);
            return OpenCvSupport.fromRgbMat(dst);
        } finally {
            src.release();
            dst.release();
        }
    }
}
