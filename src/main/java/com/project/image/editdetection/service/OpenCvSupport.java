package com.project.image.editdetection.service;

import com.project.image.editdetection.DTOs.ChangeField;
import com.project.image.editdetection.DTOs.RasterImage;
import com.project.image.editdetection.exceptions.EditDetectionException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Loads the bundled OpenCV natives once and converts between project rasters and {@link Mat}s. */
public final class OpenCvSupport {
    private static final Logger log = LoggerFactory.getLogger(OpenCvSupport.class);

    private static volatile boolean loaded;

    private OpenCvSupport() {}

    public static void ensureLoaded() {
        if (loaded) return;
        synchronized (OpenCvSupport.class) {
            if (loaded) return;
            try {
                nu.pattern.OpenCV.loadLocally();
                loaded = true;
                log.info("OpenCV loaded successfully");
            } catch (RuntimeException | UnsatisfiedLinkError e) {
                log.error("Failed to load OpenCV", e);
                throw new EditDetectionException("OpenCV native library could not be loaded", e);
            }
        }
    }

    /** RGB, 8-bit, three channels; alpha is dropped. */
    static Mat toRgbMat(RasterImage image) {
        Mat mat = new Mat(image.height(), image.width(), CvType.CV_8UC3);
        mat.put(0, 0, image.rgbBytes());
        return mat;
    }

    static RasterImage fromRgbMat(Mat mat) {
        byte[] data = new byte[mat.rows() * mat.cols() * 3];
        mat.get(0, 0, data);
        return RasterImage.of(data, mat.rows(), mat.cols(), 3);
    }

    static Mat toFloatMat(ChangeField field) {
        Mat mat = new Mat(field.height(), field.width(), CvType.CV_32F);
        mat.put(0, 0, field.toArray());
        return mat;
    }

    static float[] floats(Mat mat) {
        float[] data = new float[mat.rows() * mat.cols()];
        mat.get(0, 0, data);
        return data;
    }
}
