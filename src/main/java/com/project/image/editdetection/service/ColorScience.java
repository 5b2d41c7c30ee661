package com.project.image.editdetection.service;

import com.project.image.editdetection.DTOs.ChangeField;
import com.project.image.editdetection.DTOs.RasterImage;

/**
 * sRGB to CIE Lab conversion (D65) and the CIE76 Delta E field between two images.
 * Alpha channels are ignored.
 */
public final class ColorScience {

    // D65 reference white
    static final double XN = 0.95047;
    static final double ZN = 1.08883;

    private static final double LAB_EPSILON = 0.008856;
    private static final double LAB_KAPPA_SLOPE = 7.787;
    private static final double LAB_OFFSET = 16.0 / 116.0;

    private static final double[] SRGB_TO_LINEAR = new double[256];

    static {
        for (int c = 0; c < 256; c++) {
            SRGB_TO_LINEAR[c] = invGamma(c / 255.0);
        }
    }

    private ColorScience() {}

    /**
     * Per-pixel Delta E (CIE76) between two equal-size images.
     *
     * @return field with 0 for identical pixels and roughly 100 for black vs white
     */
    public static ChangeField deltaE(RasterImage a, RasterImage b) {
        if (!a.sameSizeAs(b)) {
            throw new IllegalArgumentException("Images must share dimensions: " + a.shape() + " vs " + b.shape());
        }
        int n = a.width() * a.height();
        float[] out = new float[n];
        double[] labA = new double[3];
        double[] labB = new double[3];

        for (int i = 0; i < n; i++) {
            toLab(a.sample(i, 0), a.sample(i, 1), a.sample(i, 2), labA);
            toLab(b.sample(i, 0), b.sample(i, 1), b.sample(i, 2), labB);
            double dl = labA[0] - labB[0], da = labA[1] - labB[1], db = labA[2] - labB[2];
            out[i] = (float) Math.sqrt(dl * dl + da * da + db * db);
        }
        return new ChangeField(a.width(), a.height(), out);
    }

    /** Converts one 8-bit sRGB triplet to {L, a, b}. */
    public static double[] sRGBtoLab(int r8, int g8, int b8) {
        double[] lab = new double[3];
        toLab(r8, g8, b8, lab);
        return lab;
    }

    static void toLab(int r8, int g8, int b8, double[] lab) {
        double r = SRGB_TO_LINEAR[r8], g = SRGB_TO_LINEAR[g8], b = SRGB_TO_LINEAR[b8];

        double x = (r * 0.4124 + g * 0.3576 + b * 0.1805) / XN;
        double y =  r * 0.2126 + g * 0.7152 + b * 0.0722;
        double z = (r * 0.0193 + g * 0.1192 + b * 0.9505) / ZN;

        double fx = fxyz(x), fy = fxyz(y), fz = fxyz(z);
        lab[0] = 116.0 * fy - 16.0;
        lab[1] = 500.0 * (fx - fy);
        lab[2] = 200.0 * (fy - fz);
    }

    static double invGamma(double c) {
        return (c <= 0.04045) ? (c / 12.92) : Math.pow((c + 0.055) / 1.055, 2.4);
    }

    static double fxyz(double t) {
        return (t > LAB_EPSILON) ? Math.cbrt(t) : (LAB_KAPPA_SLOPE * t + LAB_OFFSET);
    }
}
