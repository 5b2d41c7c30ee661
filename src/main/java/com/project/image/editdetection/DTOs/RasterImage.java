package com.project.image.editdetection.DTOs;

import com.project.image.editdetection.exceptions.ImageShapeException;

import java.awt.image.BufferedImage;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Immutable interleaved 8-bit color raster with shape (height, width, channels).
 * Only 3 (RGB) and 4 (RGBA) channel layouts are accepted; alpha is carried but never compared.
 */
public final class RasterImage {
    private final int width;
    private final int height;
    private final int channels;
    private final byte[] data;

    private RasterImage(int width, int height, int channels, byte[] data) {
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.data = data;
    }

    /**
     * Wraps a raw interleaved buffer. {@code shape} is (H, W, C) in row-major order.
     *
     * @throws ImageShapeException if the shape is not a 3- or 4-channel color layout,
     *                             or does not match the buffer length
     */
    public static RasterImage of(byte[] data, int... shape) {
        if (shape == null || shape.length != 3 || shape[2] < 3 || shape[2] > 4) {
            throw new ImageShapeException("Expected RGB image with shape (H, W, 3), got " + describe(shape));
        }
        int h = shape[0], w = shape[1], c = shape[2];
        if (h <= 0 || w <= 0) {
            throw new ImageShapeException("Image must not be empty, got " + describe(shape));
        }
        if (data == null || data.length != (long) h * w * c) {
            throw new ImageShapeException("Buffer length " + (data == null ? 0 : data.length)
                    + " does not match shape " + describe(shape));
        }
        return new RasterImage(w, h, c, Arrays.copyOf(data, data.length));
    }

    /** Copies the RGB samples of any {@link BufferedImage}; alpha is dropped. */
    public static RasterImage fromBufferedImage(BufferedImage image) {
        int w = image.getWidth(), h = image.getHeight();
        int[] argb = new int[w * h];
        image.getRGB(0, 0, w, h, argb, 0, w);

        byte[] rgb = new byte[w * h * 3];
        for (int i = 0; i < argb.length; i++) {
            int p = argb[i];
            rgb[3 * i]     = (byte) ((p >> 16) & 0xFF);
            rgb[3 * i + 1] = (byte) ((p >> 8) & 0xFF);
            rgb[3 * i + 2] = (byte) (p & 0xFF);
        }
        return new RasterImage(w, h, 3, rgb);
    }

    public int width() { return width; }
    public int height() { return height; }
    public int channels() { return channels; }

    public boolean sameSizeAs(RasterImage other) {
        return width == other.width && height == other.height;
    }

    /** Unsigned sample of channel {@code c} at pixel index {@code i = y * width + x}. */
    public int sample(int i, int c) {
        return data[i * channels + c] & 0xFF;
    }

    /** RGB-only copy of the given window. */
    public RasterImage crop(int x, int y, int w, int h) {
        if (x < 0 || y < 0 || w <= 0 || h <= 0 || x + w > width || y + h > height) {
            throw new IllegalArgumentException("Crop window " + x + "," + y + " " + w + "x" + h
                    + " outside " + width + "x" + height);
        }
        byte[] out = new byte[w * h * 3];
        for (int row = 0; row < h; row++) {
            for (int col = 0; col < w; col++) {
                int src = ((y + row) * width + (x + col)) * channels;
                int dst = (row * w + col) * 3;
                out[dst]     = data[src];
                out[dst + 1] = data[src + 1];
                out[dst + 2] = data[src + 2];
            }
        }
        return new RasterImage(w, h, 3, out);
    }

    /** Interleaved RGB bytes, alpha removed. */
    public byte[] rgbBytes() {
        if (channels == 3) return Arrays.copyOf(data, data.length);
        int n = width * height;
        byte[] out = new byte[n * 3];
        for (int i = 0; i < n; i++) {
            out[3 * i]     = data[i * channels];
            out[3 * i + 1] = data[i * channels + 1];
            out[3 * i + 2] = data[i * channels + 2];
        }
        return out;
    }

    public BufferedImage toBufferedImage() {
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int[] rgb = new int[width * height];
        for (int i = 0; i < rgb.length; i++) {
            rgb[i] = (sample(i, 0) << 16) | (sample(i, 1) << 8) | sample(i, 2);
        }
        img.setRGB(0, 0, width, height, rgb, 0, width);
        return img;
    }

    public String shape() {
        return "(" + height + ", " + width + ", " + channels + ")";
    }

    private static String describe(int[] shape) {
        if (shape == null) return "()";
        return Arrays.stream(shape).mapToObj(Integer::toString).collect(Collectors.joining(", ", "(", ")"));
    }
}
