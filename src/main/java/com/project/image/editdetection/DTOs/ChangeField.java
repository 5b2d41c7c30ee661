package com.project.image.editdetection.DTOs;

import java.util.Arrays;

/**
 * Dense row-major field of non-negative per-pixel difference values
 * (Delta E or a perceptual patch score) over a fixed width x height grid.
 */
public final class ChangeField {
    private final int width;
    private final int height;
    private final float[] values;

    public ChangeField(int width, int height, float[] values) {
        if (values.length != width * height) {
            throw new IllegalArgumentException("Expected " + (width * height) + " values, got " + values.length);
        }
        this.width = width;
        this.height = height;
        this.values = values;
    }

    public static ChangeField zeros(int width, int height) {
        return new ChangeField(width, height, new float[width * height]);
    }

    public int width() { return width; }
    public int height() { return height; }

    public float get(int x, int y) { return values[y * width + x]; }

    public float at(int index) { return values[index]; }

    public float max() {
        float m = 0f;
        for (float v : values) m = Math.max(m, v);
        return m;
    }

    public double mean() {
        double sum = 0;
        for (float v : values) sum += v;
        return values.length == 0 ? 0 : sum / values.length;
    }

    /** Copy of the backing values, row-major. */
    public float[] toArray() {
        return Arrays.copyOf(values, values.length);
    }
}
