package com.project.image.editdetection.DTOs;

/** Axis-aligned pixel rectangle; {@code (x, y)} is the top-left corner. */
public record BoundingBox(int x, int y, int width, int height) {

    public int right() { return x + width - 1; }
    public int bottom() { return y + height - 1; }
    public int area() { return width * height; }
}
