package com.project.image.editdetection.DTOs;

public record PixelPoint(int x, int y) {}
