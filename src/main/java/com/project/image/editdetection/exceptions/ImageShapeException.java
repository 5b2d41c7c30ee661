package com.project.image.editdetection.exceptions;

/** Raised when an input raster is not a 3- or 4-channel (H, W, C) color image. */
public class ImageShapeException extends EditDetectionException {
    public ImageShapeException(String message) { super(message); }
}
