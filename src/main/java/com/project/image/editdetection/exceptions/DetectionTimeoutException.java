package com.project.image.editdetection.exceptions;

/** A perceptual detection did not finish within the configured time. */
public class DetectionTimeoutException extends EditDetectionException {
    public DetectionTimeoutException(String message, Throwable cause) { super(message, cause); }
}
