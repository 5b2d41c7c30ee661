package com.project.image.editdetection.exceptions;

/** Domain-specific exception for comparison errors. */
public class EditDetectionException extends RuntimeException {
    public EditDetectionException(String message) { super(message); }
    public EditDetectionException(String message, Throwable cause) { super(message, cause); }
}
