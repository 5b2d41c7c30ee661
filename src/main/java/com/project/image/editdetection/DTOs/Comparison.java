package com.project.image.editdetection.DTOs;

/** A detection result together with its reviewer report. */
public record Comparison(DetectionResult<? extends EditRegion> result, String report) {}
