package com.project.image.editdetection.service;

import com.project.image.editdetection.DTOs.ChangeField;
import com.project.image.editdetection.DTOs.DetectionOptions;
import com.project.image.editdetection.DTOs.DetectionResult;
import com.project.image.editdetection.DTOs.RectRegion;

/** Turns a Delta E field into ranked rectangular regions. */
public interface RegionDetector {

    DetectionResult<RectRegion> detect(ChangeField deltaE, DetectionOptions options);

    /** Pixels strictly above the threshold count as changed. */
    static long countChanged(ChangeField field, double threshold) {
        long changed = 0;
        int n = field.width() * field.height();
        for (int i = 0; i < n; i++) {
            if (field.at(i) > threshold) changed++;
        }
        return changed;
    }

    static double percentOf(long changed, int width, int height) {
        long total = (long) width * height;
        return total == 0 ? 0.0 : 100.0 * changed / total;
    }
}
