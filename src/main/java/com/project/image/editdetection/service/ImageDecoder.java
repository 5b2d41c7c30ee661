package com.project.image.editdetection.service;

import com.project.image.editdetection.DTOs.RasterImage;
import com.project.image.editdetection.exceptions.EditDetectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Base64;
import javax.imageio.ImageIO;

/** Decodes uploaded bytes, data URLs and raw base64 into RGB rasters. */
public final class ImageDecoder {
    private static final Logger log = LoggerFactory.getLogger(ImageDecoder.class);

    private static final String DATA_URL_PREFIX = "data:";
    private static final String BASE64_MARKER = ";base64,";

    /** Largest accepted width or height, in pixels. */
    public static final int MAX_DIMENSION = 4000;

    private ImageDecoder() {}

    /**
     * Accepts {@code data:<mime>;base64,<payload>} or a bare base64 payload.
     *
     * @throws EditDetectionException if the text is not base64 or not a readable image
     */
    public static RasterImage fromDataUrl(String dataUrl) {
        if (dataUrl == null || dataUrl.isBlank()) {
            throw new EditDetectionException("Image data is empty");
        }
        String payload = dataUrl.trim();
        if (payload.startsWith(DATA_URL_PREFIX)) {
            int marker = payload.indexOf(BASE64_MARKER);
            if (marker < 0) {
                throw new EditDetectionException("Only base64 data URLs are supported");
            }
            payload = payload.substring(marker + BASE64_MARKER.length());
        }

        byte[] bytes;
        try {
            bytes = Base64.getMimeDecoder().decode(payload);
        } catch (IllegalArgumentException e) {
            throw new EditDetectionException("Image data is not valid base64", e);
        }
        return fromBytes(bytes);
    }

    public static RasterImage fromBytes(byte[] bytes) {
        try {
            return fromStream(new ByteArrayInputStream(bytes));
        } catch (IOException e) {
            throw new EditDetectionException("Failed to read image", e);
        }
    }

    public static RasterImage fromStream(InputStream in) throws IOException {
        BufferedImage image = ImageIO.read(in);
        if (image == null) {
            throw new EditDetectionException("The file is not a valid image or is corrupted.");
        }
        log.debug("Decoded image {}x{}", image.getWidth(), image.getHeight());
        return RasterImage.fromBufferedImage(image);
    }

    /**
     * @throws EditDetectionException if either side exceeds {@link #MAX_DIMENSION}
     */
    public static RasterImage requireWithinLimits(RasterImage image, String label) {
        if (image.width() > MAX_DIMENSION || image.height() > MAX_DIMENSION) {
            throw new EditDetectionException("The " + label + " image is too large. Maximum size: "
                    + MAX_DIMENSION + "x" + MAX_DIMENSION + " pixels");
        }
        return image;
    }
}
