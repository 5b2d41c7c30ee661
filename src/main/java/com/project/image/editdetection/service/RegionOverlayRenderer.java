package com.project.image.editdetection.service;

import com.project.image.editdetection.DTOs.BoundingBox;
import com.project.image.editdetection.DTOs.DetectionResult;
import com.project.image.editdetection.DTOs.EditRegion;
import com.project.image.editdetection.DTOs.PixelPoint;
import com.project.image.editdetection.DTOs.PolygonRegion;
import com.project.image.editdetection.DTOs.RasterImage;
import com.project.image.editdetection.exceptions.EditDetectionException;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.Polygon;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Base64;
import javax.imageio.ImageIO;

/**
 * Draws detected regions over the edited image, numbered in report order, and encodes the result as PNG.
 */
public class RegionOverlayRenderer {

    private static final Color OUTLINE = new Color(255, 40, 40);
    private static final Color FILL = new Color(255, 40, 40, 60);
    private static final Color LABEL_BG = new Color(0, 0, 0, 160);

    private final boolean labels;

    public RegionOverlayRenderer() {
        this(true);
    }

    /** @param labels whether to number each region in report order */
    public RegionOverlayRenderer(boolean labels) {
        this.labels = labels;
    }

    /**
     * @param edited image to draw on; resampled onto the result's grid when its size differs
     */
    public BufferedImage render(RasterImage edited, DetectionResult<? extends EditRegion> result) {
        int w = result.imageWidth(), h = result.imageHeight();
        RasterImage base = edited;
        if (edited.width() != w || edited.height() != h) {
            base = ImageResampler.resize(edited, w, h);
        }

        BufferedImage overlay = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g2d = overlay.createGraphics();
        try {
            g2d.drawImage(base.toBufferedImage(), 0, 0, null);
            g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g2d.setStroke(new BasicStroke(2f));
            if (labels) g2d.setFont(new Font(Font.SANS_SERIF, Font.BOLD, 12));

            int index = 1;
            for (EditRegion region : result.regions()) {
                BoundingBox b = region.bounds();
                if (region instanceof PolygonRegion p && p.polygon().size() >= 3) {
                    Polygon shape = new Polygon();
                    for (PixelPoint pt : p.polygon()) shape.addPoint(pt.x(), pt.y());
                    g2d.setColor(FILL);
                    g2d.fillPolygon(shape);
                    g2d.setColor(OUTLINE);
                    g2d.drawPolygon(shape);
                } else {
                    g2d.setColor(FILL);
                    g2d.fillRect(b.x(), b.y(), b.width(), b.height());
                    g2d.setColor(OUTLINE);
                    g2d.drawRect(b.x(), b.y(), Math.max(b.width() - 1, 0), Math.max(b.height() - 1, 0));
                }
                if (labels) drawLabel(g2d, String.valueOf(index), b.x(), b.y());
                index++;
            }
        } finally {
            g2d.dispose();
        }
        return overlay;
    }

    public byte[] renderPng(RasterImage edited, DetectionResult<? extends EditRegion> result) {
        return toPng(render(edited, result));
    }

    public String renderDataUrl(RasterImage edited, DetectionResult<? extends EditRegion> result) {
        return "data:image/png;base64," + Base64.getEncoder().encodeToString(renderPng(edited, result));
    }

    private static void drawLabel(Graphics2D g2d, String text, int x, int y) {
        int tw = g2d.getFontMetrics().stringWidth(text) + 6;
        int th = g2d.getFontMetrics().getHeight();
        g2d.setColor(LABEL_BG);
        g2d.fillRect(x, y, tw, th);
        g2d.setColor(Color.WHITE);
        g2d.drawString(text, x + 3, y + g2d.getFontMetrics().getAscent());
    }

    static byte[] toPng(BufferedImage img) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            ImageIO.write(img, "png", baos);
            return baos.toByteArray();
        } catch (IOException e) {
            throw new EditDetectionException("Failed to encode image", e);
        }
    }
}
