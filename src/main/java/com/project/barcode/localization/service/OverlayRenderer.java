package com.project.barcode.localization.service;

import com.project.barcode.localization.DTOs.BarcodeRegion;
import com.project.barcode.localization.exceptions.DetectionException;

import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.List;
import javax.imageio.ImageIO;
import org.springframework.stereotype.Component;

/**
 * Draws detected regions over the source image: translucent cyan fill, red outline.
 */
@Component
public class OverlayRenderer {

    private static final Color FILL_COLOR    = new Color(0, 180, 255);
    private static final Color OUTLINE_COLOR = new Color(255, 0, 0);
    private static final float FILL_ALPHA = 0.25f;

    public byte[] renderPng(BufferedImage input, List<BarcodeRegion> regions) {
        return encode(render(input, regions), "png");
    }

    public BufferedImage render(BufferedImage input, List<BarcodeRegion> regions) {
        BufferedImage overlay = new BufferedImage(input.getWidth(), input.getHeight(), BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = overlay.createGraphics();
        try {
            g.drawImage(input, 0, 0, null);
            // growing runs report nested boxes; draw each rectangle once
            for (BarcodeRegion r : new LinkedHashSet<>(regions)) {
                g.setComposite(AlphaComposite.getInstance(AlphaComposite.SRC_OVER, FILL_ALPHA));
                g.setColor(FILL_COLOR);
                g.fillRect(r.xStart(), r.yStart(), r.width(), r.height());
                g.setComposite(AlphaComposite.SrcOver);
                g.setColor(OUTLINE_COLOR);
                g.drawRect(r.xStart(), r.yStart(), r.width() - 1, r.height() - 1);
                if (r.width() > 2 && r.height() > 2) {
                    g.drawRect(r.xStart() + 1, r.yStart() + 1, r.width() - 3, r.height() - 3);
                }
            }
        } finally {
            g.dispose();
        }
        return overlay;
    }

    /** Encodes with the named ImageIO writer; fails when no writer accepts the image. */
    public static byte[] encode(BufferedImage img, String formatName) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            if (ImageIO.write(img, formatName, baos)) {
                return baos.toByteArray();
            }
        }
        catch (IOException e) {
            throw new DetectionException("Failed to encode image", e);
        }
        throw new DetectionException("No " + formatName + " writer available for the overlay");
    }
}
