package com.project.barcode.localization;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import javax.imageio.ImageIO;

/** Synthetic fixtures: white images with one-pixel vertical stripes in a chosen row range. */
final class TestImages {

    private TestImages() {
    }

    static BufferedImage striped(int width, int height, int stripeTop, int stripeBottom) {
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, width, height);
        g.dispose();
        for (int y = stripeTop; y < stripeBottom; y++) {
            for (int x = 1; x < width; x += 2) {
                img.setRGB(x, y, 0x000000);
            }
        }
        return img;
    }

    static byte[] png(BufferedImage img) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(img, "png", out);
        return out.toByteArray();
    }

    /** Alternating 1/0 scanline starting with 1. */
    static double[] alternating(int length) {
        double[] line = new double[length];
        for (int i = 0; i < length; i += 2) {
            line[i] = 1.0;
        }
        return line;
    }
}
