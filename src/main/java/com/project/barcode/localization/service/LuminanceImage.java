package com.project.barcode.localization.service;

import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;

/**
 * Immutable 8-bit grayscale raster, row-major. The detection pipeline only ever reads it.
 */
public final class LuminanceImage {

    private final int width;
    private final int height;
    private final byte[] samples;

    private LuminanceImage(int width, int height, byte[] samples) {
        this.width = width;
        this.height = height;
        this.samples = samples;
    }

    public static LuminanceImage of(int width, int height, byte[] samples) {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("Image must be at least 1x1, got " + width + "x" + height);
        }
        if (samples == null || samples.length != width * height) {
            throw new IllegalArgumentException("Expected " + (width * height) + " samples");
        }
        return new LuminanceImage(width, height, samples.clone());
    }

    /**
     * Converts an sRGB image with Rec. 709 luma weights in fixed point,
     * {@code (2126 R + 7152 G + 722 B) / 10000}, truncating. 8-bit gray images are read from the
     * raster as-is; {@code getRGB} would apply a colour-space conversion to them.
     */
    public static LuminanceImage fromBufferedImage(BufferedImage input) {
        final int w = input.getWidth(), h = input.getHeight();
        if (input.getType() == BufferedImage.TYPE_BYTE_GRAY) {
            int[] raw = input.getRaster().getSamples(0, 0, w, h, 0, new int[w * h]);
            byte[] gray = new byte[w * h];
            for (int i = 0; i < raw.length; i++) {
                gray[i] = (byte) raw[i];
            }
            return new LuminanceImage(w, h, gray);
        }

        int[] argb = new int[w * h];
        input.getRGB(0, 0, w, h, argb, 0, w);

        byte[] gray = new byte[w * h];
        for (int i = 0; i < argb.length; i++) {
            int p = argb[i];
            int r = (p >> 16) & 0xFF, g = (p >> 8) & 0xFF, b = p & 0xFF;
            gray[i] = (byte) luma(r, g, b);
        }
        return new LuminanceImage(w, h, gray);
    }

    static int luma(int r, int g, int b) {
        return (2126 * r + 7152 * g + 722 * b) / 10000;
    }

    /** The rows {@code [yStart, yStart + rows)} as an 8-bit gray image. */
    public BufferedImage band(int yStart, int rows) {
        if (yStart < 0 || rows < 1 || yStart + rows > height) {
            throw new IllegalArgumentException("Band [" + yStart + ", " + (yStart + rows)
                    + ") is outside image height " + height);
        }
        BufferedImage band = new BufferedImage(width, rows, BufferedImage.TYPE_BYTE_GRAY);
        byte[] target = ((DataBufferByte) band.getRaster().getDataBuffer()).getData();
        System.arraycopy(samples, yStart * width, target, 0, width * rows);
        return band;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    /** Sample at (x, y) in the range 0..255. */
    public int sample(int x, int y) {
        return samples[y * width + x] & 0xFF;
    }
}
