package com.project.barcode.localization.service;

import org.springframework.stereotype.Component;

/**
 * Reads the horizontal run of pixels through a tile's vertical midpoint and binarizes it.
 */
@Component
public class ScanlineExtractor {

    static final int BINARIZATION_THRESHOLD = 128;

    /**
     * @return {@code tileWidth} values, 1.0 where the sample is strictly brighter than 128 and
     *         0.0 otherwise
     */
    public double[] extract(LuminanceImage image, int xStart, int yStart, int tileWidth, int tileHeight) {
        final int y = yStart + tileHeight / 2;
        double[] line = new double[tileWidth];
        for (int x = 0; x < tileWidth; x++) {
            line[x] = image.sample(xStart + x, y) > BINARIZATION_THRESHOLD ? 1.0 : 0.0;
        }
        return line;
    }
}
