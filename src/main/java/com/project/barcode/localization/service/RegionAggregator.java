package com.project.barcode.localization.service;

import com.project.barcode.localization.DTOs.BarcodeRegion;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Turns a band's score row into regions: any run of at least {@code minRun} consecutive
 * non-zero columns is reported as a barcode candidate spanning those columns and the full band
 * height. Bands are judged independently, so nothing is merged across bands.
 */
@Component
public class RegionAggregator {

    public List<BarcodeRegion> aggregate(double[] scores, int minRun, int tileWidth,
                                         int yStart, int yEnd, EmissionPolicy policy) {
        if (minRun < 1) {
            throw new IllegalArgumentException("Minimum run length must be positive, got " + minRun);
        }
        List<BarcodeRegion> regions = new ArrayList<>();
        int count = 0;
        int start = -1;

        for (int i = 0; i < scores.length; i++) {
            // NaN fails this comparison and ends the run like a zero score
            if (scores[i] > 0.0) {
                if (count == 0) {
                    start = i;
                }
                count++;
                if (policy == EmissionPolicy.GROWING && count >= minRun
                        || policy == EmissionPolicy.FIRST && count == minRun) {
                    regions.add(span(start, i, tileWidth, yStart, yEnd));
                }
            } else {
                if (policy == EmissionPolicy.MAXIMAL && count >= minRun) {
                    regions.add(span(start, i - 1, tileWidth, yStart, yEnd));
                }
                count = 0;
                start = -1;
            }
        }
        if (policy == EmissionPolicy.MAXIMAL && count >= minRun) {
            regions.add(span(start, scores.length - 1, tileWidth, yStart, yEnd));
        }
        return regions;
    }

    private static BarcodeRegion span(int firstColumn, int lastColumn, int tileWidth, int yStart, int yEnd) {
        return new BarcodeRegion(firstColumn * tileWidth, (lastColumn + 1) * tileWidth, yStart, yEnd);
    }
}
