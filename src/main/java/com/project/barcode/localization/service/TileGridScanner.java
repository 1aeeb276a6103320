package com.project.barcode.localization.service;

import com.project.barcode.localization.DTOs.BandScores;
import com.project.barcode.localization.DTOs.BarcodeRegion;
import com.project.barcode.localization.DTOs.DetectionResult;
import com.project.barcode.localization.config.DetectionSettings;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Walks the tile grid band by band (top to bottom) and column by column (left to right),
 * scoring the central scanline of every tile and collecting the regions each band yields.
 */
@Component
public class TileGridScanner {
    private static final Logger log = LoggerFactory.getLogger(TileGridScanner.class);

    private final ScanlineExtractor extractor;
    private final SpectralScorer scorer;
    private final RegionAggregator aggregator;

    public TileGridScanner(ScanlineExtractor extractor, SpectralScorer scorer, RegionAggregator aggregator) {
        this.extractor = extractor;
        this.scorer = scorer;
        this.aggregator = aggregator;
    }

    public DetectionResult scan(LuminanceImage image, DetectionSettings settings) {
        return scan(image, settings, BandListener.NONE);
    }

    public DetectionResult scan(LuminanceImage image, DetectionSettings settings, BandListener listener) {
        TileGrid grid = TileGrid.derive(image.width(), image.height(), settings.columns(), settings.tileHeight());

        if (grid.scannedWidth() < image.width() || grid.scannedHeight() < image.height()) {
            log.debug("Grid covers {}x{} of {}x{}; trailing pixels are not scanned",
                    grid.scannedWidth(), grid.scannedHeight(), image.width(), image.height());
        }

        List<BandScores> bands = new ArrayList<>(grid.rows());
        List<BarcodeRegion> regions = new ArrayList<>();

        for (int band = 0; band < grid.rows(); band++) {
            final int yStart = grid.bandStart(band);
            final int yEnd = yStart + grid.tileHeight();

            double[] scores = new double[grid.columns()];
            for (int col = 0; col < grid.columns(); col++) {
                double[] line = extractor.extract(image, grid.columnStart(col), yStart,
                        grid.tileWidth(), grid.tileHeight());
                scores[col] = scorer.score(line, settings.threshold());
            }

            List<BarcodeRegion> found = aggregator.aggregate(scores, settings.consecutiveThreshold(),
                    grid.tileWidth(), yStart, yEnd, settings.emissionPolicy());
            regions.addAll(found);

            BandScores bandScores = new BandScores(band, yStart, yEnd, scores, found);
            bands.add(bandScores);
            log.debug("Band {} [{}, {}): {} region(s)", band, yStart, yEnd, found.size());

            listener.onBand(grid, bandScores);
        }

        return new DetectionResult(image.width(), image.height(), grid.tileWidth(), grid.tileHeight(),
                grid.columns(), grid.rows(), bands, regions);
    }
}
