package com.project.barcode.localization;

import com.project.barcode.localization.DTOs.BandScores;
import com.project.barcode.localization.DTOs.BarcodeRegion;
import com.project.barcode.localization.DTOs.DetectionResult;
import com.project.barcode.localization.config.DetectionSettings;
import com.project.barcode.localization.service.LuminanceImage;
import com.project.barcode.localization.service.RegionAggregator;
import com.project.barcode.localization.service.ScanlineExtractor;
import com.project.barcode.localization.service.SpectralScorer;
import com.project.barcode.localization.service.TileGrid;
import com.project.barcode.localization.service.TileGridScanner;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TileGridScannerTest {
    private final TileGridScanner scanner =
            new TileGridScanner(new ScanlineExtractor(), new SpectralScorer(), new RegionAggregator());

    private static final DetectionSettings FIVE_COLUMNS = DetectionSettings.defaults().withGrid(5, 100);

    @Test
    void stripedTopBand_isReportedAsOneRegion() {
        // 600 px wide / 5 columns = 120 px tiles; 250 px high / 100 = 2 bands, last 50 rows dropped
        LuminanceImage image = LuminanceImage.fromBufferedImage(TestImages.striped(600, 250, 0, 100));

        DetectionResult result = scanner.scan(image, FIVE_COLUMNS);

        assertThat(result.rows()).isEqualTo(2);
        assertThat(result.tileWidth()).isEqualTo(120);
        assertThat(result.bands()).hasSize(2);
        assertThat(boxed(result.bands().get(0).scores())).hasSize(5)
                .allSatisfy(score -> assertThat(score).isCloseTo(60.0, within(1e-6)));
        assertThat(result.bands().get(1).scores()).containsOnly(0.0);
        assertThat(result.regions()).containsExactly(new BarcodeRegion(0, 600, 0, 100));
    }

    @Test
    void stripesTooNarrowForMinimumRun_yieldNoRegion() {
        // stripes only under the first four columns
        LuminanceImage image = LuminanceImage.fromBufferedImage(TestImages.striped(480, 100, 0, 100));
        LuminanceImage padded = padRight(image, 600);

        DetectionResult result = scanner.scan(padded, FIVE_COLUMNS);

        assertThat(boxed(result.bands().get(0).scores())).filteredOn(s -> s > 0.0).hasSize(4);
        assertThat(result.regions()).isEmpty();
    }

    @Test
    void bandsAreReportedTopToBottom_withTheirOwnRegions() {
        LuminanceImage image = LuminanceImage.fromBufferedImage(TestImages.striped(600, 300, 200, 300));
        List<Integer> order = new ArrayList<>();

        DetectionResult result = scanner.scan(image, FIVE_COLUMNS, (grid, band) -> order.add(band.bandIndex()));

        assertThat(order).containsExactly(0, 1, 2);
        BandScores last = result.bands().get(2);
        assertThat(last.yStart()).isEqualTo(200);
        assertThat(last.yEnd()).isEqualTo(300);
        assertThat(last.regions()).containsExactly(new BarcodeRegion(0, 600, 200, 300));
        assertThat(result.bands().get(0).regions()).isEmpty();
    }

    @Test
    void rescanningSameImage_givesIdenticalRegions() {
        LuminanceImage image = LuminanceImage.fromBufferedImage(TestImages.striped(600, 400, 100, 300));

        assertThat(scanner.scan(image, FIVE_COLUMNS).regions())
                .isEqualTo(scanner.scan(image, FIVE_COLUMNS).regions())
                .hasSize(2);
    }

    @Test
    void imageShorterThanOneBand_hasNoBands() {
        LuminanceImage image = LuminanceImage.fromBufferedImage(TestImages.striped(600, 99, 0, 99));

        DetectionResult result = scanner.scan(image, FIVE_COLUMNS);

        assertThat(result.rows()).isZero();
        assertThat(result.regions()).isEmpty();
    }

    @Test
    void moreColumnsThanPixels_isAConfigurationError() {
        LuminanceImage image = LuminanceImage.of(4, 4, new byte[16]);

        assertThatThrownBy(() -> scanner.scan(image, DetectionSettings.defaults().withGrid(5, 2)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("exceeds image width");
    }

    @Test
    void gridGeometry_truncatesRemainders() {
        TileGrid grid = TileGrid.derive(607, 250, 5, 100);

        assertThat(grid.tileWidth()).isEqualTo(121);
        assertThat(grid.columns()).isEqualTo(5);
        assertThat(grid.rows()).isEqualTo(2);
        assertThat(grid.scannedWidth()).isEqualTo(605);
        assertThat(grid.scannedHeight()).isEqualTo(200);
    }

    private static List<Double> boxed(double[] scores) {
        return Arrays.stream(scores).boxed().collect(Collectors.toList());
    }

    private static LuminanceImage padRight(LuminanceImage image, int width) {
        byte[] samples = new byte[width * image.height()];
        for (int y = 0; y < image.height(); y++) {
            for (int x = 0; x < width; x++) {
                int value = x < image.width() ? image.sample(x, y) : 255;
                samples[y * width + x] = (byte) value;
            }
        }
        return LuminanceImage.of(width, image.height(), samples);
    }
}
