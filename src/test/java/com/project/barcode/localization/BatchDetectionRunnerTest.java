package com.project.barcode.localization;

import com.project.barcode.localization.cli.BatchDetectionRunner;
import com.project.barcode.localization.config.DetectionSettings;
import com.project.barcode.localization.exceptions.DetectionException;
import com.project.barcode.localization.service.BarcodeDetectionService;
import com.project.barcode.localization.service.ImageDecoder;
import com.project.barcode.localization.service.RegionAggregator;
import com.project.barcode.localization.service.ReporterFactory;
import com.project.barcode.localization.service.ScanlineExtractor;
import com.project.barcode.localization.service.ScoreChartRenderer;
import com.project.barcode.localization.service.SpectralScorer;
import com.project.barcode.localization.service.StorageService;
import com.project.barcode.localization.service.TileGridScanner;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchDetectionRunnerTest {

    private BatchDetectionRunner runner(Path uploads) {
        StorageService storage = new StorageService(uploads.toString());
        BarcodeDetectionService service = new BarcodeDetectionService(
                new TileGridScanner(new ScanlineExtractor(), new SpectralScorer(), new RegionAggregator()));
        ReporterFactory reporters = new ReporterFactory(storage, new ScoreChartRenderer(), true);
        return new BatchDetectionRunner(new ImageDecoder(), service, reporters, storage,
                DetectionSettings.defaults().withGrid(5, 100));
    }

    @Test
    void imageOption_writesSectionsAndCharts(@TempDir Path tmp) throws Exception {
        Path image = tmp.resolve("shelf.png");
        Files.write(image, TestImages.png(TestImages.striped(600, 200, 0, 100)));
        Path out = tmp.resolve("out");

        runner(tmp.resolve("uploads")).run(new DefaultApplicationArguments(
                "--image=" + image, "--output=" + out));

        assertThat(out.resolve("sections/section_0.png")).exists();
        assertThat(out.resolve("sections/section_1.png")).exists();
        assertThat(out.resolve("section_magnitudes_0_height.png")).exists();
        assertThat(out.resolve("section_magnitudes_1_height.png")).exists();
    }

    @Test
    void withoutImageOption_doesNothing(@TempDir Path tmp) throws Exception {
        Path uploads = tmp.resolve("uploads");

        runner(uploads).run(new DefaultApplicationArguments());

        try (Stream<Path> entries = Files.list(uploads)) {
            assertThat(entries).isEmpty();
        }
    }

    @Test
    void missingImage_abortsRun(@TempDir Path tmp) {
        assertThatThrownBy(() -> runner(tmp.resolve("uploads")).run(new DefaultApplicationArguments(
                "--image=" + tmp.resolve("absent.png"))))
                .isInstanceOf(DetectionException.class);
    }
}
