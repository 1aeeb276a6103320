package com.project.barcode.localization;

import com.project.barcode.localization.DTOs.BarcodeRegion;
import com.project.barcode.localization.service.FileSystemDetectionReporter;
import com.project.barcode.localization.service.ScoreChartRenderer;
import org.jfree.chart.JFreeChart;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FileSystemDetectionReporterTest {
    private final ScoreChartRenderer renderer = new ScoreChartRenderer();

    @Test
    void writesCropsAndChartsUnderRunDirectory(@TempDir Path runDir) throws Exception {
        Files.createDirectories(runDir.resolve("sections"));
        FileSystemDetectionReporter reporter = new FileSystemDetectionReporter(runDir, renderer);

        reporter.saveBandCrop(3, TestImages.striped(60, 10, 0, 10));
        reporter.renderScoreChart(3, new double[]{0, 60, 61, 0}, List.of(new BarcodeRegion(10, 30, 300, 400)), 10, 100);

        assertThat(runDir.resolve("sections/section_3.png")).exists();
        assertThat(runDir.resolve("section_magnitudes_3_height.png")).exists();
        assertThat(reporter.crops()).hasSize(1);
        assertThat(reporter.charts()).containsExactly(runDir.resolve("section_magnitudes_3_height.png"));
    }

    @Test
    void allZeroScoreRow_stillGetsAUsableAxis() {
        JFreeChart chart = renderer.build(0, new double[]{0, 0, 0}, List.of(), 10, 100);

        assertThat(chart.getXYPlot().getRangeAxis().getUpperBound()).isEqualTo(1.0);
    }

    @Test
    void axisTopsOutAtHighestScore() {
        JFreeChart chart = renderer.build(0, new double[]{0, 72.5, Double.NaN, 60}, List.of(), 10, 100);

        assertThat(chart.getXYPlot().getRangeAxis().getUpperBound()).isEqualTo(72.5);
    }
}
