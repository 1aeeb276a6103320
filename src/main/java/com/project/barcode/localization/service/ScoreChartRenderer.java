package com.project.barcode.localization.service;

import com.project.barcode.localization.DTOs.BarcodeRegion;
import java.awt.Color;
import java.awt.Paint;
import java.io.File;
import java.io.IOException;
import java.util.List;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartUtils;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.xy.StandardXYBarPainter;
import org.jfree.chart.renderer.xy.XYBarRenderer;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;
import org.springframework.stereotype.Component;

/**
 * Bar chart of one band's score row: one bar per tile column, red where the column lies inside
 * a detected region, blue elsewhere.
 */
@Component
public class ScoreChartRenderer {

    static final int WIDTH = 800;
    static final int HEIGHT = 600;

    private static final Color REGION_COLOR = Color.RED;
    private static final Color PLAIN_COLOR = Color.BLUE;

    public JFreeChart build(int bandIndex, double[] scores, List<BarcodeRegion> regions,
                            int tileWidth, int tileHeight) {
        XYSeries series = new XYSeries("score");
        boolean[] highlighted = new boolean[scores.length];
        final int y = bandIndex * tileHeight;
        for (int i = 0; i < scores.length; i++) {
            series.add(i, scores[i]);
            final int x = i * tileWidth;
            highlighted[i] = regions.stream().anyMatch(r -> r.contains(x, y));
        }
        XYSeriesCollection dataset = new XYSeriesCollection(series);
        dataset.setIntervalWidth(1.0);

        JFreeChart chart = ChartFactory.createXYBarChart(
                "Height Section " + bandIndex + " - frequency component strength",
                "column", false, "score", dataset, PlotOrientation.VERTICAL, false, false, false);

        XYPlot plot = chart.getXYPlot();
        XYBarRenderer renderer = new XYBarRenderer() {
            @Override
            public Paint getItemPaint(int row, int column) {
                return highlighted[column] ? REGION_COLOR : PLAIN_COLOR;
            }
        };
        renderer.setBarPainter(new StandardXYBarPainter());
        renderer.setShadowVisible(false);
        plot.setRenderer(renderer);
        plot.getDomainAxis().setRange(-0.5, Math.max(scores.length, 1) - 0.5);
        plot.getRangeAxis().setRange(0.0, upperBound(scores));
        return chart;
    }

    public void render(File target, int bandIndex, double[] scores, List<BarcodeRegion> regions,
                       int tileWidth, int tileHeight) throws IOException {
        ChartUtils.saveChartAsPNG(target, build(bandIndex, scores, regions, tileWidth, tileHeight), WIDTH, HEIGHT);
    }

    /** Largest finite score, or 1.0 when the row has none above zero. */
    static double upperBound(double[] scores) {
        double max = 0.0;
        for (double s : scores) {
            if (!Double.isNaN(s) && s > max) {
                max = s;
            }
        }
        return max > 0.0 && !Double.isInfinite(max) ? max : 1.0;
    }
}
