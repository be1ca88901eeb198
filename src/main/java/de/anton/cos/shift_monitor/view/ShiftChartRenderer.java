package de.anton.cos.shift_monitor.view;

import de.anton.cos.shift_monitor.model.AggregationBucket;
import de.anton.cos.shift_monitor.model.AggregationKey;
import de.anton.cos.shift_monitor.model.DailyMedian;
import de.anton.cos.shift_monitor.model.DetectorSegment;
import de.anton.cos.shift_monitor.model.DriftSummaryRow;
import de.anton.cos.shift_monitor.model.LinearFit;
import de.anton.cos.shift_monitor.model.MeasuredShiftRecord;
import de.anton.cos.shift_monitor.model.SegmentDifference;
import de.anton.cos.shift_monitor.model.ToleranceBand;
import de.anton.cos.shift_monitor.model.ToleranceEnvelope;

import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartUtils;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.axis.NumberAxis;
import org.jfree.chart.plot.CombinedDomainXYPlot;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.chart.plot.ValueMarker;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.xy.XYLineAndShapeRenderer;
import org.jfree.chart.ui.RectangleInsets;
import org.jfree.chart.util.ShapeUtils;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.*;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Renders the monitor figures as PNG files with JFreeChart. Nothing is shown on
 * screen, so this works in a headless JVM.
 */
public class ShiftChartRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ShiftChartRenderer.class);

    public static final String DRIFT_CHART_NAME = "shifts_vs_exptime.png";
    private static final int WIDTH = 1200;
    private static final int HEIGHT = 800;

    // --- Colors and shapes ---
    private static final Color[] SERIES_COLORS = { new Color(31, 119, 180), new Color(255, 127, 14), new Color(44, 160, 44), new Color(214, 39, 40), new Color(148, 103, 189), new Color(140, 86, 75), new Color(227, 119, 194), new Color(127, 127, 127), new Color(188, 189, 34), new Color(23, 190, 207) };
    private static final Shape POINT_SHAPE = ShapeUtils.createDiamond(2.0f);
    private static final Color FIT_COLOR = Color.BLACK;
    private static final Color RANGE_COLOR = Color.RED;

    /** Lower edge of the cenwave y-range for the short-wavelength (FUV) settings. */
    private static final double FUV_CENWAVE_LIMIT = 1700;

    private final Path outputDirectory;

    public ShiftChartRenderer(Path outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    /** SHIFT2 spread against exposure time, one series per segment; the tolerance is drawn as a marker. */
    public Path renderDrift(List<DriftSummaryRow> rows, double tolerance) throws IOException {
        Map<DetectorSegment, XYSeries> bySegment = new TreeMap<>();
        for (DriftSummaryRow row : rows) {
            if (Double.isNaN(row.exposureDuration())) continue;
            bySegment.computeIfAbsent(row.segment(), s -> new XYSeries(s.name(), false, true)).add(row.exposureDuration(), row.offsetSpread());
        }
        XYSeriesCollection dataset = new XYSeriesCollection();
        bySegment.values().forEach(dataset::addSeries);

        JFreeChart chart = createScatter("Internal drift", "Exposure time (s)", "SHIFT2 max - min (px)", dataset);
        XYPlot plot = chart.getXYPlot();
        plot.addRangeMarker(marker(tolerance));
        plot.addRangeMarker(marker(-tolerance));
        return save(chart, DRIFT_CHART_NAME);
    }

    /**
     * Per element: all SHIFT1 values, the daily medians, the trend line and the search range.
     *
     * @return The written files.
     */
    public List<Path> renderElementTrends(SortedMap<AggregationKey, AggregationBucket> byElement, ToleranceEnvelope envelope) throws IOException {
        List<Path> written = new ArrayList<>();
        for (AggregationBucket bucket : byElement.values()) {
            List<MeasuredShiftRecord> records = bucket.getRecords();
            if (records.isEmpty()) continue;
            String element = bucket.getKey().opticalElement();

            XYSeries all = new XYSeries("SHIFT1", false, true);
            records.forEach(r -> all.add(r.exposureStart(), r.dispersionShift()));
            XYSeries medians = new XYSeries("Daily median", false, true);
            bucket.getDailyMedians().forEach(m -> medians.add(m.day(), m.median()));

            XYSeriesCollection dataset = new XYSeriesCollection();
            dataset.addSeries(all);
            dataset.addSeries(medians);
            double first = records.get(0).exposureStart();
            double last = records.get(records.size() - 1).exposureStart();
            LinearFit fit = bucket.getFit();
            if (fit != null) {
                XYSeries line = new XYSeries(String.format("Fit %.4f px/day", fit.slope()), false, true);
                line.add(first, fit.valueAt(first));
                line.add(last, fit.valueAt(last));
                dataset.addSeries(line);
            }
            ToleranceBand band = envelope.bandFor(element).orElse(null);
            if (band != null) {
                dataset.addSeries(bandEdge("Search range (lower)", band, first, last, true));
                dataset.addSeries(bandEdge("Search range (upper)", band, first, last, false));
            }

            JFreeChart chart = createScatter(element + " SHIFT1 trend", "MJD", "SHIFT1 (px)", dataset);
            XYLineAndShapeRenderer renderer = (XYLineAndShapeRenderer) chart.getXYPlot().getRenderer();
            for (int i = 2; i < dataset.getSeriesCount(); i++) {
                renderer.setSeriesLinesVisible(i, true);
                renderer.setSeriesShapesVisible(i, false);
                renderer.setSeriesPaint(i, i == 2 && fit != null ? FIT_COLOR : RANGE_COLOR);
            }
            written.add(save(chart, element.replace(' ', '_') + "_shifts.png"));
        }
        return written;
    }

    /** Per element: daily medians of every central wavelength in its own color. */
    public List<Path> renderCenwaveTrends(SortedMap<AggregationKey, AggregationBucket> byCenwave) throws IOException {
        Map<String, XYSeriesCollection> byElement = new TreeMap<>();
        Map<String, Integer> firstCenwave = new TreeMap<>();
        for (AggregationBucket bucket : byCenwave.values()) {
            AggregationKey key = bucket.getKey();
            XYSeries series = new XYSeries(String.valueOf(key.centralWavelength()), false, true);
            for (DailyMedian m : bucket.getDailyMedians()) {
                series.add(m.day(), m.median());
            }
            byElement.computeIfAbsent(key.opticalElement(), e -> new XYSeriesCollection()).addSeries(series);
            firstCenwave.putIfAbsent(key.opticalElement(), key.centralWavelength());
        }

        List<Path> written = new ArrayList<>();
        for (Map.Entry<String, XYSeriesCollection> entry : byElement.entrySet()) {
            JFreeChart chart = createScatter(entry.getKey() + " daily median SHIFT1 by cenwave", "MJD", "SHIFT1 (px)", entry.getValue());
            NumberAxis rangeAxis = (NumberAxis) chart.getXYPlot().getRangeAxis();
            Integer cenwave = firstCenwave.get(entry.getKey());
            if (cenwave != null && cenwave < FUV_CENWAVE_LIMIT) {
                rangeAxis.setRange(-140, 80);
            } else {
                rangeAxis.setRange(-80, 80);
            }
            written.add(save(chart, entry.getKey() + "_shifts_color.png"));
        }
        return written;
    }

    /** SHIFT1A - SHIFT1B against MJD, one file per central wavelength. */
    public List<Path> renderDifferences(SortedMap<Integer, List<SegmentDifference>> differences) throws IOException {
        List<Path> written = new ArrayList<>();
        for (Map.Entry<Integer, List<SegmentDifference>> entry : differences.entrySet()) {
            XYSeries series = new XYSeries("A - B", false, true);
            entry.getValue().forEach(d -> series.add(d.mjd(), d.difference()));
            JFreeChart chart = createScatter("SHIFT1A - SHIFT1B, CENWAVE " + entry.getKey(), "MJD", "A - B (px)", new XYSeriesCollection(series));
            written.add(save(chart, "difference_" + entry.getKey() + ".png"));
        }
        return written;
    }

    /**
     * SHIFT2 against SHIFT1, one file per central wavelength with one panel per segment.
     *
     * @return The written files.
     */
    public List<Path> renderShiftRelations(SortedMap<Integer, SortedMap<DetectorSegment, List<MeasuredShiftRecord>>> relations) throws IOException {
        List<Path> written = new ArrayList<>();
        for (Map.Entry<Integer, SortedMap<DetectorSegment, List<MeasuredShiftRecord>>> entry : relations.entrySet()) {
            NumberAxis domainAxis = new NumberAxis("SHIFT1 (px)");
            domainAxis.setAutoRangeIncludesZero(false);
            CombinedDomainXYPlot combined = new CombinedDomainXYPlot(domainAxis);
            combined.setGap(10.0);
            int colorIndex = 0;
            for (Map.Entry<DetectorSegment, List<MeasuredShiftRecord>> panel : entry.getValue().entrySet()) {
                XYSeries series = new XYSeries(panel.getKey().name(), false, true);
                panel.getValue().forEach(r -> series.add(r.dispersionShift(), r.crossDispersionShift()));

                XYLineAndShapeRenderer renderer = new XYLineAndShapeRenderer(false, true);
                renderer.setSeriesPaint(0, SERIES_COLORS[colorIndex++ % SERIES_COLORS.length]);
                renderer.setSeriesShape(0, POINT_SHAPE);
                NumberAxis rangeAxis = new NumberAxis("SHIFT2 " + panel.getKey().name() + " (px)");
                rangeAxis.setAutoRangeIncludesZero(false);
                XYPlot subplot = new XYPlot(new XYSeriesCollection(series), null, rangeAxis, renderer);
                subplot.setBackgroundPaint(Color.WHITE);
                subplot.setDomainGridlinePaint(Color.LIGHT_GRAY);
                subplot.setRangeGridlinePaint(Color.LIGHT_GRAY);
                combined.add(subplot, 1);
            }
            JFreeChart chart = new JFreeChart("SHIFT2 vs SHIFT1, CENWAVE " + entry.getKey(), JFreeChart.DEFAULT_TITLE_FONT, combined, true);
            chart.setBackgroundPaint(Color.WHITE);
            written.add(save(chart, "shift_relation_" + entry.getKey() + ".png"));
        }
        return written;
    }

    private JFreeChart createScatter(String title, String xLabel, String yLabel, XYSeriesCollection dataset) {
        JFreeChart chart = ChartFactory.createScatterPlot(title, xLabel, yLabel, dataset, PlotOrientation.VERTICAL, true, false, false);
        XYPlot plot = chart.getXYPlot();
        plot.setBackgroundPaint(Color.WHITE);
        plot.setDomainGridlinePaint(Color.LIGHT_GRAY);
        plot.setRangeGridlinePaint(Color.LIGHT_GRAY);
        plot.setAxisOffset(new RectangleInsets(5.0, 5.0, 5.0, 5.0));

        XYLineAndShapeRenderer renderer = new XYLineAndShapeRenderer(false, true);
        for (int i = 0; i < dataset.getSeriesCount(); i++) {
            renderer.setSeriesPaint(i, SERIES_COLORS[i % SERIES_COLORS.length]);
            renderer.setSeriesShape(i, POINT_SHAPE);
        }
        plot.setRenderer(renderer);
        ((NumberAxis) plot.getDomainAxis()).setAutoRangeIncludesZero(false);
        return chart;
    }

    /** Step line of one edge of the band between {@code first} and {@code last}. */
    private XYSeries bandEdge(String name, ToleranceBand band, double first, double last, boolean lower) {
        XYSeries series = new XYSeries(name, true, true);
        series.add(first, edge(band, first, lower));
        double epoch = band.epochBoundary();
        if (epoch > first && epoch < last) {
            series.add(Math.nextDown(epoch), edge(band, first, lower));
            series.add(epoch, edge(band, epoch, lower));
        }
        series.add(last, edge(band, last, lower));
        return series;
    }

    private double edge(ToleranceBand band, double mjd, boolean lower) {
        return lower ? band.rangeAt(mjd).lower() : band.rangeAt(mjd).upper();
    }

    private ValueMarker marker(double value) {
        ValueMarker marker = new ValueMarker(value);
        marker.setPaint(RANGE_COLOR);
        return marker;
    }

    private Path save(JFreeChart chart, String fileName) throws IOException {
        Files.createDirectories(outputDirectory);
        Path file = outputDirectory.resolve(fileName);
        ChartUtils.saveChartAsPNG(file.toFile(), chart, WIDTH, HEIGHT);
        logger.debug("Chart written: {}", file);
        return file;
    }
}
