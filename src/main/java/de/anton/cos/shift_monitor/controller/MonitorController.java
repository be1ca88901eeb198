package de.anton.cos.shift_monitor.controller;

import de.anton.cos.shift_monitor.model.AggregationBucket;
import de.anton.cos.shift_monitor.model.Anomaly;
import de.anton.cos.shift_monitor.model.DifferenceReportWriter;
import de.anton.cos.shift_monitor.model.DriftSummaryRow;
import de.anton.cos.shift_monitor.model.ExposureProductReader;
import de.anton.cos.shift_monitor.model.MeasuredShiftRecord;
import de.anton.cos.shift_monitor.model.ShiftReportExporter;
import de.anton.cos.shift_monitor.model.ShiftTableReader;
import de.anton.cos.shift_monitor.model.ShiftTableWriter;
import de.anton.cos.shift_monitor.service.AnomalyFlagger;
import de.anton.cos.shift_monitor.service.CorpusWalker;
import de.anton.cos.shift_monitor.service.DriftScanner;
import de.anton.cos.shift_monitor.service.FlashRecordExtractor;
import de.anton.cos.shift_monitor.service.MonitorConfiguration;
import de.anton.cos.shift_monitor.service.ReferenceTableResolver;
import de.anton.cos.shift_monitor.service.ShiftAggregator;
import de.anton.cos.shift_monitor.service.ShiftAggregator.AggregationResult;
import de.anton.cos.shift_monitor.service.ShiftCollector;
import de.anton.cos.shift_monitor.view.ShiftChartRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Wires the monitor components from one {@link MonitorConfiguration} and runs the
 * pipeline: (optional) shift collection, aggregation with the A/B difference report,
 * search range check, drift scan with drift check, and finally the reports.
 */
public class MonitorController {

    private static final Logger logger = LoggerFactory.getLogger(MonitorController.class);

    /**
     * Everything a run produced.
     */
    public static class MonitorRun {
        public final List<MeasuredShiftRecord> records;
        public final AggregationResult aggregation;
        public final List<DriftSummaryRow> driftRows;
        public final List<Anomaly> anomalies;

        private MonitorRun(List<MeasuredShiftRecord> records, AggregationResult aggregation,
                           List<DriftSummaryRow> driftRows, List<Anomaly> anomalies) {
            this.records = Collections.unmodifiableList(records);
            this.aggregation = aggregation;
            this.driftRows = Collections.unmodifiableList(driftRows);
            this.anomalies = Collections.unmodifiableList(anomalies);
        }
    }

    private final MonitorConfiguration config;
    private final ShiftCollector collector;
    private final ShiftTableReader tableReader;
    private final ShiftAggregator aggregator;
    private final DriftScanner driftScanner;
    private final AnomalyFlagger flagger;
    private final ShiftReportExporter exporter;
    private final ShiftChartRenderer chartRenderer;

    public MonitorController(MonitorConfiguration config) {
        this.config = Objects.requireNonNull(config, "Configuration cannot be null.");
        ExposureProductReader reader = new ExposureProductReader();
        ReferenceTableResolver resolver = new ReferenceTableResolver(config.referenceDirectory());
        FlashRecordExtractor extractor = new FlashRecordExtractor(reader, resolver);
        CorpusWalker walker = new CorpusWalker(config);

        this.collector = new ShiftCollector(config, extractor, walker, new ShiftTableWriter());
        this.tableReader = new ShiftTableReader();
        this.aggregator = new ShiftAggregator(config);
        this.driftScanner = new DriftScanner(config, reader, walker);
        this.flagger = new AnomalyFlagger(config);
        this.exporter = new ShiftReportExporter();
        this.chartRenderer = new ShiftChartRenderer(config.monitorDirectory());
        logger.debug("MonitorController created for corpus {}", config.corpusRoot());
    }

    /**
     * Runs the full pipeline.
     *
     * @return The results of the run.
     * @throws IOException If a step that the rest of the run depends on fails.
     */
    public MonitorRun run() throws IOException {
        logger.info("Starting monitor run: corpus {}, monitor directory {}", config.corpusRoot(), config.monitorDirectory());
        Files.createDirectories(config.monitorDirectory());

        // 1. Shift table
        List<MeasuredShiftRecord> records;
        if (config.collectShifts()) {
            records = collector.collect(config.corpusRoot());
        } else if (Files.isRegularFile(config.shiftTableFile())) {
            records = tableReader.read(config.shiftTableFile());
        } else {
            logger.warn("Shift table {} not found and collection disabled; trend analysis is skipped.", config.shiftTableFile());
            records = List.of();
        }

        // 2. Aggregation and A/B differences
        AggregationResult aggregation = aggregator.aggregate(records);
        DifferenceReportWriter.write(aggregation.differences, config.differenceReportFile());
        List<Anomaly> anomalies = new ArrayList<>(flagger.flagSearchRange(records));

        // 3. Internal drift
        List<DriftSummaryRow> driftRows = driftScanner.scan(config.corpusRoot());
        anomalies.addAll(flagger.flagDrift(driftRows));
        anomalies.forEach(a -> logger.info("Anomaly: {}", a));

        // 4. Reports
        if (config.exportWorkbook()) {
            List<AggregationBucket> buckets = new ArrayList<>(aggregation.bySegment.values());
            buckets.addAll(aggregation.byCenwave.values());
            exporter.export(buckets, aggregation.differences, anomalies, config.workbookFile());
        }
        if (config.renderCharts()) {
            renderCharts(aggregation, driftRows);
        }

        logger.info("Monitor run finished: {} records, {} drift rows, {} anomalies.", records.size(), driftRows.size(), anomalies.size());
        return new MonitorRun(records, aggregation, driftRows, anomalies);
    }

    private void renderCharts(AggregationResult aggregation, List<DriftSummaryRow> driftRows) {
        try {
            chartRenderer.renderDrift(driftRows, config.driftTolerance());
            chartRenderer.renderElementTrends(aggregation.byElement, flagger.getEnvelope());
            chartRenderer.renderCenwaveTrends(aggregation.byCenwave);
            chartRenderer.renderDifferences(aggregation.differences);
            chartRenderer.renderShiftRelations(aggregation.relations);
            logger.info("Charts written to {}", config.monitorDirectory());
        } catch (IOException | RuntimeException e) {
            // Text and table outputs are complete at this point
            logger.error("Chart rendering failed", e);
        }
    }
}
