package de.anton.cos.shift_monitor.service;

import de.anton.cos.shift_monitor.algorithms.Statistics;
import de.anton.cos.shift_monitor.exception.MissingRequiredFieldException;
import de.anton.cos.shift_monitor.model.DeduplicationPolicy;
import de.anton.cos.shift_monitor.model.DetectorSegment;
import de.anton.cos.shift_monitor.model.DriftLog;
import de.anton.cos.shift_monitor.model.DriftSummaryRow;
import de.anton.cos.shift_monitor.model.ExposureHeader;
import de.anton.cos.shift_monitor.model.ExposureProductReader;
import de.anton.cos.shift_monitor.model.FlashRow;
import de.anton.cos.shift_monitor.model.LampflashProduct;
import de.anton.cos.shift_monitor.model.ProductKind;
import de.anton.cos.shift_monitor.model.ScanReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Internal drift check: for every FUV lamp-flash exposure with more than one
 * flash, the spread of SHIFT2 per segment shows how much the spectrum moved in
 * the cross-dispersion direction during the exposure. The spread uses the raw
 * SHIFT_XDISP of the flash table; no reference table or FP-POS is involved.
 * <p>
 * Results are appended to the drift log of the monitor directory.
 */
public class DriftScanner {

    private static final Logger logger = LoggerFactory.getLogger(DriftScanner.class);

    /** Segments the drift is computed for. */
    private static final DetectorSegment[] DRIFT_SEGMENTS = { DetectorSegment.FUVA, DetectorSegment.FUVB };

    private final MonitorConfiguration config;
    private final ExposureProductReader reader;
    private final CorpusWalker walker;

    public DriftScanner(MonitorConfiguration config, ExposureProductReader reader, CorpusWalker walker) {
        this.config = Objects.requireNonNull(config, "Configuration cannot be null.");
        this.reader = Objects.requireNonNull(reader, "Reader cannot be null.");
        this.walker = Objects.requireNonNull(walker, "Walker cannot be null.");
    }

    /**
     * Scans the corpus below {@code root} and appends the results to the drift log.
     *
     * @return The summary rows in depth-first order.
     * @throws IOException If the root cannot be listed or the drift log cannot be written.
     */
    public List<DriftSummaryRow> scan(Path root) throws IOException {
        ScanReport report = new ScanReport();
        List<DriftSummaryRow> rows = scan(root, report);
        logger.info("Drift scan of {} finished: {} rows; {}", root, rows.size(), report.summary());
        return rows;
    }

    /**
     * Same as {@link #scan(Path)}, counting into a caller-supplied report.
     */
    public List<DriftSummaryRow> scan(Path root, ScanReport report) throws IOException {
        Objects.requireNonNull(report, "Report cannot be null.");
        logger.info("Starting drift scan below {} (deduplication {})", root, config.deduplication());
        List<Path> files = walker.collectFiles(root, ProductKind.LAMPFLASH::matches, report);

        Set<String> seen = new HashSet<>();
        List<DriftSummaryRow> rows = new ArrayList<>();
        for (Path file : files) {
            if (Thread.currentThread().isInterrupted()) {
                throw new IOException("Drift scan interrupted before " + file);
            }
            if (config.deduplication() == DeduplicationPolicy.FILE_NAME
                    && !seen.add(file.getFileName().toString())) {
                logger.debug("Skipping {}: file name already processed", file);
                report.excluded(ScanReport.Exclusion.DUPLICATE);
                continue;
            }
            try {
                rows.addAll(scanFile(file, seen, report));
            } catch (IOException e) {
                logger.error("Skipping {} in drift scan: {}", file, e.getMessage(), e);
                report.fileFailed(file, e);
            }
        }

        DriftLog.append(config.driftLogFile(), rows);
        return rows;
    }

    /**
     * Summary rows of one file, or none if the file is excluded.
     *
     * @param seen Exposure identities processed so far (only used by {@link DeduplicationPolicy#EXPOSURE_IDENTITY}).
     */
    List<DriftSummaryRow> scanFile(Path file, Set<String> seen, ScanReport report) throws IOException {
        LampflashProduct product = reader.readLampflash(file);
        ExposureHeader header = product.header();

        if (config.deduplication() == DeduplicationPolicy.EXPOSURE_IDENTITY
                && !seen.add(header.dataset() + '@' + header.exposureStart())) {
            logger.debug("Skipping {}: exposure {} already processed", file, header.dataset());
            report.excluded(ScanReport.Exclusion.DUPLICATE);
            return List.of();
        }
        if (header.isNuv()) {
            logger.debug("Skipping {}: NUV exposure", file);
            report.excluded(ScanReport.Exclusion.NUV_DETECTOR);
            return List.of();
        }
        if (header.numFlash() == null) {
            throw new MissingRequiredFieldException(file, ExposureProductReader.KEY_NUMFLASH);
        }
        if (header.numFlash() <= 1) {
            logger.debug("Skipping {}: NUMFLASH={}", file, header.numFlash());
            report.excluded(ScanReport.Exclusion.SINGLE_FLASH);
            return List.of();
        }
        if (product.isEmpty()) {
            logger.debug("Skipping {}: empty flash table", file);
            report.excluded(ScanReport.Exclusion.EMPTY_TABLE);
            return List.of();
        }

        report.fileProcessed();

        List<DriftSummaryRow> rows = new ArrayList<>();
        for (DetectorSegment segment : DRIFT_SEGMENTS) {
            double[] shifts = product.rows().stream()
                    .filter(r -> DetectorSegment.fromName(r.segmentName()) == segment)
                    .mapToDouble(FlashRow::shiftXdisp)
                    .filter(Double::isFinite)
                    .toArray();
            if (shifts.length < 2) {
                continue;
            }
            DriftSummaryRow row = new DriftSummaryRow(file.toString(), segment, Statistics.range(shifts), header.exposureTime());
            logger.trace("{}", row);
            rows.add(row);
        }
        return rows;
    }
}
