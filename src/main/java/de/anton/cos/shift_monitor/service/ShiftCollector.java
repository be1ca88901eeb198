package de.anton.cos.shift_monitor.service;

import de.anton.cos.shift_monitor.model.MeasuredShiftRecord;
import de.anton.cos.shift_monitor.model.ScanReport;
import de.anton.cos.shift_monitor.model.ShiftTableWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Batch step that builds the aggregated shift table: every lamp-flash and raw
 * acquisition product of the corpus is extracted and the records are written
 * in walk order.
 */
public class ShiftCollector {

    private static final Logger logger = LoggerFactory.getLogger(ShiftCollector.class);

    private final MonitorConfiguration config;
    private final FlashRecordExtractor extractor;
    private final CorpusWalker walker;
    private final ShiftTableWriter writer;

    public ShiftCollector(MonitorConfiguration config, FlashRecordExtractor extractor, CorpusWalker walker, ShiftTableWriter writer) {
        this.config = Objects.requireNonNull(config, "Configuration cannot be null.");
        this.extractor = Objects.requireNonNull(extractor, "Extractor cannot be null.");
        this.walker = Objects.requireNonNull(walker, "Walker cannot be null.");
        this.writer = Objects.requireNonNull(writer, "Writer cannot be null.");
    }

    /**
     * Collects all records below {@code root} and writes them to the configured shift table.
     *
     * @return The collected records.
     * @throws IOException If the corpus root cannot be listed or the table cannot be written.
     */
    public List<MeasuredShiftRecord> collect(Path root) throws IOException {
        ScanReport report = new ScanReport();
        List<MeasuredShiftRecord> records = collect(root, report);
        writer.write(records, config.shiftTableFile());
        logger.info("Shift collection below {} finished: {}", root, report.summary());
        return records;
    }

    /** Extracts the records without writing the table. Failing files are logged and skipped. */
    public List<MeasuredShiftRecord> collect(Path root, ScanReport report) throws IOException {
        List<Path> files = walker.collectFiles(root, extractor::supports, report);
        logger.info("Collecting shifts from {} product files below {}", files.size(), root);
        List<MeasuredShiftRecord> records = new ArrayList<>();
        for (Path file : files) {
            if (Thread.currentThread().isInterrupted()) {
                throw new IOException("Shift collection interrupted before " + file);
            }
            try (Stream<MeasuredShiftRecord> stream = extractor.extract(file, report)) {
                stream.forEach(records::add);
                report.fileProcessed();
            } catch (IOException e) {
                logger.error("Skipping {} in shift collection: {}", file, e.getMessage(), e);
                report.fileFailed(file, e);
            }
        }
        return records;
    }
}
