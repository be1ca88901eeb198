package de.anton.cos.shift_monitor.service;

import de.anton.cos.shift_monitor.model.MeasuredShiftRecord;
import de.anton.cos.shift_monitor.model.ProductKind;
import de.anton.cos.shift_monitor.model.ScanReport;

import java.io.IOException;
import java.nio.file.Path;
import java.util.stream.Stream;

/**
 * Extraction strategy for one {@link ProductKind}. Implementations keep no state
 * between files.
 */
public interface ShiftExtractor {

    /** @return the product kind this extractor understands. */
    ProductKind kind();

    /**
     * Reads {@code file} and returns its measurements. The file is closed when this
     * method returns; rows are turned into records while the stream is consumed.
     *
     * @param file   Product file of {@link #kind()}.
     * @param report Receives counts of emitted and skipped records.
     * @throws IOException If the file as a whole cannot be used.
     */
    Stream<MeasuredShiftRecord> extract(Path file, ScanReport report) throws IOException;
}
