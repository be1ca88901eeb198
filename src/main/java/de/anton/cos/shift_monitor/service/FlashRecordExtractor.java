package de.anton.cos.shift_monitor.service;

import de.anton.cos.shift_monitor.model.ExposureProductReader;
import de.anton.cos.shift_monitor.model.MeasuredShiftRecord;
import de.anton.cos.shift_monitor.model.ProductKind;
import de.anton.cos.shift_monitor.model.ScanReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Entry point for shift extraction: derives the {@link ProductKind} of a file
 * from its name and hands it to the matching {@link ShiftExtractor}.
 */
public class FlashRecordExtractor {

    private static final Logger logger = LoggerFactory.getLogger(FlashRecordExtractor.class);

    private final Map<ProductKind, ShiftExtractor> extractors = new EnumMap<>(ProductKind.class);

    public FlashRecordExtractor(ReferenceTableResolver resolver) {
        this(new ExposureProductReader(), resolver);
    }

    public FlashRecordExtractor(ExposureProductReader reader, ReferenceTableResolver resolver) {
        register(new LampflashExtractor(reader, resolver));
        register(new AcquisitionExtractor(reader));
    }

    private void register(ShiftExtractor extractor) {
        extractors.put(extractor.kind(), extractor);
    }

    /** True if the file name denotes a product kind this extractor handles. */
    public boolean supports(Path file) {
        return ProductKind.fromFileName(file).map(extractors::containsKey).orElse(false);
    }

    public Stream<MeasuredShiftRecord> extract(Path file) throws IOException {
        return extract(file, new ScanReport());
    }

    /**
     * Extracts the measurements of one product file.
     *
     * @param file   Lamp-flash or raw acquisition product.
     * @param report Receives record counts.
     * @return A finite stream of records; rows are converted lazily.
     * @throws IllegalArgumentException If the file name matches no known product kind.
     * @throws IOException              If the file (or a file it depends on) cannot be used.
     */
    public Stream<MeasuredShiftRecord> extract(Path file, ScanReport report) throws IOException {
        Objects.requireNonNull(file, "File cannot be null.");
        ProductKind kind = ProductKind.fromFileName(file)
                .orElseThrow(() -> new IllegalArgumentException("Not a lamp-flash or acquisition product: " + file.getFileName()));
        logger.debug("Extracting {} as {}", file.getFileName(), kind);
        return extractors.get(kind).extract(file, report);
    }
}
