package de.anton.cos.shift_monitor.service;

import de.anton.cos.shift_monitor.exception.LookupMissException;
import de.anton.cos.shift_monitor.exception.MalformedRecordException;
import de.anton.cos.shift_monitor.exception.MissingRequiredFieldException;
import de.anton.cos.shift_monitor.model.ConfigurationKey;
import de.anton.cos.shift_monitor.model.DetectorSegment;
import de.anton.cos.shift_monitor.model.ExposureHeader;
import de.anton.cos.shift_monitor.model.ExposureProductReader;
import de.anton.cos.shift_monitor.model.FlashRow;
import de.anton.cos.shift_monitor.model.LampflashProduct;
import de.anton.cos.shift_monitor.model.MeasuredShiftRecord;
import de.anton.cos.shift_monitor.model.ProductKind;
import de.anton.cos.shift_monitor.model.ReferenceOffsetTable;
import de.anton.cos.shift_monitor.model.ScanReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Turns every row of a lamp-flash table into a {@link MeasuredShiftRecord}.
 * SHIFT_DISP is corrected by the FP-POS pixel shift of the exposure's LAMPTAB;
 * both shifts are rounded to five decimals. Two table rows (FUVA and FUVB, or
 * two NUV stripes) belong to one flash, hence flash = row / 2 + 1.
 */
public class LampflashExtractor implements ShiftExtractor {

    private static final Logger logger = LoggerFactory.getLogger(LampflashExtractor.class);

    private final ExposureProductReader reader;
    private final ReferenceTableResolver resolver;

    public LampflashExtractor(ExposureProductReader reader, ReferenceTableResolver resolver) {
        this.reader = Objects.requireNonNull(reader, "Reader cannot be null.");
        this.resolver = Objects.requireNonNull(resolver, "Resolver cannot be null.");
    }

    @Override
    public ProductKind kind() {
        return ProductKind.LAMPFLASH;
    }

    @Override
    public Stream<MeasuredShiftRecord> extract(Path file, ScanReport report) throws IOException {
        return extract(reader.readLampflash(file), report);
    }

    /**
     * Extracts the records of an already read lamp-flash product.
     *
     * @throws MissingRequiredFieldException If the exposure has no FPPOS or LAMPTAB.
     * @throws IOException                   If the reference table cannot be read.
     */
    public Stream<MeasuredShiftRecord> extract(LampflashProduct product, ScanReport report) throws IOException {
        Objects.requireNonNull(report, "Report cannot be null.");
        ExposureHeader header = product.header();
        if (header.fpPosition() == null) {
            throw new MissingRequiredFieldException(product.file(), ExposureProductReader.KEY_FPPOS);
        }
        if (header.referenceTableId() == null || header.referenceTableId().isEmpty()) {
            throw new MissingRequiredFieldException(product.file(), ExposureProductReader.KEY_LAMPTAB);
        }
        // Load before streaming so an unreadable table fails the whole file
        ReferenceOffsetTable table = resolver.table(header.referenceTableId());
        List<FlashRow> rows = product.rows();
        logger.trace("{}: {} flash rows, reference table {}", product.file().getFileName(), rows.size(), table.getTableId());

        return IntStream.range(0, rows.size())
                .mapToObj(i -> {
                    try {
                        MeasuredShiftRecord record = toRecord(product.file(), header, table, i, rows.get(i));
                        report.recordEmitted();
                        return record;
                    } catch (MalformedRecordException e) {
                        logger.warn(e.getMessage());
                        report.recordSkipped();
                        return null;
                    }
                })
                .filter(Objects::nonNull);
    }

    private MeasuredShiftRecord toRecord(Path file, ExposureHeader header, ReferenceOffsetTable table,
                                         int index, FlashRow row) throws MalformedRecordException {
        DetectorSegment segment = DetectorSegment.fromName(row.segmentName());
        if (segment == null) {
            throw new MalformedRecordException(file, index, "unknown segment '" + row.segmentName() + "'");
        }
        if (!Double.isFinite(row.shiftDisp()) || !Double.isFinite(row.shiftXdisp())) {
            throw new MalformedRecordException(file, index, "non-finite shift");
        }

        ConfigurationKey key = ConfigurationKey.forFlash(segment, header.opticalElement(),
                header.centralWavelength(), header.fpPosition());
        double offset;
        try {
            offset = resolver.resolve(table, key);
        } catch (LookupMissException e) {
            throw new MalformedRecordException(file, index, e.getMessage());
        }

        return new MeasuredShiftRecord(
                header.exposureStart(),
                header.dataset(),
                header.proposalId(),
                header.detector(),
                header.opticalElement(),
                header.centralWavelength(),
                segment,
                header.fpPosition(),
                header.referenceTableId(),
                index / 2 + 1,
                MeasuredShiftRecord.roundShift(row.shiftDisp() - offset),
                MeasuredShiftRecord.roundShift(row.shiftXdisp()),
                row.specFound());
    }
}
