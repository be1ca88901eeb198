package de.anton.cos.shift_monitor.service;

import de.anton.cos.shift_monitor.model.AcquisitionProduct;
import de.anton.cos.shift_monitor.model.ExposureHeader;
import de.anton.cos.shift_monitor.model.ExposureProductReader;
import de.anton.cos.shift_monitor.model.MeasuredShiftRecord;
import de.anton.cos.shift_monitor.model.ProductKind;
import de.anton.cos.shift_monitor.model.ScanReport;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Builds the single measurement of a raw acquisition from the target position in
 * its telemetry companion. LQTAYCOR/LQTAXCOR are raw detector coordinates, rotated
 * by 90 degrees and mirrored with respect to the user frame.
 */
public class AcquisitionExtractor implements ShiftExtractor {

    /** Largest raw pixel coordinate of the acquisition frame. */
    public static final double FRAME_SIZE = 1023.0;
    /** FP-POS reported for acquisitions. */
    public static final int ACQ_FP_POSITION = -1;

    private final ExposureProductReader reader;

    public AcquisitionExtractor(ExposureProductReader reader) {
        this.reader = Objects.requireNonNull(reader, "Reader cannot be null.");
    }

    @Override
    public ProductKind kind() {
        return ProductKind.RAW_ACQUISITION;
    }

    @Override
    public Stream<MeasuredShiftRecord> extract(Path file, ScanReport report) throws IOException {
        AcquisitionProduct product = reader.readAcquisition(file);
        report.recordEmitted();
        return Stream.of(toRecord(product));
    }

    /** Converts the telemetry position to user-frame shifts; a non-positive LQTAYCOR means "not located". */
    static MeasuredShiftRecord toRecord(AcquisitionProduct product) {
        ExposureHeader header = product.header();
        Double dispersion = null;
        Double crossDispersion = null;
        if (product.lqtaYcor() > 0) {
            dispersion = FRAME_SIZE - product.lqtaYcor();
            crossDispersion = FRAME_SIZE - product.lqtaXcor();
        }
        return new MeasuredShiftRecord(
                header.exposureStart(),
                header.dataset(),
                header.proposalId(),
                header.detector(),
                header.opticalElement(),
                header.centralWavelength(),
                null,
                ACQ_FP_POSITION,
                header.referenceTableId(),
                1,
                dispersion,
                crossDispersion,
                false);
    }
}
