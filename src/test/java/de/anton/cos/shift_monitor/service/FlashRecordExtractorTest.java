package de.anton.cos.shift_monitor.service;

import de.anton.cos.shift_monitor.FitsFixtures;
import de.anton.cos.shift_monitor.FitsFixtures.RefRow;
import de.anton.cos.shift_monitor.exception.MissingCompanionFileException;
import de.anton.cos.shift_monitor.exception.MissingRequiredFieldException;
import de.anton.cos.shift_monitor.model.DetectorSegment;
import de.anton.cos.shift_monitor.model.MeasuredShiftRecord;
import de.anton.cos.shift_monitor.model.ScanReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FlashRecordExtractorTest {

    @TempDir
    Path tempDir;

    private Path refDir;
    private Path dataDir;
    private FlashRecordExtractor extractor;

    @BeforeEach
    void setUp() throws Exception {
        refDir = Files.createDirectories(tempDir.resolve("lref"));
        dataDir = Files.createDirectories(tempDir.resolve("data"));
        FitsFixtures.writeReferenceTable(refDir.resolve(FitsFixtures.LAMPTAB),
                new RefRow("FUVA", "G130M", 1291, 0, 1.2345),
                new RefRow("FUVB", "G130M", 1291, 0, 0.5));
        extractor = new FlashRecordExtractor(new ReferenceTableResolver(refDir));
    }

    private List<MeasuredShiftRecord> extract(Path file, ScanReport report) throws Exception {
        try (Stream<MeasuredShiftRecord> records = extractor.extract(file, report)) {
            return records.collect(Collectors.toList());
        }
    }

    @Test
    void emitsOneRecordPerRowWithFlashIndex() throws Exception {
        Path file = FitsFixtures.lampflash()
                .extension("NUMFLASH", 3)
                .row("FUVA", 10.0, 0.1, true).row("FUVB", 10.0, 0.2, true)
                .row("FUVA", 11.0, 0.3, true).row("FUVB", 11.0, 0.4, true)
                .row("FUVA", 12.0, 0.5, false)
                .write(dataDir.resolve("lb1a01abq_lampflash.fits"));

        ScanReport report = new ScanReport();
        List<MeasuredShiftRecord> records = extract(file, report);

        assertEquals(5, records.size());
        for (int i = 0; i < records.size(); i++) {
            assertEquals(i / 2 + 1, records.get(i).flashIndex());
        }
        assertEquals(5, report.getRecordsEmitted());
        assertFalse(records.get(4).found());
        MeasuredShiftRecord first = records.get(0);
        assertEquals("lb1a01abq", first.dataset());
        assertEquals(12345, first.proposalId());
        assertEquals("G130M", first.opticalElement());
        assertEquals(1291, first.centralWavelength());
        assertEquals(3, first.focalPlanePosition());
        assertEquals(FitsFixtures.LAMPTAB, first.referenceTableId());
        assertEquals(56000.25, first.exposureStart(), 1e-9);
    }

    @Test
    void dispersionShiftIsCorrectedAndRounded() throws Exception {
        Path file = FitsFixtures.lampflash()
                .row("FUVA", 10.0, 0.123456789, true)
                .row("FUVB", 10.0, -1.0, true)
                .write(dataDir.resolve("lb1a01abq_lampflash.fits"));

        List<MeasuredShiftRecord> records = extract(file, new ScanReport());

        assertEquals(8.7655, records.get(0).dispersionShift(), 0.0);
        assertEquals(0.12346, records.get(0).crossDispersionShift(), 0.0);
        assertEquals(9.5, records.get(1).dispersionShift(), 0.0);
        assertEquals(DetectorSegment.FUVB, records.get(1).segment());
    }

    @Test
    void tableWithoutOffsetsLeavesShiftUncorrected() throws Exception {
        FitsFixtures.writeReferenceTableWithoutOffsets(refDir.resolve("old_lamp.fits"));
        Path file = FitsFixtures.lampflash()
                .primary("LAMPTAB", "lref$old_lamp.fits")
                .row("FUVA", 10.0, 0.0, true)
                .write(dataDir.resolve("lb1a01abq_lampflash.fits"));

        assertEquals(10.0, extract(file, new ScanReport()).get(0).dispersionShift(), 0.0);
    }

    @Test
    void malformedRowsAreSkippedAndCounted() throws Exception {
        Path file = FitsFixtures.lampflash()
                .row("FUVA", 10.0, 0.1, true)
                .row("XYZ", 10.0, 0.2, true)
                .row("FUVA", Double.NaN, 0.3, true)
                .row("FUVB", 12.0, 0.4, true)
                .write(dataDir.resolve("lb1a01abq_lampflash.fits"));

        ScanReport report = new ScanReport();
        List<MeasuredShiftRecord> records = extract(file, report);

        assertEquals(2, records.size());
        assertEquals(1, records.get(0).flashIndex());
        assertEquals(2, records.get(1).flashIndex());
        assertEquals(2, report.getRecordsSkipped());
    }

    @Test
    void lookupMissSkipsOnlyThatRow() throws Exception {
        Path file = FitsFixtures.lampflash()
                .primary("FPPOS", 1)
                .row("FUVA", 10.0, 0.1, true)
                .write(dataDir.resolve("lb1a01abq_lampflash.fits"));

        ScanReport report = new ScanReport();
        assertTrue(extract(file, report).isEmpty());
        assertEquals(1, report.getRecordsSkipped());
    }

    @Test
    void missingFpposFailsTheFile() throws Exception {
        Path file = FitsFixtures.lampflash()
                .withoutPrimary("FPPOS")
                .row("FUVA", 10.0, 0.1, true)
                .write(dataDir.resolve("lb1a01abq_lampflash.fits"));

        MissingRequiredFieldException e = assertThrows(MissingRequiredFieldException.class, () -> extract(file, new ScanReport()));
        assertEquals("FPPOS", e.getField());
    }

    @Test
    void missingLampTableFailsTheFile() throws Exception {
        Path file = FitsFixtures.lampflash()
                .withoutPrimary("LAMPTAB")
                .row("FUVA", 10.0, 0.1, true)
                .write(dataDir.resolve("lb1a01abq_lampflash.fits"));

        MissingRequiredFieldException e = assertThrows(MissingRequiredFieldException.class, () -> extract(file, new ScanReport()));
        assertEquals("LAMPTAB", e.getField());
    }

    @Test
    void acquisitionCoordinatesAreTransformed() throws Exception {
        Path acq = FitsFixtures.writeAcquisition(dataDir.resolve("lb1a02xyq_rawacq.fits"), 56010.5);
        FitsFixtures.writeTelemetry(dataDir.resolve("lb1a02xyq_spt.fits"), 500.0, 300.0);

        List<MeasuredShiftRecord> records = extract(acq, new ScanReport());

        assertEquals(1, records.size());
        MeasuredShiftRecord r = records.get(0);
        assertEquals(523.0, r.dispersionShift(), 0.0);
        assertEquals(723.0, r.crossDispersionShift(), 0.0);
        assertFalse(r.found());
        assertEquals(-1, r.focalPlanePosition());
        assertEquals(1, r.flashIndex());
        assertNull(r.segment());
        assertEquals("lb1a02xyq", r.dataset());
        assertEquals("MIRRORA", r.opticalElement());
    }

    @Test
    void nonPositiveAcquisitionCoordinateMeansNotLocated() throws Exception {
        Path acq = FitsFixtures.writeAcquisition(dataDir.resolve("lb1a02xyq_rawacq.fits"), 56010.5);
        FitsFixtures.writeTelemetry(dataDir.resolve("lb1a02xyq_spt.fits"), 0.0, 300.0);

        MeasuredShiftRecord r = extract(acq, new ScanReport()).get(0);

        assertNull(r.dispersionShift());
        assertNull(r.crossDispersionShift());
    }

    @Test
    void crossDispersionKeywordIsOptionalWhenTargetWasNotLocated() throws Exception {
        Path acq = FitsFixtures.writeAcquisition(dataDir.resolve("lb1a02xyq_rawacq.fits"), 56010.5);
        FitsFixtures.writeTelemetry(dataDir.resolve("lb1a02xyq_spt.fits"), 0.0, null);

        List<MeasuredShiftRecord> records = extract(acq, new ScanReport());

        assertEquals(1, records.size());
        assertNull(records.get(0).dispersionShift());
        assertNull(records.get(0).crossDispersionShift());
    }

    @Test
    void acquisitionWithoutCompanionFails() throws Exception {
        Path acq = FitsFixtures.writeAcquisition(dataDir.resolve("lb1a02xyq_rawacq.fits"), 56010.5);

        MissingCompanionFileException e = assertThrows(MissingCompanionFileException.class, () -> extract(acq, new ScanReport()));
        assertEquals(dataDir.resolve("lb1a02xyq_spt.fits"), e.getCompanion());
    }

    @Test
    void companionWithoutCoordinateFails() throws Exception {
        Path acq = FitsFixtures.writeAcquisition(dataDir.resolve("lb1a02xyq_rawacq.fits"), 56010.5);
        FitsFixtures.writeTelemetry(dataDir.resolve("lb1a02xyq_spt.fits"), 500.0, null);

        MissingRequiredFieldException e = assertThrows(MissingRequiredFieldException.class, () -> extract(acq, new ScanReport()));
        assertEquals("LQTAXCOR", e.getField());
    }

    @Test
    void unknownProductKindIsRejected() {
        Path other = dataDir.resolve("lb1a01abq_x1d.fits");
        assertFalse(extractor.supports(other));
        assertThrows(IllegalArgumentException.class, () -> extractor.extract(other));
    }
}
