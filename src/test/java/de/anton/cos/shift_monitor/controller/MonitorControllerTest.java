package de.anton.cos.shift_monitor.controller;

import de.anton.cos.shift_monitor.FitsFixtures;
import de.anton.cos.shift_monitor.TestConfigurations;
import de.anton.cos.shift_monitor.model.AggregationKey;
import de.anton.cos.shift_monitor.model.Anomaly;
import de.anton.cos.shift_monitor.model.DetectorSegment;
import de.anton.cos.shift_monitor.service.MonitorConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MonitorControllerTest {

    @TempDir
    Path tempDir;

    private Path corpus;
    private Path monitor;
    private Path refDir;

    @BeforeEach
    void setUp() throws Exception {
        corpus = Files.createDirectories(tempDir.resolve("corpus"));
        monitor = tempDir.resolve("monitor");
        refDir = Files.createDirectories(tempDir.resolve("lref"));
        FitsFixtures.writeReferenceTableWithoutOffsets(refDir.resolve(FitsFixtures.LAMPTAB));

        Path visit = corpus.resolve("12345/v01/cal");
        FitsFixtures.lampflash()
                .row("FUVA", 5.0, 0.0, true).row("FUVB", 3.0, 1.0, true)
                .row("FUVA", 5.0, 3.0, true).row("FUVB", 3.0, 1.0, true)
                .write(visit.resolve("la1_lampflash.fits"));
        FitsFixtures.writeAcquisition(visit.resolve("lb1a02xyq_rawacq.fits"), 56010.5);
        FitsFixtures.writeTelemetry(visit.resolve("lb1a02xyq_spt.fits"), 500.0, 300.0);
    }

    @Test
    void fullRunWritesAllProducts() throws Exception {
        MonitorConfiguration config = TestConfigurations.config(corpus, monitor, refDir);

        MonitorController.MonitorRun run = new MonitorController(config).run();

        assertEquals(5, run.records.size());
        assertEquals(2, run.driftRows.size());
        assertEquals(1, run.anomalies.size());
        Anomaly drift = run.anomalies.get(0);
        assertEquals(Anomaly.Kind.INTERNAL_DRIFT, drift.kind());
        assertEquals(DetectorSegment.FUVA, drift.segment());
        assertEquals(3.0, drift.value(), 1e-9);

        assertEquals(1, run.aggregation.differences.get(1291).size());
        assertEquals(2.0, run.aggregation.differences.get(1291).get(0).difference(), 1e-9);
        assertTrue(run.aggregation.byElement.containsKey(AggregationKey.ofElement("MIRRORA")));

        assertTrue(Files.isRegularFile(config.shiftTableFile()));
        assertTrue(Files.isRegularFile(config.workbookFile()));
        assertEquals(1, Files.readAllLines(config.differenceReportFile(), StandardCharsets.UTF_8).size());
        assertEquals(2, Files.readAllLines(config.driftLogFile(), StandardCharsets.UTF_8).size());
    }

    @Test
    void laterRunReadsTheStoredShiftTable() throws Exception {
        MonitorConfiguration collecting = TestConfigurations.config(corpus, monitor, refDir);
        new MonitorController(collecting).run();

        MonitorConfiguration reading = new MonitorConfiguration(corpus, monitor, refDir, "all_shifts.fits", 3,
                TestConfigurations.EXCLUDED_FRAGMENTS, List.of("otfrdata"), collecting.deduplication(), 2.0,
                collecting.positiveOnlyElements(), false, false, false);
        MonitorController.MonitorRun run = new MonitorController(reading).run();

        assertEquals(5, run.records.size());
        assertEquals(4, Files.readAllLines(reading.driftLogFile(), StandardCharsets.UTF_8).size());
    }

    @Test
    void missingShiftTableWithoutCollectionStillScansDrift() throws Exception {
        MonitorConfiguration config = new MonitorConfiguration(corpus, monitor, refDir, "all_shifts.fits", 3,
                TestConfigurations.EXCLUDED_FRAGMENTS, List.of("otfrdata"),
                TestConfigurations.config(corpus, monitor, refDir).deduplication(), 2.0,
                Set.of("MIRRORA"), false, true, false);

        MonitorController.MonitorRun run = new MonitorController(config).run();

        assertTrue(run.records.isEmpty());
        assertTrue(run.aggregation.bySegment.isEmpty());
        assertEquals(2, run.driftRows.size());
        assertTrue(Files.isRegularFile(config.workbookFile()));
        assertFalse(Files.exists(config.shiftTableFile()));
    }
}
