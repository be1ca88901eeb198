package de.anton.cos.shift_monitor.service;

import de.anton.cos.shift_monitor.model.DeduplicationPolicy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Properties;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MonitorConfigurationTest {

    @TempDir
    Path tempDir;

    @Test
    void bundledDefaults() throws Exception {
        MonitorConfiguration config = MonitorConfiguration.loadDefaults();

        assertEquals(Paths.get("/smov/cos/Data/"), config.corpusRoot());
        assertEquals(3, config.leafDepth());
        assertEquals(List.of("Quality", "Fasttrack", "targets", "podfiles", "gzip", "experimental", "Anomalies"),
                config.excludedPathFragments());
        assertEquals(List.of("otfrdata"), config.excludedDirectorySuffixes());
        assertEquals(DeduplicationPolicy.EXPOSURE_IDENTITY, config.deduplication());
        assertEquals(2.0, config.driftTolerance(), 0.0);
        assertEquals(Set.of("MIRRORA", "MIRRORB"), config.positiveOnlyElements());
        assertFalse(config.collectShifts());
        assertEquals(Paths.get("/grp/hst/cos/Monitors/Shifts/", "all_shifts.fits"), config.shiftTableFile());
        assertEquals(Paths.get("/grp/hst/cos/Monitors/Shifts/", "drift.txt"), config.driftLogFile());
    }

    @Test
    void fileOverridesBundledValues() throws Exception {
        Path file = tempDir.resolve("monitor.properties");
        Files.write(file, List.of(
                "corpus.root=" + tempDir.resolve("data").toString().replace('\\', '/'),
                "scan.deduplication=file-name",
                "drift.tolerance=1.5",
                "output.charts=false"), StandardCharsets.UTF_8);

        MonitorConfiguration config = MonitorConfiguration.load(file);

        assertEquals(tempDir.resolve("data"), config.corpusRoot());
        assertEquals(DeduplicationPolicy.FILE_NAME, config.deduplication());
        assertEquals(1.5, config.driftTolerance(), 0.0);
        assertFalse(config.renderCharts());
        assertEquals(3, config.leafDepth());
    }

    @Test
    void missingRequiredKeyIsRejected() {
        Properties p = new Properties();
        p.setProperty("corpus.root", "/data");
        p.setProperty("reference.dir", "/lref");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> MonitorConfiguration.fromProperties(p));
        assertTrue(e.getMessage().contains("monitor.dir"));
    }

    @Test
    void nonPositiveToleranceIsRejected() {
        Properties p = new Properties();
        p.setProperty("corpus.root", "/data");
        p.setProperty("monitor.dir", "/monitor");
        p.setProperty("reference.dir", "/lref");
        p.setProperty("drift.tolerance", "0");

        assertThrows(IllegalArgumentException.class, () -> MonitorConfiguration.fromProperties(p));
    }

    @Test
    void unknownPolicyIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> DeduplicationPolicy.fromString("by-color"));
        assertEquals(DeduplicationPolicy.EXPOSURE_IDENTITY, DeduplicationPolicy.fromString(null));
    }
}
