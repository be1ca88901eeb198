package de.anton.cos.shift_monitor.service;

import de.anton.cos.shift_monitor.TestConfigurations;
import de.anton.cos.shift_monitor.model.ProductKind;
import de.anton.cos.shift_monitor.model.ScanReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CorpusWalkerTest {

    @TempDir
    Path root;

    private final CorpusWalker walker = new CorpusWalker(3, TestConfigurations.EXCLUDED_FRAGMENTS, List.of("otfrdata"));

    private Path touch(String relative) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        return Files.createFile(file);
    }

    @Test
    void takesFilesOnlyAtLeafDepth() throws Exception {
        Path leaf = touch("12345/visit01/cal/la1_lampflash.fits");
        touch("12345/visit01/lb2_lampflash.fits");
        touch("12345/visit01/cal/deeper/lc3_lampflash.fits");
        touch("ld4_lampflash.fits");

        List<Path> files = walker.collectFiles(root, ProductKind.LAMPFLASH::matches, new ScanReport());

        assertEquals(List.of(leaf), files);
    }

    @Test
    void excludedSubtreesAreSkippedAndCounted() throws Exception {
        Path kept = touch("12345/visit01/cal/la1_lampflash.fits");
        touch("Anomalies/visit01/cal/lb2_lampflash.fits");
        touch("12345/Quality/cal/lc3_lampflash.fits");
        touch("12345/visit02/otfrdata/ld4_lampflash.fits");

        ScanReport report = new ScanReport();
        List<Path> files = walker.collectFiles(root, ProductKind.LAMPFLASH::matches, report);

        assertEquals(List.of(kept), files);
        assertEquals(2, report.getExcluded(ScanReport.Exclusion.EXCLUDED_DIRECTORY));
    }

    @Test
    void orderIsDepthFirstByName() throws Exception {
        Path b = touch("b/x/y/lb_lampflash.fits");
        Path a2 = touch("a/x/z/la2_lampflash.fits");
        Path a1 = touch("a/x/y/la1_lampflash.fits");

        assertEquals(List.of(a1, a2, b), walker.collectFiles(root, ProductKind.LAMPFLASH::matches, new ScanReport()));
    }

    @Test
    void filterSelectsProductKind() throws Exception {
        Path flash = touch("p/v/c/la1_lampflash.fits");
        touch("p/v/c/la1_x1d.fits");
        Path acq = touch("p/v/c/la2_rawacq.fits.gz");

        assertEquals(List.of(flash), walker.collectFiles(root, ProductKind.LAMPFLASH::matches, new ScanReport()));
        assertEquals(List.of(acq), walker.collectFiles(root, ProductKind.RAW_ACQUISITION::matches, new ScanReport()));
    }

    @Test
    void exclusionMatchesRelativePathOnly() {
        assertTrue(walker.isExcluded(Paths.get("12345", "experimental_runs")));
        assertFalse(walker.isExcluded(Paths.get("12345", "visit01")));
    }

    @Test
    void missingRootIsAnError() {
        assertThrows(IOException.class,
                () -> walker.collectFiles(root.resolve("absent"), p -> true, new ScanReport()));
    }
}
