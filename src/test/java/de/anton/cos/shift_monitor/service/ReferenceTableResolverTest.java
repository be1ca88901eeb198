package de.anton.cos.shift_monitor.service;

import de.anton.cos.shift_monitor.FitsFixtures;
import de.anton.cos.shift_monitor.FitsFixtures.RefRow;
import de.anton.cos.shift_monitor.exception.LookupMissException;
import de.anton.cos.shift_monitor.model.ConfigurationKey;
import de.anton.cos.shift_monitor.model.DetectorSegment;
import de.anton.cos.shift_monitor.model.ReferenceOffsetTable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceTableResolverTest {

    @TempDir
    Path refDir;

    @Test
    void resolvesPixelShiftOfMatchingRow() throws Exception {
        FitsFixtures.writeReferenceTable(refDir.resolve("lamp.fits"),
                new RefRow("FUVA", "G130M", 1291, 0, 1.2345),
                new RefRow("FUVB", "G130M", 1291, 0, -2.5),
                new RefRow("FUVA", "G130M", 1291, 1, 7.0));
        ReferenceTableResolver resolver = new ReferenceTableResolver(refDir);

        assertEquals(1.2345, resolver.resolve("lamp.fits", new ConfigurationKey(DetectorSegment.FUVA, "G130M", 1291, 0)), 1e-12);
        assertEquals(-2.5, resolver.resolve("lamp.fits", new ConfigurationKey(DetectorSegment.FUVB, "G130M", 1291, 0)), 1e-12);
        assertEquals(7.0, resolver.resolve("lamp.fits", ConfigurationKey.forFlash(DetectorSegment.FUVA, "G130M", 1291, 4)), 1e-12);
    }

    @Test
    void tableWithoutOffsetColumnYieldsZeroForAnyKey() throws Exception {
        FitsFixtures.writeReferenceTableWithoutOffsets(refDir.resolve("old_lamp.fits"));
        ReferenceTableResolver resolver = new ReferenceTableResolver(refDir);

        assertEquals(0.0, resolver.resolve("old_lamp.fits", new ConfigurationKey(DetectorSegment.FUVA, "G130M", 1291, 0)));
        assertEquals(0.0, resolver.resolve("old_lamp.fits", new ConfigurationKey(DetectorSegment.NUVC, "G285M", 3094, -2)));
        assertFalse(resolver.table("old_lamp.fits").isCorrectionDefined());
    }

    @Test
    void missingRowIsReportedAsLookupMiss() throws Exception {
        FitsFixtures.writeReferenceTable(refDir.resolve("lamp.fits"), new RefRow("FUVA", "G130M", 1291, 0, 1.0));
        ReferenceTableResolver resolver = new ReferenceTableResolver(refDir);
        ConfigurationKey key = new ConfigurationKey(DetectorSegment.FUVA, "G160M", 1577, 0);

        LookupMissException e = assertThrows(LookupMissException.class, () -> resolver.resolve("lamp.fits", key));
        assertEquals(key, e.getKey());
        assertEquals("lamp.fits", e.getTableId());
    }

    @Test
    void tablesAreLoadedOnce() throws Exception {
        FitsFixtures.writeReferenceTable(refDir.resolve("lamp.fits"), new RefRow("FUVA", "G130M", 1291, 0, 1.0));
        ReferenceTableResolver resolver = new ReferenceTableResolver(refDir);

        ReferenceOffsetTable first = resolver.table("lamp.fits");
        ReferenceOffsetTable second = resolver.table("lamp.fits");
        assertSame(first, second);
        assertEquals(1, resolver.loadedTableCount());
    }

    @Test
    void missingTableFileIsAnIoError() {
        ReferenceTableResolver resolver = new ReferenceTableResolver(refDir);
        assertThrows(NoSuchFileException.class, () -> resolver.table("absent.fits"));
        assertEquals(0, resolver.loadedTableCount());
    }

    @Test
    void inMemoryTableUsesFirstMatchingRow() throws Exception {
        ConfigurationKey key = new ConfigurationKey(DetectorSegment.FUVB, "G160M", 1600, -1);
        ReferenceOffsetTable table = ReferenceOffsetTable.withOffsets("mem", List.of(
                new ReferenceOffsetTable.Row(key, 3.0),
                new ReferenceOffsetTable.Row(key, 4.0)));

        assertEquals(3.0, new ReferenceTableResolver(refDir).resolve(table, key));
    }
}
