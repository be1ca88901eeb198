package de.anton.cos.shift_monitor.service;

import de.anton.cos.shift_monitor.model.Anomaly;
import de.anton.cos.shift_monitor.model.DetectorSegment;
import de.anton.cos.shift_monitor.model.DriftSummaryRow;
import de.anton.cos.shift_monitor.model.MeasuredShiftRecord;
import de.anton.cos.shift_monitor.model.SearchRange;
import de.anton.cos.shift_monitor.model.ToleranceEnvelope;
import org.junit.jupiter.api.Test;

import java.util.List;

import static de.anton.cos.shift_monitor.TestRecords.fuv;
import static de.anton.cos.shift_monitor.TestRecords.nuv;
import static org.junit.jupiter.api.Assertions.*;

class AnomalyFlaggerTest {

    private final AnomalyFlagger flagger = new AnomalyFlagger(2.0, ToleranceEnvelope.defaults());

    @Test
    void spreadAboveToleranceIsFlagged() {
        List<DriftSummaryRow> rows = List.of(
                new DriftSummaryRow("/a/la1_lampflash.fits", DetectorSegment.FUVA, 2.5, 1200.0),
                new DriftSummaryRow("/a/la1_lampflash.fits", DetectorSegment.FUVB, 2.0, 1200.0),
                new DriftSummaryRow("/a/la2_lampflash.fits", DetectorSegment.FUVA, -3.0, 600.0),
                new DriftSummaryRow("/a/la3_lampflash.fits", DetectorSegment.FUVA, 0.4, 600.0));

        List<Anomaly> anomalies = flagger.flagDrift(rows);

        assertEquals(2, anomalies.size());
        Anomaly first = anomalies.get(0);
        assertEquals(Anomaly.Kind.INTERNAL_DRIFT, first.kind());
        assertEquals("/a/la1_lampflash.fits", first.source());
        assertEquals(DetectorSegment.FUVA, first.segment());
        assertEquals(-2.0, first.lower(), 0.0);
        assertEquals(2.0, first.upper(), 0.0);
        assertTrue(Double.isNaN(first.mjd()));
        assertEquals("/a/la2_lampflash.fits", anomalies.get(1).source());
    }

    @Test
    void explicitToleranceOverridesConfigured() {
        List<DriftSummaryRow> rows = List.of(new DriftSummaryRow("/a/la1_lampflash.fits", DetectorSegment.FUVA, 1.5, 1200.0));

        assertEquals(1, AnomalyFlagger.flagDrift(rows, 1.0).size());
        assertTrue(flagger.flagDrift(rows).isEmpty());
    }

    @Test
    void nonPositiveToleranceIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new AnomalyFlagger(0.0, ToleranceEnvelope.defaults()));
    }

    @Test
    void fuvShiftOutsideSearchRangeIsFlagged() {
        List<MeasuredShiftRecord> records = List.of(
                fuv("la1", 56000.2, "G130M", 1291, DetectorSegment.FUVA, 285.0),
                fuv("la2", 56000.2, "G130M", 1291, DetectorSegment.FUVA, 285.5),
                fuv("la3", 56000.2, "G160M", 1600, DetectorSegment.FUVB, -300.0),
                fuv("la4", 56000.2, "G130M", 1291, DetectorSegment.FUVA, null));

        List<Anomaly> anomalies = flagger.flagSearchRange(records);

        assertEquals(2, anomalies.size());
        assertEquals("la2", anomalies.get(0).source());
        assertEquals(Anomaly.Kind.SEARCH_RANGE, anomalies.get(0).kind());
        assertEquals(56000.2, anomalies.get(0).mjd(), 0.0);
        assertEquals("la3", anomalies.get(1).source());
        assertEquals(DetectorSegment.FUVB, anomalies.get(1).segment());
    }

    @Test
    void nuvRangeMovesAtItsEpoch() {
        List<MeasuredShiftRecord> records = List.of(
                nuv("lb1", ToleranceEnvelope.NUV_M_EPOCH - 1, "G185M", 1850, DetectorSegment.NUVA, -70.0),
                nuv("lb2", ToleranceEnvelope.NUV_M_EPOCH + 1, "G185M", 1850, DetectorSegment.NUVA, -70.0),
                nuv("lb3", ToleranceEnvelope.NUV_M_EPOCH + 1, "G185M", 1850, DetectorSegment.NUVA, 50.0));

        List<Anomaly> anomalies = flagger.flagSearchRange(records);

        assertEquals(List.of("lb1", "lb3"), anomalies.stream().map(Anomaly::source).toList());
        assertEquals(-78.0, anomalies.get(1).lower(), 0.0);
        assertEquals(38.0, anomalies.get(1).upper(), 0.0);
    }

    @Test
    void elementsWithoutBandAreNotChecked() {
        List<MeasuredShiftRecord> records = List.of(nuv("lb1", 56000.0, "MIRRORA", 0, DetectorSegment.NUVA, 5000.0));
        assertTrue(flagger.flagSearchRange(records).isEmpty());
    }

    @Test
    void defaultEnvelopeEpochs() {
        ToleranceEnvelope envelope = ToleranceEnvelope.defaults();

        assertEquals(new SearchRange(-58.0, 58.0), envelope.rangeAt("G230L", ToleranceEnvelope.G230L_EPOCH - 0.5).orElseThrow());
        assertEquals(new SearchRange(-98.0, 18.0), envelope.rangeAt("G230L", ToleranceEnvelope.G230L_EPOCH).orElseThrow());
        assertEquals(new SearchRange(-68.0, 48.0), envelope.rangeAt("G225M", 60000.0).orElseThrow());
        assertEquals(new SearchRange(-285.0, 285.0), envelope.rangeAt("G140L", 60000.0).orElseThrow());
        assertTrue(envelope.rangeAt("PSA", 60000.0).isEmpty());
    }
}
