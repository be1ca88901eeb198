package de.anton.cos.shift_monitor.service;

import de.anton.cos.shift_monitor.model.Anomaly;
import de.anton.cos.shift_monitor.model.DriftSummaryRow;
import de.anton.cos.shift_monitor.model.MeasuredShiftRecord;
import de.anton.cos.shift_monitor.model.SearchRange;
import de.anton.cos.shift_monitor.model.ToleranceEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Applies the fixed tolerances of the monitor: the internal drift limit on
 * SHIFT2 spreads and the per-grating search range on SHIFT1.
 */
public class AnomalyFlagger {

    private static final Logger logger = LoggerFactory.getLogger(AnomalyFlagger.class);

    private final double driftTolerance;
    private final ToleranceEnvelope envelope;

    public AnomalyFlagger(MonitorConfiguration config) {
        this(config.driftTolerance(), ToleranceEnvelope.defaults());
    }

    public AnomalyFlagger(double driftTolerance, ToleranceEnvelope envelope) {
        if (!(driftTolerance > 0)) {
            throw new IllegalArgumentException("Drift tolerance must be positive: " + driftTolerance);
        }
        this.driftTolerance = driftTolerance;
        this.envelope = Objects.requireNonNull(envelope, "Envelope cannot be null.");
    }

    public ToleranceEnvelope getEnvelope() {
        return envelope;
    }

    /** Drift anomalies with the configured tolerance. */
    public List<Anomaly> flagDrift(Collection<DriftSummaryRow> rows) {
        return flagDrift(rows, driftTolerance);
    }

    /**
     * Flags every row whose spread magnitude exceeds {@code tolerance}. A spread equal
     * to the tolerance is accepted.
     */
    public static List<Anomaly> flagDrift(Collection<DriftSummaryRow> rows, double tolerance) {
        List<Anomaly> anomalies = new ArrayList<>();
        for (DriftSummaryRow row : rows) {
            if (Math.abs(row.offsetSpread()) > tolerance) {
                anomalies.add(new Anomaly(Anomaly.Kind.INTERNAL_DRIFT, row.filePath(), row.segment(),
                        row.offsetSpread(), -tolerance, tolerance, Double.NaN));
            }
        }
        if (!anomalies.isEmpty()) {
            logger.warn("{} of {} drift rows exceed the tolerance of {} pixels.", anomalies.size(), rows.size(), tolerance);
        }
        return anomalies;
    }

    /** Search range anomalies against this flagger's envelope. */
    public List<Anomaly> flagSearchRange(Collection<MeasuredShiftRecord> records) {
        return flagSearchRange(records, envelope);
    }

    /**
     * Flags records whose SHIFT1 lies outside the search range that was active for
     * their grating at their exposure start. Records without SHIFT1 and gratings
     * without a band are not checked.
     */
    public static List<Anomaly> flagSearchRange(Collection<MeasuredShiftRecord> records, ToleranceEnvelope envelope) {
        List<Anomaly> anomalies = new ArrayList<>();
        for (MeasuredShiftRecord r : records) {
            if (!r.hasDispersionShift()) {
                continue;
            }
            Optional<SearchRange> range = envelope.rangeAt(r.opticalElement(), r.exposureStart());
            if (range.isPresent() && !range.get().contains(r.dispersionShift())) {
                SearchRange band = range.get();
                anomalies.add(new Anomaly(Anomaly.Kind.SEARCH_RANGE, r.dataset(), r.segment(),
                        r.dispersionShift(), band.lower(), band.upper(), r.exposureStart()));
            }
        }
        if (!anomalies.isEmpty()) {
            logger.warn("{} of {} shift records lie outside their search range.", anomalies.size(), records.size());
        }
        return anomalies;
    }
}
