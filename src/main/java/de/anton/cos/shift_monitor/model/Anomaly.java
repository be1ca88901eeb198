package de.anton.cos.shift_monitor.model;

import java.util.Objects;

/**
 * A value outside its tolerance.
 *
 * @param kind    What was checked.
 * @param source  File path (drift) or dataset rootname (search range).
 * @param segment Segment involved, null if not applicable.
 * @param value   Offending value in pixels.
 * @param lower   Lower tolerance bound.
 * @param upper   Upper tolerance bound.
 * @param mjd     Exposure start, NaN if unknown.
 */
public record Anomaly(Kind kind, String source, DetectorSegment segment, double value, double lower, double upper, double mjd) {

    public enum Kind {
        /** Spread of SHIFT2 within one exposure exceeds the drift tolerance. */
        INTERNAL_DRIFT,
        /** SHIFT1 outside the search range of the grating. */
        SEARCH_RANGE
    }

    public Anomaly {
        Objects.requireNonNull(kind, "Kind cannot be null.");
        Objects.requireNonNull(source, "Source cannot be null.");
    }

    @Override
    public String toString() {
        return String.format("%s %s %s value=%.5f allowed=[%.2f, %.2f]", kind, source, segment == null ? "-" : segment, value, lower, upper);
    }
}
