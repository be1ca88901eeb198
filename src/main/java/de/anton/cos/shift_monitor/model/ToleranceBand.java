package de.anton.cos.shift_monitor.model;

import java.util.Objects;

/**
 * Search range of one optical element, which may change once at an epoch.
 *
 * @param opticalElement Grating the band applies to.
 * @param epochBoundary  MJD at which {@code afterEpoch} takes over; +infinity for a constant band.
 * @param beforeEpoch    Range before the epoch.
 * @param afterEpoch     Range from the epoch on.
 */
public record ToleranceBand(String opticalElement, double epochBoundary, SearchRange beforeEpoch, SearchRange afterEpoch) {
    public ToleranceBand {
        Objects.requireNonNull(opticalElement, "Optical element cannot be null.");
        Objects.requireNonNull(beforeEpoch, "Range before epoch cannot be null.");
        Objects.requireNonNull(afterEpoch, "Range after epoch cannot be null.");
    }

    public static ToleranceBand constant(String opticalElement, SearchRange range) {
        return new ToleranceBand(opticalElement, Double.POSITIVE_INFINITY, range, range);
    }

    public SearchRange rangeAt(double mjd) {
        return mjd < epochBoundary ? beforeEpoch : afterEpoch;
    }
}
