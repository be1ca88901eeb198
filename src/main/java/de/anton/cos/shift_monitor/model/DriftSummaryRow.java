package de.anton.cos.shift_monitor.model;

import java.util.Objects;

/**
 * Spread of SHIFT2 across the flashes of one segment within one lamp-flash file.
 *
 * @param filePath         Path of the lamp-flash file.
 * @param segment          Segment the spread was computed for.
 * @param offsetSpread     max - min of the cross-dispersion shift.
 * @param exposureDuration EXPTIME of the exposure in seconds.
 */
public record DriftSummaryRow(String filePath, DetectorSegment segment, double offsetSpread, double exposureDuration) {
    public DriftSummaryRow {
        Objects.requireNonNull(filePath, "File path cannot be null.");
        Objects.requireNonNull(segment, "Segment cannot be null.");
    }
}
