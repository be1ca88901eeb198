package de.anton.cos.shift_monitor.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * One measured alignment offset: a single lamp flash on one segment, or the single
 * synthetic measurement of a raw acquisition. Also the row type of the aggregated shift table.
 *
 * @param exposureStart        Exposure start (MJD).
 * @param dataset              Rootname of the exposure, lower case.
 * @param proposalId           Proposal the exposure belongs to.
 * @param detector             "FUV" or "NUV".
 * @param opticalElement       Grating or mirror.
 * @param centralWavelength    Central wavelength setting.
 * @param segment              Segment of the flash, null for acquisitions.
 * @param focalPlanePosition   FP-POS (1..4), -1 for acquisitions, null if unknown.
 * @param referenceTableId     LAMPTAB file name used for the correction.
 * @param flashIndex           1-based flash number, null if not applicable.
 * @param dispersionShift      SHIFT1 in pixels (corrected), null if the feature was not locatable.
 * @param crossDispersionShift SHIFT2 in pixels, null if the feature was not locatable.
 * @param found                Whether the calibration pipeline located the lamp spectrum.
 */
public record MeasuredShiftRecord(
    double exposureStart,
    String dataset,
    int proposalId,
    String detector,
    String opticalElement,
    int centralWavelength,
    DetectorSegment segment,
    Integer focalPlanePosition,
    String referenceTableId,
    Integer flashIndex,
    Double dispersionShift,
    Double crossDispersionShift,
    boolean found
) {
    /** Number of decimals kept for shift values. */
    public static final int SHIFT_DECIMALS = 5;

    public MeasuredShiftRecord {
        Objects.requireNonNull(dataset, "Dataset cannot be null.");
        Objects.requireNonNull(detector, "Detector cannot be null.");
        Objects.requireNonNull(opticalElement, "Optical element cannot be null.");
    }

    public boolean hasDispersionShift() {
        return dispersionShift != null && !dispersionShift.isNaN();
    }

    public boolean hasCrossDispersionShift() {
        return crossDispersionShift != null && !crossDispersionShift.isNaN();
    }

    /** Integer MJD of the exposure start, used for per-day reduction. */
    public int day() {
        return (int) Math.floor(exposureStart);
    }

    /**
     * Rounds a shift to {@link #SHIFT_DECIMALS} places, half-even on the exact binary value.
     */
    public static double roundShift(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return new BigDecimal(value).setScale(SHIFT_DECIMALS, RoundingMode.HALF_EVEN).doubleValue();
    }
}
