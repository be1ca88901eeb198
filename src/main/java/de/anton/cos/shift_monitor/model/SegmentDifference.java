package de.anton.cos.shift_monitor.model;

/**
 * SHIFT1 of segment A and segment B of one FUV dataset.
 *
 * @param dataset           Dataset rootname.
 * @param opticalElement    Grating.
 * @param centralWavelength Central wavelength.
 * @param fpPosition        FP-POS of the FUVA row.
 * @param mjd               Exposure start of the FUVA row.
 * @param aShift            SHIFT1 of FUVA.
 * @param bShift            SHIFT1 of FUVB.
 */
public record SegmentDifference(String dataset, String opticalElement, int centralWavelength,
                                int fpPosition, double mjd, double aShift, double bShift) {

    /** @return SHIFT1A - SHIFT1B. */
    public double difference() {
        return aShift - bShift;
    }
}
