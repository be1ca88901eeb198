package de.anton.cos.shift_monitor.model;

import java.util.Objects;

/**
 * Instrument configuration used as the lookup key into a reference offset table.
 *
 * @param segment           Detector segment of the flash.
 * @param opticalElement    Grating or mirror, e.g. "G130M".
 * @param centralWavelength Central wavelength setting.
 * @param focalPlaneOffset  FP-POS relative to the nominal position 3.
 */
public record ConfigurationKey(
    DetectorSegment segment,
    String opticalElement,
    int centralWavelength,
    int focalPlaneOffset
) {
    public ConfigurationKey {
        Objects.requireNonNull(segment, "Segment cannot be null.");
        Objects.requireNonNull(opticalElement, "Optical element cannot be null.");
        opticalElement = opticalElement.trim();
    }

    /** Builds the key for a lamp-flash exposure, converting FPPOS (1..4) to the offset from 3. */
    public static ConfigurationKey forFlash(DetectorSegment segment, String opticalElement,
                                            int centralWavelength, int fpPosition) {
        return new ConfigurationKey(segment, opticalElement, centralWavelength, fpPosition - 3);
    }

    @Override
    public String toString() {
        return String.format("%s/%s/%d/fpoffset=%d", segment, opticalElement, centralWavelength, focalPlaneOffset);
    }
}
