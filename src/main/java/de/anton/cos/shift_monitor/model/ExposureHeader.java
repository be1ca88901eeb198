package de.anton.cos.shift_monitor.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Header metadata of one exposure product, read from the primary header and the
 * first extension.
 *
 * @param dataset           Rootname derived from the file name.
 * @param exposureStart     EXPSTART (MJD).
 * @param exposureTime      EXPTIME in seconds, NaN if absent.
 * @param proposalId        PROPOSID.
 * @param detector          DETECTOR ("FUV"/"NUV").
 * @param opticalElement    OPT_ELEM.
 * @param centralWavelength CENWAVE.
 * @param fpPosition        FPPOS, null if absent.
 * @param referenceTableId  LAMPTAB file name without the "lref$" prefix, null if absent.
 * @param numFlash          NUMFLASH, null if absent.
 */
public record ExposureHeader(
    String dataset,
    double exposureStart,
    double exposureTime,
    int proposalId,
    String detector,
    String opticalElement,
    int centralWavelength,
    Integer fpPosition,
    String referenceTableId,
    Integer numFlash
) {
    public ExposureHeader {
        Objects.requireNonNull(dataset, "Dataset cannot be null.");
        Objects.requireNonNull(detector, "Detector cannot be null.");
        Objects.requireNonNull(opticalElement, "Optical element cannot be null.");
    }

    public boolean isNuv() {
        return "NUV".equalsIgnoreCase(detector);
    }

    /** Strips an environment prefix such as "lref$" from a reference file keyword. */
    public static String stripReferencePrefix(String keyword) {
        if (keyword == null) {
            return null;
        }
        String trimmed = keyword.trim();
        int dollar = trimmed.lastIndexOf('$');
        return dollar >= 0 ? trimmed.substring(dollar + 1) : trimmed;
    }

    /** Rootname of an exposure product: the file name up to the first underscore, lower case. */
    public static String datasetOf(String fileName) {
        int underscore = fileName.indexOf('_');
        String root = underscore > 0 ? fileName.substring(0, underscore) : fileName;
        return root.toLowerCase(Locale.ROOT);
    }
}
