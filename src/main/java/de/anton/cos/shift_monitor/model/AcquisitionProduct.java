package de.anton.cos.shift_monitor.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Raw acquisition header plus the two target-position keywords of its telemetry companion.
 *
 * @param file      The rawacq file.
 * @param companion The spt file the coordinates were read from.
 * @param header    Header metadata of the rawacq file.
 * @param lqtaYcor  LQTAYCOR in raw detector coordinates.
 * @param lqtaXcor  LQTAXCOR in raw detector coordinates, NaN when LQTAYCOR is not positive.
 */
public record AcquisitionProduct(Path file, Path companion, ExposureHeader header, double lqtaYcor, double lqtaXcor) {
    public AcquisitionProduct {
        Objects.requireNonNull(file, "File cannot be null.");
        Objects.requireNonNull(header, "Header cannot be null.");
    }
}
