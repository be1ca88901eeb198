package de.anton.cos.shift_monitor.model;

import java.util.Locale;

/**
 * How repeated lamp-flash files are recognised during a corpus walk.
 */
public enum DeduplicationPolicy {
    /** A file name seen once is never processed again, whatever its directory. */
    FILE_NAME,
    /** Files are duplicates only if rootname and exposure start agree. */
    EXPOSURE_IDENTITY;

    public static DeduplicationPolicy fromString(String value) {
        if (value == null || value.isBlank()) {
            return EXPOSURE_IDENTITY;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
