package de.anton.cos.shift_monitor.model;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Structural kind of an exposure product, decided once from its file name.
 */
public enum ProductKind {
    /** Lamp-flash table written by the calibration pipeline (one row per flash and segment). */
    LAMPFLASH("_lampflash.fits"),
    /** Raw target acquisition; the shift comes from the companion telemetry (spt) file. */
    RAW_ACQUISITION("_rawacq.fits");

    private final String marker;

    ProductKind(String marker) {
        this.marker = marker;
    }

    public String getMarker() {
        return marker;
    }

    public boolean matches(String fileName) {
        return fileName != null && fileName.contains(marker);
    }

    public boolean matches(Path file) {
        return file != null && file.getFileName() != null && matches(file.getFileName().toString());
    }

    /**
     * Derives the product kind from a file name.
     *
     * @param file Product path; only the file name is inspected.
     * @return The kind, or empty if the file is neither a lamp-flash nor a raw acquisition product.
     */
    public static Optional<ProductKind> fromFileName(Path file) {
        if (file == null || file.getFileName() == null) {
            return Optional.empty();
        }
        String name = file.getFileName().toString();
        for (ProductKind kind : values()) {
            if (kind.matches(name)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
