package de.anton.cos.shift_monitor.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Contents of a lamp-flash file held in memory after the file has been closed.
 */
public record LampflashProduct(Path file, ExposureHeader header, List<FlashRow> rows) {
    public LampflashProduct {
        Objects.requireNonNull(file, "File cannot be null.");
        Objects.requireNonNull(header, "Header cannot be null.");
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
