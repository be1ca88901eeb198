package de.anton.cos.shift_monitor.exception;

import java.nio.file.Path;

/**
 * A header keyword or table column needed for extraction is absent.
 */
public class MissingRequiredFieldException extends ExposureProductException {

    private final String field;

    public MissingRequiredFieldException(Path file, String field) {
        super(file, String.format("Required field '%s' missing in %s", field, file == null ? "?" : file.getFileName()));
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
