package de.anton.cos.shift_monitor.exception;

import java.nio.file.Path;

/**
 * A single table row cannot be turned into a record. Callers skip the row and
 * continue with the rest of the file.
 */
public class MalformedRecordException extends ExposureProductException {

    private final int row;

    public MalformedRecordException(Path file, int row, String reason) {
        super(file, String.format("Row %d of %s skipped: %s", row, file == null ? "?" : file.getFileName(), reason));
        this.row = row;
    }

    public int getRow() {
        return row;
    }
}
