package de.anton.cos.shift_monitor.exception;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Base class for failures while reading an exposure product. Carries the file
 * the failure belongs to so batch callers can report it.
 */
public class ExposureProductException extends IOException {

    private final Path file;

    public ExposureProductException(Path file, String message) {
        super(message);
        this.file = file;
    }

    public ExposureProductException(Path file, String message, Throwable cause) {
        super(message, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
