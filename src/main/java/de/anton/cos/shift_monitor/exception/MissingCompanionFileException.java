package de.anton.cos.shift_monitor.exception;

import java.nio.file.Path;

/**
 * The telemetry (spt) companion of a raw acquisition product does not exist.
 */
public class MissingCompanionFileException extends ExposureProductException {

    private final Path companion;

    public MissingCompanionFileException(Path file, Path companion) {
        super(file, String.format("Companion file %s for %s not found", companion, file.getFileName()));
        this.companion = companion;
    }

    public Path getCompanion() {
        return companion;
    }
}
