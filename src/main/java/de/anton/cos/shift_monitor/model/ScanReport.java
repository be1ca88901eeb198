package de.anton.cos.shift_monitor.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts what happened during a corpus pass: files processed, files excluded by
 * policy (not errors), files that failed, and rows skipped as malformed.
 * Counters are safe to update from several threads.
 */
public class ScanReport {

    /** Reasons a file or directory is legitimately left out of a pass. */
    public enum Exclusion {
        EXCLUDED_DIRECTORY("excluded directory"),
        DUPLICATE("duplicate exposure"),
        NUV_DETECTOR("NUV detector"),
        SINGLE_FLASH("fewer than two flashes"),
        EMPTY_TABLE("empty flash table");

        private final String description;

        Exclusion(String description) {
            this.description = description;
        }

        @Override
        public String toString() {
            return description;
        }
    }

    /** A file that could not be processed, with the reason. */
    public record Failure(Path file, String reason) { }

    private final AtomicInteger filesProcessed = new AtomicInteger();
    private final AtomicInteger recordsEmitted = new AtomicInteger();
    private final AtomicInteger recordsSkipped = new AtomicInteger();
    private final Map<Exclusion, AtomicInteger> exclusions = new EnumMap<>(Exclusion.class);
    private final List<Failure> failures = Collections.synchronizedList(new ArrayList<>());

    public ScanReport() {
        for (Exclusion exclusion : Exclusion.values()) {
            exclusions.put(exclusion, new AtomicInteger());
        }
    }

    public void fileProcessed() { filesProcessed.incrementAndGet(); }
    public void recordEmitted() { recordsEmitted.incrementAndGet(); }
    public void recordSkipped() { recordsSkipped.incrementAndGet(); }
    public void excluded(Exclusion exclusion) { exclusions.get(exclusion).incrementAndGet(); }

    public void fileFailed(Path file, Exception cause) {
        String reason = cause.getClass().getSimpleName() + ": " + cause.getMessage();
        failures.add(new Failure(file, reason));
    }

    public int getFilesProcessed() { return filesProcessed.get(); }
    public int getRecordsEmitted() { return recordsEmitted.get(); }
    public int getRecordsSkipped() { return recordsSkipped.get(); }
    public int getExcluded(Exclusion exclusion) { return exclusions.get(exclusion).get(); }

    public List<Failure> getFailures() {
        synchronized (failures) {
            return List.copyOf(failures);
        }
    }

    public int getFilesFailed() { return failures.size(); }

    /** One-line summary suitable for the end-of-scan log message. */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%d files processed, %d records, %d records skipped as malformed, %d files failed",
                getFilesProcessed(), getRecordsEmitted(), getRecordsSkipped(), getFilesFailed()));
        for (Exclusion exclusion : Exclusion.values()) {
            int count = getExcluded(exclusion);
            if (count > 0) {
                sb.append(", ").append(count).append(" excluded (").append(exclusion).append(')');
            }
        }
        return sb.toString();
    }
}
