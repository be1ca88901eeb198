package de.anton.cos.shift_monitor.service;

import de.anton.cos.shift_monitor.exception.LookupMissException;
import de.anton.cos.shift_monitor.model.ConfigurationKey;
import de.anton.cos.shift_monitor.model.ReferenceOffsetTable;
import de.anton.cos.shift_monitor.model.ReferenceTableReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves the expected FP-POS pixel shift for an instrument configuration from
 * a lamp reference table. Tables are read once per resolver and then shared
 * read-only.
 */
public class ReferenceTableResolver {

    private static final Logger logger = LoggerFactory.getLogger(ReferenceTableResolver.class);

    private final Path referenceDirectory;
    private final ReferenceTableReader reader;
    private final Map<String, ReferenceOffsetTable> tables = new ConcurrentHashMap<>();

    public ReferenceTableResolver(Path referenceDirectory) {
        this(referenceDirectory, new ReferenceTableReader());
    }

    public ReferenceTableResolver(Path referenceDirectory, ReferenceTableReader reader) {
        this.referenceDirectory = Objects.requireNonNull(referenceDirectory, "Reference directory cannot be null.");
        this.reader = Objects.requireNonNull(reader, "Reader cannot be null.");
    }

    /**
     * Pixel shift for {@code key} in {@code table}.
     *
     * @return The shift, or 0 if the table defines no FP-POS correction.
     * @throws LookupMissException If the table defines corrections but has no row for the key.
     */
    public double resolve(ReferenceOffsetTable table, ConfigurationKey key) throws LookupMissException {
        Objects.requireNonNull(table, "Reference table cannot be null.");
        return table.lookup(key);
    }

    /**
     * Pixel shift for {@code key} in the named table, loading the table on first use.
     *
     * @param tableId LAMPTAB file name inside the reference directory.
     * @throws IOException         If the table cannot be read.
     * @throws LookupMissException If the table has no row for the key.
     */
    public double resolve(String tableId, ConfigurationKey key) throws IOException, LookupMissException {
        return resolve(table(tableId), key);
    }

    /** Returns the named table, reading it on first access. */
    public ReferenceOffsetTable table(String tableId) throws IOException {
        Objects.requireNonNull(tableId, "Reference table id cannot be null.");
        try {
            return tables.computeIfAbsent(tableId, id -> {
                try {
                    ReferenceOffsetTable table = reader.read(referenceDirectory.resolve(id));
                    logger.info("Loaded reference table {}", table);
                    return table;
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    /** Number of tables loaded so far. */
    public int loadedTableCount() {
        return tables.size();
    }
}
