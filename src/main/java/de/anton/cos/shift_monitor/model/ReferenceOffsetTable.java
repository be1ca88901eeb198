package de.anton.cos.shift_monitor.model;

import de.anton.cos.shift_monitor.exception.LookupMissException;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable in-memory copy of a lamp reference table (LAMPTAB), reduced to the
 * columns needed for FP-POS pixel-shift correction.
 * Instances are shared read-only between all extractions that reference the same table.
 */
public final class ReferenceOffsetTable {

    /** One table row: configuration and the pixel shift (FP_PIXEL_SHIFT) it implies. */
    public record Row(ConfigurationKey key, double pixelShift) {
        public Row {
            Objects.requireNonNull(key, "Row key cannot be null.");
        }
    }

    private final String tableId;
    private final boolean correctionDefined;
    private final List<Row> rows;

    private ReferenceOffsetTable(String tableId, boolean correctionDefined, List<Row> rows) {
        this.tableId = Objects.requireNonNull(tableId, "Table id cannot be null.");
        this.correctionDefined = correctionDefined;
        this.rows = rows == null ? Collections.emptyList() : List.copyOf(rows);
    }

    /** Table that carries an FPOFFSET column; lookups are by exact key match. */
    public static ReferenceOffsetTable withOffsets(String tableId, List<Row> rows) {
        return new ReferenceOffsetTable(tableId, true, rows);
    }

    /** Table without an FPOFFSET column: every lookup yields 0. */
    public static ReferenceOffsetTable withoutOffsets(String tableId) {
        return new ReferenceOffsetTable(tableId, false, Collections.emptyList());
    }

    /**
     * Returns the pixel shift of the first row matching all four key fields.
     *
     * @param key Configuration to look up.
     * @return The pixel shift, or 0 when the table defines no FP-POS correction.
     * @throws LookupMissException If the table defines corrections but no row matches.
     */
    public double lookup(ConfigurationKey key) throws LookupMissException {
        Objects.requireNonNull(key, "Lookup key cannot be null.");
        if (!correctionDefined) {
            return 0.0;
        }
        for (Row row : rows) {
            if (row.key().equals(key)) {
                return row.pixelShift();
            }
        }
        throw new LookupMissException(tableId, key);
    }

    public String getTableId() { return tableId; }
    public boolean isCorrectionDefined() { return correctionDefined; }
    public List<Row> getRows() { return rows; }

    @Override
    public String toString() {
        return String.format("ReferenceOffsetTable[id='%s', correction=%s, rows=%d]", tableId, correctionDefined, rows.size());
    }
}
