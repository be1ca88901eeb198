package de.anton.cos.shift_monitor.model;

import de.anton.cos.shift_monitor.exception.ExposureProductException;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.TableHDU;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads a lamp reference table (LAMPTAB) FITS file into a {@link ReferenceOffsetTable}.
 * Only SEGMENT, OPT_ELEM, CENWAVE, FPOFFSET and FP_PIXEL_SHIFT of the first table
 * extension are used. A table without an FPOFFSET column yields a table that
 * defines no correction.
 */
public class ReferenceTableReader {

    private static final Logger logger = LoggerFactory.getLogger(ReferenceTableReader.class);

    public static final String COL_SEGMENT = "SEGMENT";
    public static final String COL_OPT_ELEM = "OPT_ELEM";
    public static final String COL_CENWAVE = "CENWAVE";
    public static final String COL_FPOFFSET = "FPOFFSET";
    public static final String COL_PIXEL_SHIFT = "FP_PIXEL_SHIFT";

    /**
     * Reads the reference table stored in {@code file}.
     *
     * @param file LAMPTAB file.
     * @return The immutable table.
     * @throws IOException If the file cannot be read or lacks a required column.
     */
    public ReferenceOffsetTable read(Path file) throws IOException {
        Objects.requireNonNull(file, "Reference table file cannot be null.");
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString(), null, "Reference table not found");
        }
        String tableId = file.getFileName().toString();
        logger.debug("Reading reference table {}", file);

        try (Fits fits = new Fits(file.toFile())) {
            BasicHDU<?>[] hdus = fits.read();
            if (hdus == null || hdus.length < 2 || !(hdus[1] instanceof TableHDU)) {
                throw new ExposureProductException(file, "Reference table " + tableId + " has no table extension");
            }
            TableHDU<?> table = (TableHDU<?>) hdus[1];

            if (!FitsAccess.hasColumn(table, COL_FPOFFSET)) {
                logger.info("Reference table {} has no {} column; no FP-POS correction applies.", tableId, COL_FPOFFSET);
                return ReferenceOffsetTable.withoutOffsets(tableId);
            }

            String[] segments = FitsAccess.toStrings(FitsAccess.requireColumn(table, COL_SEGMENT, file));
            String[] elements = FitsAccess.toStrings(FitsAccess.requireColumn(table, COL_OPT_ELEM, file));
            int[] cenwaves = FitsAccess.toInts(FitsAccess.requireColumn(table, COL_CENWAVE, file));
            int[] fpOffsets = FitsAccess.toInts(FitsAccess.requireColumn(table, COL_FPOFFSET, file));
            double[] shifts = FitsAccess.toDoubles(FitsAccess.requireColumn(table, COL_PIXEL_SHIFT, file));

            List<ReferenceOffsetTable.Row> rows = new ArrayList<>(segments.length);
            for (int i = 0; i < segments.length; i++) {
                DetectorSegment segment = DetectorSegment.fromName(segments[i]);
                if (segment == null || elements[i] == null) {
                    logger.trace("Skipping reference row {} of {} with segment '{}'", i, tableId, segments[i]);
                    continue;
                }
                ConfigurationKey key = new ConfigurationKey(segment, elements[i], cenwaves[i], fpOffsets[i]);
                rows.add(new ReferenceOffsetTable.Row(key, shifts[i]));
            }
            logger.debug("Reference table {} loaded with {} rows.", tableId, rows.size());
            return ReferenceOffsetTable.withOffsets(tableId, rows);
        } catch (FitsException e) {
            throw new ExposureProductException(file, "Cannot read reference table " + tableId + ": " + e.getMessage(), e);
        }
    }
}
