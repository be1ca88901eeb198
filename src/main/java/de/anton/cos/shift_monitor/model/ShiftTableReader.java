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

/**
 * Reads the aggregated shift table written by {@link ShiftTableWriter}.
 * Rows that cannot be turned into a record are skipped and logged.
 */
public class ShiftTableReader {

    private static final Logger logger = LoggerFactory.getLogger(ShiftTableReader.class);

    /**
     * @param file The shift table.
     * @return All valid rows in table order.
     * @throws NoSuchFileException If the table does not exist.
     * @throws IOException         If the file is not a shift table or cannot be parsed.
     */
    public List<MeasuredShiftRecord> read(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString());
        }
        logger.info("Reading shift table {}", file);
        try (Fits fits = new Fits(file.toFile())) {
            BasicHDU<?>[] hdus = fits.read();
            if (hdus == null || hdus.length < 2 || !(hdus[1] instanceof TableHDU)) {
                throw new ExposureProductException(file, file.getFileName() + " has no table extension");
            }
            TableHDU<?> table = (TableHDU<?>) hdus[1];
            List<MeasuredShiftRecord> records = new ArrayList<>();
            if (table.getNRows() == 0) {
                return records;
            }

            double[] mjd = FitsAccess.toDoubles(FitsAccess.requireColumn(table, "MJD", file));
            String[] dataset = FitsAccess.toStrings(FitsAccess.requireColumn(table, "DATASET", file));
            int[] proposal = FitsAccess.toInts(FitsAccess.requireColumn(table, "PROPOSID", file));
            String[] detector = FitsAccess.toStrings(FitsAccess.requireColumn(table, "DETECTOR", file));
            String[] element = FitsAccess.toStrings(FitsAccess.requireColumn(table, "OPT_ELEM", file));
            int[] cenwave = FitsAccess.toInts(FitsAccess.requireColumn(table, "CENWAVE", file));
            String[] segment = FitsAccess.toStrings(FitsAccess.requireColumn(table, "SEGMENT", file));
            int[] fppos = FitsAccess.toInts(FitsAccess.requireColumn(table, "FPPOS", file));
            int[] flash = FitsAccess.toInts(FitsAccess.requireColumn(table, "FLASH", file));
            String[] lampTab = FitsAccess.toStrings(FitsAccess.requireColumn(table, "LAMPTAB", file));
            double[] xShift = FitsAccess.toDoubles(FitsAccess.requireColumn(table, "X_SHIFT", file));
            double[] yShift = FitsAccess.toDoubles(FitsAccess.requireColumn(table, "Y_SHIFT", file));
            boolean[] found = FitsAccess.toBooleans(FitsAccess.requireColumn(table, "FOUND", file));

            int skipped = 0;
            for (int i = 0; i < mjd.length; i++) {
                DetectorSegment seg = null;
                if (!isMissing(segment[i])) {
                    seg = DetectorSegment.fromName(segment[i]);
                    if (seg == null) {
                        logger.warn("Skipping row {} of {}: unknown segment '{}'", i, file, segment[i]);
                        skipped++;
                        continue;
                    }
                }
                if (isMissing(dataset[i]) || isMissing(detector[i]) || isMissing(element[i]) || Double.isNaN(mjd[i])) {
                    logger.warn("Skipping row {} of {}: incomplete identification", i, file);
                    skipped++;
                    continue;
                }
                records.add(new MeasuredShiftRecord(
                        mjd[i], dataset[i], proposal[i], detector[i], element[i], cenwave[i], seg,
                        fppos[i] == 0 ? null : fppos[i],
                        isMissing(lampTab[i]) ? null : lampTab[i],
                        flash[i] == 0 ? null : flash[i],
                        Double.isNaN(xShift[i]) ? null : xShift[i],
                        Double.isNaN(yShift[i]) ? null : yShift[i],
                        found[i]));
            }
            logger.info("Read {} shift records from {} ({} rows skipped)", records.size(), file.getFileName(), skipped);
            return records;
        } catch (FitsException e) {
            throw new ExposureProductException(file, "Cannot parse shift table " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private static boolean isMissing(String value) {
        return value == null || value.isEmpty() || ShiftTableWriter.NOT_AVAILABLE.equals(value);
    }
}
