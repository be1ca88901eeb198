package de.anton.cos.shift_monitor.model;

import nom.tam.fits.BasicHDU;
import nom.tam.fits.BinaryTable;
import nom.tam.fits.BinaryTableHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.util.BufferedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Writes the aggregated shift table: one FITS binary table row per
 * {@link MeasuredShiftRecord}. Missing shifts are stored as NaN, missing strings
 * as {@value #NOT_AVAILABLE} and a missing FP-POS or flash number as 0.
 */
public class ShiftTableWriter {

    private static final Logger logger = LoggerFactory.getLogger(ShiftTableWriter.class);

    public static final String NOT_AVAILABLE = "N/A";

    static final String[] COLUMNS = {
            "MJD", "DATASET", "PROPOSID", "DETECTOR", "OPT_ELEM", "CENWAVE", "SEGMENT",
            "FPPOS", "FLASH", "LAMPTAB", "X_SHIFT", "Y_SHIFT", "FOUND"
    };

    /**
     * Writes (replaces) the shift table.
     *
     * @param records Records in the order they should appear in the table.
     * @param file    Target file; written to a temporary sibling first and then moved into place.
     * @throws IOException If the table cannot be built or written.
     */
    public void write(List<MeasuredShiftRecord> records, Path file) throws IOException {
        if (records.isEmpty()) {
            logger.warn("No shift records to write, {} left unchanged.", file);
            return;
        }
        int n = records.size();
        double[] mjd = new double[n];
        String[] dataset = new String[n];
        int[] proposal = new int[n];
        String[] detector = new String[n];
        String[] element = new String[n];
        int[] cenwave = new int[n];
        String[] segment = new String[n];
        int[] fppos = new int[n];
        int[] flash = new int[n];
        String[] lampTab = new String[n];
        double[] xShift = new double[n];
        double[] yShift = new double[n];
        boolean[] found = new boolean[n];

        for (int i = 0; i < n; i++) {
            MeasuredShiftRecord r = records.get(i);
            mjd[i] = r.exposureStart();
            dataset[i] = r.dataset();
            proposal[i] = r.proposalId();
            detector[i] = r.detector();
            element[i] = r.opticalElement();
            cenwave[i] = r.centralWavelength();
            segment[i] = r.segment() == null ? NOT_AVAILABLE : r.segment().name();
            fppos[i] = r.focalPlanePosition() == null ? 0 : r.focalPlanePosition();
            flash[i] = r.flashIndex() == null ? 0 : r.flashIndex();
            lampTab[i] = r.referenceTableId() == null || r.referenceTableId().isEmpty() ? NOT_AVAILABLE : r.referenceTableId();
            xShift[i] = r.dispersionShift() == null ? Double.NaN : r.dispersionShift();
            yShift[i] = r.crossDispersionShift() == null ? Double.NaN : r.crossDispersionShift();
            found[i] = r.found();
        }

        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.deleteIfExists(temp);
        try (Fits fits = new Fits()) {
            BinaryTable data = new BinaryTable(new Object[] {
                    mjd, dataset, proposal, detector, element, cenwave, segment,
                    fppos, flash, lampTab, xShift, yShift, found });
            BinaryTableHDU table = new BinaryTableHDU(BinaryTableHDU.manufactureHeader(data), data);
            for (int c = 0; c < COLUMNS.length; c++) {
                table.setColumnName(c, COLUMNS[c], null);
            }
            fits.addHDU(BasicHDU.getDummyHDU());
            fits.addHDU(table);
            try (BufferedFile out = new BufferedFile(temp.toFile(), "rw")) {
                fits.write(out);
            }
        } catch (FitsException e) {
            Files.deleteIfExists(temp);
            throw new IOException("Cannot write shift table " + file + ": " + e.getMessage(), e);
        }
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        logger.info("Wrote {} shift records to {}", n, file);
    }
}
