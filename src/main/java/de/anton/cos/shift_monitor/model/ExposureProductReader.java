package de.anton.cos.shift_monitor.model;

import de.anton.cos.shift_monitor.exception.ExposureProductException;
import de.anton.cos.shift_monitor.exception.MissingCompanionFileException;
import de.anton.cos.shift_monitor.exception.MissingRequiredFieldException;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
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
 * Reads COS exposure products (lamp-flash tables, raw acquisitions and their
 * telemetry companions) with nom-tam-fits. Every file is fully read and closed
 * before the method returns.
 */
public class ExposureProductReader {

    private static final Logger logger = LoggerFactory.getLogger(ExposureProductReader.class);

    // Primary header
    public static final String KEY_PROPOSID = "PROPOSID";
    public static final String KEY_DETECTOR = "DETECTOR";
    public static final String KEY_OPT_ELEM = "OPT_ELEM";
    public static final String KEY_CENWAVE = "CENWAVE";
    public static final String KEY_FPPOS = "FPPOS";
    public static final String KEY_LAMPTAB = "LAMPTAB";
    // First extension
    public static final String KEY_EXPSTART = "EXPSTART";
    public static final String KEY_EXPTIME = "EXPTIME";
    public static final String KEY_NUMFLASH = "NUMFLASH";
    // Telemetry companion, first extension
    public static final String KEY_LQTAYCOR = "LQTAYCOR";
    public static final String KEY_LQTAXCOR = "LQTAXCOR";

    public static final String COL_SEGMENT = "SEGMENT";
    public static final String COL_SHIFT_DISP = "SHIFT_DISP";
    public static final String COL_SHIFT_XDISP = "SHIFT_XDISP";
    public static final String COL_SPEC_FOUND = "SPEC_FOUND";

    private static final String ACQ_MARKER = "rawacq";
    private static final String TELEMETRY_MARKER = "spt";

    /**
     * Reads the headers and the flash table of a lamp-flash file.
     *
     * @param file The lamp-flash file.
     * @return The file contents; rows are empty if the table extension has no rows.
     * @throws IOException If the file cannot be opened or parsed, or a required keyword or column is missing.
     */
    public LampflashProduct readLampflash(Path file) throws IOException {
        Objects.requireNonNull(file, "Lamp-flash file cannot be null.");
        requireFile(file);
        logger.trace("Reading lamp-flash file {}", file);
        try (Fits fits = new Fits(file.toFile())) {
            BasicHDU<?>[] hdus = readAll(fits, file);
            ExposureHeader header = readHeader(file, hdus);

            if (!(hdus[1] instanceof TableHDU)) {
                throw new ExposureProductException(file, "First extension of " + file.getFileName() + " is not a table");
            }
            TableHDU<?> table = (TableHDU<?>) hdus[1];
            List<FlashRow> rows = new ArrayList<>();
            if (table.getNRows() > 0) {
                String[] segments = FitsAccess.toStrings(FitsAccess.requireColumn(table, COL_SEGMENT, file));
                double[] shiftDisp = FitsAccess.toDoubles(FitsAccess.requireColumn(table, COL_SHIFT_DISP, file));
                double[] shiftXdisp = FitsAccess.toDoubles(FitsAccess.requireColumn(table, COL_SHIFT_XDISP, file));
                boolean[] found = FitsAccess.toBooleans(FitsAccess.requireColumn(table, COL_SPEC_FOUND, file));
                for (int i = 0; i < segments.length; i++) {
                    rows.add(new FlashRow(segments[i], shiftDisp[i], shiftXdisp[i], found[i]));
                }
            }
            return new LampflashProduct(file, header, rows);
        } catch (FitsException e) {
            throw new ExposureProductException(file, "Cannot parse " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads a raw acquisition file and the target position from its telemetry companion.
     *
     * @param file The rawacq file.
     * @return Header plus LQTAYCOR/LQTAXCOR.
     * @throws MissingCompanionFileException  If the spt companion does not exist.
     * @throws MissingRequiredFieldException If a required keyword is missing in either file.
     * @throws IOException                    For other read failures.
     */
    public AcquisitionProduct readAcquisition(Path file) throws IOException {
        Objects.requireNonNull(file, "Acquisition file cannot be null.");
        requireFile(file);
        ExposureHeader header;
        try (Fits fits = new Fits(file.toFile())) {
            header = readHeader(file, readAll(fits, file));
        } catch (FitsException e) {
            throw new ExposureProductException(file, "Cannot parse " + file.getFileName() + ": " + e.getMessage(), e);
        }

        Path companion = companionOf(file);
        if (!Files.isRegularFile(companion)) {
            throw new MissingCompanionFileException(file, companion);
        }
        try (Fits spt = new Fits(companion.toFile())) {
            Header telemetry = readAll(spt, companion)[1].getHeader();
            double yCor = FitsAccess.requireDouble(telemetry, KEY_LQTAYCOR, companion);
            // LQTAXCOR only matters when the target was located
            double xCor = yCor > 0 ? FitsAccess.requireDouble(telemetry, KEY_LQTAXCOR, companion) : Double.NaN;
            return new AcquisitionProduct(file, companion, header, yCor, xCor);
        } catch (FitsException e) {
            throw new ExposureProductException(companion, "Cannot parse " + companion.getFileName() + ": " + e.getMessage(), e);
        }
    }

    /** Telemetry companion of a raw acquisition: "rawacq" replaced by "spt" in the file name. */
    public static Path companionOf(Path acquisition) {
        String name = acquisition.getFileName().toString().replace(ACQ_MARKER, TELEMETRY_MARKER);
        return acquisition.resolveSibling(name);
    }

    private static void requireFile(Path file) throws NoSuchFileException {
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString());
        }
    }

    private BasicHDU<?>[] readAll(Fits fits, Path file) throws FitsException, IOException {
        BasicHDU<?>[] hdus = fits.read();
        if (hdus == null || hdus.length < 2) {
            throw new ExposureProductException(file, file.getFileName() + " has no extension");
        }
        return hdus;
    }

    // LAMPTAB, FPPOS and NUMFLASH are optional here; the consumers that need them check.
    private ExposureHeader readHeader(Path file, BasicHDU<?>[] hdus) throws MissingRequiredFieldException {
        Header primary = hdus[0].getHeader();
        Header extension = hdus[1].getHeader();

        String lampTab = FitsAccess.optionalString(primary, KEY_LAMPTAB);
        double expTime = extension.containsKey(KEY_EXPTIME) ? extension.getDoubleValue(KEY_EXPTIME) : Double.NaN;

        return new ExposureHeader(
                ExposureHeader.datasetOf(file.getFileName().toString()),
                FitsAccess.requireDouble(extension, KEY_EXPSTART, file),
                expTime,
                FitsAccess.requireInt(primary, KEY_PROPOSID, file),
                FitsAccess.requireString(primary, KEY_DETECTOR, file),
                FitsAccess.requireString(primary, KEY_OPT_ELEM, file),
                FitsAccess.requireInt(primary, KEY_CENWAVE, file),
                FitsAccess.optionalInt(primary, KEY_FPPOS),
                ExposureHeader.stripReferencePrefix(lampTab),
                FitsAccess.optionalInt(extension, KEY_NUMFLASH));
    }
}
