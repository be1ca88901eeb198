package de.anton.cos.shift_monitor.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * The drift log: a plain text file with one line per {@link DriftSummaryRow},
 * {@code <filePath> <segment> <spread> <exposureDuration>}, separated by single
 * spaces. Numbers use the shortest round-trip form ("0.8", "1200.0", "1e-05") so
 * that logs written by the historic monitor and by this one can be mixed.
 */
public final class DriftLog {

    private static final Logger logger = LoggerFactory.getLogger(DriftLog.class);

    private DriftLog() { throw new IllegalStateException("Utility class"); }

    /** Appends rows to the log, creating it (and its directory) if needed. */
    public static void append(Path logFile, List<DriftSummaryRow> rows) throws IOException {
        if (rows.isEmpty()) {
            logger.debug("No drift rows to append to {}", logFile);
            return;
        }
        Path parent = logFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(logFile, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE)) {
            for (DriftSummaryRow row : rows) {
                writer.write(formatLine(row));
                writer.write('\n');
            }
        }
        logger.info("Appended {} drift rows to {}", rows.size(), logFile);
    }

    /**
     * Reads all rows of a log. Lines that cannot be parsed are skipped with a warning.
     *
     * @return The rows, empty if the log does not exist.
     */
    public static List<DriftSummaryRow> read(Path logFile) throws IOException {
        if (!Files.exists(logFile)) {
            return Collections.emptyList();
        }
        List<DriftSummaryRow> rows = new ArrayList<>();
        int lineNumber = 0;
        for (String line : Files.readAllLines(logFile, StandardCharsets.UTF_8)) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            try {
                rows.add(parseLine(line));
            } catch (IllegalArgumentException e) {
                logger.warn("Skipping malformed drift log line {} of {}: {}", lineNumber, logFile, e.getMessage());
            }
        }
        return rows;
    }

    public static String formatLine(DriftSummaryRow row) {
        return row.filePath() + ' ' + row.segment().name() + ' '
                + formatNumber(row.offsetSpread()) + ' ' + formatNumber(row.exposureDuration());
    }

    /** Parses one log line; the path may itself contain spaces. */
    static DriftSummaryRow parseLine(String line) {
        String trimmed = line.trim();
        int third = trimmed.lastIndexOf(' ');
        int second = third > 0 ? trimmed.lastIndexOf(' ', third - 1) : -1;
        int first = second > 0 ? trimmed.lastIndexOf(' ', second - 1) : -1;
        if (first <= 0) {
            throw new IllegalArgumentException("expected 4 fields: '" + line + "'");
        }
        DetectorSegment segment = DetectorSegment.fromName(trimmed.substring(first + 1, second));
        if (segment == null) {
            throw new IllegalArgumentException("unknown segment in '" + line + "'");
        }
        return new DriftSummaryRow(trimmed.substring(0, first), segment,
                parseNumber(trimmed.substring(second + 1, third)),
                parseNumber(trimmed.substring(third + 1)));
    }

    /** Shortest representation, fixed notation for exponents -4..15, otherwise scientific ("1e-05"). */
    public static String formatNumber(double value) {
        if (Double.isNaN(value)) return "nan";
        if (Double.isInfinite(value)) return value > 0 ? "inf" : "-inf";
        if (value == 0.0) return (1.0 / value < 0) ? "-0.0" : "0.0";

        BigDecimal decimal = new BigDecimal(Double.toString(value)).stripTrailingZeros();
        int exponent = decimal.precision() - decimal.scale() - 1;
        if (exponent >= -4 && exponent < 16) {
            String plain = decimal.toPlainString();
            return plain.indexOf('.') >= 0 ? plain : plain + ".0";
        }
        String digits = decimal.unscaledValue().abs().toString();
        String mantissa = digits.length() == 1 ? digits : digits.charAt(0) + "." + digits.substring(1);
        return String.format(Locale.ROOT, "%s%se%s%02d", value < 0 ? "-" : "", mantissa, exponent < 0 ? "-" : "+", Math.abs(exponent));
    }

    static double parseNumber(String text) {
        switch (text.toLowerCase(Locale.ROOT)) {
            case "nan": return Double.NaN;
            case "inf": return Double.POSITIVE_INFINITY;
            case "-inf": return Double.NEGATIVE_INFINITY;
            default: return Double.parseDouble(text);
        }
    }
}
