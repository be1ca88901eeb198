package de.anton.cos.shift_monitor.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Writes the FUVA/FUVB difference report, one line per paired dataset:
 * {@code <mjd>  <opt_elem>  <cenwave>  <fppos>   <shift1a>  <shift1b>}.
 * Lines are in dataset order across all central wavelengths. The file is replaced on every run.
 */
public final class DifferenceReportWriter {

    private static final Logger logger = LoggerFactory.getLogger(DifferenceReportWriter.class);
    private static final String LINE_FORMAT = "%5.5f  %s  %d  %d   %3.2f  %3.2f  \n";

    private DifferenceReportWriter() { throw new IllegalStateException("Utility class"); }

    public static void write(Map<Integer, List<SegmentDifference>> differencesByCenwave, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        List<SegmentDifference> ordered = differencesByCenwave.values().stream()
                .flatMap(Collection::stream)
                .sorted(Comparator.comparing(SegmentDifference::dataset))
                .collect(Collectors.toList());
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (SegmentDifference d : ordered) {
                writer.write(formatLine(d));
            }
        }
        logger.info("Wrote {} A/B difference lines to {}", ordered.size(), file);
    }

    public static String formatLine(SegmentDifference d) {
        return String.format(Locale.ROOT, LINE_FORMAT,
                d.mjd(), d.opticalElement(), d.centralWavelength(), d.fpPosition(), d.aShift(), d.bShift());
    }
}
