package de.anton.cos.shift_monitor.service;

import de.anton.cos.shift_monitor.model.DeduplicationPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable configuration of a monitor run. Passed to every component at
 * construction time.
 */
public record MonitorConfiguration(
    Path corpusRoot,
    Path monitorDirectory,
    Path referenceDirectory,
    String shiftTableName,
    int leafDepth,
    List<String> excludedPathFragments,
    List<String> excludedDirectorySuffixes,
    DeduplicationPolicy deduplication,
    double driftTolerance,
    Set<String> positiveOnlyElements,
    boolean renderCharts,
    boolean exportWorkbook,
    boolean collectShifts
) {
    private static final Logger logger = LoggerFactory.getLogger(MonitorConfiguration.class);

    public static final String DEFAULT_RESOURCE = "shift-monitor.properties";
    public static final String DRIFT_LOG_NAME = "drift.txt";
    public static final String DIFFERENCE_REPORT_NAME = "shift_data.txt";
    public static final String WORKBOOK_NAME = "shift_summary.xlsx";

    public MonitorConfiguration {
        Objects.requireNonNull(corpusRoot, "Corpus root cannot be null.");
        Objects.requireNonNull(monitorDirectory, "Monitor directory cannot be null.");
        Objects.requireNonNull(referenceDirectory, "Reference directory cannot be null.");
        Objects.requireNonNull(shiftTableName, "Shift table name cannot be null.");
        Objects.requireNonNull(deduplication, "Deduplication policy cannot be null.");
        if (leafDepth < 0) {
            throw new IllegalArgumentException("Leaf depth cannot be negative: " + leafDepth);
        }
        if (!(driftTolerance > 0)) {
            throw new IllegalArgumentException("Drift tolerance must be positive: " + driftTolerance);
        }
        excludedPathFragments = excludedPathFragments == null ? List.of() : List.copyOf(excludedPathFragments);
        excludedDirectorySuffixes = excludedDirectorySuffixes == null ? List.of() : List.copyOf(excludedDirectorySuffixes);
        positiveOnlyElements = positiveOnlyElements == null ? Set.of() : Set.copyOf(positiveOnlyElements);
    }

    public Path shiftTableFile() { return monitorDirectory.resolve(shiftTableName); }
    public Path driftLogFile() { return monitorDirectory.resolve(DRIFT_LOG_NAME); }
    public Path differenceReportFile() { return monitorDirectory.resolve(DIFFERENCE_REPORT_NAME); }
    public Path workbookFile() { return monitorDirectory.resolve(WORKBOOK_NAME); }

    /** Copy of this configuration pointing at other directories; used by tests and ad-hoc runs. */
    public MonitorConfiguration withDirectories(Path corpus, Path monitor, Path reference) {
        return new MonitorConfiguration(corpus, monitor, reference, shiftTableName, leafDepth,
                excludedPathFragments, excludedDirectorySuffixes, deduplication, driftTolerance,
                positiveOnlyElements, renderCharts, exportWorkbook, collectShifts);
    }

    /**
     * Loads the configuration from a properties file. Keys missing in the file fall back
     * to the bundled {@value #DEFAULT_RESOURCE}.
     */
    public static MonitorConfiguration load(Path file) throws IOException {
        Properties properties = loadBundledProperties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }
        logger.info("Configuration loaded from {}", file.toAbsolutePath());
        return fromProperties(properties);
    }

    /** Loads the bundled {@value #DEFAULT_RESOURCE}. */
    public static MonitorConfiguration loadDefaults() throws IOException {
        return fromProperties(loadBundledProperties());
    }

    public static MonitorConfiguration fromProperties(Properties p) {
        return new MonitorConfiguration(
                Paths.get(require(p, "corpus.root")),
                Paths.get(require(p, "monitor.dir")),
                Paths.get(require(p, "reference.dir")),
                p.getProperty("shift.table", "all_shifts.fits").trim(),
                Integer.parseInt(p.getProperty("corpus.leafDepth", "3").trim()),
                splitList(p.getProperty("corpus.excludedFragments", "")),
                splitList(p.getProperty("corpus.excludedSuffixes", "")),
                DeduplicationPolicy.fromString(p.getProperty("scan.deduplication")),
                Double.parseDouble(p.getProperty("drift.tolerance", "2.0").trim()),
                Set.copyOf(splitList(p.getProperty("aggregation.positiveOnlyElements", ""))),
                Boolean.parseBoolean(p.getProperty("output.charts", "true").trim()),
                Boolean.parseBoolean(p.getProperty("output.workbook", "true").trim()),
                Boolean.parseBoolean(p.getProperty("collect.shifts", "false").trim()));
    }

    private static Properties loadBundledProperties() throws IOException {
        Properties properties = new Properties();
        try (InputStream in = MonitorConfiguration.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IOException("Bundled configuration '" + DEFAULT_RESOURCE + "' not found on the classpath.");
            }
            properties.load(in);
        }
        return properties;
    }

    private static String require(Properties p, String key) {
        String value = p.getProperty(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing configuration key '" + key + "'.");
        }
        return value.trim();
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }
}
