package de.anton.cos.shift_monitor.service;

import de.anton.cos.shift_monitor.model.ScanReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Depth-first walk over the exposure corpus. Directory entries are visited in
 * name order and the files of a directory come before its subdirectories, so
 * the resulting order is reproducible.
 * <p>
 * Subtrees whose path (relative to the corpus root) contains an excluded fragment
 * are skipped entirely. Files are only taken from directories exactly
 * {@code leafDepth} levels below the root, and not from directories whose name ends
 * with an excluded suffix.
 */
public class CorpusWalker {

    private static final Logger logger = LoggerFactory.getLogger(CorpusWalker.class);

    private final int leafDepth;
    private final List<String> excludedFragments;
    private final List<String> excludedSuffixes;

    public CorpusWalker(MonitorConfiguration config) {
        this(config.leafDepth(), config.excludedPathFragments(), config.excludedDirectorySuffixes());
    }

    public CorpusWalker(int leafDepth, List<String> excludedFragments, List<String> excludedSuffixes) {
        this.leafDepth = leafDepth;
        this.excludedFragments = List.copyOf(excludedFragments);
        this.excludedSuffixes = List.copyOf(excludedSuffixes);
    }

    /**
     * Collects the files of all leaf directories that pass {@code fileFilter}.
     *
     * @param root       Corpus root.
     * @param fileFilter Selects files by path (usually by product kind).
     * @param report     Counts excluded directories.
     * @return Matching files in depth-first order.
     * @throws IOException If the root itself cannot be listed.
     */
    public List<Path> collectFiles(Path root, Predicate<Path> fileFilter, ScanReport report) throws IOException {
        Objects.requireNonNull(root, "Corpus root cannot be null.");
        if (!Files.isDirectory(root)) {
            throw new IOException("Corpus root is not a directory: " + root);
        }
        List<Path> files = new ArrayList<>();
        walk(root, root, 0, fileFilter, report, files);
        logger.debug("Corpus walk below {} found {} matching files.", root, files.size());
        return files;
    }

    private void walk(Path root, Path dir, int depth, Predicate<Path> fileFilter, ScanReport report, List<Path> out) throws IOException {
        if (Thread.currentThread().isInterrupted()) {
            throw new IOException("Corpus walk interrupted at " + dir);
        }
        if (depth > 0 && isExcluded(root.relativize(dir))) {
            logger.debug("Skipping excluded directory {}", dir);
            report.excluded(ScanReport.Exclusion.EXCLUDED_DIRECTORY);
            return;
        }

        List<Path> entries;
        try (Stream<Path> listing = Files.list(dir)) {
            entries = listing.sorted().collect(Collectors.toList());
        } catch (IOException e) {
            if (depth == 0) {
                throw e;
            }
            logger.warn("Cannot list directory {}: {}", dir, e.getMessage());
            return;
        }

        if (depth == leafDepth && !hasExcludedSuffix(dir)) {
            logger.trace("Scanning leaf directory {}", dir);
            for (Path entry : entries) {
                if (Files.isRegularFile(entry) && fileFilter.test(entry)) {
                    out.add(entry);
                }
            }
        }
        if (depth >= leafDepth) {
            return;
        }
        for (Path entry : entries) {
            if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                walk(root, entry, depth + 1, fileFilter, report, out);
            }
        }
    }

    boolean isExcluded(Path relative) {
        String path = relative.toString();
        return excludedFragments.stream().anyMatch(path::contains);
    }

    private boolean hasExcludedSuffix(Path dir) {
        Path name = dir.getFileName();
        return name != null && excludedSuffixes.stream().anyMatch(name.toString()::endsWith);
    }
}
