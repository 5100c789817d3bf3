package com.catmepim.chartsync.config;

import java.nio.file.Files;
import java.nio.file.Path;

import com.catmepim.chartsync.opc.ArchiveLimits;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Command definition and configuration holder for the chart synchronization CLI.
 * Uses picocli annotations; fields are public for direct picocli access.
 *
 * @invariant inputFile != null && action != null
 *           && (action == COUNT || chartIndex >= 1)
 *           && (action != UPDATE || dataFile != null)
 *           && (!action.mutatesPackage() || outputFile != null)
 *           && configuration is not mutated after validation
 */
@Command(name = "docx-chart-sync",
         mixinStandardHelpOptions = true,
         version = "DOCX Chart Sync 1.0.0",
         description = "Reads, updates and copies charts of a DOCX document, keeping their embedded workbooks in sync.")
public class ChartSyncConfig {

    @Option(names = {"-i", "--input"}, required = true, description = "Path to the input DOCX file.")
    public Path inputFile;

    @Option(names = {"-o", "--output"}, description = "Path of the DOCX file to write. Required for UPDATE and COPY.")
    public Path outputFile;

    @Option(names = {"-a", "--action"}, required = true, description = "Action to run: ${COMPLETION-CANDIDATES}")
    public Action action;

    @Option(names = {"-c", "--chart"}, description = "1-based chart index. Required for READ, UPDATE and COPY.")
    public int chartIndex = 0;

    @Option(names = {"-d", "--data"}, description = "JSON file with categories, series and optional titles (UPDATE).")
    public Path dataFile;

    @Option(names = {"--pretty-print"}, description = "Pretty print JSON output.")
    public boolean prettyPrint = false;

    @Option(names = {"--overwrite"}, description = "Overwrite the output file if it already exists.")
    public boolean overwrite = false;

    @Option(names = {"--min-inflate-ratio"}, description = "Minimum compression ratio accepted for zip entries (zip bomb protection). Default: 0.01")
    public double minInflateRatio = ArchiveLimits.DEFAULT_MIN_INFLATE_RATIO;

    @Option(names = {"--max-entry-size-mb"}, description = "Largest uncompressed size accepted for one zip entry, in MB. Default: 100")
    public int maxEntrySizeMb = 100;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose logging.")
    public boolean verbose = false;

    public ChartSyncConfig() {
    }

    /**
     * Performs validation after picocli populates fields.
     *
     * @throws IllegalArgumentException if validation fails
     * @pre All required options are set.
     * @post Configuration is considered valid. Fields are not mutated after validation.
     */
    public void validate() {
        if (action != Action.COUNT && chartIndex < 1) {
            throw new IllegalArgumentException("Chart index (--chart) must be >= 1 for action " + action);
        }
        if (action == Action.UPDATE && dataFile == null) {
            throw new IllegalArgumentException("Data file (--data) is required for action UPDATE");
        }
        if (action.mutatesPackage() && outputFile == null) {
            throw new IllegalArgumentException("Output path (--output) is required for action: " + action);
        }
        if (outputFile != null && inputFile != null
                && outputFile.toAbsolutePath().normalize().equals(inputFile.toAbsolutePath().normalize())) {
            throw new IllegalArgumentException("Output path must differ from the input path: " + outputFile);
        }
        if (outputFile != null && Files.exists(outputFile) && !overwrite) {
            throw new IllegalArgumentException("Output file already exists (use --overwrite): " + outputFile);
        }
        if (minInflateRatio <= 0 || minInflateRatio >= 1) {
            throw new IllegalArgumentException("Minimum inflate ratio must be between 0 and 1: " + minInflateRatio);
        }
        if (maxEntrySizeMb <= 0) {
            throw new IllegalArgumentException("Max entry size must be positive: " + maxEntrySizeMb);
        }
    }

    public ArchiveLimits toArchiveLimits() {
        return new ArchiveLimits(maxEntrySizeMb * 1024L * 1024L, ArchiveLimits.DEFAULT_MAX_INFLATION_FACTOR,
                minInflateRatio);
    }

    /**
     * Actions the CLI can run.
     */
    public enum Action {
        READ(false),
        UPDATE(true),
        COPY(true),
        COUNT(false);

        private final boolean mutatesPackage;

        Action(boolean mutatesPackage) {
            this.mutatesPackage = mutatesPackage;
        }

        public boolean mutatesPackage() {
            return mutatesPackage;
        }
    }
}
