package com.catmepim.chartsync;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import org.apache.poi.openxml4j.util.ZipSecureFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.chartsync.chart.ChartCopier;
import com.catmepim.chartsync.chart.ChartDataValidator;
import com.catmepim.chartsync.chart.ChartXmlParser;
import com.catmepim.chartsync.chart.ChartXmlUpdater;
import com.catmepim.chartsync.exception.ChartSyncException;
import com.catmepim.chartsync.exception.ErrorCode;
import com.catmepim.chartsync.exception.PartResolutionException;
import com.catmepim.chartsync.model.ChartData;
import com.catmepim.chartsync.model.ChartUpdateResult;
import com.catmepim.chartsync.model.ChartView;
import com.catmepim.chartsync.opc.ArchiveLimits;
import com.catmepim.chartsync.opc.DocxPackage;
import com.catmepim.chartsync.opc.IdAllocator;
import com.catmepim.chartsync.opc.PackageArchive;
import com.catmepim.chartsync.opc.PartNames;
import com.catmepim.chartsync.workbook.EmbeddedWorkbookSynchronizer;
import com.catmepim.chartsync.workbook.WorkbookLink;
import com.catmepim.chartsync.workbook.WorkbookResolver;

/**
 * Editing session over one word-processing package: reads, updates and copies charts
 * while keeping chart caches, embedded workbooks, relationships and content types
 * consistent.
 * <p>
 * Each operation reads the parts it needs from storage, computes every new part in memory
 * and only then writes them, so a failed operation leaves the package unchanged.
 * Instances are not thread-safe.
 *
 * <pre>
 * try (DocxChartEditor editor = DocxChartEditor.open(Path.of("report.docx"))) {
 *     editor.updateChart(1, data);
 *     int copy = editor.copyChart(1);
 *     editor.save(Path.of("report-out.docx"));
 * }
 * </pre>
 *
 * @invariant after close(), no operation is possible and any owned temporary directory is gone
 */
public final class DocxChartEditor implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DocxChartEditor.class);

    private static final Pattern CHART_FILE = Pattern.compile("^chart\\d+\\.xml$");

    private final DocxPackage pkg;
    private final Path ownedDirectory;
    private final PackageArchive archive;
    private final ChartXmlParser parser = new ChartXmlParser();
    private final ChartXmlUpdater updater = new ChartXmlUpdater();
    private final WorkbookResolver resolver = new WorkbookResolver();
    private final EmbeddedWorkbookSynchronizer synchronizer;
    private final IdAllocator allocator = new IdAllocator();
    private final ChartCopier copier;
    private boolean closed;

    private DocxChartEditor(DocxPackage pkg, Path ownedDirectory, ArchiveLimits limits) {
        this.pkg = pkg;
        this.ownedDirectory = ownedDirectory;
        this.archive = new PackageArchive(limits);
        this.synchronizer = new EmbeddedWorkbookSynchronizer(archive);
        this.copier = new ChartCopier(resolver, allocator);
    }

    public static DocxChartEditor open(Path docx) {
        return open(docx, ArchiveLimits.defaults());
    }

    /**
     * Extracts a {@code .docx} file into a private temporary directory.
     *
     * @throws ChartSyncException if the file cannot be extracted or lacks a required part
     */
    public static DocxChartEditor open(Path docx, ArchiveLimits limits) {
        try (InputStream in = Files.newInputStream(docx)) {
            return open(in, limits);
        } catch (IOException e) {
            throw new ChartSyncException(ErrorCode.IO, "Cannot read package", e).withContext("path", docx);
        }
    }

    public static DocxChartEditor open(InputStream in) {
        return open(in, ArchiveLimits.defaults());
    }

    /**
     * Extracts a package read from a stream. The stream is consumed but not closed.
     */
    public static DocxChartEditor open(InputStream in, ArchiveLimits limits) {
        applyPoiLimits(limits);
        Path dir = null;
        try {
            dir = Files.createTempDirectory("docx-chart-sync-");
            int entries = new PackageArchive(limits).extract(in, dir);
            DocxChartEditor editor = new DocxChartEditor(new DocxPackage(dir), dir, limits);
            editor.pkg.validateStructure();
            logger.info("Opened package with {} entries into {}", entries, dir);
            return editor;
        } catch (IOException e) {
            deleteQuietly(dir);
            throw new ChartSyncException(ErrorCode.IO, "Cannot extract package", e);
        } catch (RuntimeException e) {
            deleteQuietly(dir);
            throw e;
        }
    }

    /**
     * Works directly on an already extracted package. The caller keeps ownership of the
     * directory; {@link #close()} leaves it in place.
     */
    public static DocxChartEditor openExtracted(Path directory) {
        return openExtracted(directory, ArchiveLimits.defaults());
    }

    public static DocxChartEditor openExtracted(Path directory, ArchiveLimits limits) {
        applyPoiLimits(limits);
        DocxChartEditor editor = new DocxChartEditor(new DocxPackage(directory), null, limits);
        editor.pkg.validateStructure();
        return editor;
    }

    public DocxPackage getPackage() {
        return pkg;
    }

    /**
     * @return number of {@code chart{N}.xml} parts in {@code word/charts}
     */
    public int getChartCount() {
        ensureOpen();
        try {
            List<String> names = pkg.listFileNames(PartNames.CHARTS_DIR);
            return (int) names.stream().filter(n -> CHART_FILE.matcher(n).matches()).count();
        } catch (IOException e) {
            throw new ChartSyncException(ErrorCode.IO, "Cannot list chart parts", e);
        }
    }

    /**
     * Reads categories, series and titles of a chart from its cached data.
     */
    public ChartData getChartData(int chartIndex) {
        return readChart(chartIndex).getData();
    }

    public ChartView readChart(int chartIndex) {
        ensureOpen();
        String chartPart = requireChart(chartIndex);
        try {
            return parser.parse(pkg.read(chartPart), chartPart);
        } catch (IOException e) {
            throw ioFailure("Cannot read chart", e, chartIndex);
        } catch (ChartSyncException e) {
            throw e.withContext("chartIndex", chartIndex);
        }
    }

    public WorkbookLink resolveWorkbook(int chartIndex) {
        ensureOpen();
        requireChart(chartIndex);
        try {
            return resolver.resolve(pkg, chartIndex);
        } catch (IOException e) {
            throw ioFailure("Cannot resolve workbook", e, chartIndex);
        }
    }

    /**
     * Rewrites a chart and its embedded workbook from new data.
     * <p>
     * Both new parts are computed before either is written. Invalid data, an unresolvable
     * workbook or an unusable chart structure leave both parts byte-identical.
     *
     * @param chartIndex 1-based chart index
     * @param data new categories, series and optional titles; empty titles are left alone
     * @return what was changed, including titles that could not be applied
     * @throws com.catmepim.chartsync.exception.InvalidChartDataException before anything is read
     * @throws PartResolutionException if the chart or its workbook cannot be resolved
     * @throws com.catmepim.chartsync.exception.ChartParseException if the chart cannot be rewritten
     */
    public ChartUpdateResult updateChart(int chartIndex, ChartData data) {
        ensureOpen();
        ChartDataValidator.validate(data);
        String chartPart = requireChart(chartIndex);
        try {
            WorkbookLink link = resolver.resolve(pkg, chartIndex);
            byte[] originalChart = pkg.read(chartPart);
            ChartXmlUpdater.Outcome outcome = updater.update(originalChart, chartPart, data);
            byte[] workbook = synchronizer.synchronize(pkg.read(link.getWorkbookPart()), link.getWorkbookPart(), data);

            pkg.write(chartPart, outcome.getXml());
            try {
                pkg.write(link.getWorkbookPart(), workbook);
            } catch (IOException e) {
                pkg.write(chartPart, originalChart);
                throw e;
            }

            ChartUpdateResult result = new ChartUpdateResult(chartIndex, link.getWorkbookPart(),
                    outcome.getSeriesCount(), outcome.getChartTitle(), outcome.getCategoryAxisTitle(),
                    outcome.getValueAxisTitle());
            if (result.hasIgnoredTitles()) {
                logger.warn("Chart {} updated, but some titles had no anchor: {}", chartIndex, result);
            }
            logger.info("Updated chart {}: {} categories, {} series, workbook {}", chartIndex,
                    data.getCategories().size(), outcome.getSeriesCount(), link.getWorkbookPart());
            return result;
        } catch (IOException e) {
            throw ioFailure("Cannot update chart", e, chartIndex);
        } catch (ChartSyncException e) {
            if (!e.getContext().containsKey("chartIndex")) {
                e.withContext("chartIndex", chartIndex);
            }
            throw e;
        }
    }

    /**
     * Duplicates a chart with a private copy of its workbook and inserts it after the
     * paragraph of the source chart.
     *
     * @return the 1-based index of the new chart
     */
    public int copyChart(int sourceIndex) {
        ensureOpen();
        requireChart(sourceIndex);
        try {
            return copier.copy(pkg, sourceIndex);
        } catch (IOException e) {
            throw ioFailure("Cannot copy chart", e, sourceIndex);
        }
    }

    /**
     * Packs the current package state into a {@code .docx} file.
     */
    public void save(Path output) {
        ensureOpen();
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(output)) {
                archive.pack(pkg.getRoot(), out);
            }
            logger.info("Saved package to {}", output);
        } catch (IOException e) {
            throw new ChartSyncException(ErrorCode.IO, "Cannot save package", e).withContext("path", output);
        }
    }

    /**
     * Packs the current package state into a stream, which is not closed.
     */
    public void save(OutputStream out) {
        ensureOpen();
        try {
            archive.pack(pkg.getRoot(), out);
        } catch (IOException e) {
            throw new ChartSyncException(ErrorCode.IO, "Cannot save package", e);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (ownedDirectory != null) {
            deleteQuietly(ownedDirectory);
            logger.debug("Removed working directory {}", ownedDirectory);
        }
    }

    private String requireChart(int chartIndex) {
        String chartPart = PartNames.chartPart(Math.max(chartIndex, 0));
        if (chartIndex < 1 || !pkg.exists(chartPart)) {
            throw new PartResolutionException(ErrorCode.CHART_NOT_FOUND, "Chart does not exist")
                    .withContext("chartIndex", chartIndex);
        }
        return chartPart;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Editor is closed");
        }
    }

    private static ChartSyncException ioFailure(String message, IOException e, int chartIndex) {
        return new ChartSyncException(ErrorCode.IO, message, e).withContext("chartIndex", chartIndex);
    }

    private static void applyPoiLimits(ArchiveLimits limits) {
        // process-wide POI settings, read when an embedded workbook is opened
        ZipSecureFile.setMinInflateRatio(limits.getMinInflateRatio());
        ZipSecureFile.setMaxEntrySize(limits.getMaxEntrySizeBytes());
        logger.debug("ZipSecureFile limits: {}", limits);
    }

    private static void deleteQuietly(Path dir) {
        if (dir == null || !Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    logger.warn("Could not delete {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            logger.warn("Could not clean up {}: {}", dir, e.getMessage());
        }
    }
}
