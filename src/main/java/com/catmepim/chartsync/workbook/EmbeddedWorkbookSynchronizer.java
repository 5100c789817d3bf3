package com.catmepim.chartsync.workbook;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.openxml4j.exceptions.InvalidFormatException;
import org.apache.poi.openxml4j.exceptions.InvalidOperationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.chartsync.chart.ChartDataValidator;
import com.catmepim.chartsync.exception.ChartSyncException;
import com.catmepim.chartsync.exception.ErrorCode;
import com.catmepim.chartsync.model.ChartData;
import com.catmepim.chartsync.model.SeriesData;
import com.catmepim.chartsync.opc.PackageArchive;
import com.catmepim.chartsync.opc.PartNames;
import com.catmepim.chartsync.opc.Relationship;
import com.catmepim.chartsync.xml.XmlDocument;
import com.catmepim.chartsync.xml.XmlElement;
import com.catmepim.chartsync.xml.XmlTreeParser;

/**
 * Mirrors chart data into the embedded workbook that backs a chart.
 * <p>
 * The workbook is opened through POI's OPC layer; packages POI rejects are handled on
 * their raw ZIP entries instead. The data worksheet is the workbook's first sheet. Its
 * grid, dimension and auto-filter are rewritten, shared strings are appended to and any
 * table on the sheet is re-fitted to the new extent.
 *
 * @invariant the input bytes are never modified; the result is a complete new package
 */
public class EmbeddedWorkbookSynchronizer {

    private static final Logger logger = LoggerFactory.getLogger(EmbeddedWorkbookSynchronizer.class);

    static final String WORKBOOK_PART = "xl/workbook.xml";
    static final String DEFAULT_SHARED_STRINGS_PART = "xl/sharedStrings.xml";
    private static final String WORKSHEETS_PREFIX = "xl/worksheets/sheet";

    private final PackageArchive archive;

    public EmbeddedWorkbookSynchronizer(PackageArchive archive) {
        this.archive = archive;
    }

    /**
     * @param workbook current workbook bytes
     * @param workbookPart part name for error context
     * @param data chart data, validated before the workbook is opened
     * @return the rewritten workbook package
     * @throws com.catmepim.chartsync.exception.InvalidChartDataException if the data is invalid
     * @throws ChartSyncException with {@link ErrorCode#INVALID_WORKBOOK} if the workbook has
     *         no usable worksheet
     * @throws IOException if the workbook cannot be read or written
     */
    public byte[] synchronize(byte[] workbook, String workbookPart, ChartData data) throws IOException {
        ChartDataValidator.validate(data);
        try (WorkbookParts parts = open(workbook, workbookPart)) {
            String worksheetPart = selectWorksheet(parts);
            if (worksheetPart == null) {
                throw new ChartSyncException(ErrorCode.INVALID_WORKBOOK, "No worksheet found in embedded workbook")
                        .withContext("part", workbookPart);
            }

            String sharedStringsPart = sharedStringsPart(parts);
            SharedStringTable sharedStrings = null;
            if (sharedStringsPart != null) {
                sharedStrings = SharedStringTable.parse(parts.read(sharedStringsPart), sharedStringsPart);
            }
            int stringsBefore = sharedStrings == null ? 0 : sharedStrings.size();

            XmlDocument sheet = XmlTreeParser.parse(parts.read(worksheetPart), worksheetPart);
            WorksheetGridWriter grid = new WorksheetGridWriter(sheet, sharedStrings);
            List<String> tableParts = tableParts(parts, worksheetPart);

            String cornerLabel = grid.cellText("A1");
            if ((cornerLabel == null || cornerLabel.isEmpty()) && !tableParts.isEmpty()) {
                // table header cells cannot be empty
                cornerLabel = " ";
            }
            grid.write(data, cornerLabel);

            String extent = WorksheetGridWriter.extent(data);
            List<String> headers = headers(data, cornerLabel);
            List<byte[]> tables = new ArrayList<>(tableParts.size());
            for (String tablePart : tableParts) {
                XmlDocument table = XmlTreeParser.parse(parts.read(tablePart), tablePart);
                TableRangeRewriter.rewrite(table, extent, headers);
                tables.add(table.toBytes());
            }

            parts.write(worksheetPart, sheet.toBytes());
            for (int i = 0; i < tableParts.size(); i++) {
                parts.write(tableParts.get(i), tables.get(i));
            }
            if (sharedStrings != null) {
                parts.write(sharedStringsPart, sharedStrings.toBytes());
                logger.debug("Shared strings: {} existing, {} appended", stringsBefore,
                        sharedStrings.size() - stringsBefore);
            }
            byte[] result = parts.toBytes();
            logger.debug("Synchronized {} via {}: sheet {}, extent {}, {} table(s)",
                    workbookPart, parts.describe(), worksheetPart, extent, tableParts.size());
            return result;
        }
    }

    private WorkbookParts open(byte[] workbook, String workbookPart) throws IOException {
        try {
            return OpcWorkbookParts.open(workbook);
        } catch (IOException | InvalidFormatException | UnsupportedFileFormatException
                | InvalidOperationException e) {
            logger.warn("POI could not open embedded workbook {} ({}); falling back to raw ZIP access",
                    workbookPart, e.getMessage());
            return ZipWorkbookParts.open(workbook, archive);
        }
    }

    /**
     * The first {@code sheet} of {@code xl/workbook.xml} resolved through the workbook's
     * relationships, or else the first {@code xl/worksheets/sheet*.xml} part.
     *
     * @return the worksheet part name, or null if the workbook has none
     */
    String selectWorksheet(WorkbookParts parts) throws IOException {
        if (parts.exists(WORKBOOK_PART)) {
            XmlElement root = XmlTreeParser.parse(parts.read(WORKBOOK_PART), WORKBOOK_PART).getRoot();
            XmlElement sheet = null;
            for (XmlElement sheets : root.getChildElements()) {
                if ("sheets".equals(sheets.getLocalName())) {
                    for (XmlElement candidate : sheets.getChildElements()) {
                        if ("sheet".equals(candidate.getLocalName())) {
                            sheet = candidate;
                            break;
                        }
                    }
                    break;
                }
            }
            String relId = sheet == null ? null : sheet.getAttributeByLocalName("id", true);
            if (relId != null) {
                for (Relationship rel : parts.relationships(WORKBOOK_PART)) {
                    if (relId.equals(rel.getId()) && !rel.isExternal()) {
                        String target = PartNames.resolve(WORKBOOK_PART, rel.getTarget());
                        if (parts.exists(target)) {
                            return target;
                        }
                        logger.warn("First sheet target {} does not exist; using first worksheet part", target);
                    }
                }
            }
        }
        for (String name : parts.partNames()) {
            if (name.startsWith(WORKSHEETS_PREFIX) && name.endsWith(".xml")) {
                return name;
            }
        }
        return null;
    }

    private static String sharedStringsPart(WorkbookParts parts) throws IOException {
        if (parts.exists(WORKBOOK_PART)) {
            for (Relationship rel : parts.relationships(WORKBOOK_PART)) {
                if (rel.hasTypeSuffix("sharedStrings") && !rel.isExternal()) {
                    String target = PartNames.resolve(WORKBOOK_PART, rel.getTarget());
                    if (parts.exists(target)) {
                        return target;
                    }
                }
            }
        }
        return parts.exists(DEFAULT_SHARED_STRINGS_PART) ? DEFAULT_SHARED_STRINGS_PART : null;
    }

    private static List<String> tableParts(WorkbookParts parts, String worksheetPart) throws IOException {
        List<String> tables = new ArrayList<>();
        for (Relationship rel : parts.relationships(worksheetPart)) {
            if (rel.hasTypeSuffix("table") && !rel.isExternal()) {
                String target = PartNames.resolve(worksheetPart, rel.getTarget());
                if (parts.exists(target)) {
                    tables.add(target);
                }
            }
        }
        return tables;
    }

    private static List<String> headers(ChartData data, String cornerLabel) {
        List<String> headers = new ArrayList<>(data.getSeries().size() + 1);
        headers.add(cornerLabel == null ? "" : cornerLabel);
        for (SeriesData s : data.getSeries()) {
            headers.add(s.getName());
        }
        return headers;
    }
}
