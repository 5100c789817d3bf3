package com.catmepim.chartsync.chart;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.chartsync.exception.ChartParseException;
import com.catmepim.chartsync.exception.ErrorCode;
import com.catmepim.chartsync.exception.PartResolutionException;
import com.catmepim.chartsync.opc.ContentTypesPart;
import com.catmepim.chartsync.opc.DocxPackage;
import com.catmepim.chartsync.opc.IdAllocator;
import com.catmepim.chartsync.opc.PartNames;
import com.catmepim.chartsync.opc.Relationship;
import com.catmepim.chartsync.opc.RelationshipsPart;
import com.catmepim.chartsync.workbook.WorkbookLink;
import com.catmepim.chartsync.workbook.WorkbookResolver;
import com.catmepim.chartsync.xml.TagNaming;
import com.catmepim.chartsync.xml.XmlDocument;
import com.catmepim.chartsync.xml.XmlElement;
import com.catmepim.chartsync.xml.XmlTreeParser;

/**
 * Duplicates a chart together with every part it privately owns (embedded workbook,
 * style and color parts, ...) and places the copy in a new paragraph right after the
 * paragraph holding the source chart.
 * <p>
 * All new identifiers come from the {@link IdAllocator}: chart index, document
 * relationship ID and drawing-object ID. No part is shared between source and copy.
 *
 * @invariant after a copy, source and copy resolve to different workbook parts
 */
public class ChartCopier {

    private static final Logger logger = LoggerFactory.getLogger(ChartCopier.class);

    private static final Pattern TRAILING_DIGITS = Pattern.compile("^(.*?)(\\d+)$");

    private final WorkbookResolver resolver;
    private final IdAllocator allocator;

    public ChartCopier(WorkbookResolver resolver, IdAllocator allocator) {
        this.resolver = resolver;
        this.allocator = allocator;
    }

    /**
     * @param pkg the document package
     * @param sourceIndex 1-based index of the chart to copy
     * @return the index of the new chart part
     * @throws PartResolutionException if the source chart, its workbook or its document
     *         relationship cannot be resolved
     * @throws ChartParseException with {@link ErrorCode#DRAWING_NOT_FOUND} if the document
     *         has no drawing referencing the source chart
     * @throws IOException on storage failure
     */
    public int copy(DocxPackage pkg, int sourceIndex) throws IOException {
        String sourceChart = PartNames.chartPart(sourceIndex);
        WorkbookLink link = resolver.resolve(pkg, sourceIndex);

        RelationshipsPart docRels = parseRels(pkg, DocxPackage.DOCUMENT_RELS_PART);
        Relationship sourceRel = docRels.findByTargetPart(DocxPackage.DOCUMENT_PART, sourceChart);
        if (sourceRel == null || !sourceRel.hasTypeSuffix("chart")) {
            throw new PartResolutionException(ErrorCode.RELATIONSHIP_NOT_FOUND,
                    "Document has no relationship to the source chart")
                    .withContext("chartIndex", sourceIndex)
                    .withContext("part", sourceChart);
        }

        byte[] documentBytes = pkg.read(DocxPackage.DOCUMENT_PART);
        XmlDocument document = parseDocument(documentBytes);
        XmlElement sourceDrawing = findChartReference(document.getRoot(), sourceRel.getId());
        TagNaming wordNaming = TagNaming.detect(document.getRoot());
        XmlElement paragraph = sourceDrawing == null ? null : sourceDrawing.ancestor(wordNaming.tag("p"));
        if (paragraph == null || paragraph.getParent() == null) {
            throw new ChartParseException(ErrorCode.DRAWING_NOT_FOUND,
                    "Could not find the drawing of the source chart in the document")
                    .withContext("chartIndex", sourceIndex)
                    .withContext("relationshipId", sourceRel.getId());
        }

        int newIndex = allocator.nextChartIndex(pkg.listFileNames(PartNames.CHARTS_DIR));
        String newChart = PartNames.chartPart(newIndex);
        ContentTypesPart contentTypes = ContentTypesPart.parse(pkg.read(ContentTypesPart.PART_NAME));

        // private parts first, so the copy never points at anything it does not own
        String sourceRelsPart = PartNames.relsPartFor(sourceChart);
        RelationshipsPart chartRels = parseRels(pkg, sourceRelsPart);
        Map<Relationship, String> owned = new LinkedHashMap<>();
        for (Relationship rel : chartRels.getRelationships()) {
            if (!rel.isExternal()) {
                owned.put(rel, resolveOwnedPart(sourceChart, rel, sourceIndex));
            }
        }
        Set<String> reserved = new HashSet<>();
        List<String> created = new ArrayList<>();
        for (Map.Entry<Relationship, String> entry : owned.entrySet()) {
            Relationship rel = entry.getKey();
            String ownedPart = entry.getValue();
            if (!pkg.exists(ownedPart)) {
                logger.warn("Chart {} relationship {} points at missing part {}; left as is",
                        sourceIndex, rel.getId(), ownedPart);
                continue;
            }
            String copyPart = derivePartName(pkg, ownedPart, newIndex, reserved);
            pkg.copy(ownedPart, copyPart);
            created.add(copyPart);
            chartRels.setTarget(rel.getId(), PartNames.relativize(newChart, copyPart));
            String override = contentTypes.getOverride(ownedPart);
            if (override != null) {
                contentTypes.addOverride(copyPart, override);
            }
            if (rel.getId().equals(link.getRelationshipId())) {
                logger.debug("Workbook {} duplicated as {}", ownedPart, copyPart);
            }
        }

        pkg.copy(sourceChart, newChart);
        pkg.write(PartNames.relsPartFor(newChart), chartRels.toBytes());

        String newRelId = allocator.nextRelationshipId(DocxPackage.DOCUMENT_RELS_PART, docRels);
        docRels.add(new Relationship(newRelId, sourceRel.getType(),
                PartNames.relativize(DocxPackage.DOCUMENT_PART, newChart)));

        long[] extent = extentOf(sourceDrawing);
        long drawingObjectId = allocator.nextDrawingObjectId(DocxPackage.DOCUMENT_PART,
                new String(documentBytes, StandardCharsets.UTF_8));
        XmlElement newParagraph = ChartDrawingBuilder.forDocument(document.getRoot())
                .build(newIndex, newRelId, drawingObjectId, extent[0], extent[1]);
        paragraph.getParent().insertAfter(paragraph, newParagraph);

        String chartType = contentTypes.getOverride(sourceChart);
        contentTypes.addOverride(newChart, chartType == null ? ContentTypesPart.CHART_CONTENT_TYPE : chartType);

        pkg.write(DocxPackage.DOCUMENT_RELS_PART, docRels.toBytes());
        pkg.write(DocxPackage.DOCUMENT_PART, document.toBytes());
        pkg.write(ContentTypesPart.PART_NAME, contentTypes.toBytes());

        logger.info("Copied chart {} to chart {} (relationship {}, docPr {}, {} private part(s))",
                sourceIndex, newIndex, newRelId, drawingObjectId, created.size());
        return newIndex;
    }

    /**
     * @throws PartResolutionException if the target lies outside the package
     */
    private static String resolveOwnedPart(String sourceChart, Relationship rel, int sourceIndex) {
        try {
            return PartNames.resolve(sourceChart, rel.getTarget());
        } catch (IllegalArgumentException e) {
            throw new PartResolutionException(ErrorCode.RELATIONSHIP_NOT_FOUND,
                    "Relationship target escapes the package", e)
                    .withContext("chartIndex", sourceIndex)
                    .withContext("relationshipId", rel.getId())
                    .withContext("target", rel.getTarget());
        }
    }

    /**
     * Name for the copy of a chart-owned part: the trailing number of the file name is
     * replaced by the new chart index, or the index is appended when there is none.
     * Names already taken are skipped by counting upwards.
     */
    static String derivePartName(DocxPackage pkg, String sourcePart, int newIndex, Set<String> reserved) {
        String dir = PartNames.directoryOf(sourcePart);
        String file = PartNames.fileName(sourcePart);
        int dot = file.lastIndexOf('.');
        String base = dot < 0 ? file : file.substring(0, dot);
        String ext = dot < 0 ? "" : file.substring(dot);
        Matcher m = TRAILING_DIGITS.matcher(base);
        if (m.matches()) {
            base = m.group(1);
        }
        int n = newIndex;
        while (true) {
            String candidate = (dir.isEmpty() ? "" : dir + "/") + base + n + ext;
            if (!pkg.exists(candidate) && reserved.add(candidate)) {
                return candidate;
            }
            n++;
        }
    }

    /**
     * First chart reference ({@code c:chart r:id="..."}) with the given relationship ID.
     */
    static XmlElement findChartReference(XmlElement root, String relationshipId) {
        for (XmlElement child : root.getChildElements()) {
            if ("chart".equals(child.getLocalName())
                    && relationshipId.equals(child.getAttributeByLocalName("id", true))) {
                return child;
            }
            XmlElement nested = findChartReference(child, relationshipId);
            if (nested != null) {
                return nested;
            }
        }
        return null;
    }

    /**
     * Size of the source drawing, or the default chart size when it cannot be read.
     */
    static long[] extentOf(XmlElement chartReference) {
        XmlElement frame = chartReference.getParent();
        while (frame != null && !"inline".equals(frame.getLocalName()) && !"anchor".equals(frame.getLocalName())) {
            frame = frame.getParent();
        }
        if (frame != null) {
            for (XmlElement child : frame.getChildElements()) {
                if ("extent".equals(child.getLocalName())) {
                    Double cx = Numbers.parseOrNull(child.getAttribute("cx"));
                    Double cy = Numbers.parseOrNull(child.getAttribute("cy"));
                    if (cx != null && cy != null && cx > 0 && cy > 0) {
                        return new long[] {cx.longValue(), cy.longValue()};
                    }
                }
            }
        }
        return new long[] {ChartDrawingBuilder.DEFAULT_EXTENT_CX, ChartDrawingBuilder.DEFAULT_EXTENT_CY};
    }

    private static RelationshipsPart parseRels(DocxPackage pkg, String relsPart) throws IOException {
        if (!pkg.exists(relsPart)) {
            throw new PartResolutionException(ErrorCode.RELATIONSHIP_NOT_FOUND, "Relationships part is missing")
                    .withContext("part", relsPart);
        }
        try {
            return RelationshipsPart.parse(pkg.read(relsPart), relsPart);
        } catch (IOException e) {
            throw new PartResolutionException(ErrorCode.RELATIONSHIP_NOT_FOUND,
                    "Relationships part cannot be parsed", e)
                    .withContext("part", relsPart);
        }
    }

    private static XmlDocument parseDocument(byte[] raw) {
        try {
            return XmlTreeParser.parse(raw, DocxPackage.DOCUMENT_PART);
        } catch (IOException e) {
            throw new ChartParseException(ErrorCode.XML_PARSE, "Document XML is not well-formed", e)
                    .withContext("part", DocxPackage.DOCUMENT_PART);
        }
    }
}
