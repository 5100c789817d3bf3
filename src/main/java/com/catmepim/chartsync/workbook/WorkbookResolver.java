package com.catmepim.chartsync.workbook;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.chartsync.exception.ChartParseException;
import com.catmepim.chartsync.exception.ErrorCode;
import com.catmepim.chartsync.exception.PartResolutionException;
import com.catmepim.chartsync.opc.DocxPackage;
import com.catmepim.chartsync.opc.PartNames;
import com.catmepim.chartsync.opc.Relationship;
import com.catmepim.chartsync.opc.RelationshipsPart;
import com.catmepim.chartsync.xml.XmlDocument;
import com.catmepim.chartsync.xml.XmlElement;
import com.catmepim.chartsync.xml.XmlTreeParser;

/**
 * Follows a chart's {@code externalData} reference through the chart's own {@code .rels}
 * part to its embedded workbook.
 * <p>
 * Every failure names the chart index and, once known, the relationship ID.
 */
public class WorkbookResolver {

    private static final Logger logger = LoggerFactory.getLogger(WorkbookResolver.class);

    /**
     * @param pkg the document package
     * @param chartIndex 1-based chart index
     * @return the resolved link; its workbook part exists
     * @throws PartResolutionException if the chart, its relationships, the externalData
     *         reference, the relationship or the workbook part cannot be found
     * @throws IOException on storage failure
     */
    public WorkbookLink resolve(DocxPackage pkg, int chartIndex) throws IOException {
        String chartPart = PartNames.chartPart(chartIndex);
        if (!pkg.exists(chartPart)) {
            throw new PartResolutionException(ErrorCode.CHART_NOT_FOUND, "Chart part does not exist")
                    .withContext("chartIndex", chartIndex)
                    .withContext("part", chartPart);
        }
        String relId = externalDataRelationshipId(pkg.read(chartPart), chartPart, chartIndex);

        String relsPart = PartNames.relsPartFor(chartPart);
        RelationshipsPart rels = readRelationships(pkg, relsPart, chartIndex, relId);
        Relationship rel = rels.findById(relId);
        if (rel == null) {
            throw new PartResolutionException(ErrorCode.RELATIONSHIP_NOT_FOUND, "Relationship not found")
                    .withContext("chartIndex", chartIndex)
                    .withContext("relationshipId", relId)
                    .withContext("part", relsPart);
        }
        if (rel.isExternal()) {
            throw new PartResolutionException(ErrorCode.WORKBOOK_NOT_FOUND,
                    "Chart data is linked to an external workbook, not an embedded one")
                    .withContext("chartIndex", chartIndex)
                    .withContext("relationshipId", relId)
                    .withContext("target", rel.getTarget());
        }

        String workbookPart;
        try {
            workbookPart = PartNames.resolve(chartPart, rel.getTarget());
        } catch (IllegalArgumentException e) {
            throw new PartResolutionException(ErrorCode.RELATIONSHIP_NOT_FOUND,
                    "Relationship target escapes the package", e)
                    .withContext("chartIndex", chartIndex)
                    .withContext("relationshipId", relId)
                    .withContext("target", rel.getTarget());
        }
        if (!pkg.exists(workbookPart)) {
            throw new PartResolutionException(ErrorCode.WORKBOOK_NOT_FOUND, "Embedded workbook does not exist")
                    .withContext("chartIndex", chartIndex)
                    .withContext("relationshipId", relId)
                    .withContext("part", workbookPart);
        }
        logger.debug("Chart {} data: {} -> {}", chartIndex, relId, workbookPart);
        return new WorkbookLink(chartIndex, chartPart, relId, rel.getTarget(), workbookPart);
    }

    /**
     * Reads the relationship ID of the chart's {@code externalData} element, whatever
     * prefix the element and its {@code id} attribute use.
     */
    String externalDataRelationshipId(byte[] chartXml, String chartPart, int chartIndex) {
        XmlDocument doc;
        try {
            doc = XmlTreeParser.parse(chartXml, chartPart);
        } catch (IOException e) {
            throw new ChartParseException(ErrorCode.XML_PARSE, "Chart XML is not well-formed", e)
                    .withContext("chartIndex", chartIndex);
        }
        XmlElement externalData = null;
        for (XmlElement child : doc.getRoot().getChildElements()) {
            if ("externalData".equals(child.getLocalName())) {
                externalData = child;
                break;
            }
        }
        String relId = externalData == null ? null : externalData.getAttributeByLocalName("id", true);
        if (relId == null || relId.isEmpty()) {
            throw new PartResolutionException(ErrorCode.EXTERNAL_DATA_MISSING,
                    "Chart has no externalData relationship")
                    .withContext("chartIndex", chartIndex);
        }
        return relId;
    }

    private static RelationshipsPart readRelationships(DocxPackage pkg, String relsPart, int chartIndex, String relId)
            throws IOException {
        if (!pkg.exists(relsPart)) {
            throw new PartResolutionException(ErrorCode.RELATIONSHIP_NOT_FOUND, "Chart relationships part is missing")
                    .withContext("chartIndex", chartIndex)
                    .withContext("relationshipId", relId)
                    .withContext("part", relsPart);
        }
        byte[] raw = pkg.read(relsPart);
        try {
            return RelationshipsPart.parse(raw, relsPart);
        } catch (IOException e) {
            throw new PartResolutionException(ErrorCode.RELATIONSHIP_NOT_FOUND,
                    "Chart relationships part cannot be parsed", e)
                    .withContext("chartIndex", chartIndex)
                    .withContext("relationshipId", relId)
                    .withContext("part", relsPart);
        }
    }
}
