package com.catmepim.chartsync.opc;

import java.io.IOException;

import com.catmepim.chartsync.xml.XmlDocument;
import com.catmepim.chartsync.xml.XmlElement;
import com.catmepim.chartsync.xml.XmlTreeParser;

/**
 * Parsed {@code [Content_Types].xml}.
 */
public final class ContentTypesPart {

    public static final String PART_NAME = "[Content_Types].xml";

    public static final String CHART_CONTENT_TYPE =
            "application/vnd.openxmlformats-officedocument.drawingml.chart+xml";
    public static final String CHART_STYLE_CONTENT_TYPE =
            "application/vnd.ms-office.chartstyle+xml";
    public static final String CHART_COLOR_STYLE_CONTENT_TYPE =
            "application/vnd.ms-office.chartcolorstyle+xml";
    public static final String WORKBOOK_CONTENT_TYPE =
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";

    private final XmlDocument document;

    private ContentTypesPart(XmlDocument document) {
        this.document = document;
    }

    public static ContentTypesPart parse(byte[] raw) throws IOException {
        XmlDocument doc = XmlTreeParser.parse(raw, PART_NAME);
        if (!"Types".equals(doc.getRoot().getLocalName())) {
            throw new IOException("Not a content types part: root is <" + doc.getRoot().getName() + ">");
        }
        return new ContentTypesPart(doc);
    }

    /**
     * @param partName package part name without leading slash
     * @return the override content type, or null
     */
    public String getOverride(String partName) {
        XmlElement el = overrideElement(partName);
        return el == null ? null : el.getAttribute("ContentType");
    }

    public boolean hasOverride(String partName) {
        return overrideElement(partName) != null;
    }

    /**
     * @return the {@code Default} content type for a file extension, or null
     */
    public String getDefault(String extension) {
        for (XmlElement el : document.getRoot().getChildElements()) {
            if ("Default".equals(el.getLocalName()) && extension.equalsIgnoreCase(el.getAttribute("Extension"))) {
                return el.getAttribute("ContentType");
            }
        }
        return null;
    }

    /**
     * Registers an override unless the part already has one.
     *
     * @return true if an override was added
     */
    public boolean addOverride(String partName, String contentType) {
        if (hasOverride(partName)) {
            return false;
        }
        XmlElement el = new XmlElement(qualified("Override"))
                .setAttribute("PartName", PartNames.contentTypePartName(partName))
                .setAttribute("ContentType", contentType);
        document.getRoot().appendChild(el);
        return true;
    }

    /**
     * Registers a {@code Default} for an extension unless one exists.
     */
    public boolean addDefault(String extension, String contentType) {
        if (getDefault(extension) != null) {
            return false;
        }
        XmlElement el = new XmlElement(qualified("Default"))
                .setAttribute("Extension", extension)
                .setAttribute("ContentType", contentType);
        // Defaults precede overrides by convention
        XmlElement root = document.getRoot();
        int insertAt = 0;
        for (XmlElement child : root.getChildElements()) {
            if ("Default".equals(child.getLocalName())) {
                insertAt = root.indexOf(child) + 1;
            }
        }
        root.insertChild(insertAt, el);
        return true;
    }

    public byte[] toBytes() {
        return document.toBytes();
    }

    private XmlElement overrideElement(String partName) {
        String wanted = PartNames.contentTypePartName(partName);
        for (XmlElement el : document.getRoot().getChildElements()) {
            if ("Override".equals(el.getLocalName()) && wanted.equalsIgnoreCase(el.getAttribute("PartName"))) {
                return el;
            }
        }
        return null;
    }

    private String qualified(String localName) {
        String prefix = document.getRoot().getPrefix();
        return prefix == null ? localName : prefix + ":" + localName;
    }
}
