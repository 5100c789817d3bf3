package com.catmepim.chartsync.chart;

import java.io.IOException;
import java.util.Map;

import com.catmepim.chartsync.xml.XmlElement;
import com.catmepim.chartsync.xml.XmlTreeParser;

/**
 * Generates the paragraph that places a chart inline in the document body.
 */
final class ChartDrawingBuilder {

    static final String WORDPROCESSING_DRAWING_NS =
            "http://schemas.openxmlformats.org/drawingml/2006/wordprocessingDrawing";
    static final String WP14_NS = "http://schemas.microsoft.com/office/word/2010/wordprocessingDrawing";

    static final long DEFAULT_EXTENT_CX = 6099523L;
    static final long DEFAULT_EXTENT_CY = 3340467L;

    static final long ANCHOR_ID_BASE = 0x30000000L;
    static final long EDIT_ID_BASE = 0x0D000000L;
    static final long ID_INCREMENT = 0x1000L;

    private final String wordPrefix;
    private final String drawingPrefix;
    private final boolean declareDrawingNamespace;
    private final String wp14Prefix;

    private ChartDrawingBuilder(String wordPrefix, String drawingPrefix, boolean declareDrawingNamespace,
                                String wp14Prefix) {
        this.wordPrefix = wordPrefix;
        this.drawingPrefix = drawingPrefix;
        this.declareDrawingNamespace = declareDrawingNamespace;
        this.wp14Prefix = wp14Prefix;
    }

    /**
     * Picks prefixes from the namespace declarations of the document root. The
     * {@code wp14} IDs are only emitted when the document declares that namespace.
     */
    static ChartDrawingBuilder forDocument(XmlElement documentRoot) {
        String wordPrefix = documentRoot.getPrefix() == null ? "w" : documentRoot.getPrefix();
        String drawingPrefix = prefixFor(documentRoot, WORDPROCESSING_DRAWING_NS);
        String wp14Prefix = prefixFor(documentRoot, WP14_NS);
        return new ChartDrawingBuilder(wordPrefix, drawingPrefix == null ? "wp" : drawingPrefix,
                drawingPrefix == null, wp14Prefix);
    }

    private static String prefixFor(XmlElement root, String namespace) {
        for (Map.Entry<String, String> attr : root.getAttributes().entrySet()) {
            if (attr.getKey().startsWith("xmlns:") && namespace.equals(attr.getValue())) {
                return attr.getKey().substring("xmlns:".length());
            }
        }
        return null;
    }

    /**
     * @param chartIndex index of the chart part, drives the {@code wp14} IDs and the object name
     * @param relationshipId document relationship pointing at the chart part
     * @param drawingObjectId unique {@code docPr} ID
     * @param cx width in EMU
     * @param cy height in EMU
     */
    XmlElement build(int chartIndex, String relationshipId, long drawingObjectId, long cx, long cy)
            throws IOException {
        String w = wordPrefix;
        String wp = drawingPrefix;
        StringBuilder sb = new StringBuilder(1024);
        sb.append('<').append(w).append(":p><").append(w).append(":r><").append(w).append(":drawing>");
        sb.append('<').append(wp).append(":inline distT=\"0\" distB=\"0\" distL=\"0\" distR=\"0\"");
        if (declareDrawingNamespace) {
            sb.append(" xmlns:").append(wp).append("=\"").append(WORDPROCESSING_DRAWING_NS).append('"');
        }
        if (wp14Prefix != null) {
            sb.append(' ').append(wp14Prefix).append(":anchorId=\"")
                    .append(String.format("%08X", ANCHOR_ID_BASE + chartIndex * ID_INCREMENT)).append('"');
            sb.append(' ').append(wp14Prefix).append(":editId=\"")
                    .append(String.format("%08X", EDIT_ID_BASE + chartIndex * ID_INCREMENT)).append('"');
        }
        sb.append('>');
        sb.append('<').append(wp).append(":extent cx=\"").append(cx).append("\" cy=\"").append(cy).append("\"/>");
        sb.append('<').append(wp).append(":effectExtent l=\"0\" t=\"0\" r=\"15875\" b=\"12700\"/>");
        sb.append('<').append(wp).append(":docPr id=\"").append(drawingObjectId)
                .append("\" name=\"Chart ").append(chartIndex).append("\"/>");
        sb.append('<').append(wp).append(":cNvGraphicFramePr/>");
        sb.append("<a:graphic xmlns:a=\"http://schemas.openxmlformats.org/drawingml/2006/main\">");
        sb.append("<a:graphicData uri=\"http://schemas.openxmlformats.org/drawingml/2006/chart\">");
        sb.append("<c:chart xmlns:c=\"http://schemas.openxmlformats.org/drawingml/2006/chart\"");
        sb.append(" xmlns:r=\"http://schemas.openxmlformats.org/officeDocument/2006/relationships\"");
        sb.append(" r:id=\"").append(relationshipId).append("\"/>");
        sb.append("</a:graphicData></a:graphic>");
        sb.append("</").append(wp).append(":inline>");
        sb.append("</").append(w).append(":drawing></").append(w).append(":r></").append(w).append(":p>");
        return XmlTreeParser.parseFragment(sb.toString());
    }
}
