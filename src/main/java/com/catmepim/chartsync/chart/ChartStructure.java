package com.catmepim.chartsync.chart;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.poi.ss.SpreadsheetVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.chartsync.exception.ChartParseException;
import com.catmepim.chartsync.exception.ErrorCode;
import com.catmepim.chartsync.model.ChartKind;
import com.catmepim.chartsync.xml.TagNaming;
import com.catmepim.chartsync.xml.XmlDocument;
import com.catmepim.chartsync.xml.XmlElement;
import com.catmepim.chartsync.xml.XmlTreeParser;

/**
 * Structural landmarks of a parsed chart part: naming strategy, {@code chart},
 * {@code plotArea}, the chart-type element and its kind. Shared by reading and mutation so
 * both agree on where things are.
 */
final class ChartStructure {

    private static final Logger logger = LoggerFactory.getLogger(ChartStructure.class);

    private static final String CHART_SPACE = "chartSpace";

    // cached points mirror one worksheet column
    private static final int MAX_POINTS = SpreadsheetVersion.EXCEL2007.getMaxRows();

    final XmlDocument document;
    final TagNaming naming;
    final XmlElement chart;
    final XmlElement plotArea;
    final XmlElement typeElement;
    final ChartKind kind;

    private ChartStructure(XmlDocument document, TagNaming naming, XmlElement chart, XmlElement plotArea,
                           XmlElement typeElement, ChartKind kind) {
        this.document = document;
        this.naming = naming;
        this.chart = chart;
        this.plotArea = plotArea;
        this.typeElement = typeElement;
        this.kind = kind;
    }

    static XmlDocument parseXml(byte[] raw, String partName) {
        try {
            return XmlTreeParser.parse(raw, partName);
        } catch (IOException e) {
            throw new ChartParseException(ErrorCode.XML_PARSE, "Chart XML is not well-formed", e)
                    .withContext("part", partName);
        }
    }

    /**
     * @throws ChartParseException if the root is not {@code chartSpace}, {@code chart} or
     *         {@code plotArea} is missing, or no supported chart-type element exists
     */
    static ChartStructure locate(XmlDocument document) {
        XmlElement root = document.getRoot();
        if (!CHART_SPACE.equals(root.getLocalName())) {
            throw new ChartParseException(ErrorCode.INVALID_CHART_STRUCTURE,
                    "Content does not appear to be chart XML (missing chartSpace root)")
                    .withContext("root", root.getName());
        }
        TagNaming naming = TagNaming.detect(root);
        logger.debug("Chart naming strategy: {}", naming);

        XmlElement chart = root.firstChild(naming.tag("chart"));
        if (chart == null) {
            throw new ChartParseException(ErrorCode.INVALID_CHART_STRUCTURE, "chartSpace has no chart element");
        }
        XmlElement plotArea = chart.firstChild(naming.tag("plotArea"));
        if (plotArea == null) {
            throw new ChartParseException(ErrorCode.INVALID_CHART_STRUCTURE, "chart has no plotArea element");
        }
        for (ChartKind kind : ChartKind.values()) {
            XmlElement typeElement = plotArea.firstChild(naming.tag(kind.getElementName()));
            if (typeElement != null) {
                logger.debug("Chart kind {} found as <{}>", kind, typeElement.getName());
                return new ChartStructure(document, naming, chart, plotArea, typeElement, kind);
            }
        }
        throw new ChartParseException(ErrorCode.INVALID_CHART_STRUCTURE, "Unsupported or missing chart type");
    }

    List<XmlElement> allSeries() {
        return plotArea.descendants(naming.tag("ser"));
    }

    List<XmlElement> typeSeries() {
        return typeElement.childrenNamed(naming.tag("ser"));
    }

    XmlElement chartTitle() {
        return chart.firstChild(naming.tag("title"));
    }

    /**
     * The axis the categories run along: the first category or date axis; for scatter
     * charts, which only have value axes, the first value axis.
     */
    XmlElement categoryAxis() {
        XmlElement axis = plotArea.firstChild(naming.tag("catAx"));
        if (axis == null) {
            axis = plotArea.firstChild(naming.tag("dateAx"));
        }
        if (axis == null && kind.hasNumericCategories()) {
            axis = plotArea.firstChild(naming.tag("valAx"));
        }
        return axis;
    }

    XmlElement valueAxis() {
        XmlElement categoryAxis = categoryAxis();
        for (XmlElement axis : plotArea.childrenNamed(naming.tag("valAx"))) {
            if (axis != categoryAxis) {
                return axis;
            }
        }
        return null;
    }

    /**
     * The element whose text carries a title: the first rich-text run ({@code a:t}) or,
     * for titles bound to a cell, the cached value ({@code c:v}).
     *
     * @return the anchor, or null when the title or its text node is absent
     */
    static XmlElement titleTextAnchor(XmlElement title) {
        if (title == null) {
            return null;
        }
        XmlElement anchor = title.firstDescendantByLocalName("t");
        if (anchor == null) {
            anchor = title.firstDescendantByLocalName("v");
        }
        return anchor;
    }

    static XmlElement axisTitle(XmlElement axis, TagNaming naming) {
        return axis == null ? null : axis.firstChild(naming.tag("title"));
    }

    /**
     * Reads the points of a reference or literal ({@code strRef}, {@code numRef},
     * {@code multiLvlStrRef}, {@code strLit}, {@code numLit}) below {@code container}.
     * Points are placed by their {@code idx}; gaps become empty strings.
     */
    List<String> readPoints(XmlElement container) {
        List<String> result = new ArrayList<>();
        if (container == null) {
            return result;
        }
        XmlElement cache = null;
        for (String name : new String[] {"strCache", "numCache", "multiLvlStrCache", "strLit", "numLit"}) {
            cache = container.firstDescendant(naming.tag(name));
            if (cache != null) {
                break;
            }
        }
        if (cache == null) {
            return result;
        }
        if (naming.matches(cache, "multiLvlStrCache")) {
            // first level holds the leaf labels
            XmlElement level = cache.firstChild(naming.tag("lvl"));
            return level == null ? result : placePoints(level, declaredCount(cache));
        }
        return placePoints(cache, declaredCount(cache));
    }

    /**
     * Places points by {@code idx}. The size is the declared count, bounded by the highest
     * index actually present and by the worksheet row limit; points outside that are dropped.
     */
    private List<String> placePoints(XmlElement cache, int declared) {
        List<XmlElement> points = cache.childrenNamed(naming.tag("pt"));
        int present = 0;
        for (int i = 0; i < points.size(); i++) {
            int idx = indexOf(points.get(i), i);
            if (idx >= 0 && idx < MAX_POINTS) {
                present = Math.max(present, idx + 1);
            }
        }
        int size = declared < 0 ? present : Math.min(declared, present);

        List<String> result = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            result.add("");
        }
        int dropped = 0;
        for (int i = 0; i < points.size(); i++) {
            int idx = indexOf(points.get(i), i);
            if (idx >= 0 && idx < size) {
                XmlElement v = points.get(i).firstChild(naming.tag("v"));
                result.set(idx, v == null ? "" : v.getText().trim());
            } else {
                dropped++;
            }
        }
        if (dropped > 0) {
            logger.warn("Ignored {} cached point(s) outside 0..{} in <{}>", dropped, size - 1, cache.getName());
        }
        if (declared > size) {
            logger.warn("<{}> declares {} points but only {} are present", cache.getName(), declared, size);
        }
        return result;
    }

    private int declaredCount(XmlElement cache) {
        XmlElement ptCount = cache.firstChild(naming.tag("ptCount"));
        if (ptCount == null) {
            return -1;
        }
        Double n = Numbers.parseOrNull(ptCount.getAttribute("val"));
        return n == null || n < 0 ? -1 : n.intValue();
    }

    private static int indexOf(XmlElement point, int fallback) {
        Double idx = Numbers.parseOrNull(point.getAttribute("idx"));
        return idx == null ? fallback : idx.intValue();
    }
}
