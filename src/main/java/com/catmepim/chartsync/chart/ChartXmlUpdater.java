package com.catmepim.chartsync.chart;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.util.AreaReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.chartsync.model.ChartData;
import com.catmepim.chartsync.model.TitleUpdate;
import com.catmepim.chartsync.xml.XmlDocument;
import com.catmepim.chartsync.xml.XmlElement;

/**
 * Rewrites a chart part from new {@link ChartData}.
 * <p>
 * The series of the chart-type element are replaced in place by generated ones, so the
 * series count follows the data and no stale series survive. Every other child of the
 * chart-type element (axis IDs, data labels, gap width, overlap, vary-colors, ...) keeps its
 * content and position. Titles are replaced only when new text is supplied and a text
 * anchor exists; the outcome is reported per title.
 *
 * @invariant the input bytes are never modified; a failed update produces no output
 */
public final class ChartXmlUpdater {

    private static final Logger logger = LoggerFactory.getLogger(ChartXmlUpdater.class);

    static final String DEFAULT_SHEET_NAME = "Sheet1";

    /** Children that precede the series of a chart-type element. */
    private static final Set<String> LEADING_SETTINGS = new HashSet<>(
            Arrays.asList("barDir", "grouping", "varyColors", "scatterStyle"));

    /**
     * Result of a chart rewrite.
     */
    public static final class Outcome {
        private final byte[] xml;
        private final int seriesCount;
        private final TitleUpdate chartTitle;
        private final TitleUpdate categoryAxisTitle;
        private final TitleUpdate valueAxisTitle;

        Outcome(byte[] xml, int seriesCount, TitleUpdate chartTitle, TitleUpdate categoryAxisTitle,
                TitleUpdate valueAxisTitle) {
            this.xml = xml;
            this.seriesCount = seriesCount;
            this.chartTitle = chartTitle;
            this.categoryAxisTitle = categoryAxisTitle;
            this.valueAxisTitle = valueAxisTitle;
        }

        public byte[] getXml() {
            return xml;
        }

        public int getSeriesCount() {
            return seriesCount;
        }

        public TitleUpdate getChartTitle() {
            return chartTitle;
        }

        public TitleUpdate getCategoryAxisTitle() {
            return categoryAxisTitle;
        }

        public TitleUpdate getValueAxisTitle() {
            return valueAxisTitle;
        }
    }

    /**
     * @param raw current chart part bytes
     * @param partName part name for error context
     * @param data validated before the chart is parsed
     * @return the rewritten part; its XML declaration is followed by a line break
     * @throws com.catmepim.chartsync.exception.InvalidChartDataException if the data is invalid
     * @throws com.catmepim.chartsync.exception.ChartParseException if the chart structure is
     *         unusable or scatter categories are not numeric
     */
    public Outcome update(byte[] raw, String partName, ChartData data) {
        ChartDataValidator.validate(data);

        XmlDocument document = ChartStructure.parseXml(raw, partName);
        ChartStructure structure = ChartStructure.locate(document);

        List<Double> xValues = Collections.emptyList();
        if (structure.kind.hasNumericCategories()) {
            xValues = ChartXmlParser.parseScatterXValues(data.getCategories());
        }

        TitleUpdate chartTitle = replaceTitle(structure.chartTitle(), data.getChartTitle(), "chart");
        TitleUpdate categoryAxisTitle = replaceTitle(
                ChartStructure.axisTitle(structure.categoryAxis(), structure.naming),
                data.getCategoryAxisTitle(), "category axis");
        TitleUpdate valueAxisTitle = replaceTitle(
                ChartStructure.axisTitle(structure.valueAxis(), structure.naming),
                data.getValueAxisTitle(), "value axis");

        String sheetName = detectSheetName(structure);
        SeriesXmlBuilder builder = new SeriesXmlBuilder(structure.naming, structure.kind, sheetName);
        replaceSeries(structure, builder, data, xValues);

        logger.debug("Rewrote {} series of {} ({} chart, sheet '{}')",
                data.getSeries().size(), partName, structure.kind, sheetName);
        return new Outcome(document.toBytes(), data.getSeries().size(),
                chartTitle, categoryAxisTitle, valueAxisTitle);
    }

    private static void replaceSeries(ChartStructure structure, SeriesXmlBuilder builder, ChartData data,
                                      List<Double> xValues) {
        XmlElement typeElement = structure.typeElement;
        List<XmlElement> oldSeries = structure.typeSeries();

        int insertAt;
        if (!oldSeries.isEmpty()) {
            insertAt = typeElement.indexOf(oldSeries.get(0));
        } else {
            insertAt = 0;
            List<XmlElement> children = typeElement.getChildElements();
            for (XmlElement child : children) {
                if (LEADING_SETTINGS.contains(child.getLocalName())) {
                    insertAt = typeElement.indexOf(child) + 1;
                }
            }
        }
        for (XmlElement ser : oldSeries) {
            typeElement.removeChild(ser);
        }

        int firstNumber = firstFreeSeriesNumber(structure, oldSeries);
        for (int i = 0; i < data.getSeries().size(); i++) {
            XmlElement previous = i < oldSeries.size() ? oldSeries.get(i) : null;
            XmlElement ser = builder.build(i, firstNumber + i, data.getSeries().get(i), data.getCategories(),
                    xValues, previous);
            typeElement.insertChild(insertAt + i, ser);
        }
    }

    /**
     * Series {@code idx} and {@code order} are unique across the whole plot area. In a combo
     * chart, the rewritten series are numbered after those of the other chart types.
     */
    static int firstFreeSeriesNumber(ChartStructure structure, List<XmlElement> replaced) {
        int next = 0;
        for (XmlElement ser : structure.allSeries()) {
            if (replaced.contains(ser)) {
                continue;
            }
            for (String name : new String[] {"idx", "order"}) {
                XmlElement el = ser.firstChild(structure.naming.tag(name));
                Double value = el == null ? null : Numbers.parseOrNull(el.getAttribute("val"));
                if (value != null && value >= 0 && value < Integer.MAX_VALUE) {
                    next = Math.max(next, value.intValue() + 1);
                }
            }
        }
        return next;
    }

    private static TitleUpdate replaceTitle(XmlElement title, String newText, String which) {
        if (newText == null || newText.isEmpty()) {
            return TitleUpdate.NOT_REQUESTED;
        }
        XmlElement anchor = ChartStructure.titleTextAnchor(title);
        if (anchor == null) {
            logger.warn("No {} title text to replace; '{}' was not applied", which, newText);
            return TitleUpdate.ANCHOR_NOT_FOUND;
        }
        anchor.setText(newText);
        return TitleUpdate.UPDATED;
    }

    /**
     * Sheet the existing series formulas point at, {@code Sheet1} if there is none.
     */
    static String detectSheetName(ChartStructure structure) {
        for (XmlElement ser : structure.typeSeries()) {
            for (XmlElement f : ser.descendants(structure.naming.tag("f"))) {
                String sheet = sheetNameOf(f.getText());
                if (sheet != null) {
                    return sheet;
                }
            }
        }
        return DEFAULT_SHEET_NAME;
    }

    static String sheetNameOf(String formula) {
        if (formula == null || formula.indexOf('!') < 0) {
            return null;
        }
        try {
            String sheet = new AreaReference(formula.trim(), SpreadsheetVersion.EXCEL2007)
                    .getFirstCell().getSheetName();
            return sheet == null || sheet.isEmpty() ? null : sheet;
        } catch (IllegalArgumentException | IllegalStateException e) {
            logger.debug("Ignoring series formula '{}': {}", formula, e.getMessage());
            return null;
        }
    }
}
