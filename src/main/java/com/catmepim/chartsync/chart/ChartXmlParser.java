package com.catmepim.chartsync.chart;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.chartsync.exception.ChartParseException;
import com.catmepim.chartsync.exception.ErrorCode;
import com.catmepim.chartsync.model.ChartData;
import com.catmepim.chartsync.model.ChartKind;
import com.catmepim.chartsync.model.ChartView;
import com.catmepim.chartsync.model.SeriesData;
import com.catmepim.chartsync.xml.XmlDocument;
import com.catmepim.chartsync.xml.XmlElement;

/**
 * Reads a chart part into a {@link ChartView}, whether or not its elements carry a
 * namespace prefix.
 * <p>
 * The read path is lenient: missing titles read as empty strings and series whose cached
 * values do not match the category count are padded with zeros or truncated. Structural
 * problems (no {@code chartSpace}, no supported chart type, non-numeric scatter X values)
 * abort with {@link ChartParseException}.
 *
 * @invariant every returned series has one value per category when categories exist
 */
public final class ChartXmlParser {

    private static final Logger logger = LoggerFactory.getLogger(ChartXmlParser.class);

    /**
     * @param raw chart part bytes
     * @param partName part name for error context
     * @throws ChartParseException on malformed XML or an unrecognized chart structure
     */
    public ChartView parse(byte[] raw, String partName) {
        return parse(ChartStructure.parseXml(raw, partName));
    }

    public ChartView parse(XmlDocument document) {
        ChartStructure structure = ChartStructure.locate(document);

        String title = titleText(structure.chartTitle());
        String categoryAxisTitle = titleText(ChartStructure.axisTitle(structure.categoryAxis(), structure.naming));
        String valueAxisTitle = titleText(ChartStructure.axisTitle(structure.valueAxis(), structure.naming));

        List<XmlElement> serElements = structure.allSeries();
        List<String> categories = readCategories(structure, serElements);

        List<SeriesData> series = new ArrayList<>(serElements.size());
        for (int i = 0; i < serElements.size(); i++) {
            XmlElement ser = serElements.get(i);
            String name = seriesName(structure, ser);
            List<Double> values = readValues(structure, ser, categories.size(), i);
            series.add(new SeriesData(name, values));
        }

        List<Double> xValues = Collections.emptyList();
        if (structure.kind.hasNumericCategories()) {
            xValues = parseScatterXValues(categories);
        }

        logger.debug("Parsed {} chart: {} categories, {} series", structure.kind, categories.size(), series.size());
        ChartData data = new ChartData(categories, series, title, categoryAxisTitle, valueAxisTitle);
        return new ChartView(structure.kind, data, xValues);
    }

    /**
     * Re-reads textual categories as scatter X values.
     *
     * @throws ChartParseException with {@link ErrorCode#NON_NUMERIC_SCATTER_CATEGORY} for
     *         a blank or non-numeric entry
     */
    public static List<Double> parseScatterXValues(List<String> categories) {
        List<Double> values = new ArrayList<>(categories.size());
        for (int i = 0; i < categories.size(); i++) {
            Double v = Numbers.parseOrNull(categories.get(i));
            if (v == null || v.isNaN() || v.isInfinite()) {
                throw new ChartParseException(ErrorCode.NON_NUMERIC_SCATTER_CATEGORY,
                        "Scatter chart categories must be numeric")
                        .withContext("categoryIndex", i)
                        .withContext("category", categories.get(i));
            }
            values.add(v);
        }
        return values;
    }

    private static String titleText(XmlElement title) {
        XmlElement anchor = ChartStructure.titleTextAnchor(title);
        return anchor == null ? "" : anchor.getText().trim();
    }

    private static List<String> readCategories(ChartStructure structure, List<XmlElement> serElements) {
        if (serElements.isEmpty()) {
            return Collections.emptyList();
        }
        XmlElement first = serElements.get(0);
        XmlElement cat = first.firstChild(structure.naming.tag(ChartKind.SCATTER.categoryElementName()));
        if (cat == null) {
            cat = first.firstChild(structure.naming.tag(ChartKind.BAR.categoryElementName()));
        }
        return structure.readPoints(cat);
    }

    private static String seriesName(ChartStructure structure, XmlElement ser) {
        XmlElement tx = ser.firstChild(structure.naming.tag("tx"));
        if (tx == null) {
            return "";
        }
        XmlElement v = tx.firstDescendant(structure.naming.tag("v"));
        return v == null ? "" : v.getText().trim();
    }

    private static List<Double> readValues(ChartStructure structure, XmlElement ser, int count, int seriesIndex) {
        XmlElement val = ser.firstChild(structure.naming.tag(ChartKind.SCATTER.valueElementName()));
        if (val == null) {
            val = ser.firstChild(structure.naming.tag(ChartKind.BAR.valueElementName()));
        }
        List<String> points = structure.readPoints(val);
        List<Double> values = new ArrayList<>(Math.max(points.size(), count));
        for (String p : points) {
            Double v = Numbers.parseOrNull(p);
            values.add(v == null ? 0.0 : v);
        }
        if (count > 0 && values.size() != count) {
            logger.warn("Series {} has {} cached values for {} categories; {}",
                    seriesIndex, values.size(), count, values.size() < count ? "padding with zeros" : "truncating");
            while (values.size() < count) {
                values.add(0.0);
            }
            while (values.size() > count) {
                values.remove(values.size() - 1);
            }
        }
        return values;
    }
}
