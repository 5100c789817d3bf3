package com.catmepim.chartsync.chart;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.util.AreaReference;
import org.apache.poi.ss.util.CellReference;

import com.catmepim.chartsync.model.ChartKind;
import com.catmepim.chartsync.model.SeriesData;
import com.catmepim.chartsync.xml.TagNaming;
import com.catmepim.chartsync.xml.XmlElement;

/**
 * Generates {@code ser} elements for one chart-type element.
 * <p>
 * Every generated series references the worksheet layout the workbook synchronizer writes:
 * series names in row 1 from column B, categories in column A from row 2, values below
 * each series name.
 */
final class SeriesXmlBuilder {

    /** Per-series formatting carried over from the series previously at the same position. */
    private static final Set<String> LEADING_STYLE = new HashSet<>(
            Arrays.asList("spPr", "invertIfNegative", "marker", "explosion"));
    private static final Set<String> TRAILING_STYLE = new HashSet<>(Arrays.asList("smooth"));

    private final TagNaming naming;
    private final ChartKind kind;
    private final String sheetName;

    SeriesXmlBuilder(TagNaming naming, ChartKind kind, String sheetName) {
        this.naming = naming;
        this.kind = kind;
        this.sheetName = sheetName;
    }

    /**
     * @param index position of the series in the data, selects its worksheet column
     * @param number value for {@code idx} and {@code order}, unique within the plot area
     * @param series name and values
     * @param categories category labels
     * @param xValues numeric categories for scatter charts, ignored otherwise
     * @param previous series formerly at this position, or null
     */
    XmlElement build(int index, int number, SeriesData series, List<String> categories, List<Double> xValues,
                     XmlElement previous) {
        int column = index + 1;
        int lastRow = categories.size();

        XmlElement ser = naming.element("ser")
                .appendChild(naming.valElement("idx", Integer.toString(number)))
                .appendChild(naming.valElement("order", Integer.toString(number)));

        XmlElement nameRef = naming.element("strRef")
                .appendChild(naming.textElement("f", reference(0, column, 0, column)))
                .appendChild(stringCache(Collections.singletonList(series.getName())));
        ser.appendChild(naming.element("tx").appendChild(nameRef));

        copyStyle(previous, ser, LEADING_STYLE);

        if (kind.hasNumericCategories()) {
            XmlElement xRef = naming.element("numRef")
                    .appendChild(naming.textElement("f", reference(1, 0, lastRow, 0)))
                    .appendChild(numberCache(xValues));
            ser.appendChild(naming.element(kind.categoryElementName()).appendChild(xRef));
        } else {
            XmlElement catRef = naming.element("strRef")
                    .appendChild(naming.textElement("f", reference(1, 0, lastRow, 0)))
                    .appendChild(stringCache(categories));
            ser.appendChild(naming.element(kind.categoryElementName()).appendChild(catRef));
        }

        XmlElement valRef = naming.element("numRef")
                .appendChild(naming.textElement("f", reference(1, column, lastRow, column)))
                .appendChild(numberCache(series.getValues()));
        ser.appendChild(naming.element(kind.valueElementName()).appendChild(valRef));

        copyStyle(previous, ser, TRAILING_STYLE);
        return ser;
    }

    private XmlElement stringCache(List<String> values) {
        XmlElement cache = naming.element("strCache")
                .appendChild(naming.valElement("ptCount", Integer.toString(values.size())));
        for (int i = 0; i < values.size(); i++) {
            cache.appendChild(point(i, values.get(i)));
        }
        return cache;
    }

    private XmlElement numberCache(List<Double> values) {
        XmlElement cache = naming.element("numCache")
                .appendChild(naming.textElement("formatCode", "General"))
                .appendChild(naming.valElement("ptCount", Integer.toString(values.size())));
        for (int i = 0; i < values.size(); i++) {
            cache.appendChild(point(i, Numbers.format(values.get(i))));
        }
        return cache;
    }

    private XmlElement point(int idx, String value) {
        return naming.element("pt")
                .setAttribute("idx", Integer.toString(idx))
                .appendChild(naming.textElement("v", value));
    }

    /**
     * Absolute reference on the data sheet, zero-based rows and columns.
     */
    String reference(int firstRow, int firstCol, int lastRow, int lastCol) {
        CellReference first = new CellReference(sheetName, firstRow, firstCol, true, true);
        if (firstRow == lastRow && firstCol == lastCol) {
            return first.formatAsString();
        }
        CellReference last = new CellReference(sheetName, lastRow, lastCol, true, true);
        return new AreaReference(first, last, SpreadsheetVersion.EXCEL2007).formatAsString();
    }

    private void copyStyle(XmlElement previous, XmlElement target, Set<String> localNames) {
        if (previous == null) {
            return;
        }
        for (XmlElement child : previous.getChildElements()) {
            if (localNames.contains(child.getLocalName())) {
                target.appendChild(child);
            }
        }
    }
}
