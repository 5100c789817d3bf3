package com.catmepim.chartsync.workbook;

import java.util.List;

import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.ss.util.CellReference;

import com.catmepim.chartsync.chart.Numbers;
import com.catmepim.chartsync.exception.ChartSyncException;
import com.catmepim.chartsync.exception.ErrorCode;
import com.catmepim.chartsync.model.ChartData;
import com.catmepim.chartsync.model.SeriesData;
import com.catmepim.chartsync.xml.TagNaming;
import com.catmepim.chartsync.xml.XmlDocument;
import com.catmepim.chartsync.xml.XmlElement;

/**
 * Writes chart data into a worksheet's cell grid.
 * <p>
 * Layout: series names in row 1 from column B, categories in column A from row 2, the
 * value of category {@code i} and series {@code j} at row {@code i + 2}, column {@code j + 2}.
 * String cells reference the shared string table when the workbook has one and are
 * written inline otherwise.
 */
final class WorksheetGridWriter {

    private final XmlDocument sheet;
    private final TagNaming naming;
    private final SharedStringTable sharedStrings;

    /**
     * @param sharedStrings table to intern strings into, or null for inline strings
     */
    WorksheetGridWriter(XmlDocument sheet, SharedStringTable sharedStrings) {
        this.sheet = sheet;
        this.naming = TagNaming.detect(sheet.getRoot());
        this.sharedStrings = sharedStrings;
    }

    /**
     * @return the data extent as an A1 range, e.g. {@code A1:C4}
     */
    static String extent(ChartData data) {
        return new CellRangeAddress(0, data.getCategories().size(), 0, data.getSeries().size()).formatAsString();
    }

    /**
     * Text of an existing cell, resolving shared and inline strings.
     *
     * @return the text, or null if the cell does not exist
     */
    String cellText(String ref) {
        XmlElement sheetData = sheetData();
        for (XmlElement row : sheetData.childrenNamed(naming.tag("row"))) {
            for (XmlElement c : row.childrenNamed(naming.tag("c"))) {
                if (ref.equals(c.getAttribute("r"))) {
                    return textOf(c);
                }
            }
        }
        return null;
    }

    /**
     * Replaces the content of {@code sheetData} and updates {@code dimension} and the
     * sheet-level {@code autoFilter} to the new extent.
     *
     * @param cornerLabel text for A1, or null to leave A1 empty
     */
    void write(ChartData data, String cornerLabel) {
        XmlElement sheetData = sheetData();
        sheetData.removeChildren();

        List<SeriesData> series = data.getSeries();
        List<String> categories = data.getCategories();

        XmlElement header = row(1);
        if (cornerLabel != null) {
            header.appendChild(stringCell(0, 0, cornerLabel));
        }
        for (int s = 0; s < series.size(); s++) {
            header.appendChild(stringCell(0, s + 1, series.get(s).getName()));
        }
        sheetData.appendChild(header);

        for (int i = 0; i < categories.size(); i++) {
            XmlElement row = row(i + 2);
            row.appendChild(stringCell(i + 1, 0, categories.get(i)));
            for (int s = 0; s < series.size(); s++) {
                row.appendChild(numberCell(i + 1, s + 1, series.get(s).getValues().get(i)));
            }
            sheetData.appendChild(row);
        }

        String extent = extent(data);
        XmlElement dimension = sheet.getRoot().firstChild(naming.tag("dimension"));
        if (dimension != null) {
            dimension.setAttribute("ref", extent);
        }
        XmlElement autoFilter = sheet.getRoot().firstChild(naming.tag("autoFilter"));
        if (autoFilter != null) {
            autoFilter.setAttribute("ref", extent);
        }
    }

    private XmlElement sheetData() {
        XmlElement sheetData = sheet.getRoot().firstChild(naming.tag("sheetData"));
        if (sheetData == null) {
            throw new ChartSyncException(ErrorCode.INVALID_WORKBOOK, "Worksheet has no sheetData element");
        }
        return sheetData;
    }

    private XmlElement row(int rowNumber) {
        return naming.element("row").setAttribute("r", Integer.toString(rowNumber));
    }

    private XmlElement stringCell(int row, int col, String value) {
        XmlElement c = naming.element("c").setAttribute("r", new CellReference(row, col).formatAsString());
        if (sharedStrings != null) {
            c.setAttribute("t", "s");
            c.appendChild(naming.textElement("v", Integer.toString(sharedStrings.intern(value))));
        } else {
            c.setAttribute("t", "inlineStr");
            XmlElement t = naming.textElement("t", value);
            if (!value.equals(value.trim())) {
                t.setAttribute("xml:space", "preserve");
            }
            c.appendChild(naming.element("is").appendChild(t));
        }
        return c;
    }

    private XmlElement numberCell(int row, int col, double value) {
        return naming.element("c")
                .setAttribute("r", new CellReference(row, col).formatAsString())
                .appendChild(naming.textElement("v", Numbers.format(value)));
    }

    private String textOf(XmlElement c) {
        String type = c.getAttribute("t");
        if ("inlineStr".equals(type)) {
            XmlElement is = c.firstChild(naming.tag("is"));
            if (is == null) {
                return "";
            }
            XmlElement t = is.firstChild(naming.tag("t"));
            if (t != null) {
                return t.getText();
            }
            StringBuilder sb = new StringBuilder();
            for (XmlElement r : is.childrenNamed(naming.tag("r"))) {
                XmlElement rt = r.firstChild(naming.tag("t"));
                sb.append(rt == null ? "" : rt.getText());
            }
            return sb.toString();
        }
        XmlElement v = c.firstChild(naming.tag("v"));
        String raw = v == null ? "" : v.getText();
        if ("s".equals(type) && sharedStrings != null) {
            try {
                String text = sharedStrings.get(Integer.parseInt(raw.trim()));
                return text == null ? "" : text;
            } catch (NumberFormatException e) {
                return "";
            }
        }
        return raw;
    }
}
