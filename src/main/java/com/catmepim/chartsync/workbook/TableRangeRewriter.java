package com.catmepim.chartsync.workbook;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.catmepim.chartsync.xml.TagNaming;
import com.catmepim.chartsync.xml.XmlDocument;
import com.catmepim.chartsync.xml.XmlElement;

/**
 * Re-fits a worksheet table ({@code xl/tables/table*.xml}) to the rewritten data grid:
 * the table range, its auto-filter range and its columns, whose names must equal the
 * header cells of row 1.
 */
final class TableRangeRewriter {

    private TableRangeRewriter() {
    }

    /**
     * @param table parsed table part
     * @param extent new range, e.g. {@code A1:C4}
     * @param headers header cell texts of row 1, column A first
     */
    static void rewrite(XmlDocument table, String extent, List<String> headers) {
        XmlElement root = table.getRoot();
        TagNaming naming = TagNaming.detect(root);
        root.setAttribute("ref", extent);

        XmlElement autoFilter = root.firstChild(naming.tag("autoFilter"));
        if (autoFilter != null) {
            autoFilter.setAttribute("ref", extent);
        }

        XmlElement tableColumns = root.firstChild(naming.tag("tableColumns"));
        if (tableColumns == null) {
            tableColumns = naming.element("tableColumns");
            root.insertChild(columnsPosition(root, naming), tableColumns);
        }
        List<XmlElement> existing = tableColumns.childrenNamed(naming.tag("tableColumn"));
        int nextId = 1;
        for (XmlElement column : existing) {
            nextId = Math.max(nextId, parseId(column.getAttribute("id")) + 1);
        }

        for (int i = headers.size(); i < existing.size(); i++) {
            tableColumns.removeChild(existing.get(i));
        }
        Set<String> used = new HashSet<>();
        for (int i = 0; i < headers.size(); i++) {
            String name = uniqueName(headers.get(i), used);
            if (i < existing.size()) {
                existing.get(i).setAttribute("name", name);
            } else {
                tableColumns.appendChild(naming.element("tableColumn")
                        .setAttribute("id", Integer.toString(nextId++))
                        .setAttribute("name", name));
            }
        }
        tableColumns.setAttribute("count", Integer.toString(headers.size()));
    }

    /**
     * {@code tableColumns} follows {@code autoFilter} and {@code sortState} when they exist.
     */
    private static int columnsPosition(XmlElement root, TagNaming naming) {
        int position = 0;
        for (XmlElement child : root.getChildElements()) {
            if (naming.matches(child, "autoFilter") || naming.matches(child, "sortState")) {
                position = root.indexOf(child) + 1;
            }
        }
        return position;
    }

    /**
     * Column names are unique within a table; duplicates get a numeric suffix.
     */
    private static String uniqueName(String header, Set<String> used) {
        String name = header;
        int suffix = 2;
        while (!used.add(name.toLowerCase())) {
            name = header + suffix++;
        }
        return name;
    }

    private static int parseId(String id) {
        try {
            return id == null ? 0 : Integer.parseInt(id.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
