package com.catmepim.chartsync.workbook;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.catmepim.chartsync.xml.TagNaming;
import com.catmepim.chartsync.xml.XmlDocument;
import com.catmepim.chartsync.xml.XmlElement;
import com.catmepim.chartsync.xml.XmlTreeParser;

/**
 * The workbook's shared string table ({@code xl/sharedStrings.xml}).
 * <p>
 * Append-only: existing entries are never removed, reordered or rewritten, so indices
 * referenced by cells this update does not touch stay valid. Lookup is by exact value;
 * the first entry with a given text wins.
 *
 * @invariant size() never decreases
 */
public final class SharedStringTable {

    private final XmlDocument document;
    private final TagNaming naming;
    private final List<String> entries = new ArrayList<>();
    private final Map<String, Integer> indexByValue = new HashMap<>();

    private SharedStringTable(XmlDocument document) {
        this.document = document;
        this.naming = TagNaming.detect(document.getRoot());
        for (XmlElement si : document.getRoot().childrenNamed(naming.tag("si"))) {
            String text = itemText(si);
            indexByValue.putIfAbsent(text, entries.size());
            entries.add(text);
        }
    }

    public static SharedStringTable parse(byte[] raw, String partName) throws IOException {
        XmlDocument doc = XmlTreeParser.parse(raw, partName);
        if (!"sst".equals(doc.getRoot().getLocalName())) {
            throw new IOException("Not a shared string table: " + partName);
        }
        return new SharedStringTable(doc);
    }

    /**
     * Returns the index of {@code value}, appending it when absent.
     */
    public int intern(String value) {
        Integer existing = indexByValue.get(value);
        if (existing != null) {
            return existing;
        }
        XmlElement t = naming.textElement("t", value);
        if (!value.equals(value.trim())) {
            t.setAttribute("xml:space", "preserve");
        }
        document.getRoot().appendChild(naming.element("si").appendChild(t));
        int index = entries.size();
        entries.add(value);
        indexByValue.put(value, index);
        return index;
    }

    /**
     * @return the text at {@code index}, or null if out of range
     */
    public String get(int index) {
        return index >= 0 && index < entries.size() ? entries.get(index) : null;
    }

    public int size() {
        return entries.size();
    }

    /**
     * Serializes the table with {@code count} and {@code uniqueCount} set to the entry count.
     */
    public byte[] toBytes() {
        String n = Integer.toString(entries.size());
        document.getRoot().setAttribute("count", n).setAttribute("uniqueCount", n);
        return document.toBytes();
    }

    /**
     * Plain text of an item: its {@code t}, or the concatenated {@code t} of its rich runs.
     * Phonetic runs are not part of the value.
     */
    private String itemText(XmlElement si) {
        XmlElement t = si.firstChild(naming.tag("t"));
        if (t != null) {
            return t.getText();
        }
        StringBuilder sb = new StringBuilder();
        for (XmlElement run : si.childrenNamed(naming.tag("r"))) {
            XmlElement rt = run.firstChild(naming.tag("t"));
            if (rt != null) {
                sb.append(rt.getText());
            }
        }
        return sb.toString();
    }
}
