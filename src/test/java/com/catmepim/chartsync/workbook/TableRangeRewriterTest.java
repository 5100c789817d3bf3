package com.catmepim.chartsync.workbook;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.Arrays;

import org.junit.jupiter.api.Test;

import com.catmepim.chartsync.DocxFixtures;
import com.catmepim.chartsync.xml.XmlDocument;
import com.catmepim.chartsync.xml.XmlTreeParser;

class TableRangeRewriterTest {

    private static XmlDocument table(String columns) throws IOException {
        return XmlTreeParser.parse(DocxFixtures.bytes(
                "<table xmlns=\"http://schemas.openxmlformats.org/spreadsheetml/2006/main\" id=\"1\" name=\"Table1\""
                        + " displayName=\"Table1\" ref=\"A1:D3\"><autoFilter ref=\"A1:D3\"/>" + columns
                        + "<tableStyleInfo name=\"TableStyleMedium2\"/></table>"), "xl/tables/table1.xml");
    }

    @Test
    void shrinksRangeAndColumns() throws IOException {
        XmlDocument doc = table("<tableColumns count=\"4\"><tableColumn id=\"1\" name=\"Category\"/>"
                + "<tableColumn id=\"2\" name=\"A\"/><tableColumn id=\"3\" name=\"B\"/><tableColumn id=\"4\" name=\"C\"/>"
                + "</tableColumns>");

        TableRangeRewriter.rewrite(doc, "A1:B6", Arrays.asList("Category", "Sales"));
        String xml = doc.getRoot().toXml();

        assertTrue(xml.contains("ref=\"A1:B6\"><autoFilter ref=\"A1:B6\"/>"), xml);
        assertTrue(xml.contains("<tableColumns count=\"2\"><tableColumn id=\"1\" name=\"Category\"/>"
                + "<tableColumn id=\"2\" name=\"Sales\"/></tableColumns>"), xml);
    }

    @Test
    void growsColumnsWithFreshIdsAndUniqueNames() throws IOException {
        XmlDocument doc = table("<tableColumns count=\"2\"><tableColumn id=\"1\" name=\"Category\"/>"
                + "<tableColumn id=\"5\" name=\"A\"/></tableColumns>");

        TableRangeRewriter.rewrite(doc, "A1:D3", Arrays.asList(" ", "Sales", "sales"));
        String xml = doc.getRoot().toXml();

        assertTrue(xml.contains("<tableColumn id=\"1\" name=\" \"/><tableColumn id=\"5\" name=\"Sales\"/>"
                + "<tableColumn id=\"6\" name=\"sales2\"/>"), xml);
        assertTrue(xml.contains("count=\"3\""));
    }

    @Test
    void createsMissingColumnList() throws IOException {
        XmlDocument doc = table("");

        TableRangeRewriter.rewrite(doc, "A1:B2", Arrays.asList("Category", "Sales"));
        String xml = doc.getRoot().toXml();

        assertEquals(xml.indexOf("<autoFilter") + "<autoFilter ref=\"A1:B2\"/>".length(), xml.indexOf("<tableColumns"));
        assertTrue(xml.contains("<tableColumn id=\"2\" name=\"Sales\"/>"), xml);
    }
}
