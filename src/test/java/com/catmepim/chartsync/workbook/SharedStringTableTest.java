package com.catmepim.chartsync.workbook;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;

import org.junit.jupiter.api.Test;

import com.catmepim.chartsync.DocxFixtures;

class SharedStringTableTest {

    private static final String SST = "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>"
            + "<sst xmlns=\"http://schemas.openxmlformats.org/spreadsheetml/2006/main\" count=\"5\" uniqueCount=\"2\">"
            + "<si><t>Critical</t></si>"
            + "<si><r><rPr><b/></rPr><t>Rich</t></r><r><t xml:space=\"preserve\"> text</t></r></si>"
            + "</sst>";

    @Test
    void readsPlainAndRichItems() throws IOException {
        SharedStringTable table = SharedStringTable.parse(DocxFixtures.bytes(SST), "xl/sharedStrings.xml");

        assertEquals(2, table.size());
        assertEquals("Critical", table.get(0));
        assertEquals("Rich text", table.get(1));
        assertNull(table.get(2));
    }

    @Test
    void internReusesExactMatchesAndAppendsTheRest() throws IOException {
        SharedStringTable table = SharedStringTable.parse(DocxFixtures.bytes(SST), "xl/sharedStrings.xml");

        assertEquals(0, table.intern("Critical"));
        assertEquals(2, table.intern("critical"));
        assertEquals(3, table.intern(" padded "));
        assertEquals(2, table.intern("critical"));

        String xml = DocxFixtures.string(table.toBytes());
        assertTrue(xml.contains("count=\"4\" uniqueCount=\"4\""), xml);
        assertTrue(xml.contains("<si><t xml:space=\"preserve\"> padded </t></si>"), xml);
        assertTrue(xml.indexOf("<t>Critical</t>") < xml.indexOf("<t>critical</t>"));
    }
}
