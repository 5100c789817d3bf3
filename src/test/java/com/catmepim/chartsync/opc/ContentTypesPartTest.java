package com.catmepim.chartsync.opc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

class ContentTypesPartTest {

    private static final String TYPES = "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>"
            + "<Types xmlns=\"http://schemas.openxmlformats.org/package/2006/content-types\">"
            + "<Default Extension=\"xml\" ContentType=\"application/xml\"/>"
            + "<Override PartName=\"/word/charts/chart1.xml\" ContentType=\"" + ContentTypesPart.CHART_CONTENT_TYPE + "\"/>"
            + "</Types>";

    @Test
    void overridesAreAddedOnce() throws IOException {
        ContentTypesPart types = ContentTypesPart.parse(TYPES.getBytes(StandardCharsets.UTF_8));

        assertTrue(types.addOverride("word/charts/chart2.xml", ContentTypesPart.CHART_CONTENT_TYPE));
        assertFalse(types.addOverride("word/charts/chart2.xml", "application/other"));
        assertFalse(types.addOverride("word/charts/chart1.xml", ContentTypesPart.CHART_CONTENT_TYPE));

        ContentTypesPart reparsed = ContentTypesPart.parse(types.toBytes());
        assertEquals(ContentTypesPart.CHART_CONTENT_TYPE, reparsed.getOverride("word/charts/chart2.xml"));
        assertNull(reparsed.getOverride("word/charts/chart3.xml"));
    }

    @Test
    void defaultsAreInsertedBeforeOverrides() throws IOException {
        ContentTypesPart types = ContentTypesPart.parse(TYPES.getBytes(StandardCharsets.UTF_8));

        assertTrue(types.addDefault("xlsx", ContentTypesPart.WORKBOOK_CONTENT_TYPE));
        assertFalse(types.addDefault("XLSX", "application/other"));

        String xml = new String(types.toBytes(), StandardCharsets.UTF_8);
        assertTrue(xml.indexOf("Extension=\"xlsx\"") < xml.indexOf("<Override"), xml);
        assertEquals("application/xml", types.getDefault("xml"));
    }
}
