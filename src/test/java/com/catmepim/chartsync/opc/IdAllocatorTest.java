package com.catmepim.chartsync.opc;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

class IdAllocatorTest {

    @Test
    void relationshipIdsFollowTheHighestExistingNumber() {
        assertEquals(12, IdAllocator.scanMax(IdAllocator.Family.RELATIONSHIP_ID,
                Arrays.asList("rId1", "rId12", "rId3", "rIdX", "customId99")));
    }

    @Test
    void chartIndexIgnoresOtherFiles() {
        IdAllocator allocator = new IdAllocator();

        int next = allocator.nextChartIndex(Arrays.asList("chart1.xml", "chart7.xml", "colors7.xml", "style2.xml",
                "chart3.xml.bak"));

        assertEquals(8, next);
    }

    @Test
    void drawingObjectIdsAreFoundWithAnyPrefix() {
        String xml = "<w:body><wp:docPr id=\"4\" name=\"Chart 1\"/><docPr name=\"x\" id=\"17\"/>"
                + "<pic:cNvPr id=\"99\"/></w:body>";

        assertEquals(17, IdAllocator.scanMax(IdAllocator.Family.DRAWING_OBJECT_ID, Collections.singletonList(xml)));
    }

    @Test
    void drawingObjectIdsAboveSignedIntRangeAreAccepted() {
        String xml = "<w:body><wp:docPr id=\"3000000000\" name=\"Chart 1\"/><wp:docPr id=\"7\"/></w:body>";

        assertEquals(3000000000L, IdAllocator.scanMax(IdAllocator.Family.DRAWING_OBJECT_ID,
                Collections.singletonList(xml)));
        assertEquals(3000000001L, new IdAllocator().nextDrawingObjectId("word/document.xml", xml));
    }

    @Test
    void bookmarkIdsAreScanned() {
        String xml = "<w:bookmarkStart w:id=\"3\" w:name=\"a\"/><w:bookmarkEnd w:id=\"3\"/>"
                + "<w:bookmarkStart w:name=\"b\" w:id=\"8\"/>";

        assertEquals(9, new IdAllocator().nextBookmarkId("word/document.xml", xml));
    }

    @Test
    void emptyScopesStartAtOne() {
        IdAllocator allocator = new IdAllocator();

        assertEquals("rId1", allocator.nextRelationshipId("word/_rels/document.xml.rels", RelationshipsPart.empty()));
        assertEquals(1, allocator.nextChartIndex(Collections.<String>emptyList()));
    }

    @Test
    void numbersAreNeverIssuedTwiceInOneSession() {
        IdAllocator allocator = new IdAllocator();

        assertEquals(3, allocator.next(IdAllocator.Family.CHART_PART, "word/charts",
                Arrays.asList("chart1.xml", "chart2.xml")));
        // chart3 was never written, or was removed again
        assertEquals(4, allocator.next(IdAllocator.Family.CHART_PART, "word/charts",
                Arrays.asList("chart1.xml", "chart2.xml")));
    }

    @Test
    void scopesAreIndependent() {
        IdAllocator allocator = new IdAllocator();

        assertEquals(5, allocator.next(IdAllocator.Family.RELATIONSHIP_ID, "a.rels", Arrays.asList("rId4")));
        assertEquals(2, allocator.next(IdAllocator.Family.RELATIONSHIP_ID, "b.rels", Arrays.asList("rId1")));
        assertEquals(6, allocator.next(IdAllocator.Family.RELATIONSHIP_ID, "a.rels", Arrays.asList("rId4")));
    }
}
