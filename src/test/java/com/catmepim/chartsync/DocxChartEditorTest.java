package com.catmepim.chartsync;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.catmepim.chartsync.exception.ChartSyncException;
import com.catmepim.chartsync.exception.ErrorCode;
import com.catmepim.chartsync.exception.InvalidChartDataException;
import com.catmepim.chartsync.exception.PartResolutionException;
import com.catmepim.chartsync.model.ChartData;
import com.catmepim.chartsync.model.ChartKind;
import com.catmepim.chartsync.model.ChartUpdateResult;
import com.catmepim.chartsync.model.SeriesData;
import com.catmepim.chartsync.model.TitleUpdate;
import com.catmepim.chartsync.opc.ContentTypesPart;
import com.catmepim.chartsync.opc.DocxPackage;
import com.catmepim.chartsync.opc.RelationshipsPart;

class DocxChartEditorTest {

    private static final String CHART1 = "word/charts/chart1.xml";
    private static final String CHART2 = "word/charts/chart2.xml";
    private static final String WORKBOOK1 = "word/embeddings/Microsoft_Excel_Worksheet1.xlsx";
    private static final String WORKBOOK2 = "word/embeddings/Microsoft_Excel_Worksheet2.xlsx";

    @TempDir
    Path tempDir;

    private Path singleChartDocx() throws IOException {
        return DocxFixtures.docx()
                .chart(DocxFixtures.barChart(DocxFixtures.sampleData()), DocxFixtures.workbook(DocxFixtures.sampleData()))
                .writeTo(tempDir.resolve("single.docx"));
    }

    private Path twoChartDocx() throws IOException {
        return DocxFixtures.docx()
                .chart(DocxFixtures.barChart(DocxFixtures.sampleData()), DocxFixtures.workbook(DocxFixtures.sampleData()))
                .chart(DocxFixtures.lineChart(DocxFixtures.sampleData()), DocxFixtures.workbook(DocxFixtures.sampleData()))
                .writeTo(tempDir.resolve("two.docx"));
    }

    @Test
    void countsCharts() throws IOException {
        try (DocxChartEditor editor = DocxChartEditor.open(twoChartDocx())) {
            assertEquals(2, editor.getChartCount());
            assertEquals(ChartKind.BAR, editor.readChart(1).getKind());
            assertEquals(ChartKind.LINE, editor.readChart(2).getKind());
        }
    }

    @Test
    void readsCachedData() throws IOException {
        try (DocxChartEditor editor = DocxChartEditor.open(singleChartDocx())) {
            assertEquals(DocxFixtures.sampleData(), editor.getChartData(1));
        }
    }

    @Test
    void updateRewritesChartAndWorkbook() throws IOException {
        Path out = tempDir.resolve("out.docx");
        try (DocxChartEditor editor = DocxChartEditor.open(singleChartDocx())) {
            ChartUpdateResult result = editor.updateChart(1, DocxFixtures.scenarioAData());

            assertEquals(2, result.getSeriesCount());
            assertEquals(WORKBOOK1, result.getWorkbookPart());
            assertEquals(TitleUpdate.NOT_REQUESTED, result.getChartTitle());
            editor.save(out);
        }

        try (DocxChartEditor reopened = DocxChartEditor.open(out)) {
            ChartData read = reopened.getChartData(1);
            assertEquals(DocxFixtures.scenarioAData().getCategories(), read.getCategories());
            assertEquals(DocxFixtures.scenarioAData().getSeries(), read.getSeries());
            assertEquals("Defects", read.getChartTitle());

            String chart = DocxFixtures.string(reopened.getPackage().read(CHART1));
            assertTrue(chart.contains("<c:f>Sheet1!$A$2:$A$4</c:f>"), chart);
            assertTrue(chart.contains("<c:f>Sheet1!$C$2:$C$4</c:f>"), chart);

            try (XSSFWorkbook wb = new XSSFWorkbook(new ByteArrayInputStream(reopened.getPackage().read(WORKBOOK1)))) {
                XSSFSheet sheet = wb.getSheet("Sheet1");
                assertEquals("Critical", sheet.getRow(0).getCell(1).getStringCellValue());
                assertEquals("Non-critical", sheet.getRow(0).getCell(2).getStringCellValue());
                assertEquals("Device A", sheet.getRow(1).getCell(0).getStringCellValue());
                assertEquals("Device C", sheet.getRow(3).getCell(0).getStringCellValue());
                assertEquals(4.0, sheet.getRow(1).getCell(1).getNumericCellValue());
                assertEquals(6.0, sheet.getRow(3).getCell(2).getNumericCellValue());
            }
        }
    }

    @Test
    void titlesAreAppliedWhenSupplied() throws IOException {
        try (DocxChartEditor editor = DocxChartEditor.open(singleChartDocx())) {
            ChartUpdateResult result = editor.updateChart(1,
                    DocxFixtures.scenarioAData().withTitles("Defects by device", "Device", "Defects"));

            assertEquals(TitleUpdate.UPDATED, result.getChartTitle());
            assertEquals(TitleUpdate.UPDATED, result.getCategoryAxisTitle());
            assertEquals(TitleUpdate.UPDATED, result.getValueAxisTitle());
            assertFalse(result.hasIgnoredTitles());

            ChartData read = editor.getChartData(1);
            assertEquals("Defects by device", read.getChartTitle());
            assertEquals("Device", read.getCategoryAxisTitle());
            assertEquals("Defects", read.getValueAxisTitle());
        }
    }

    @Test
    void invalidDataLeavesPartsUntouched() throws IOException {
        try (DocxChartEditor editor = DocxChartEditor.open(singleChartDocx())) {
            DocxPackage pkg = editor.getPackage();
            byte[] chartBefore = pkg.read(CHART1);
            byte[] workbookBefore = pkg.read(WORKBOOK1);

            ChartData mismatched = new ChartData(Arrays.asList("A", "B", "C"),
                    Collections.singletonList(SeriesData.of("Critical", 1, 2)));
            InvalidChartDataException e = assertThrows(InvalidChartDataException.class,
                    () -> editor.updateChart(1, mismatched));

            assertEquals(ErrorCode.INVALID_CHART_DATA, e.getCode());
            assertArrayEquals(chartBefore, pkg.read(CHART1));
            assertArrayEquals(workbookBefore, pkg.read(WORKBOOK1));
        }
    }

    @Test
    void unusableWorkbookLeavesChartUntouched() throws IOException {
        Path docx = DocxFixtures.docx()
                .chart(DocxFixtures.barChart(DocxFixtures.sampleData()), DocxFixtures.bytes("not a workbook"))
                .writeTo(tempDir.resolve("broken.docx"));
        try (DocxChartEditor editor = DocxChartEditor.open(docx)) {
            byte[] chartBefore = editor.getPackage().read(CHART1);

            assertThrows(ChartSyncException.class, () -> editor.updateChart(1, DocxFixtures.scenarioAData()));

            assertArrayEquals(chartBefore, editor.getPackage().read(CHART1));
        }
    }

    @Test
    void updatingOneChartLeavesTheOtherAlone() throws IOException {
        try (DocxChartEditor editor = DocxChartEditor.open(twoChartDocx())) {
            DocxPackage pkg = editor.getPackage();
            byte[] chart1 = pkg.read(CHART1);
            byte[] workbook1 = pkg.read(WORKBOOK1);
            byte[] workbook2 = pkg.read(WORKBOOK2);

            editor.updateChart(2, DocxFixtures.scenarioAData());

            assertArrayEquals(chart1, pkg.read(CHART1));
            assertArrayEquals(workbook1, pkg.read(WORKBOOK1));
            assertFalse(Arrays.equals(workbook2, pkg.read(WORKBOOK2)));
            assertEquals(DocxFixtures.scenarioAData().getSeries(), editor.getChartData(2).getSeries());
        }
    }

    @Test
    void copyThenUpdateWithFewerSeries() throws IOException {
        try (DocxChartEditor editor = DocxChartEditor.open(singleChartDocx())) {
            int copy = editor.copyChart(1);
            assertEquals(2, copy);
            assertEquals(2, editor.getChartCount());

            ChartData oneSeries = new ChartData(Arrays.asList("Device A", "Device B"),
                    Collections.singletonList(SeriesData.of("Total", 5, 9)));
            editor.updateChart(copy, oneSeries);

            String copied = DocxFixtures.string(editor.getPackage().read(CHART2));
            String source = DocxFixtures.string(editor.getPackage().read(CHART1));
            assertEquals(1, DocxFixtures.countOccurrences(copied, "<c:ser>"));
            assertEquals(2, DocxFixtures.countOccurrences(source, "<c:ser>"));
            assertEquals(DocxFixtures.sampleData(), editor.getChartData(1));
        }
    }

    @Test
    void copyOwnsItsWorkbook() throws IOException {
        try (DocxChartEditor editor = DocxChartEditor.open(singleChartDocx())) {
            int copy = editor.copyChart(1);

            assertEquals(WORKBOOK1, editor.resolveWorkbook(1).getWorkbookPart());
            assertEquals(WORKBOOK2, editor.resolveWorkbook(copy).getWorkbookPart());
            assertArrayEquals(editor.getPackage().read(WORKBOOK1), editor.getPackage().read(WORKBOOK2));

            editor.updateChart(copy, DocxFixtures.scenarioAData());

            assertNotEquals(DocxFixtures.string(editor.getPackage().read(WORKBOOK1)),
                    DocxFixtures.string(editor.getPackage().read(WORKBOOK2)));
            assertEquals(DocxFixtures.sampleData(), editor.getChartData(1));
        }
    }

    @Test
    void copyPlacesNewDrawingAfterSourceParagraph() throws IOException {
        try (DocxChartEditor editor = DocxChartEditor.open(singleChartDocx())) {
            editor.copyChart(1);
            DocxPackage pkg = editor.getPackage();

            String document = DocxFixtures.string(pkg.read(DocxPackage.DOCUMENT_PART));
            int source = document.indexOf("r:id=\"rId2\"");
            int copy = document.indexOf("r:id=\"rId3\"");
            int after = document.indexOf("After chart 1");
            assertTrue(source >= 0 && source < copy && copy < after, document);
            assertTrue(document.contains("<wp:docPr id=\"2\" name=\"Chart 2\"/>"), document);
            assertTrue(document.contains("wp14:anchorId="), document);
            assertEquals(2, DocxFixtures.countOccurrences(document, "<w:drawing>"));

            RelationshipsPart rels = RelationshipsPart.parse(pkg.read(DocxPackage.DOCUMENT_RELS_PART),
                    DocxPackage.DOCUMENT_RELS_PART);
            assertEquals("charts/chart2.xml", rels.findById("rId3").getTarget());

            ContentTypesPart types = ContentTypesPart.parse(pkg.read(ContentTypesPart.PART_NAME));
            assertEquals(ContentTypesPart.CHART_CONTENT_TYPE, types.getOverride(CHART2));
        }
    }

    @Test
    void copyOmitsWp14WhenUndeclared() throws IOException {
        Path docx = DocxFixtures.docx()
                .chart(DocxFixtures.barChart(DocxFixtures.sampleData()), DocxFixtures.workbook(DocxFixtures.sampleData()))
                .withoutWp14()
                .writeTo(tempDir.resolve("plain.docx"));
        try (DocxChartEditor editor = DocxChartEditor.open(docx)) {
            editor.copyChart(1);

            String document = DocxFixtures.string(editor.getPackage().read(DocxPackage.DOCUMENT_PART));
            assertFalse(document.contains("wp14:"), document);
        }
    }

    @Test
    void copyDuplicatesChartStylePart() throws IOException {
        Path docx = DocxFixtures.docx()
                .chart(DocxFixtures.barChart(DocxFixtures.sampleData()), DocxFixtures.workbook(DocxFixtures.sampleData()))
                .chartRelationship(1, "<Relationship Id=\"rId2\""
                        + " Type=\"http://schemas.microsoft.com/office/2011/relationships/chartStyle\""
                        + " Target=\"style1.xml\"/>")
                .part("word/charts/style1.xml",
                        "<cs:chartStyle xmlns:cs=\"http://schemas.microsoft.com/office/drawing/2012/chartStyle\" id=\"201\"/>")
                .writeTo(tempDir.resolve("styled.docx"));
        try (DocxChartEditor editor = DocxChartEditor.open(docx)) {
            editor.copyChart(1);
            DocxPackage pkg = editor.getPackage();

            RelationshipsPart rels = RelationshipsPart.parse(pkg.read("word/charts/_rels/chart2.xml.rels"),
                    "word/charts/_rels/chart2.xml.rels");
            assertEquals("style2.xml", rels.findById("rId2").getTarget());
            assertEquals("../embeddings/Microsoft_Excel_Worksheet2.xlsx", rels.findById("rId1").getTarget());
            assertArrayEquals(pkg.read("word/charts/style1.xml"), pkg.read("word/charts/style2.xml"));
        }
    }

    @Test
    void copyHandlesDrawingIdsBeyondSignedIntRange() throws IOException {
        Path docx = DocxFixtures.docx()
                .chart(DocxFixtures.barChart(DocxFixtures.sampleData()), DocxFixtures.workbook(DocxFixtures.sampleData()))
                .docPrIdsFrom(3000000000L)
                .writeTo(tempDir.resolve("large-ids.docx"));
        try (DocxChartEditor editor = DocxChartEditor.open(docx)) {
            assertEquals(2, editor.copyChart(1));

            String document = DocxFixtures.string(editor.getPackage().read(DocxPackage.DOCUMENT_PART));
            assertEquals(1, DocxFixtures.countOccurrences(document, "docPr id=\"3000000000\""));
            assertEquals(1, DocxFixtures.countOccurrences(document, "docPr id=\"3000000001\""));
        }
    }

    @Test
    void copyRejectsChartPartsReachingOutsideThePackage() throws IOException {
        Path docx = DocxFixtures.docx()
                .chart(DocxFixtures.barChart(DocxFixtures.sampleData()), DocxFixtures.workbook(DocxFixtures.sampleData()))
                .chartRelationship(1, "<Relationship Id=\"rId2\""
                        + " Type=\"http://schemas.microsoft.com/office/2011/relationships/chartStyle\""
                        + " Target=\"../../../outside.xml\"/>")
                .writeTo(tempDir.resolve("escaping.docx"));
        try (DocxChartEditor editor = DocxChartEditor.open(docx)) {
            PartResolutionException e = assertThrows(PartResolutionException.class, () -> editor.copyChart(1));

            assertEquals(ErrorCode.RELATIONSHIP_NOT_FOUND, e.getCode());
            assertEquals(1, e.getContext().get("chartIndex"));
            assertEquals("rId2", e.getContext().get("relationshipId"));
            assertFalse(editor.getPackage().exists(CHART2));
            assertEquals(1, editor.getChartCount());
        }
    }

    @Test
    void twoCopiesGetDistinctIdentifiers() throws IOException {
        try (DocxChartEditor editor = DocxChartEditor.open(singleChartDocx())) {
            assertEquals(2, editor.copyChart(1));
            assertEquals(3, editor.copyChart(1));

            String document = DocxFixtures.string(editor.getPackage().read(DocxPackage.DOCUMENT_PART));
            assertEquals(1, DocxFixtures.countOccurrences(document, "docPr id=\"2\""));
            assertEquals(1, DocxFixtures.countOccurrences(document, "docPr id=\"3\""));
            assertEquals(1, DocxFixtures.countOccurrences(document, "r:id=\"rId4\""));
            assertEquals(WORKBOOK1, editor.resolveWorkbook(1).getWorkbookPart());
            assertEquals("word/embeddings/Microsoft_Excel_Worksheet3.xlsx", editor.resolveWorkbook(3).getWorkbookPart());
        }
    }

    @Test
    void savedCopySurvivesReopen() throws IOException {
        Path out = tempDir.resolve("copied.docx");
        try (DocxChartEditor editor = DocxChartEditor.open(singleChartDocx())) {
            int copy = editor.copyChart(1);
            editor.updateChart(copy, DocxFixtures.scenarioAData());
            editor.save(out);
        }

        try (DocxChartEditor reopened = DocxChartEditor.open(out)) {
            assertEquals(2, reopened.getChartCount());
            assertEquals(DocxFixtures.sampleData(), reopened.getChartData(1));
            assertEquals(DocxFixtures.scenarioAData().getSeries(), reopened.getChartData(2).getSeries());
        }
    }

    @Test
    void missingChartIsReported() throws IOException {
        try (DocxChartEditor editor = DocxChartEditor.open(singleChartDocx())) {
            PartResolutionException e = assertThrows(PartResolutionException.class,
                    () -> editor.updateChart(4, DocxFixtures.scenarioAData()));
            assertEquals(ErrorCode.CHART_NOT_FOUND, e.getCode());
            assertEquals(4, e.getContext().get("chartIndex"));

            assertThrows(PartResolutionException.class, () -> editor.getChartData(0));
            assertThrows(PartResolutionException.class, () -> editor.copyChart(2));
        }
    }

    @Test
    void closeRemovesWorkingDirectory() throws IOException {
        DocxChartEditor editor = DocxChartEditor.open(singleChartDocx());
        Path root = editor.getPackage().getRoot();
        assertTrue(Files.isDirectory(root));

        editor.close();

        assertFalse(Files.exists(root));
        assertThrows(IllegalStateException.class, editor::getChartCount);
        editor.close();
    }

    @Test
    void extractedDirectoryWithoutDocumentIsRejected() throws IOException {
        Path bare = Files.createDirectories(tempDir.resolve("bare"));

        PartResolutionException e = assertThrows(PartResolutionException.class,
                () -> DocxChartEditor.openExtracted(bare));
        assertEquals(ErrorCode.PART_NOT_FOUND, e.getCode());
    }
}
