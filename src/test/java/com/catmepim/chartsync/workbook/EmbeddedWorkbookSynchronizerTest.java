package com.catmepim.chartsync.workbook;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.poi.xssf.model.SharedStringsTable;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFTable;
import org.apache.poi.xssf.usermodel.XSSFTableColumn;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import com.catmepim.chartsync.DocxFixtures;
import com.catmepim.chartsync.exception.ChartSyncException;
import com.catmepim.chartsync.exception.ErrorCode;
import com.catmepim.chartsync.exception.InvalidChartDataException;
import com.catmepim.chartsync.model.ChartData;
import com.catmepim.chartsync.model.SeriesData;
import com.catmepim.chartsync.opc.ArchiveLimits;
import com.catmepim.chartsync.opc.PackageArchive;

class EmbeddedWorkbookSynchronizerTest {

    private static final String PART = "word/embeddings/Microsoft_Excel_Worksheet1.xlsx";

    private final PackageArchive archive = new PackageArchive(ArchiveLimits.defaults());
    private final EmbeddedWorkbookSynchronizer synchronizer = new EmbeddedWorkbookSynchronizer(archive);

    @Test
    void writesHeaderCategoriesAndValues() throws IOException {
        byte[] result = synchronizer.synchronize(DocxFixtures.workbook(DocxFixtures.sampleData()), PART,
                DocxFixtures.scenarioAData());

        try (XSSFWorkbook wb = new XSSFWorkbook(new ByteArrayInputStream(result))) {
            XSSFSheet sheet = wb.getSheetAt(0);
            assertEquals("Critical", sheet.getRow(0).getCell(1).getStringCellValue());
            assertEquals("Non-critical", sheet.getRow(0).getCell(2).getStringCellValue());
            assertEquals("Device A", sheet.getRow(1).getCell(0).getStringCellValue());
            assertEquals("Device C", sheet.getRow(3).getCell(0).getStringCellValue());
            assertEquals(4.0, sheet.getRow(1).getCell(1).getNumericCellValue());
            assertEquals(6.0, sheet.getRow(3).getCell(2).getNumericCellValue());
            assertEquals(3, sheet.getLastRowNum());
            assertEquals("A1:C4", sheet.getCTWorksheet().getDimension().getRef());
        }
    }

    @Test
    void sharedStringsAreOnlyAppended() throws IOException {
        byte[] original = DocxFixtures.workbook(DocxFixtures.sampleData());
        List<String> before = sharedStrings(original);

        List<String> after = sharedStrings(synchronizer.synchronize(original, PART, DocxFixtures.scenarioAData()));

        assertEquals(before, after.subList(0, before.size()));
        assertEquals(Arrays.asList("Device A", "Device B", "Device C"), after.subList(before.size(), after.size()));
    }

    @Test
    void tablesFollowTheNewExtent() throws IOException {
        ChartData threeSeries = new ChartData(Arrays.asList("Device A", "Device B", "Device C"), Arrays.asList(
                SeriesData.of("Critical", 4, 3, 2), SeriesData.of("Non-critical", 8, 7, 6),
                SeriesData.of("Info", 1, 1, 1)));

        byte[] result = synchronizer.synchronize(DocxFixtures.workbook(DocxFixtures.sampleData(), true), PART,
                threeSeries);

        try (XSSFWorkbook wb = new XSSFWorkbook(new ByteArrayInputStream(result))) {
            XSSFSheet sheet = wb.getSheetAt(0);
            XSSFTable table = sheet.getTables().get(0);
            assertEquals("A1:D4", table.getCTTable().getRef());
            List<String> names = new ArrayList<>();
            for (XSSFTableColumn column : table.getColumns()) {
                names.add(column.getName());
            }
            assertEquals(Arrays.asList("Category", "Critical", "Non-critical", "Info"), names);
            assertEquals("Category", sheet.getRow(0).getCell(0).getStringCellValue());
        }
    }

    @Test
    void fallsBackToRawZipForPackagesPoiRejects() throws IOException {
        byte[] result = synchronizer.synchronize(DocxFixtures.bareZipWorkbook(), PART, DocxFixtures.scenarioAData());

        Map<String, byte[]> entries = archive.readEntries(result);
        String sheet = DocxFixtures.string(entries.get("xl/worksheets/sheet1.xml"));
        assertTrue(sheet.contains("<dimension ref=\"A1:C4\"/>"), sheet);
        assertTrue(sheet.contains("<c r=\"B1\" t=\"inlineStr\"><is><t>Critical</t></is></c>"), sheet);
        assertTrue(sheet.contains("<c r=\"C4\"><v>6</v></c>"), sheet);
        assertTrue(entries.containsKey("xl/workbook.xml"));
    }

    @Test
    void workbookWithoutWorksheetIsInvalid() throws IOException {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("xl/workbook.xml", DocxFixtures.bytes("<workbook xmlns=\"urn:x\"><sheets/></workbook>"));
        byte[] workbook = archive.writeEntries(entries);

        ChartSyncException e = assertThrows(ChartSyncException.class,
                () -> synchronizer.synchronize(workbook, PART, DocxFixtures.scenarioAData()));

        assertEquals(ErrorCode.INVALID_WORKBOOK, e.getCode());
    }

    @Test
    void invalidDataLeavesInputUntouched() throws IOException {
        byte[] original = DocxFixtures.workbook(DocxFixtures.sampleData());
        byte[] copy = original.clone();
        ChartData mismatch = new ChartData(Arrays.asList("A", "B"), Arrays.asList(SeriesData.of("Critical", 1)));

        assertThrows(InvalidChartDataException.class, () -> synchronizer.synchronize(original, PART, mismatch));
        assertArrayEquals(copy, original);
    }

    private static List<String> sharedStrings(byte[] workbook) throws IOException {
        try (XSSFWorkbook wb = new XSSFWorkbook(new ByteArrayInputStream(workbook))) {
            SharedStringsTable sst = (SharedStringsTable) wb.getSharedStringSource();
            List<String> values = new ArrayList<>();
            for (int i = 0; i < sst.getUniqueCount(); i++) {
                values.add(sst.getItemAt(i).getString());
            }
            return values;
        }
    }
}
