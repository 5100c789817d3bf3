package com.catmepim.chartsync;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ChartSyncApplicationTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream captured = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private Path input;

    @BeforeEach
    void setUp() throws IOException {
        originalOut = System.out;
        System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8.name()));
        input = DocxFixtures.docx()
                .chart(DocxFixtures.barChart(DocxFixtures.sampleData()), DocxFixtures.workbook(DocxFixtures.sampleData()))
                .writeTo(tempDir.resolve("report.docx"));
    }

    @AfterEach
    void restoreOut() {
        System.setOut(originalOut);
    }

    private String output() throws IOException {
        return captured.toString(StandardCharsets.UTF_8.name()).trim();
    }

    @Test
    void countPrintsNumberOfCharts() throws IOException {
        assertEquals(0, ChartSyncApplication.run(new String[] {"-i", input.toString(), "-a", "COUNT"}));
        assertEquals("1", output());
    }

    @Test
    void readPrintsChartDataAsJson() throws IOException {
        assertEquals(0, ChartSyncApplication.run(new String[] {"-i", input.toString(), "-a", "READ", "-c", "1"}));

        String json = output();
        assertTrue(json.contains("\"categories\":[\"Old 1\",\"Old 2\"]"), json);
        assertTrue(json.contains("\"chartTitle\":\"Defects\""), json);
    }

    @Test
    void updateWritesOutputAndKeepsInput() throws IOException {
        byte[] original = Files.readAllBytes(input);
        Path data = Files.write(tempDir.resolve("data.json"), DocxFixtures.bytes(
                "{\"categories\":[\"Device A\",\"Device B\",\"Device C\"],"
                        + "\"series\":[{\"name\":\"Critical\",\"values\":[4,3,2]},"
                        + "{\"name\":\"Non-critical\",\"values\":[8,7,6]}]}"));
        Path out = tempDir.resolve("updated.docx");

        int code = ChartSyncApplication.run(new String[] {
                "-i", input.toString(), "-o", out.toString(), "-a", "UPDATE", "-c", "1", "-d", data.toString()});

        assertEquals(0, code);
        assertTrue(output().contains("\"seriesCount\":2"), output());
        assertArrayEquals(original, Files.readAllBytes(input));
        try (DocxChartEditor editor = DocxChartEditor.open(out)) {
            assertEquals(DocxFixtures.scenarioAData().getSeries(), editor.getChartData(1).getSeries());
        }
    }

    @Test
    void copyPrintsNewIndex() throws IOException {
        Path out = tempDir.resolve("copied.docx");

        assertEquals(0, ChartSyncApplication.run(new String[] {
                "-i", input.toString(), "-o", out.toString(), "-a", "COPY", "-c", "1"}));

        assertEquals("2", output());
        try (DocxChartEditor editor = DocxChartEditor.open(out)) {
            assertEquals(2, editor.getChartCount());
        }
    }

    @Test
    void failuresReturnNonZero() throws IOException {
        assertNotEquals(0, ChartSyncApplication.run(new String[] {"-i", input.toString(), "-a", "READ", "-c", "7"}));
        assertNotEquals(0, ChartSyncApplication.run(new String[] {"-i", input.toString(), "-a", "COPY", "-c", "1"}));
        assertNotEquals(0, ChartSyncApplication.run(new String[] {"-a", "COUNT"}));
        assertNotEquals(0, ChartSyncApplication.run(new String[] {
                "-i", tempDir.resolve("missing.docx").toString(), "-a", "COUNT"}));
        assertFalse(Files.exists(tempDir.resolve("missing.docx")));
    }

    @Test
    void helpIsPrinted() throws IOException {
        assertEquals(0, ChartSyncApplication.run(new String[] {"--help"}));
        assertTrue(output().contains("docx-chart-sync"));
    }
}
