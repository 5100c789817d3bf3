package com.catmepim.chartsync.opc;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.catmepim.chartsync.exception.ZipBombDetectedException;

class PackageArchiveTest {

    @TempDir
    Path tempDir;

    private final PackageArchive archive = new PackageArchive(ArchiveLimits.defaults());

    @Test
    void packWritesContentTypesFirst() throws IOException {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("word/document.xml", bytes("<doc/>"));
        entries.put("[Content_Types].xml", bytes("<Types/>"));
        entries.put("_rels/.rels", bytes("<Relationships/>"));
        Path dir = Files.createDirectory(tempDir.resolve("pkg"));
        archive.extract(new ByteArrayInputStream(archive.writeEntries(entries)), dir);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        archive.pack(dir, out);

        assertEquals(Arrays.asList("[Content_Types].xml", "_rels/.rels", "word/document.xml"),
                entryNames(out.toByteArray()));
        assertArrayEquals(bytes("<doc/>"), archive.readEntries(out.toByteArray()).get("word/document.xml"));
    }

    @Test
    void extractRejectsEntriesEscapingTheTarget() throws IOException {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("../evil.txt", bytes("x"));
        byte[] zip = archive.writeEntries(entries);
        Path dir = Files.createDirectory(tempDir.resolve("target"));

        assertThrows(IOException.class, () -> archive.extract(new ByteArrayInputStream(zip), dir));
        assertFalse(Files.exists(tempDir.resolve("evil.txt")));
    }

    @Test
    void oversizedEntriesAreRejected() throws IOException {
        PackageArchive strict = new PackageArchive(new ArchiveLimits(1024, 1000, 0.01));
        Map<String, byte[]> entries = new LinkedHashMap<>();
        byte[] big = new byte[4096];
        Arrays.fill(big, (byte) 'a');
        entries.put("big.txt", big);

        byte[] zip = archive.writeEntries(entries);

        assertThrows(ZipBombDetectedException.class, () -> strict.readEntries(zip));
    }

    @Test
    void emptyArchivesAreRejected() {
        assertThrows(IOException.class, () -> archive.readEntries(new byte[0]));
    }

    private static List<String> entryNames(byte[] zip) throws IOException {
        List<String> names = new ArrayList<>();
        try (ZipInputStream zis = new ZipInputStream(new ByteArrayInputStream(zip))) {
            ZipEntry entry;
            while ((entry = zis.getNextEntry()) != null) {
                names.add(entry.getName());
            }
        }
        return names;
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
