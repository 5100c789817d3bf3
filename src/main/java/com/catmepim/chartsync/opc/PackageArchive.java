package com.catmepim.chartsync.opc;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.chartsync.exception.ZipBombDetectedException;

/**
 * Inflates and re-packs OOXML ZIP containers with java.util.zip, enforcing per-entry size
 * and inflation limits while reading.
 * <p>
 * Used for the outer document package and as the fallback access path to embedded
 * workbooks that POI's OPC layer refuses to open.
 *
 * @invariant No entry is written outside the extraction directory.
 * @invariant {@code [Content_Types].xml} is always the first entry of a packed archive.
 */
public class PackageArchive {

    private static final Logger logger = LoggerFactory.getLogger(PackageArchive.class);
    private static final int DEFAULT_BUFFER_SIZE = 8192;

    private final ArchiveLimits limits;

    public PackageArchive(ArchiveLimits limits) {
        if (limits == null) {
            throw new IllegalArgumentException("Archive limits must not be null");
        }
        this.limits = limits;
    }

    /**
     * Extracts every entry of the archive into {@code destDir}.
     *
     * @param in archive stream, consumed but not closed
     * @param destDir existing destination directory
     * @return number of extracted file entries
     * @throws ZipBombDetectedException if an entry exceeds the configured limits
     * @throws IOException on read or write failure, or if an entry name escapes {@code destDir}
     * @pre destDir is an existing directory
     */
    public int extract(InputStream in, Path destDir) throws IOException {
        Path root = destDir.toAbsolutePath().normalize();
        int count = 0;
        try (ZipInputStream zis = new ZipInputStream(new BufferedInputStream(in, DEFAULT_BUFFER_SIZE))) {
            ZipEntry entry;
            while ((entry = zis.getNextEntry()) != null) {
                Path target = root.resolve(entry.getName()).normalize();
                if (!target.startsWith(root)) {
                    throw new IOException("Archive entry escapes extraction directory: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                } else {
                    Path parent = target.getParent();
                    if (parent != null) {
                        Files.createDirectories(parent);
                    }
                    Files.write(target, readEntryWithSafety(zis, entry));
                    count++;
                }
                zis.closeEntry();
            }
        }
        logger.debug("Extracted {} entries into {}", count, root);
        return count;
    }

    public int extract(Path archive, Path destDir) throws IOException {
        try (InputStream in = Files.newInputStream(archive)) {
            return extract(in, destDir);
        }
    }

    /**
     * Reads every file entry of an in-memory archive, preserving entry order.
     */
    public Map<String, byte[]> readEntries(byte[] archive) throws IOException {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        try (ZipInputStream zis = new ZipInputStream(new ByteArrayInputStream(archive))) {
            ZipEntry entry;
            while ((entry = zis.getNextEntry()) != null) {
                if (!entry.isDirectory()) {
                    entries.put(entry.getName(), readEntryWithSafety(zis, entry));
                }
                zis.closeEntry();
            }
        }
        if (entries.isEmpty()) {
            throw new IOException("Archive contains no entries");
        }
        return entries;
    }

    /**
     * Writes entries as a new archive, content types first, the rest in the given order.
     */
    public byte[] writeEntries(Map<String, byte[]> entries) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ZipOutputStream zos = new ZipOutputStream(out)) {
            byte[] contentTypes = entries.get(ContentTypesPart.PART_NAME);
            if (contentTypes != null) {
                putEntry(zos, ContentTypesPart.PART_NAME, contentTypes);
            }
            for (Map.Entry<String, byte[]> e : entries.entrySet()) {
                if (!ContentTypesPart.PART_NAME.equals(e.getKey())) {
                    putEntry(zos, e.getKey(), e.getValue());
                }
            }
        }
        return out.toByteArray();
    }

    /**
     * Packs a directory tree into an archive written to {@code out}. Entry names use
     * forward slashes; other entries follow {@code [Content_Types].xml} in sorted order.
     *
     * @param sourceDir package root directory
     * @param out destination, not closed
     */
    public void pack(Path sourceDir, OutputStream out) throws IOException {
        Path root = sourceDir.toAbsolutePath().normalize();
        List<Path> files;
        try (Stream<Path> walk = Files.walk(root)) {
            files = walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }
        List<String> names = new ArrayList<>();
        for (Path file : files) {
            names.add(root.relativize(file).toString().replace('\\', '/'));
        }

        ZipOutputStream zos = new ZipOutputStream(out);
        if (names.remove(ContentTypesPart.PART_NAME)) {
            putEntry(zos, ContentTypesPart.PART_NAME, Files.readAllBytes(root.resolve(ContentTypesPart.PART_NAME)));
        }
        for (String name : names) {
            putEntry(zos, name, Files.readAllBytes(root.resolve(name)));
        }
        zos.finish();
        zos.flush();
        logger.debug("Packed {} entries from {}", files.size(), root);
    }

    private static void putEntry(ZipOutputStream zos, String name, byte[] content) throws IOException {
        zos.putNextEntry(new ZipEntry(name));
        zos.write(content);
        zos.closeEntry();
    }

    /**
     * Reads one entry with memory and expansion controls.
     *
     * @pre zis is positioned at the start of entry's data
     */
    private byte[] readEntryWithSafety(ZipInputStream zis, ZipEntry entry) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        byte[] buffer = new byte[DEFAULT_BUFFER_SIZE];

        long totalBytesRead = 0;
        // Unknown when the entry uses a data descriptor; only the size limit applies then
        long compressedSize = entry.getCompressedSize();

        int bytesRead;
        while ((bytesRead = zis.read(buffer)) != -1) {
            totalBytesRead += bytesRead;

            if (totalBytesRead > limits.getMaxEntrySizeBytes()) {
                throw new ZipBombDetectedException("Entry '" + entry.getName()
                        + "' exceeds maximum allowed size of " + limits.getMaxEntrySizeBytes() + " bytes");
            }

            if (compressedSize > 0 && totalBytesRead > compressedSize * limits.getMaxInflationFactor()) {
                throw new ZipBombDetectedException("Entry '" + entry.getName()
                        + "' inflation ratio exceeds safety limit of " + limits.getMaxInflationFactor() + ":1");
            }

            baos.write(buffer, 0, bytesRead);
        }

        logger.trace("Read '{}': {} bytes", entry.getName(), totalBytesRead);
        return baos.toByteArray();
    }
}
