package com.catmepim.chartsync.workbook;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.catmepim.chartsync.opc.PackageArchive;
import com.catmepim.chartsync.opc.PartNames;
import com.catmepim.chartsync.opc.Relationship;
import com.catmepim.chartsync.opc.RelationshipsPart;

/**
 * {@link WorkbookParts} over the raw ZIP entries, for embedded workbooks that POI's OPC
 * layer refuses (missing or inconsistent content types, unusual entry layouts). Entry
 * order is preserved on re-pack.
 */
public final class ZipWorkbookParts implements WorkbookParts {

    private final PackageArchive archive;
    private final Map<String, byte[]> entries;

    private ZipWorkbookParts(PackageArchive archive, Map<String, byte[]> entries) {
        this.archive = archive;
        this.entries = entries;
    }

    public static ZipWorkbookParts open(byte[] workbook, PackageArchive archive) throws IOException {
        return new ZipWorkbookParts(archive, archive.readEntries(workbook));
    }

    @Override
    public boolean exists(String partName) {
        return entries.containsKey(partName);
    }

    @Override
    public byte[] read(String partName) throws IOException {
        byte[] content = entries.get(partName);
        if (content == null) {
            throw new IOException("Workbook part not found: " + partName);
        }
        return content;
    }

    @Override
    public void write(String partName, byte[] content) throws IOException {
        if (!entries.containsKey(partName)) {
            throw new IOException("Workbook part not found: " + partName);
        }
        entries.put(partName, content);
    }

    @Override
    public List<String> partNames() {
        List<String> names = new ArrayList<>(entries.keySet());
        Collections.sort(names);
        return names;
    }

    @Override
    public List<Relationship> relationships(String sourcePart) throws IOException {
        byte[] raw = entries.get(PartNames.relsPartFor(sourcePart));
        if (raw == null) {
            return Collections.emptyList();
        }
        return RelationshipsPart.parse(raw, PartNames.relsPartFor(sourcePart)).getRelationships();
    }

    @Override
    public byte[] toBytes() throws IOException {
        return archive.writeEntries(entries);
    }

    @Override
    public String describe() {
        return "raw ZIP";
    }

    @Override
    public void close() {
        entries.clear();
    }
}
