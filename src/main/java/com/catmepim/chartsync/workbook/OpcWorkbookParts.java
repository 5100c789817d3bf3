package com.catmepim.chartsync.workbook;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.poi.openxml4j.exceptions.InvalidFormatException;
import org.apache.poi.openxml4j.opc.OPCPackage;
import org.apache.poi.openxml4j.opc.PackagePart;
import org.apache.poi.openxml4j.opc.PackagePartName;
import org.apache.poi.openxml4j.opc.PackageRelationship;
import org.apache.poi.openxml4j.opc.PackagingURIHelper;
import org.apache.poi.openxml4j.opc.TargetMode;
import org.apache.poi.util.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.chartsync.opc.Relationship;

/**
 * {@link WorkbookParts} backed by Apache POI's OPC layer. The package is opened from
 * memory and never written back to a file; {@link #close()} discards it.
 */
public final class OpcWorkbookParts implements WorkbookParts {

    private static final Logger logger = LoggerFactory.getLogger(OpcWorkbookParts.class);

    private final OPCPackage pkg;

    private OpcWorkbookParts(OPCPackage pkg) {
        this.pkg = pkg;
    }

    /**
     * @throws IOException if the bytes are not a readable OPC package
     * @throws InvalidFormatException if POI rejects the package structure
     */
    public static OpcWorkbookParts open(byte[] workbook) throws IOException, InvalidFormatException {
        OPCPackage pkg = OPCPackage.open(new ByteArrayInputStream(workbook));
        logger.debug("Opened embedded workbook through POI OPC ({} bytes)", workbook.length);
        return new OpcWorkbookParts(pkg);
    }

    @Override
    public boolean exists(String partName) {
        try {
            return pkg.getPart(toPartName(partName)) != null;
        } catch (IOException e) {
            logger.debug("Invalid part name {}: {}", partName, e.getMessage());
            return false;
        }
    }

    @Override
    public byte[] read(String partName) throws IOException {
        PackagePart part = requirePart(partName);
        try (InputStream in = part.getInputStream()) {
            return IOUtils.toByteArray(in);
        }
    }

    @Override
    public void write(String partName, byte[] content) throws IOException {
        PackagePart part = requirePart(partName);
        try (OutputStream out = part.getOutputStream()) {
            out.write(content);
        }
    }

    @Override
    public List<String> partNames() throws IOException {
        List<String> names = new ArrayList<>();
        try {
            for (PackagePart part : pkg.getParts()) {
                names.add(part.getPartName().getName().substring(1));
            }
        } catch (InvalidFormatException e) {
            throw new IOException("Cannot list workbook parts", e);
        }
        Collections.sort(names);
        return names;
    }

    @Override
    public List<Relationship> relationships(String sourcePart) throws IOException {
        List<Relationship> result = new ArrayList<>();
        PackagePart part = pkg.getPart(toPartName(sourcePart));
        if (part == null) {
            return result;
        }
        try {
            for (PackageRelationship rel : part.getRelationships()) {
                String mode = rel.getTargetMode() == TargetMode.EXTERNAL ? "External" : null;
                result.add(new Relationship(rel.getId(), rel.getRelationshipType(),
                        rel.getTargetURI().toString(), mode));
            }
        } catch (InvalidFormatException e) {
            throw new IOException("Cannot read relationships of " + sourcePart, e);
        }
        return result;
    }

    @Override
    public byte[] toBytes() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        pkg.save(out);
        return out.toByteArray();
    }

    @Override
    public String describe() {
        return "POI OPC";
    }

    @Override
    public void close() {
        pkg.revert();
    }

    private PackagePart requirePart(String partName) throws IOException {
        PackagePart part = pkg.getPart(toPartName(partName));
        if (part == null) {
            throw new IOException("Workbook part not found: " + partName);
        }
        return part;
    }

    private static PackagePartName toPartName(String partName) throws IOException {
        try {
            return PackagingURIHelper.createPartName("/" + partName);
        } catch (InvalidFormatException e) {
            throw new IOException("Invalid part name: " + partName, e);
        }
    }
}
