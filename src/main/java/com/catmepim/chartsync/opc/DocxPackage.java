package com.catmepim.chartsync.opc;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.chartsync.exception.ErrorCode;
import com.catmepim.chartsync.exception.PartResolutionException;

/**
 * A word-processing package extracted into a directory. Every read goes to storage and
 * every write replaces a whole part, so no state is cached between operations.
 * <p>
 * Not safe for concurrent use: callers serialize access to one package.
 */
public class DocxPackage {

    private static final Logger logger = LoggerFactory.getLogger(DocxPackage.class);

    public static final String DOCUMENT_PART = "word/document.xml";
    public static final String DOCUMENT_RELS_PART = "word/_rels/document.xml.rels";

    private static final String[] REQUIRED_PARTS = {
        DOCUMENT_PART, DOCUMENT_RELS_PART, ContentTypesPart.PART_NAME
    };

    private final Path root;

    public DocxPackage(Path root) {
        if (root == null) {
            throw new IllegalArgumentException("Package root must not be null");
        }
        this.root = root.toAbsolutePath().normalize();
    }

    public Path getRoot() {
        return root;
    }

    /**
     * Maps a part name to its file.
     *
     * @throws IllegalArgumentException if the part name escapes the package root
     */
    public Path resolve(String partName) {
        Path path = root.resolve(PartNames.normalize(partName)).normalize();
        if (!path.startsWith(root)) {
            throw new IllegalArgumentException("Part name escapes the package root: " + partName);
        }
        return path;
    }

    public boolean exists(String partName) {
        return Files.isRegularFile(resolve(partName));
    }

    public byte[] read(String partName) throws IOException {
        try {
            return Files.readAllBytes(resolve(partName));
        } catch (NoSuchFileException e) {
            throw new NoSuchFileException(partName, null, "Part does not exist");
        }
    }

    /**
     * Replaces the whole content of a part. The bytes go to a sibling temporary file first
     * and are then moved over the part.
     */
    public void write(String partName, byte[] content) throws IOException {
        Path target = resolve(partName);
        Path parent = target.getParent();
        Files.createDirectories(parent);
        Path tmp = Files.createTempFile(parent, ".part", ".tmp");
        try {
            Files.write(tmp, content);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
        logger.trace("Wrote part {} ({} bytes)", partName, content.length);
    }

    /**
     * Copies a part byte for byte.
     *
     * @throws java.nio.file.FileAlreadyExistsException if the destination exists
     */
    public void copy(String sourcePart, String destPart) throws IOException {
        Path target = resolve(destPart);
        Files.createDirectories(target.getParent());
        Files.copy(resolve(sourcePart), target);
        logger.debug("Copied part {} -> {}", sourcePart, destPart);
    }

    /**
     * Lists the file names (not part names) directly inside a package directory.
     *
     * @return sorted names, empty if the directory does not exist
     */
    public List<String> listFileNames(String directory) throws IOException {
        Path dir = resolve(directory);
        if (!Files.isDirectory(dir)) {
            return Collections.emptyList();
        }
        List<String> names = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path p : stream) {
                if (Files.isRegularFile(p)) {
                    names.add(p.getFileName().toString());
                }
            }
        }
        Collections.sort(names);
        return names;
    }

    /**
     * Checks that the parts every operation depends on are present.
     *
     * @throws PartResolutionException naming the first missing part
     */
    public void validateStructure() {
        for (String part : REQUIRED_PARTS) {
            if (!exists(part)) {
                throw new PartResolutionException(ErrorCode.PART_NOT_FOUND, "Required package part is missing")
                        .withContext("part", part);
            }
        }
    }
}
