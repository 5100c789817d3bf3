package com.catmepim.chartsync.workbook;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

import com.catmepim.chartsync.opc.Relationship;

/**
 * Part-level access to an embedded workbook package held in memory.
 * <p>
 * Writes are staged and only become bytes on {@link #toBytes()}, so an aborted
 * synchronization never produces a half-written workbook.
 */
public interface WorkbookParts extends Closeable {

    /**
     * @param partName package-relative part name, e.g. {@code xl/worksheets/sheet1.xml}
     */
    boolean exists(String partName);

    byte[] read(String partName) throws IOException;

    void write(String partName, byte[] content) throws IOException;

    /**
     * @return all part names in the package, sorted
     */
    List<String> partNames() throws IOException;

    /**
     * Relationships owned by a part, as written in its {@code .rels} part.
     *
     * @return empty if the part has no relationships
     */
    List<Relationship> relationships(String sourcePart) throws IOException;

    /**
     * Serializes the package including every staged write.
     */
    byte[] toBytes() throws IOException;

    /**
     * @return short name of the access path, for logging
     */
    String describe();
}
