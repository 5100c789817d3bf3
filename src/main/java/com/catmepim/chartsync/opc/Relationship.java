package com.catmepim.chartsync.opc;

/**
 * One {@code (Id, Type, Target)} entry of a {@code .rels} part.
 */
public final class Relationship {

    public static final String OFFICE_DOCUMENT_NS = "http://schemas.openxmlformats.org/officeDocument/2006/relationships";

    /** document -> chart */
    public static final String TYPE_CHART = OFFICE_DOCUMENT_NS + "/chart";
    /** chart -> embedded workbook */
    public static final String TYPE_PACKAGE = OFFICE_DOCUMENT_NS + "/package";
    public static final String TYPE_CHART_STYLE = "http://schemas.microsoft.com/office/2011/relationships/chartStyle";
    public static final String TYPE_CHART_COLOR_STYLE = "http://schemas.microsoft.com/office/2011/relationships/chartColorStyle";

    private final String id;
    private final String type;
    private final String target;
    private final String targetMode;

    public Relationship(String id, String type, String target, String targetMode) {
        this.id = id;
        this.type = type == null ? "" : type;
        this.target = target == null ? "" : target;
        this.targetMode = targetMode;
    }

    public Relationship(String id, String type, String target) {
        this(id, type, target, null);
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public String getTarget() {
        return target;
    }

    public String getTargetMode() {
        return targetMode;
    }

    public boolean isExternal() {
        return "External".equalsIgnoreCase(targetMode);
    }

    /**
     * Matches on the last path segment of the type URI so transitional and strict
     * namespace variants are both recognized ({@code .../relationships/chart}).
     */
    public boolean hasTypeSuffix(String suffix) {
        return type.endsWith("/" + suffix);
    }

    @Override
    public String toString() {
        return "Relationship{id='" + id + "', type='" + type + "', target='" + target + "'}";
    }
}
