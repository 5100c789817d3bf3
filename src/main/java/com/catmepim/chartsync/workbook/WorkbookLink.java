package com.catmepim.chartsync.workbook;

/**
 * A resolved chart-to-workbook link: which relationship of which chart points at which
 * embedded workbook part.
 */
public final class WorkbookLink {

    private final int chartIndex;
    private final String chartPart;
    private final String relationshipId;
    private final String target;
    private final String workbookPart;

    public WorkbookLink(int chartIndex, String chartPart, String relationshipId, String target, String workbookPart) {
        this.chartIndex = chartIndex;
        this.chartPart = chartPart;
        this.relationshipId = relationshipId;
        this.target = target;
        this.workbookPart = workbookPart;
    }

    public int getChartIndex() {
        return chartIndex;
    }

    public String getChartPart() {
        return chartPart;
    }

    public String getRelationshipId() {
        return relationshipId;
    }

    /**
     * @return the relationship target as written, e.g. {@code ../embeddings/Microsoft_Excel_Worksheet.xlsx}
     */
    public String getTarget() {
        return target;
    }

    /**
     * @return the resolved part name, e.g. {@code word/embeddings/Microsoft_Excel_Worksheet.xlsx}
     */
    public String getWorkbookPart() {
        return workbookPart;
    }

    @Override
    public String toString() {
        return "WorkbookLink{chart" + chartIndex + " -> " + relationshipId + " -> " + workbookPart + '}';
    }
}
