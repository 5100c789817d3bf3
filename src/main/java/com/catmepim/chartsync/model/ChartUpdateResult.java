package com.catmepim.chartsync.model;

/**
 * What an update changed. Lets callers detect title requests that were silently ignored
 * because the chart has no title anchor to write into.
 */
public final class ChartUpdateResult {

    private final int chartIndex;
    private final String workbookPart;
    private final int seriesCount;
    private final TitleUpdate chartTitle;
    private final TitleUpdate categoryAxisTitle;
    private final TitleUpdate valueAxisTitle;

    public ChartUpdateResult(int chartIndex, String workbookPart, int seriesCount,
                             TitleUpdate chartTitle, TitleUpdate categoryAxisTitle, TitleUpdate valueAxisTitle) {
        this.chartIndex = chartIndex;
        this.workbookPart = workbookPart;
        this.seriesCount = seriesCount;
        this.chartTitle = chartTitle;
        this.categoryAxisTitle = categoryAxisTitle;
        this.valueAxisTitle = valueAxisTitle;
    }

    public int getChartIndex() {
        return chartIndex;
    }

    public String getWorkbookPart() {
        return workbookPart;
    }

    public int getSeriesCount() {
        return seriesCount;
    }

    public TitleUpdate getChartTitle() {
        return chartTitle;
    }

    public TitleUpdate getCategoryAxisTitle() {
        return categoryAxisTitle;
    }

    public TitleUpdate getValueAxisTitle() {
        return valueAxisTitle;
    }

    /**
     * @return true if any requested title could not be written
     */
    public boolean hasIgnoredTitles() {
        return chartTitle == TitleUpdate.ANCHOR_NOT_FOUND
                || categoryAxisTitle == TitleUpdate.ANCHOR_NOT_FOUND
                || valueAxisTitle == TitleUpdate.ANCHOR_NOT_FOUND;
    }

    @Override
    public String toString() {
        return "ChartUpdateResult{chartIndex=" + chartIndex + ", workbookPart='" + workbookPart
                + "', seriesCount=" + seriesCount + ", chartTitle=" + chartTitle
                + ", categoryAxisTitle=" + categoryAxisTitle + ", valueAxisTitle=" + valueAxisTitle + '}';
    }
}
