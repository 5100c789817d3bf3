package com.catmepim.chartsync.model;

/**
 * Chart families the engine understands, keyed by the local name of their plot-area element.
 * Declaration order is the lookup priority when a plot area holds more than one of them.
 */
public enum ChartKind {
    BAR("barChart"),
    LINE("lineChart"),
    SCATTER("scatterChart"),
    PIE("pieChart"),
    AREA("areaChart");

    private final String elementName;

    ChartKind(String elementName) {
        this.elementName = elementName;
    }

    /**
     * @return local (unprefixed) element name, e.g. {@code barChart}
     */
    public String getElementName() {
        return elementName;
    }

    /**
     * Scatter charts carry numeric X values ({@code xVal}/{@code yVal}) instead of a
     * textual category axis ({@code cat}/{@code val}).
     */
    public boolean hasNumericCategories() {
        return this == SCATTER;
    }

    public String categoryElementName() {
        return hasNumericCategories() ? "xVal" : "cat";
    }

    public String valueElementName() {
        return hasNumericCategories() ? "yVal" : "val";
    }
}
