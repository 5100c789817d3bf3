package com.catmepim.chartsync.model;

import java.util.Collections;
import java.util.List;

/**
 * Semantic content of one chart part as read by the parser: the chart kind plus its data.
 * For scatter charts {@link #getXValues()} holds the categories re-read as numbers.
 */
public final class ChartView {

    private final ChartKind kind;
    private final ChartData data;
    private final List<Double> xValues;

    public ChartView(ChartKind kind, ChartData data, List<Double> xValues) {
        this.kind = kind;
        this.data = data;
        this.xValues = xValues == null ? Collections.emptyList() : Collections.unmodifiableList(xValues);
    }

    public ChartKind getKind() {
        return kind;
    }

    public ChartData getData() {
        return data;
    }

    public List<Double> getXValues() {
        return xValues;
    }

    @Override
    public String toString() {
        return "ChartView{kind=" + kind + ", data=" + data + '}';
    }
}
