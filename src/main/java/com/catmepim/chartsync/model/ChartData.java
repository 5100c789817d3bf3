package com.catmepim.chartsync.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Categories, series and optional titles of one chart.
 * <p>
 * Used both as the input of an update and as the result of a read-back. Titles are
 * empty strings when absent; on update an empty title means "leave the title alone".
 *
 * @invariant categories and series are never null (possibly empty)
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class ChartData {

    private final List<String> categories;
    private final List<SeriesData> series;
    private final String chartTitle;
    private final String categoryAxisTitle;
    private final String valueAxisTitle;

    @JsonCreator
    public ChartData(@JsonProperty("categories") List<String> categories,
                     @JsonProperty("series") List<SeriesData> series,
                     @JsonProperty("chartTitle") String chartTitle,
                     @JsonProperty("categoryAxisTitle") String categoryAxisTitle,
                     @JsonProperty("valueAxisTitle") String valueAxisTitle) {
        this.categories = categories == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(categories));
        this.series = series == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(series));
        this.chartTitle = chartTitle == null ? "" : chartTitle;
        this.categoryAxisTitle = categoryAxisTitle == null ? "" : categoryAxisTitle;
        this.valueAxisTitle = valueAxisTitle == null ? "" : valueAxisTitle;
    }

    public ChartData(List<String> categories, List<SeriesData> series) {
        this(categories, series, "", "", "");
    }

    /**
     * Returns a copy of this data carrying the given titles.
     */
    public ChartData withTitles(String chartTitle, String categoryAxisTitle, String valueAxisTitle) {
        return new ChartData(categories, series, chartTitle, categoryAxisTitle, valueAxisTitle);
    }

    @JsonProperty("categories")
    public List<String> getCategories() {
        return categories;
    }

    @JsonProperty("series")
    public List<SeriesData> getSeries() {
        return series;
    }

    @JsonProperty("chartTitle")
    public String getChartTitle() {
        return chartTitle;
    }

    @JsonProperty("categoryAxisTitle")
    public String getCategoryAxisTitle() {
        return categoryAxisTitle;
    }

    @JsonProperty("valueAxisTitle")
    public String getValueAxisTitle() {
        return valueAxisTitle;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ChartData)) {
            return false;
        }
        ChartData that = (ChartData) o;
        return categories.equals(that.categories)
                && series.equals(that.series)
                && chartTitle.equals(that.chartTitle)
                && categoryAxisTitle.equals(that.categoryAxisTitle)
                && valueAxisTitle.equals(that.valueAxisTitle);
    }

    @Override
    public int hashCode() {
        return Objects.hash(categories, series, chartTitle, categoryAxisTitle, valueAxisTitle);
    }

    @Override
    public String toString() {
        return "ChartData{categories=" + categories + ", series=" + series
                + ", chartTitle='" + chartTitle + "'}";
    }
}
