package com.catmepim.chartsync.chart;

import java.util.List;

import com.catmepim.chartsync.exception.InvalidChartDataException;
import com.catmepim.chartsync.model.ChartData;
import com.catmepim.chartsync.model.SeriesData;

/**
 * Structural checks on chart data, run before any part is read or written.
 */
public final class ChartDataValidator {

    private ChartDataValidator() {
    }

    /**
     * @throws InvalidChartDataException if categories or series are empty, a series name is
     *         blank, a series length differs from the category count, or a value is not finite
     * @post every series has exactly one value per category
     */
    public static void validate(ChartData data) {
        if (data == null) {
            throw new InvalidChartDataException("chart data must not be null");
        }
        List<String> categories = data.getCategories();
        if (categories.isEmpty()) {
            throw new InvalidChartDataException("categories cannot be empty");
        }
        for (int i = 0; i < categories.size(); i++) {
            if (categories.get(i) == null) {
                throw new InvalidChartDataException("categories[" + i + "] must not be null");
            }
        }
        List<SeriesData> series = data.getSeries();
        if (series.isEmpty()) {
            throw new InvalidChartDataException("at least one series is required");
        }
        for (int i = 0; i < series.size(); i++) {
            SeriesData s = series.get(i);
            if (s == null) {
                throw new InvalidChartDataException("series[" + i + "] must not be null");
            }
            if (s.getName() == null || s.getName().trim().isEmpty()) {
                throw new InvalidChartDataException("series[" + i + "] name cannot be empty");
            }
            if (s.getValues().size() != categories.size()) {
                throw new InvalidChartDataException(String.format(
                        "series[%d] values length (%d) must match categories length (%d)",
                        i, s.getValues().size(), categories.size()));
            }
            for (int j = 0; j < s.getValues().size(); j++) {
                Double v = s.getValues().get(j);
                if (v == null || v.isNaN() || v.isInfinite()) {
                    throw new InvalidChartDataException(String.format(
                            "series[%d] value[%d] must be a finite number", i, j));
                }
            }
        }
    }
}
