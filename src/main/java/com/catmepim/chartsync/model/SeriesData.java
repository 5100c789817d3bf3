package com.catmepim.chartsync.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One named chart series. Values are positionally aligned with the owning chart's categories.
 */
public final class SeriesData {

    private final String name;
    private final List<Double> values;

    @JsonCreator
    public SeriesData(@JsonProperty("name") String name, @JsonProperty("values") List<Double> values) {
        this.name = name;
        this.values = values == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static SeriesData of(String name, double... values) {
        List<Double> list = new ArrayList<>(values.length);
        for (double v : values) {
            list.add(v);
        }
        return new SeriesData(name, list);
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("values")
    public List<Double> getValues() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SeriesData)) {
            return false;
        }
        SeriesData that = (SeriesData) o;
        return Objects.equals(name, that.name) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, values);
    }

    @Override
    public String toString() {
        return "SeriesData{name='" + name + "', values=" + values + '}';
    }
}
