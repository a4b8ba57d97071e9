package org.modelplatform.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

import org.modelplatform.api.backend.TimeSeriesRow;

/**
 * One time series in wide format: the identifying columns plus a value per year.
 */
public record IamcRow(String region, String variable, String unit, String subannual,
                      SortedMap<Integer, Double> values) {

    public IamcRow {
        values = Collections.unmodifiableSortedMap(new TreeMap<>(values));
    }

    /**
     * @return one row per year, in year order
     */
    public List<TimeSeriesRow> toRows() {
        List<TimeSeriesRow> rows = new ArrayList<>(values.size());
        values.forEach((year, value) -> rows.add(new TimeSeriesRow(region, variable, unit, subannual, year, value)));
        return rows;
    }
}
