package org.modelplatform.api.backend;

import java.util.List;

/**
 * One time-series value. Component order follows {@link #FIELDS}.
 */
public record TimeSeriesRow(String region, String variable, String unit, String subannual, int year, double value) {

    public static final List<String> FIELDS = List.of("region", "variable", "unit", "subannual", "year", "value");
}
